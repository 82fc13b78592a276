package works.asdl.c;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The vocabulary of C tokens with fixed spellings,
 * for tokenizers that should keep them whole.
 */
public final class CLexicon {
	private CLexicon() {}

	/**
	 * The keywords recognized by pycparser's lexer, in its order.
	 */
	public static final List<String> KEYWORDS = List.of(
		"auto", "break", "case", "char", "const",
		"continue", "default", "do", "double", "else",
		"enum", "extern", "float", "for", "goto",
		"if", "inline", "int", "long", "register",
		"offsetof", "restrict", "return", "short", "signed",
		"sizeof", "static", "struct", "switch", "typedef",
		"union", "unsigned", "void", "volatile", "while",
		"__int128", "_Bool", "_Complex", "_Noreturn", "_Thread_local",
		"_Static_assert", "_Atomic", "_Alignof", "_Alignas"
	);

	/**
	 * Tokens of the {@link CTerminals#TABLES terminal tables} that don't start with a letter,
	 * each once, in table order.
	 */
	public static final List<String> OPERATORS = computeOperators();

	private static List<String> computeOperators() {
		Set<String> result = new LinkedHashSet<>();
		CTerminals.TABLES.tables().forEach(table -> table.tokens().stream()
			.filter(token -> !Character.isLetter(token.charAt(0)))
			.forEach(result::add));
		return List.copyOf(result);
	}
}
