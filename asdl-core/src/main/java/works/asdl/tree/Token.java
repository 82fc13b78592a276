package works.asdl.tree;

import static java.util.Objects.requireNonNull;

/**
 * A raw string payload in a field of primitive type.
 */
public record Token(String text) implements AsdlValue {
	public Token {
		requireNonNull(text);
	}

	public static Token of(String text) {
		return new Token(text);
	}

	@Override
	public String toString() {
		return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
	}
}
