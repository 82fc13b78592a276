package works.asdl.grammar;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import works.asdl.exceptions.AsdlSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the textual ASDL notation:
 *
 * <pre>
 * # comment
 * EXPR = BinaryOp(BINARY_OP op, EXPR left, EXPR right)
 *      | Break
 * BINARY_OP = Add | Sub
 * </pre>
 *
 * A definition may span several lines; a line starting with {@code |} continues the previous one.
 * The first type defined becomes the grammar's root type.
 * Field types not defined in the text must be listed among the primitive types.
 */
public final class AsdlGrammarReader {
	public static final Set<String> DEFAULT_PRIMITIVE_TYPES = Set.of("TOKEN");

	private final Set<String> primitiveTypes;

	public AsdlGrammarReader() {
		this(DEFAULT_PRIMITIVE_TYPES);
	}

	public AsdlGrammarReader(Set<String> primitiveTypes) {
		this.primitiveTypes = Set.copyOf(primitiveTypes);
	}

	public Grammar read(String text) {
		return read(new StringReader(text));
	}

	/**
	 * @throws AsdlSyntaxException if the text is not well-formed ASDL,
	 * or describes an inconsistent grammar
	 * @throws UncheckedIOException if {@code reader} fails
	 */
	public Grammar read(Reader reader) {
		List<Definition> definitions = new ArrayList<>();
		try (BufferedReader lines = new BufferedReader(reader)) {
			String line;
			int lineNumber = 0;
			Definition current = null;
			while ((line = lines.readLine()) != null) {
				++lineNumber;
				String content = stripComment(line).trim();
				if (content.isEmpty()) {
					continue;
				}
				if (content.startsWith("|")) {
					if (current == null) {
						throw new AsdlSyntaxException(lineNumber, "Alternative outside of any type definition");
					}
					current.text.append(' ').append(content);
				} else {
					int equals = content.indexOf('=');
					if (equals < 0) {
						throw new AsdlSyntaxException(lineNumber, "Expected type definition of the form TYPE = ...");
					}
					String typeName = content.substring(0, equals).trim();
					if (!isIdentifier(typeName)) {
						throw new AsdlSyntaxException(lineNumber, "Invalid type name \"" + typeName + "\"");
					}
					current = new Definition(lineNumber, typeName, new StringBuilder(content.substring(equals + 1)));
					definitions.add(current);
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}

		Grammar.Builder builder = Grammar.builder();
		primitiveTypes.forEach(builder::primitiveType);
		for (Definition d: definitions) {
			for (String alternative: d.text.toString().split("\\|", -1)) {
				Production production = parseProduction(d, alternative.trim());
				try {
					builder.production(production);
				} catch (IllegalArgumentException e) {
					throw new AsdlSyntaxException(d.lineNumber, e.getMessage(), e);
				}
			}
		}
		Grammar result;
		try {
			result = builder.build();
		} catch (IllegalArgumentException e) {
			int lineNumber = definitions.isEmpty() ? 0 : definitions.get(definitions.size() - 1).lineNumber;
			throw new AsdlSyntaxException(lineNumber, e.getMessage(), e);
		}
		LOGGER.debug("Read {}", result);
		return result;
	}

	private Production parseProduction(Definition d, String alternative) {
		if (alternative.isEmpty()) {
			throw new AsdlSyntaxException(d.lineNumber, "Empty alternative in type " + d.typeName);
		}
		int open = alternative.indexOf('(');
		if (open < 0) {
			if (!isIdentifier(alternative)) {
				throw new AsdlSyntaxException(d.lineNumber, "Invalid constructor name \"" + alternative + "\"");
			}
			return new Production(d.typeName, alternative, List.of());
		}
		String constructorName = alternative.substring(0, open).trim();
		if (!isIdentifier(constructorName)) {
			throw new AsdlSyntaxException(d.lineNumber, "Invalid constructor name \"" + constructorName + "\"");
		}
		if (!alternative.endsWith(")")) {
			throw new AsdlSyntaxException(d.lineNumber, "Unclosed field list for " + constructorName);
		}
		String body = alternative.substring(open + 1, alternative.length() - 1).trim();
		List<Field> fields = new ArrayList<>();
		if (!body.isEmpty()) {
			for (String fieldText: body.split(",", -1)) {
				fields.add(parseField(d, constructorName, fieldText.trim()));
			}
		}
		try {
			return new Production(d.typeName, constructorName, fields);
		} catch (IllegalArgumentException e) {
			throw new AsdlSyntaxException(d.lineNumber, e.getMessage(), e);
		}
	}

	private Field parseField(Definition d, String constructorName, String fieldText) {
		String[] parts = fieldText.split("\\s+");
		if (parts.length != 2) {
			throw new AsdlSyntaxException(d.lineNumber, "Expected \"TYPE name\" in " + constructorName + " but found \"" + fieldText + "\"");
		}
		String type = parts[0];
		Cardinality cardinality = Cardinality.SINGLE;
		char last = type.charAt(type.length() - 1);
		if (last == '?' || last == '*') {
			cardinality = Cardinality.fromSuffix(last);
			type = type.substring(0, type.length() - 1);
		}
		if (!isIdentifier(type) || !isIdentifier(parts[1])) {
			throw new AsdlSyntaxException(d.lineNumber, "Invalid field \"" + fieldText + "\" in " + constructorName);
		}
		return new Field(parts[1], type, cardinality);
	}

	private static String stripComment(String line) {
		int hash = line.indexOf('#');
		return (hash < 0) ? line : line.substring(0, hash);
	}

	static boolean isIdentifier(String s) {
		if (s.isEmpty() || !Character.isJavaIdentifierStart(s.charAt(0))) {
			return false;
		}
		for (int i = 1; i < s.length(); i++) {
			if (!Character.isJavaIdentifierPart(s.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	private record Definition(int lineNumber, String typeName, StringBuilder text) { }

	private static final Logger LOGGER = LoggerFactory.getLogger(AsdlGrammarReader.class);
}
