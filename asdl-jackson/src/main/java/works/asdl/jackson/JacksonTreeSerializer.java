package works.asdl.jackson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.core.exc.StreamWriteException;
import tools.jackson.databind.DeserializationContext;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueDeserializer;
import tools.jackson.databind.ValueSerializer;
import works.asdl.exceptions.UnknownProductionException;
import works.asdl.grammar.Cardinality;
import works.asdl.grammar.Field;
import works.asdl.grammar.Grammar;
import works.asdl.grammar.Production;
import works.asdl.tree.AsdlTree;
import works.asdl.tree.AsdlValue;
import works.asdl.tree.RealizedField;
import works.asdl.tree.Token;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.PROPERTY_NAME;
import static tools.jackson.core.JsonToken.START_ARRAY;
import static tools.jackson.core.JsonToken.START_OBJECT;
import static tools.jackson.core.JsonToken.VALUE_NULL;
import static tools.jackson.core.JsonToken.VALUE_STRING;

/**
 * Provides JSON serialization/deserialization of {@link AsdlTree}s using Jackson.
 * <p>
 * A tree is one object whose first member, {@value #CONSTRUCTOR_KEY}, names its constructor,
 * followed by one member per field:
 *
 * <pre>
 * {"@constructor": "BinaryOp", "op": {"@constructor": "Add"}, "left": {"@constructor": "ID", ...}, "right": ...}
 * </pre>
 *
 * The key can't collide with a field, because field names are identifiers.
 * A {@link Cardinality#MULTIPLE multiple} field is an array.
 * Other fields are a single value, or {@code null} when empty;
 * they're written as arrays only if they hold more values than their cardinality allows,
 * so that such trees survive a round trip and can be rejected by the decoder instead.
 * Values of primitive type are strings; the writer refuses a token in any other field, and a tree in a primitive one.
 * Fields missing from the input are empty.
 */
public final class JacksonTreeSerializer {
	public static final String CONSTRUCTOR_KEY = "@constructor";

	private JacksonTreeSerializer() {}

	/**
	 * @param grammar used to resolve constructor names when reading
	 */
	public static AsdlJacksonModule moduleFor(Grammar grammar) {
		return new AsdlJacksonModule(grammar);
	}

	static final class TreeSerializer extends ValueSerializer<AsdlTree> {
		private final Grammar grammar;

		TreeSerializer(Grammar grammar) {
			this.grammar = grammar;
		}

		@Override
		public void serialize(AsdlTree tree, JsonGenerator gen, SerializationContext serializers) {
			gen.writeStartObject();
			gen.writeName(CONSTRUCTOR_KEY);
			gen.writeString(tree.constructorName());
			for (RealizedField f: tree.fields()) {
				gen.writeName(f.name());
				if (f.field().cardinality() == Cardinality.MULTIPLE || f.size() > 1) {
					gen.writeStartArray();
					for (AsdlValue v: f.values()) {
						writeValue(tree, f.field(), v, gen, serializers);
					}
					gen.writeEndArray();
				} else if (f.isEmpty()) {
					gen.writeNull();
				} else {
					writeValue(tree, f.field(), f.values().get(0), gen, serializers);
				}
			}
			gen.writeEndObject();
		}

		private void writeValue(AsdlTree tree, Field field, AsdlValue value, JsonGenerator gen, SerializationContext serializers) {
			boolean primitive = grammar.isPrimitive(field.type());
			if (value instanceof Token t) {
				if (!primitive) {
					throw new StreamWriteException(gen, "Token " + t + " in non-primitive field " + tree.constructorName() + "." + field.name());
				}
				gen.writeString(t.text());
			} else {
				if (primitive) {
					throw new StreamWriteException(gen, "Tree in primitive field " + tree.constructorName() + "." + field.name());
				}
				serialize((AsdlTree) value, gen, serializers);
			}
		}
	}

	static final class TreeDeserializer extends ValueDeserializer<AsdlTree> {
		private final Grammar grammar;

		TreeDeserializer(Grammar grammar) {
			this.grammar = grammar;
		}

		@Override
		public AsdlTree deserialize(JsonParser p, DeserializationContext ctxt) {
			return readTree(p);
		}

		private AsdlTree readTree(JsonParser p) {
			expect(START_OBJECT, p);
			p.nextToken();
			if (p.currentToken() != PROPERTY_NAME || !CONSTRUCTOR_KEY.equals(p.currentName())) {
				throw new StreamReadException(p, "Tree must begin with " + CONSTRUCTOR_KEY);
			}
			p.nextToken();
			expect(VALUE_STRING, p);
			String constructorName = p.getString();
			Production production;
			try {
				production = grammar.production(constructorName);
			} catch (UnknownProductionException e) {
				throw new StreamReadException(p, e.getMessage(), e);
			}

			Map<String, List<AsdlValue>> valuesByName = new LinkedHashMap<>();
			while (p.nextToken() != END_OBJECT) {
				expect(PROPERTY_NAME, p);
				String name = p.currentName();
				if (CONSTRUCTOR_KEY.equals(name)) {
					throw new StreamReadException(p, "Tree has more than one constructor: " + constructorName + " and another");
				}
				Field field = production.findField(name).orElseThrow(() ->
					new StreamReadException(p, "Unrecognized field in " + constructorName + ": " + name));
				if (valuesByName.containsKey(name)) {
					throw new StreamReadException(p, "'" + name + "' field appears twice in " + constructorName);
				}
				p.nextToken();
				valuesByName.put(name, readFieldValues(p, field));
			}

			List<RealizedField> fields = new ArrayList<>(production.fields().size());
			for (Field f: production.fields()) {
				fields.add(new RealizedField(f, valuesByName.getOrDefault(f.name(), List.of())));
			}
			return new AsdlTree(production, fields);
		}
		private List<AsdlValue> readFieldValues(JsonParser p, Field field) {
			if (p.currentToken() == VALUE_NULL) {
				return List.of();
			} else if (p.currentToken() == START_ARRAY) {
				List<AsdlValue> result = new ArrayList<>();
				while (p.nextToken() != END_ARRAY) {
					result.add(readValue(p, field));
				}
				return result;
			} else {
				return List.of(readValue(p, field));
			}
		}

		private AsdlValue readValue(JsonParser p, Field field) {
			if (grammar.isPrimitive(field.type())) {
				expect(VALUE_STRING, p);
				return Token.of(p.getString());
			} else {
				return readTree(p);
			}
		}
	}

	static void expect(JsonToken expected, JsonParser p) {
		if (p.currentToken() != expected) {
			throw new StreamReadException(p, "Expected " + expected + "; found " + p.currentToken());
		}
	}
}
