package works.asdl.convert;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.asdl.exceptions.AsdlException;
import works.asdl.exceptions.CardinalityViolationException;
import works.asdl.exceptions.InvalidNodeTypeException;
import works.asdl.exceptions.MalformedTreeException;
import works.asdl.exceptions.UnknownProductionException;
import works.asdl.grammar.Cardinality;
import works.asdl.grammar.Field;
import works.asdl.grammar.Grammar;
import works.asdl.grammar.Production;
import works.asdl.subword.SubwordModel;
import works.asdl.subword.SubwordPieces;
import works.asdl.tree.AsdlTree;
import works.asdl.tree.AsdlValue;
import works.asdl.tree.RealizedField;
import works.asdl.tree.Token;
import works.asdl.convert.NodeShape.Component;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Converts native AST nodes to {@link AsdlTree}s and back, for one {@link Grammar}.
 * <p>
 * All the correspondences between grammar productions and native node types
 * are resolved and checked when the converter is built,
 * so a mismatched grammar fails fast with {@link InvalidNodeTypeException}
 * rather than partway through a conversion.
 * <p>
 * A converter is immutable and may be shared between threads.
 * Each call either returns a complete result or throws an {@link AsdlException};
 * exceptions raised below the top node have the path of
 * {@code Constructor.field} segments leading to the failure prepended to their message.
 *
 * @param <N> the root type of native nodes
 */
public final class AstConverter<N> {
	private final Grammar grammar;
	private final NodeRegistry<N> registry;
	private final TerminalTables terminalTables;
	private final ConverterSettings settings;
	private final @Nullable SubwordModel subwordModel;
	private final Map<String, Binding> bindingsByConstructor;
	private final Map<String, LeafBinding> leavesByType;

	public AstConverter(Grammar grammar, NodeRegistry<N> registry, TerminalTables terminalTables) {
		this(grammar, registry, terminalTables, ConverterSettings.DEFAULT, null);
	}

	/**
	 * @param subwordModel if null, leaf strings are encoded as single tokens
	 * @throws InvalidNodeTypeException if the grammar, the node types, the terminal tables
	 * and the settings don't agree with each other
	 */
	public AstConverter(Grammar grammar, NodeRegistry<N> registry, TerminalTables terminalTables, ConverterSettings settings, @Nullable SubwordModel subwordModel) {
		this.grammar = requireNonNull(grammar);
		this.registry = requireNonNull(registry);
		this.terminalTables = requireNonNull(terminalTables);
		this.settings = requireNonNull(settings);
		this.subwordModel = subwordModel;
		this.leavesByType = resolveLeaves();
		if (settings.isStrictTerminalTables()) {
			checkTerminalTables();
		}
		this.bindingsByConstructor = resolveBindings();
		LOGGER.debug("Built converter for {} with {} node types{}",
			grammar, bindingsByConstructor.size(), subwordModel == null ? "" : " and a subword model");
	}

	private AstConverter(AstConverter<N> other, @Nullable SubwordModel subwordModel) {
		this.grammar = other.grammar;
		this.registry = other.registry;
		this.terminalTables = other.terminalTables;
		this.settings = other.settings;
		this.subwordModel = subwordModel;
		this.leavesByType = other.leavesByType;
		this.bindingsByConstructor = other.bindingsByConstructor;
	}

	/**
	 * @return a converter like this one, but encoding leaf strings with {@code subwordModel}.
	 * Bindings are shared, not resolved again.
	 */
	public AstConverter<N> withSubwordModel(@Nullable SubwordModel subwordModel) {
		return new AstConverter<>(this, subwordModel);
	}

	public Grammar grammar() {
		return grammar;
	}

	public NodeRegistry<N> registry() {
		return registry;
	}

	public @Nullable SubwordModel subwordModel() {
		return subwordModel;
	}

	/**
	 * @throws UnknownProductionException if {@code node}'s type has no production
	 * @throws works.asdl.exceptions.UnknownTerminalException if a terminal token has no table entry
	 * @throws CardinalityViolationException if a required field is null
	 */
	public AsdlTree encode(N node) {
		requireNonNull(node);
		NodeShape shape = registry.shapeOf(node.getClass());
		Binding binding = bindingFor(shape.name());
		LOGGER.trace("Encoding {}", shape.name());
		List<RealizedField> fields = new ArrayList<>(binding.fields().size());
		for (FieldBinding fb: binding.fields()) {
			Object raw = fb.component().read(node);
			List<?> items = nativeItems(binding.production(), fb.field(), raw);
			List<AsdlValue> values = new ArrayList<>(items.size());
			try {
				for (Object item: items) {
					values.add(encodeValue(fb, item));
				}
			} catch (AsdlException e) {
				throw AsdlException.wrap(e, pathSegment(binding.production(), fb.field()));
			}
			fields.add(new RealizedField(fb.field(), values));
		}
		return new AsdlTree(binding.production(), fields);
	}

	/**
	 * @throws UnknownProductionException if the tree has a production with no native node type
	 * @throws works.asdl.exceptions.UnknownTerminalException if a terminal constructor has no table entry
	 * @throws CardinalityViolationException if a field has the wrong number of values
	 * @throws MalformedTreeException if a field holds the wrong kind of value
	 */
	public N decode(AsdlTree tree) {
		requireNonNull(tree);
		Binding binding = bindingFor(tree.constructorName());
		if (!binding.production().equals(tree.production())) {
			throw new MalformedTreeException("Production " + tree.production() + " does not match grammar's " + binding.production());
		}
		LOGGER.trace("Decoding {}", tree.constructorName());
		Object[] args = new Object[binding.shape().components().size()];
		List<RealizedField> realizedFields = tree.fields();
		for (int i = 0; i < realizedFields.size(); i++) {
			FieldBinding fb = binding.fields().get(i);
			RealizedField rf = realizedFields.get(i);
			List<Object> values = new ArrayList<>(rf.size());
			try {
				for (AsdlValue v: rf.values()) {
					values.add(decodeValue(fb, v));
				}
			} catch (AsdlException e) {
				throw AsdlException.wrap(e, pathSegment(binding.production(), fb.field()));
			}
			args[fb.component().index()] = reshape(binding.production(), fb.field(), values);
		}
		return registry.rootType().cast(binding.shape().instantiate(args));
	}

	private Binding bindingFor(String constructorName) {
		Binding result = bindingsByConstructor.get(constructorName);
		if (result == null) {
			throw new UnknownProductionException(constructorName);
		}
		return result;
	}

	/**
	 * A null {@code multiple} field is treated as empty.
	 */
	private static List<?> nativeItems(Production production, Field field, @Nullable Object raw) {
		if (raw == null) {
			if (field.cardinality() == Cardinality.SINGLE) {
				throw CardinalityViolationException.missingRequiredField(production, field);
			}
			return List.of();
		}
		List<?> items = (field.cardinality() == Cardinality.MULTIPLE) ? (List<?>) raw : List.of(raw);
		for (Object item: items) {
			if (item == null) {
				throw CardinalityViolationException.missingRequiredField(production, field);
			}
		}
		return items;
	}

	private AsdlValue encodeValue(FieldBinding fb, Object item) {
		return switch (fb.kind()) {
			case COMPOSITE -> encode(registry.rootType().cast(item));
			case LEAF -> encodeLeaf(fb.leaf(), (String) item);
			case TERMINAL -> {
				String constructorName = fb.table().constructorFor((String) item);
				yield AsdlTree.of(grammar.production(constructorName));
			}
			case PRIMITIVE -> Token.of((String) item);
		};
	}

	private AsdlTree encodeLeaf(LeafBinding leaf, String text) {
		if (subwordModel == null) {
			return AsdlTree.of(leaf.token(), RealizedField.of(leaf.tokenField(), Token.of(text)));
		} else {
			List<AsdlValue> pieces = new ArrayList<>();
			subwordModel.encodeAsPieces(text).forEach(p -> pieces.add(Token.of(p)));
			return AsdlTree.of(leaf.subword(), new RealizedField(leaf.subwordField(), pieces));
		}
	}

	private Object decodeValue(FieldBinding fb, AsdlValue value) {
		if (fb.kind() == FieldKind.PRIMITIVE) {
			if (value instanceof Token t) {
				return t.text();
			}
			throw new MalformedTreeException("Expected a token; found " + value);
		}
		if (!(value instanceof AsdlTree child)) {
			throw new MalformedTreeException("Expected a tree of type " + fb.field().type() + "; found token " + value);
		}
		if (!child.production().type().equals(fb.field().type())) {
			throw new MalformedTreeException("Expected a tree of type " + fb.field().type()
				+ "; found " + child.constructorName() + " of type " + child.production().type());
		}
		return switch (fb.kind()) {
			case COMPOSITE -> decode(child);
			case LEAF -> decodeLeaf(fb.leaf(), child);
			case TERMINAL -> fb.table().tokenFor(child.constructorName());
			case PRIMITIVE -> throw new AssertionError("Handled above");
		};
	}

	private static String decodeLeaf(LeafBinding leaf, AsdlTree child) {
		if (child.production().equals(leaf.token())) {
			RealizedField tokenField = child.fields().get(0);
			if (tokenField.size() != 1) {
				throw CardinalityViolationException.wrongCount(leaf.token(), leaf.tokenField(), tokenField.size());
			}
			return tokenText(tokenField.values().get(0));
		} else if (child.production().equals(leaf.subword())) {
			List<String> pieces = new ArrayList<>();
			child.fields().get(0).values().forEach(v -> pieces.add(tokenText(v)));
			return SubwordPieces.toText(pieces);
		} else {
			throw new MalformedTreeException("Expected " + leaf.token().constructorName()
				+ " or " + leaf.subword().constructorName() + "; found " + child.constructorName());
		}
	}

	private static String tokenText(AsdlValue value) {
		if (value instanceof Token t) {
			return t.text();
		}
		throw new MalformedTreeException("Expected a token; found " + value);
	}

	private static @Nullable Object reshape(Production production, Field field, List<Object> values) {
		return switch (field.cardinality()) {
			case SINGLE -> {
				if (values.size() != 1) {
					throw CardinalityViolationException.wrongCount(production, field, values.size());
				}
				yield values.get(0);
			}
			case OPTIONAL -> {
				if (values.size() > 1) {
					throw CardinalityViolationException.wrongCount(production, field, values.size());
				}
				yield values.isEmpty() ? null : values.get(0);
			}
			case MULTIPLE -> List.copyOf(values);
		};
	}

	private static String pathSegment(Production production, Field field) {
		return production.constructorName() + "." + field.name();
	}

	//
	// Resolution
	//

	private Map<String, LeafBinding> resolveLeaves() {
		Map<String, LeafBinding> result = new LinkedHashMap<>();
		settings.getLeafTypes().forEach((type, constructors) -> {
			if (!grammar.defines(type)) {
				LOGGER.debug("Grammar does not define leaf type {}", type);
				return;
			}
			Production token = leafProduction(type, constructors.tokenConstructor(), Cardinality.SINGLE);
			Production subword = leafProduction(type, constructors.subwordConstructor(), Cardinality.MULTIPLE);
			result.put(type, new LeafBinding(token, subword));
		});
		return unmodifiableMap(result);
	}

	private Production leafProduction(String type, String constructorName, Cardinality expectedCardinality) {
		Production p = grammar.findProduction(constructorName)
			.orElseThrow(() -> new InvalidNodeTypeException("Grammar has no leaf production " + constructorName + " for " + type));
		if (!p.type().equals(type)
			|| p.fields().size() != 1
			|| p.fields().get(0).cardinality() != expectedCardinality
			|| !grammar.isPrimitive(p.fields().get(0).type())) {
			throw new InvalidNodeTypeException("Leaf production " + p + " must belong to " + type
				+ " and have one " + expectedCardinality.description() + " field of primitive type");
		}
		return p;
	}

	private void checkTerminalTables() {
		for (TerminalTable table: terminalTables.tables()) {
			if (!grammar.defines(table.fieldType())) {
				continue;
			}
			for (String constructorName: table.constructors()) {
				Production p = grammar.findProduction(constructorName)
					.orElseThrow(() -> new InvalidNodeTypeException("Terminal constructor " + constructorName + " is not in the grammar"));
				if (!p.type().equals(table.fieldType()) || p.hasFields()) {
					throw new InvalidNodeTypeException("Terminal constructor " + constructorName
						+ " must be a zero-field production of " + table.fieldType() + "; found " + p);
				}
			}
		}
	}

	private Map<String, Binding> resolveBindings() {
		Map<String, Binding> result = new LinkedHashMap<>();
		for (String type: grammar.types()) {
			if (leavesByType.containsKey(type) || terminalTables.has(type)) {
				continue;
			}
			for (Production p: grammar.productionsOf(type)) {
				NodeShape shape = registry.findShape(p.constructorName())
					.orElseThrow(() -> new InvalidNodeTypeException("No native node type for production " + p.constructorName()));
				result.put(p.constructorName(), bind(p, shape));
			}
		}
		return unmodifiableMap(result);
	}

	private Binding bind(Production production, NodeShape shape) {
		if (shape.components().size() != production.fields().size()) {
			throw new InvalidNodeTypeException("Node type " + shape.type().getSimpleName()
				+ " has " + shape.components().size() + " components; production " + production
				+ " has " + production.fields().size() + " fields");
		}
		List<FieldBinding> fields = new ArrayList<>();
		Map<String, Field> fieldsByComponent = new HashMap<>();
		for (Field field: production.fields()) {
			String componentName = componentName(field.name());
			Component component = shape.findComponent(componentName)
				.orElseThrow(() -> InvalidNodeTypeException.forComponent(shape.type(), componentName, "missing for field " + field));
			Field previous = fieldsByComponent.putIfAbsent(componentName, field);
			if (previous != null) {
				throw InvalidNodeTypeException.forComponent(shape.type(), componentName,
					"bound to both " + previous + " and " + field);
			}
			FieldKind kind = kindOf(field.type());
			checkComponentType(shape, component, field, kind);
			fields.add(new FieldBinding(
				field,
				kind,
				component,
				kind == FieldKind.TERMINAL ? terminalTables.table(field.type()) : null,
				kind == FieldKind.LEAF ? leavesByType.get(field.type()) : null));
		}
		return new Binding(production, shape, List.copyOf(fields));
	}

	private FieldKind kindOf(String fieldType) {
		if (leavesByType.containsKey(fieldType)) {
			return FieldKind.LEAF;
		} else if (terminalTables.has(fieldType)) {
			return FieldKind.TERMINAL;
		} else if (grammar.isPrimitive(fieldType)) {
			return FieldKind.PRIMITIVE;
		} else {
			return FieldKind.COMPOSITE;
		}
	}

	private void checkComponentType(NodeShape shape, Component component, Field field, FieldKind kind) {
		Type valueType;
		if (field.cardinality() == Cardinality.MULTIPLE) {
			if (component.type() != List.class) {
				throw InvalidNodeTypeException.forComponent(shape.type(), component.name(), "must be a List for " + field);
			}
			if (component.genericType() instanceof ParameterizedType pt) {
				valueType = pt.getActualTypeArguments()[0];
			} else {
				throw InvalidNodeTypeException.forComponent(shape.type(), component.name(), "must have an element type");
			}
		} else {
			valueType = component.type();
		}
		if (!(valueType instanceof Class<?> valueClass)) {
			throw InvalidNodeTypeException.forComponent(shape.type(), component.name(), "unsupported type " + valueType);
		}
		if (kind == FieldKind.COMPOSITE) {
			if (!valueClass.isAssignableFrom(registry.rootType())) {
				throw InvalidNodeTypeException.forComponent(shape.type(), component.name(),
					"must accept any " + registry.rootType().getSimpleName() + " for " + field);
			}
		} else if (valueClass != String.class) {
			throw InvalidNodeTypeException.forComponent(shape.type(), component.name(), "must be a String for " + field);
		}
	}

	/**
	 * Grammar field names are snake_case; record components are camelCase.
	 */
	static String componentName(String fieldName) {
		StringBuilder sb = new StringBuilder(fieldName.length());
		boolean upperNext = false;
		for (int i = 0; i < fieldName.length(); i++) {
			char c = fieldName.charAt(i);
			if (c == '_' && sb.length() > 0) {
				upperNext = true;
			} else if (upperNext) {
				sb.append(Character.toUpperCase(c));
				upperNext = false;
			} else {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return "AstConverter(" + grammar + ", " + registry.rootType().getSimpleName() + ")";
	}

	private record Binding(Production production, NodeShape shape, List<FieldBinding> fields) { }

	private record FieldBinding(
		Field field,
		FieldKind kind,
		Component component,
		@Nullable TerminalTable table,
		@Nullable LeafBinding leaf
	) { }

	private record LeafBinding(Production token, Production subword) {
		Field tokenField() {
			return token.fields().get(0);
		}

		Field subwordField() {
			return subword.fields().get(0);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AstConverter.class);
}
