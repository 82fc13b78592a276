package works.asdl.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import works.asdl.exceptions.UnknownProductionException;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * An immutable ASDL grammar: named types, each with one or more {@link Production}s,
 * plus a set of primitive types whose values are raw tokens.
 * <p>
 * Grammars deliberately use identity equality:
 * a grammar is loaded once and shared, and converters are cached per grammar instance.
 *
 * @see AsdlGrammarReader
 */
public final class Grammar {
	private final String rootType;
	private final Set<String> primitiveTypes;
	private final Map<String, List<Production>> productionsByType;
	private final Map<String, Production> productionsByConstructor;

	private Grammar(String rootType, Set<String> primitiveTypes, Map<String, List<Production>> productionsByType) {
		this.rootType = rootType;
		this.primitiveTypes = Set.copyOf(primitiveTypes);
		var byType = new LinkedHashMap<String, List<Production>>();
		var byConstructor = new LinkedHashMap<String, Production>();
		productionsByType.forEach((type, productions) -> {
			byType.put(type, List.copyOf(productions));
			productions.forEach(p -> byConstructor.put(p.constructorName(), p));
		});
		this.productionsByType = unmodifiableMap(byType);
		this.productionsByConstructor = unmodifiableMap(byConstructor);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @throws UnknownProductionException if there's no production with the given constructor name
	 */
	public Production production(String constructorName) {
		Production result = productionsByConstructor.get(constructorName);
		if (result == null) {
			throw new UnknownProductionException(constructorName);
		}
		return result;
	}

	public Optional<Production> findProduction(String constructorName) {
		return Optional.ofNullable(productionsByConstructor.get(constructorName));
	}

	/**
	 * @return the productions of the given type, in declaration order
	 * @throws IllegalArgumentException if the grammar does not define {@code type}
	 */
	public List<Production> productionsOf(String type) {
		List<Production> result = productionsByType.get(type);
		if (result == null) {
			throw new IllegalArgumentException("Grammar does not define type " + type);
		}
		return result;
	}

	/**
	 * @return the defined (non-primitive) types, in declaration order
	 */
	public Set<String> types() {
		return productionsByType.keySet();
	}

	public Set<String> primitiveTypes() {
		return primitiveTypes;
	}

	public boolean isPrimitive(String type) {
		return primitiveTypes.contains(type);
	}

	public boolean defines(String type) {
		return productionsByType.containsKey(type);
	}

	/**
	 * @return the first type defined by the grammar
	 */
	public String rootType() {
		return rootType;
	}

	public List<Production> productions() {
		return List.copyOf(productionsByConstructor.values());
	}

	@Override
	public String toString() {
		return "Grammar(root=" + rootType + ", " + productionsByType.size() + " types, " + productionsByConstructor.size() + " productions)";
	}

	public static final class Builder {
		private final Set<String> primitiveTypes = new LinkedHashSet<>();
		private final Map<String, List<Production>> productionsByType = new LinkedHashMap<>();
		private final Set<String> constructorNames = new LinkedHashSet<>();

		Builder() {}

		public Builder primitiveType(String name) {
			primitiveTypes.add(requireNonNull(name));
			return this;
		}

		/**
		 * Adds a production to {@code type}, defining the type if this is its first production.
		 *
		 * @throws IllegalArgumentException if the constructor name is already taken
		 */
		public Builder production(String type, String constructorName, Field... fields) {
			return production(new Production(type, constructorName, List.of(fields)));
		}

		public Builder production(Production production) {
			if (!constructorNames.add(production.constructorName())) {
				throw new IllegalArgumentException("Duplicate constructor name: " + production.constructorName());
			}
			productionsByType
				.computeIfAbsent(production.type(), _t -> new ArrayList<>())
				.add(production);
			return this;
		}

		/**
		 * @throws IllegalArgumentException if the grammar is empty,
		 * or a field refers to a type that is neither defined nor primitive
		 */
		public Grammar build() {
			if (productionsByType.isEmpty()) {
				throw new IllegalArgumentException("Grammar defines no types");
			}
			for (String type: productionsByType.keySet()) {
				if (primitiveTypes.contains(type)) {
					throw new IllegalArgumentException("Type " + type + " is declared primitive but has productions");
				}
			}
			productionsByType.values().forEach(productions -> productions.forEach(p -> {
				for (Field f: p.fields()) {
					if (!productionsByType.containsKey(f.type()) && !primitiveTypes.contains(f.type())) {
						throw new IllegalArgumentException("Field " + p.constructorName() + "." + f.name() + " has undefined type " + f.type());
					}
				}
			}));
			String rootType = productionsByType.keySet().iterator().next();
			return new Grammar(rootType, primitiveTypes, productionsByType);
		}
	}
}
