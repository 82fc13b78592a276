package works.asdl.convert;

import java.lang.invoke.MethodHandles;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.asdl.exceptions.InvalidNodeTypeException;
import works.asdl.exceptions.UnknownProductionException;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * The native node types of a language, discovered from a sealed root type.
 * <p>
 * Every permitted subtype of the root must be either a record,
 * which becomes a {@link NodeShape} named by its simple name,
 * or another sealed interface, whose own permitted subtypes are scanned in turn.
 *
 * @param <N> the root type of native nodes
 */
public final class NodeRegistry<N> {
	private final Class<N> rootType;
	private final Map<String, NodeShape> shapesByName;
	private final Map<Class<?>, NodeShape> shapesByType;

	private NodeRegistry(Class<N> rootType, Map<String, NodeShape> shapesByName) {
		this.rootType = rootType;
		this.shapesByName = unmodifiableMap(new LinkedHashMap<>(shapesByName));
		Map<Class<?>, NodeShape> byType = new LinkedHashMap<>();
		shapesByName.values().forEach(s -> byType.put(s.type(), s));
		this.shapesByType = unmodifiableMap(byType);
	}

	/**
	 * @param lookup must have access to the constructors and accessors of the records
	 * @throws InvalidNodeTypeException if {@code rootType} isn't sealed,
	 * if a permitted subtype is neither a record nor a sealed interface,
	 * or if two records have the same simple name
	 */
	@SuppressWarnings("unchecked")
	public static <N> NodeRegistry<N> scan(Class<N> rootType, MethodHandles.Lookup lookup) {
		requireNonNull(lookup);
		if (!rootType.isSealed()) {
			throw new InvalidNodeTypeException("Root node type must be sealed: " + rootType);
		}
		Map<String, NodeShape> shapes = new LinkedHashMap<>();
		Deque<Class<?>> pending = new ArrayDeque<>();
		pending.add(rootType);
		while (!pending.isEmpty()) {
			Class<?> current = pending.removeFirst();
			if (current.isRecord()) {
				NodeShape shape = NodeShape.of((Class<? extends Record>) current, lookup);
				NodeShape existing = shapes.putIfAbsent(shape.name(), shape);
				if (existing != null && existing.type() != current) {
					throw new InvalidNodeTypeException("Node types " + existing.type().getName()
						+ " and " + current.getName() + " have the same name");
				}
			} else if (current.isInterface() && current.isSealed()) {
				for (Class<?> sub: current.getPermittedSubclasses()) {
					pending.addLast(sub);
				}
			} else {
				throw new InvalidNodeTypeException("Node type must be a record or a sealed interface: " + current);
			}
		}
		LOGGER.debug("Scanned {} node types under {}", shapes.size(), rootType.getSimpleName());
		return new NodeRegistry<>(rootType, shapes);
	}

	public Class<N> rootType() {
		return rootType;
	}

	/**
	 * @throws UnknownProductionException if there's no node type with this name
	 */
	public NodeShape shape(String name) {
		NodeShape result = shapesByName.get(name);
		if (result == null) {
			throw new UnknownProductionException(name, "No native node type for production " + name);
		}
		return result;
	}

	public Optional<NodeShape> findShape(String name) {
		return Optional.ofNullable(shapesByName.get(name));
	}

	/**
	 * @throws UnknownProductionException if {@code nodeType} was not found by the scan
	 */
	public NodeShape shapeOf(Class<?> nodeType) {
		NodeShape result = shapesByType.get(nodeType);
		if (result == null) {
			throw new UnknownProductionException(nodeType.getSimpleName(), "Unregistered node type " + nodeType.getName());
		}
		return result;
	}

	public Collection<NodeShape> shapes() {
		return shapesByName.values();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(NodeRegistry.class);
}
