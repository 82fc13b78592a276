package works.asdl.convert;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.asdl.grammar.Grammar;

import static java.util.Objects.requireNonNull;

/**
 * Remembers the {@link AstConverter}s built for the most recently used grammars,
 * so that convenience entry points taking only a {@link Grammar} needn't
 * resolve the grammar's bindings on every call.
 * <p>
 * Grammars are compared by identity. Thread-safe.
 */
public final class ConverterCache<N> {
	public static final int DEFAULT_CAPACITY = 8;

	private final int capacity;
	private final Function<Grammar, AstConverter<N>> factory;
	private final Map<Grammar, AstConverter<N>> converters;

	public ConverterCache(Function<Grammar, AstConverter<N>> factory) {
		this(DEFAULT_CAPACITY, factory);
	}

	public ConverterCache(int capacity, Function<Grammar, AstConverter<N>> factory) {
		if (capacity < 1) {
			throw new IllegalArgumentException("Capacity must be positive: " + capacity);
		}
		this.capacity = capacity;
		this.factory = requireNonNull(factory);
		this.converters = new LinkedHashMap<>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<Grammar, AstConverter<N>> eldest) {
				boolean evict = size() > ConverterCache.this.capacity;
				if (evict) {
					LOGGER.debug("Evicting converter for {}", eldest.getKey());
				}
				return evict;
			}
		};
	}

	/**
	 * @return the converter for {@code grammar}, building it on first use
	 */
	public synchronized AstConverter<N> get(Grammar grammar) {
		AstConverter<N> result = converters.get(requireNonNull(grammar));
		if (result == null) {
			result = factory.apply(grammar);
			converters.put(grammar, result);
			LOGGER.debug("Cached converter for {}", grammar);
		}
		return result;
	}

	public synchronized int size() {
		return converters.size();
	}

	public int capacity() {
		return capacity;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConverterCache.class);
}
