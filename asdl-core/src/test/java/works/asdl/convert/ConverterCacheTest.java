package works.asdl.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import works.asdl.convert.ToyLanguage.Node;
import works.asdl.grammar.Grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConverterCacheTest {
	final AtomicInteger builds = new AtomicInteger();

	ConverterCache<Node> cache(int capacity) {
		return new ConverterCache<>(capacity, g -> {
			builds.incrementAndGet();
			return ToyLanguage.converter(g);
		});
	}

	@Test
	void reusesConverterForSameGrammar() {
		ConverterCache<Node> cache = cache(ConverterCache.DEFAULT_CAPACITY);
		Grammar grammar = ToyLanguage.grammar();
		assertSame(cache.get(grammar), cache.get(grammar));
		assertEquals(1, builds.get());
	}

	@Test
	void equalTextIsNotTheSameGrammar() {
		ConverterCache<Node> cache = cache(ConverterCache.DEFAULT_CAPACITY);
		assertNotSame(cache.get(ToyLanguage.grammar()), cache.get(ToyLanguage.grammar()));
		assertEquals(2, builds.get());
	}

	@Test
	void evictsLeastRecentlyUsed() {
		ConverterCache<Node> cache = cache(2);
		Grammar a = ToyLanguage.grammar();
		Grammar b = ToyLanguage.grammar();
		Grammar c = ToyLanguage.grammar();
		var first = cache.get(a);
		cache.get(b);
		cache.get(a);
		cache.get(c); // evicts b
		assertEquals(2, cache.size());
		assertSame(first, cache.get(a));
		assertEquals(3, builds.get());
		cache.get(b);
		assertEquals(4, builds.get());
	}

	@Test
	void failedBuildIsNotCached() {
		ConverterCache<Node> cache = new ConverterCache<>(g -> {
			builds.incrementAndGet();
			throw new IllegalStateException("nope");
		});
		Grammar grammar = ToyLanguage.grammar();
		assertThrows(IllegalStateException.class, () -> cache.get(grammar));
		assertThrows(IllegalStateException.class, () -> cache.get(grammar));
		assertEquals(2, builds.get());
		assertEquals(0, cache.size());
	}

	@Test
	void concurrentUse() throws InterruptedException {
		ConverterCache<Node> cache = cache(ConverterCache.DEFAULT_CAPACITY);
		Grammar grammar = ToyLanguage.grammar();
		List<Thread> threads = new ArrayList<>();
		for (int i = 0; i < 8; i++) {
			threads.add(new Thread(() -> cache.get(grammar)));
		}
		threads.forEach(Thread::start);
		for (Thread t: threads) {
			t.join();
		}
		assertEquals(1, builds.get());
	}

	@Test
	void capacityMustBePositive() {
		assertThrows(IllegalArgumentException.class, () -> cache(0));
	}
}
