// Part of Rendercache
package com.machinezoo.rendercache;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class ResolutionCacheTest {
	@Test
	public void bounded() {
		ResolutionCache<Integer, String> cache = new ResolutionCache<>(10, 3);
		for (int i = 0; i < 100; ++i) {
			cache.set(i, "v" + i);
			assertThat(cache.size(), lessThanOrEqualTo(10 + 3));
		}
		// The most recent entry always survives.
		assertEquals("v99", cache.get(99));
		assertNull(cache.get(0));
	}
	@Test
	public void batchEviction() {
		ResolutionCache<Integer, String> cache = new ResolutionCache<>(10, 4);
		for (int i = 0; i < 10; ++i)
			cache.set(i, "v" + i);
		assertEquals(10, cache.size());
		// Exceeding the limit evicts the whole batch at once.
		cache.set(10, "v10");
		assertEquals(7, cache.size());
		assertEquals(List.of(4, 5, 6, 7, 8, 9, 10), cache.keys());
	}
	@Test
	public void leastRecentlyUsed() {
		ResolutionCache<String, String> cache = new ResolutionCache<>(3, 1);
		cache.set("a", "1");
		cache.set("b", "2");
		cache.set("c", "3");
		// Reads mark entries as recently used.
		assertEquals("1", cache.get("a"));
		cache.set("d", "4");
		assertFalse(cache.contains("b"));
		assertEquals(List.of("c", "a", "d"), cache.keys());
		// Writes do too.
		cache.set("c", "5");
		assertEquals(List.of("a", "d", "c"), cache.keys());
	}
	@Test
	public void maintenance() {
		ResolutionCache<String, String> cache = new ResolutionCache<>(100, 10);
		cache.set("a", "1");
		cache.set("b", "2");
		cache.set("c", "3");
		assertEquals("2", cache.remove("b"));
		assertNull(cache.remove("b"));
		assertEquals(1, cache.evict(1));
		assertEquals(List.of("c"), cache.keys());
		assertEquals(1, cache.evict(5));
		cache.set("d", "4");
		cache.clear();
		assertEquals(0, cache.size());
	}
	@Test
	public void validation() {
		assertThrows(IllegalArgumentException.class, () -> new ResolutionCache<>(-1, 10));
		assertThrows(IllegalArgumentException.class, () -> new ResolutionCache<>(10, 0));
		ResolutionCache<String, String> cache = new ResolutionCache<>(10, 1);
		assertThrows(NullPointerException.class, () -> cache.set("a", null));
		assertThrows(NullPointerException.class, () -> cache.get(null));
	}
}
