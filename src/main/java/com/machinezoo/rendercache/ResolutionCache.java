// Part of Rendercache
package com.machinezoo.rendercache;

import java.util.*;
import io.micrometer.core.instrument.*;

/*
 * Access-ordered LinkedHashMap already keeps entries sorted from least to most recently used
 * and it marks entries as used on both get() and put().
 * We don't use removeEldestEntry(), because we want to evict a whole batch at once when the limit is exceeded.
 * Batch eviction amortizes eviction cost over many insertions.
 *
 * All methods are synchronized. Contention is not expected, because caches are accessed by a single writer at a time.
 */
/**
 * Bounded least-recently-used cache that evicts a batch of entries when it grows over its limit.
 * Size never exceeds limit plus batch size.
 *
 * @param <K>
 *            type of cache keys
 * @param <V>
 *            type of cached values
 */
public class ResolutionCache<K, V> {
	private static final Counter hits = Metrics.counter("rendercache.lru.hits");
	private static final Counter misses = Metrics.counter("rendercache.lru.misses");
	private static final Counter evictions = Metrics.counter("rendercache.lru.evictions");
	private final int limit;
	private final int batch;
	private final Map<K, V> map;
	public ResolutionCache(int limit, int batch) {
		if (limit < 0)
			throw new IllegalArgumentException("Cache limit must not be negative.");
		if (batch < 1)
			throw new IllegalArgumentException("Eviction batch must contain at least one entry.");
		this.limit = limit;
		this.batch = batch;
		map = new LinkedHashMap<>(16, 0.75f, true);
	}
	public int limit() {
		return limit;
	}
	public int batch() {
		return batch;
	}
	public synchronized V get(K key) {
		Objects.requireNonNull(key);
		V value = map.get(key);
		if (value != null)
			hits.increment();
		else
			misses.increment();
		return value;
	}
	public synchronized void set(K key, V value) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(value);
		map.put(key, value);
		if (map.size() > limit)
			evict(batch);
	}
	public synchronized V remove(K key) {
		return map.remove(key);
	}
	/*
	 * Evicts up to the given number of least recently used entries. Exposed for emergency sweeps.
	 */
	public synchronized int evict(int count) {
		int evicted = 0;
		Iterator<K> iterator = map.keySet().iterator();
		while (evicted < count && iterator.hasNext()) {
			iterator.next();
			iterator.remove();
			++evicted;
		}
		evictions.increment(evicted);
		return evicted;
	}
	public synchronized int size() {
		return map.size();
	}
	public synchronized boolean contains(K key) {
		return map.containsKey(key);
	}
	/*
	 * Keys from least to most recently used. Returns a copy. Reading keys does not affect their order.
	 */
	public synchronized List<K> keys() {
		return new ArrayList<>(map.keySet());
	}
	public synchronized void clear() {
		map.clear();
	}
	@Override
	public synchronized String toString() {
		return getClass().getSimpleName() + ": " + map.size() + "/" + limit;
	}
}
