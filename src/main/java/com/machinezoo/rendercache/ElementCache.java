// Part of Rendercache
package com.machinezoo.rendercache;

import java.util.*;
import java.util.function.*;

/*
 * Element cache holds entries for both mounted and unmounted slots.
 * Entries for unmounted slots are kept until an eviction sweep confirms the slot is gone,
 * because the same slot is often mounted again shortly after unmounting (re-parenting, list reordering, back navigation).
 */
/**
 * Map from {@link StableKey} to the last artifact produced for that slot.
 */
public class ElementCache {
	private final Map<StableKey, CacheEntry<?>> map = new HashMap<>();
	public synchronized CacheEntry<?> get(StableKey key) {
		return map.get(key);
	}
	public synchronized void put(StableKey key, CacheEntry<?> entry) {
		Objects.requireNonNull(key);
		Objects.requireNonNull(entry);
		map.put(key, entry);
	}
	public synchronized CacheEntry<?> remove(StableKey key) {
		return map.remove(key);
	}
	public synchronized boolean contains(StableKey key) {
		return map.containsKey(key);
	}
	public synchronized Set<StableKey> keys() {
		return new HashSet<>(map.keySet());
	}
	public synchronized int size() {
		return map.size();
	}
	/*
	 * Condition is evaluated at removal time for every key. Returns number of removed entries.
	 */
	public synchronized int removeIf(Predicate<StableKey> condition) {
		Objects.requireNonNull(condition);
		int removed = 0;
		Iterator<StableKey> iterator = map.keySet().iterator();
		while (iterator.hasNext()) {
			if (condition.test(iterator.next())) {
				iterator.remove();
				++removed;
			}
		}
		return removed;
	}
	public synchronized void clear() {
		map.clear();
	}
	@Override
	public synchronized String toString() {
		return getClass().getSimpleName() + ": " + map.size() + " entries";
	}
}
