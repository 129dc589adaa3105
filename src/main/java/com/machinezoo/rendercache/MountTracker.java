// Part of Rendercache
package com.machinezoo.rendercache;

import java.util.*;
import org.slf4j.*;
import it.unimi.dsi.fastutil.objects.*;

/*
 * Mount tracker is the source of truth for eviction. Keys present here must never be evicted.
 * Keys are added and removed exclusively by lifecycle boundaries in response to host framework's mount and unmount hooks.
 *
 * Mounts are counted per key. Caches may be cleared while boundaries are mounted, after which a second boundary
 * is created for the same live key. Either boundary's unmount must not expose the key while the other one is still mounted.
 *
 * Redundant unmounts are tolerated. They usually indicate a component that fires its cleanup twice
 * or a boundary that was re-created for a live key, so diagnostics mode counts them and warns about repeated ones.
 */
/**
 * Live set of {@link StableKey}s whose artifacts are currently mounted.
 */
public class MountTracker {
	private static final Logger logger = LoggerFactory.getLogger(MountTracker.class);
	private final Object2IntOpenHashMap<StableKey> mounted = new Object2IntOpenHashMap<>();
	private final Object2IntOpenHashMap<StableKey> redundant = new Object2IntOpenHashMap<>();
	private final boolean diagnostics;
	public MountTracker(boolean diagnostics) {
		this.diagnostics = diagnostics;
	}
	public MountTracker() {
		this(false);
	}
	public synchronized void trackMount(StableKey key) {
		Objects.requireNonNull(key);
		mounted.addTo(key, 1);
		if (diagnostics)
			redundant.removeInt(key);
	}
	/*
	 * Returns false if the key was not mounted. That's not an error.
	 */
	public synchronized boolean untrackMount(StableKey key) {
		Objects.requireNonNull(key);
		int count = mounted.getInt(key);
		if (count > 1)
			mounted.put(key, count - 1);
		else if (count == 1)
			mounted.removeInt(key);
		boolean removed = count > 0;
		if (!removed && diagnostics) {
			int redundancy = redundant.addTo(key, 1) + 1;
			if (redundancy > 1)
				logger.warn("untrackMount called {} times for already unmounted key {}. This could indicate a leak or a lifecycle bug.", redundancy, key);
			else
				logger.debug("untrackMount called for key {}, which is not mounted.", key);
		}
		return removed;
	}
	public synchronized boolean isMounted(StableKey key) {
		return key != null && mounted.containsKey(key);
	}
	public synchronized Set<StableKey> mounted() {
		return new HashSet<>(mounted.keySet());
	}
	public synchronized int size() {
		return mounted.size();
	}
	public synchronized void cleanup() {
		mounted.clear();
		redundant.clear();
	}
	@Override
	public synchronized String toString() {
		return getClass().getSimpleName() + ": " + mounted.size() + " mounted";
	}
}
