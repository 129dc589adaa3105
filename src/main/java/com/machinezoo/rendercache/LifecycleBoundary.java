// Part of Rendercache
package com.machinezoo.rendercache;

import java.util.*;
import com.machinezoo.closeablescope.*;

/*
 * Lifecycle boundary is the only object allowed to add and remove keys in mount tracker.
 * There is exactly one boundary per live stable key. Cache hits return the existing boundary
 * and signature changes only swap the artifact inside it. Second boundary for the same key appears only
 * after caches are cleared. Mount tracker counts mounts per key, so the old boundary's unmount doesn't expose the new one.
 *
 * Notifications use the boundary's own key, which doesn't change when the artifact is swapped.
 * Hosts often register the unmount callback once and keep it across re-renders.
 *
 * Boundaries of uncached nodes have no key. They still track mounted state, but they don't notify anyone.
 * All state changes synchronize on the owning context, so that eviction sweeps observe consistent mount state.
 */
/**
 * Wrapper around a cached artifact emitting mount and unmount notifications exactly once per visibility transition.
 * 
 * @param <A>
 *            type of the wrapped artifact
 */
public class LifecycleBoundary<A> {
	private final Object lock;
	private final MountTracker tracker;
	private final StableKey key;
	private volatile A artifact;
	private boolean mounted;
	LifecycleBoundary(Object lock, MountTracker tracker, StableKey key, A artifact) {
		Objects.requireNonNull(lock);
		Objects.requireNonNull(tracker);
		this.lock = lock;
		this.tracker = tracker;
		this.key = key;
		this.artifact = artifact;
	}
	public StableKey key() {
		return key;
	}
	public A artifact() {
		return artifact;
	}
	void artifact(A artifact) {
		this.artifact = artifact;
	}
	public boolean mounted() {
		synchronized (lock) {
			return mounted;
		}
	}
	/*
	 * Returned scope unmounts the boundary when closed, which is handy for hosts with scoped lifecycles and in tests.
	 */
	public CloseableScope mount() {
		synchronized (lock) {
			if (!mounted) {
				mounted = true;
				StableKey current = key;
				if (current != null)
					tracker.trackMount(current);
			}
		}
		return this::unmount;
	}
	/*
	 * Returns true if this call performed the transition, false if the boundary wasn't mounted.
	 */
	public boolean unmount() {
		synchronized (lock) {
			if (!mounted)
				return false;
			mounted = false;
			StableKey current = key;
			if (current != null)
				tracker.untrackMount(current);
			return true;
		}
	}
	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + key + ") = " + artifact;
	}
}
