// Part of Rendercache
package com.machinezoo.rendercache.eviction;

/**
 * Diagnostic hook notified after every completed eviction sweep.
 * Exceptions thrown by the listener are logged and otherwise ignored.
 */
@FunctionalInterface
public interface EvictionListener {
	void swept(SweepKind kind, int evicted);
}
