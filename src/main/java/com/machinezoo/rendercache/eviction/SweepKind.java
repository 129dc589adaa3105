// Part of Rendercache
package com.machinezoo.rendercache.eviction;

/**
 * Signal that caused an eviction sweep.
 */
public enum SweepKind {
	NAVIGATION,
	VISIBILITY,
	FINALIZATION,
	MANUAL,
	/**
	 * Sweep triggered by memory pressure. Besides unmounted elements, it also purges theme resolution caches.
	 */
	EMERGENCY
}
