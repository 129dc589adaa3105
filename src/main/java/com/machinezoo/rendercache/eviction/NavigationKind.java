// Part of Rendercache
package com.machinezoo.rendercache.eviction;

/**
 * Origin of navigation signal.
 */
public enum NavigationKind {
	/**
	 * Navigation initiated by the user through history traversal (back and forward).
	 */
	PASSIVE,
	/**
	 * Programmatic navigation that pushes or replaces history entries.
	 */
	ACTIVE
}
