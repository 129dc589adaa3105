// Part of Rendercache
/**
 * Signals that trigger eviction of unmounted elements from the element cache.
 */
package com.machinezoo.rendercache.eviction;
