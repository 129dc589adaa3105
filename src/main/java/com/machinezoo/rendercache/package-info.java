// Part of Rendercache
/*
 * Conventions shared by all classes in this library:
 * - Null check is performed on method parameters where appropriate.
 * - Exceptions from host-provided code (factories, theme functions, listeners) never escape into rendering. They are logged.
 * - Everything that mutates caches or mount state synchronizes on the context lock.
 * - Metrics are exposed via the global Micrometer registry. Only eviction sweeps are traced.
 * - Method toString() is defined and cheap.
 */
/**
 * Memoized node construction and mount tracking.
 */
package com.machinezoo.rendercache;
