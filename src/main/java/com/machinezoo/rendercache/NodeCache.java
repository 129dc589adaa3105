// Part of Rendercache
package com.machinezoo.rendercache;

import java.lang.ref.*;
import java.util.*;
import org.slf4j.*;
import com.google.common.cache.*;
import com.machinezoo.rendercache.encoding.*;
import com.machinezoo.rendercache.eviction.*;
import com.machinezoo.rendercache.theme.*;
import com.machinezoo.rendercache.utils.*;
import io.micrometer.core.instrument.*;

/*
 * Node construction is memoized per slot. Stable key identifies the slot, signature captures everything
 * the artifact depends on, including dependency values and the theme.
 * Raw properties are encoded before theme resolution. The theme is part of the signature.
 *
 * Nodes without dependency list opt out of memoization. They are rebuilt on every call
 * and their boundaries carry no key, so they never appear in mount tracker.
 *
 * The whole construction runs under the context lock.
 * The lock is reentrant, so factories may construct child nodes recursively.
 */
/**
 * Entry point for memoized construction of render artifacts.
 *
 * @param <A>
 *            type of produced artifacts
 */
public class NodeCache<A> {
	private static final Logger logger = LoggerFactory.getLogger(NodeCache.class);
	private static final Counter hits = Metrics.counter("rendercache.elements.hits");
	private static final Counter misses = Metrics.counter("rendercache.elements.misses");
	private static final Cleaner cleaner = Cleaner.create(new DaemonThreads("rendercache-cleaner"));
	private final RenderCacheContext context;
	private final ArtifactFactory<A> factory;
	/*
	 * Guava's weak keys compare by reference, so owners with custom equals() are registered correctly.
	 */
	private final Cache<Object, Boolean> owners = CacheBuilder.newBuilder()
		.weakKeys()
		.build();
	public NodeCache(RenderCacheContext context, ArtifactFactory<A> factory) {
		Objects.requireNonNull(context);
		Objects.requireNonNull(factory);
		this.context = context;
		this.factory = factory;
	}
	public RenderCacheContext context() {
		return context;
	}
	/**
	 * Constructs uncached artifact. Such artifacts are rebuilt on every call.
	 */
	public LifecycleBoundary<A> construct(Object elementType, Map<String, Object> rawProps, Theme theme) {
		synchronized (context.lock()) {
			misses.increment();
			return uncached(elementType, rawProps, theme);
		}
	}
	/**
	 * Constructs artifact for the given slot, reusing the cached one if nothing it depends on has changed.
	 *
	 * @param deps
	 *            dependency values, {@code null} disables caching
	 */
	@SuppressWarnings("unchecked")
	public LifecycleBoundary<A> construct(Object elementType, Map<String, Object> rawProps, StableKey key, List<?> deps, Theme theme) {
		if (deps == null)
			return construct(elementType, rawProps, theme);
		Objects.requireNonNull(key, "Cached nodes require stable key.");
		synchronized (context.lock()) {
			Signature signature = context.encoder().encode(Arrays.asList(
				elementType,
				rawProps,
				deps,
				theme != null ? theme.mode() : null,
				theme != null ? theme.system() : null));
			/*
			 * Encoder never throws. It returns sentinel signature instead, which would make all such nodes look equal.
			 */
			if (signature.equals(CanonicalEncoder.UNSERIALIZABLE_SIGNATURE)) {
				logger.warn("Cannot compute signature of node {}. Constructing it without caching.", key);
				misses.increment();
				return uncached(elementType, rawProps, theme);
			}
			CacheEntry<A> entry = (CacheEntry<A>)context.elements().get(key);
			if (entry != null && entry.signature().equals(signature)) {
				hits.increment();
				entry.hit();
				return entry.boundary();
			}
			misses.increment();
			A artifact = build(elementType, rawProps, theme);
			if (entry != null) {
				entry.replace(signature, artifact);
				return entry.boundary();
			}
			LifecycleBoundary<A> boundary = new LifecycleBoundary<>(context.lock(), context.tracker(), key, artifact);
			context.elements().put(key, new CacheEntry<>(signature, boundary));
			return boundary;
		}
	}
	/**
	 * Same as {@link #construct(Object, Map, StableKey, List, Theme)}, but also requests eviction sweep when the owner is garbage-collected.
	 */
	public LifecycleBoundary<A> construct(Object owner, Object elementType, Map<String, Object> rawProps, StableKey key, List<?> deps, Theme theme) {
		Objects.requireNonNull(owner);
		watch(owner);
		return construct(elementType, rawProps, key, deps, theme);
	}
	/*
	 * Finalization hook is a safety net for hosts that lose boundaries without unmounting them.
	 * Cleaner action must not reference the owner. It references the controller only weakly.
	 */
	private void watch(Object owner) {
		if (!context.config().finalizationHook())
			return;
		if (owners.asMap().putIfAbsent(owner, Boolean.TRUE) == null)
			cleaner.register(owner, new WeakRunnable<>(context.eviction(), EvictionController::ownerCollected));
	}
	private LifecycleBoundary<A> uncached(Object elementType, Map<String, Object> rawProps, Theme theme) {
		return new LifecycleBoundary<>(context.lock(), context.tracker(), null, build(elementType, rawProps, theme));
	}
	private A build(Object elementType, Map<String, Object> rawProps, Theme theme) {
		Map<String, Object> props = context.resolver().resolve(rawProps, theme, true);
		return factory.build(elementType, props);
	}
	@Override
	public String toString() {
		return getClass().getSimpleName() + ": " + context.elements();
	}
}
