// Part of Rendercache
package com.machinezoo.rendercache;

import java.util.*;
import com.machinezoo.rendercache.encoding.*;
import com.machinezoo.rendercache.eviction.*;
import com.machinezoo.rendercache.theme.*;

/*
 * Context owns one instance of every cache component and the lock that serializes them.
 * Construction, lifecycle notifications and eviction sweeps all synchronize on lock(),
 * which makes every sweep atomic relative to node construction.
 *
 * Applications usually create one context per process or per rendering root.
 * Tests create one context per test, which isolates them from each other.
 */
/**
 * Owner of all cache components of one rendering root.
 */
public class RenderCacheContext {
	private final Object lock = new Object();
	private final RenderCacheConfig config;
	private final CanonicalEncoder encoder;
	private final ThemeGraphResolver resolver;
	private final ElementCache elements = new ElementCache();
	private final MountTracker tracker;
	private final EvictionController eviction;
	public RenderCacheContext(RenderCacheConfig config) {
		Objects.requireNonNull(config);
		this.config = config;
		encoder = new CanonicalEncoder();
		resolver = new ThemeGraphResolver(
			encoder,
			new ResolutionCache<>(config.resolutionLimit(), config.resolutionBatch()),
			new ResolutionCache<>(config.pathLimit(), config.pathBatch()),
			config.resolutionCaching());
		tracker = new MountTracker(config.diagnostics());
		eviction = new EvictionController(this);
	}
	public RenderCacheContext() {
		this(new RenderCacheConfig());
	}
	public RenderCacheConfig config() {
		return config;
	}
	public Object lock() {
		return lock;
	}
	public CanonicalEncoder encoder() {
		return encoder;
	}
	public ThemeGraphResolver resolver() {
		return resolver;
	}
	public ElementCache elements() {
		return elements;
	}
	public MountTracker tracker() {
		return tracker;
	}
	public EvictionController eviction() {
		return eviction;
	}
	public <A> NodeCache<A> nodes(ArtifactFactory<A> factory) {
		return new NodeCache<>(this, factory);
	}
	/*
	 * Mount state is kept. Boundaries that are still mounted keep their keys in the tracker,
	 * so their slots remain protected when they are constructed again.
	 */
	public void clearCaches() {
		synchronized (lock) {
			elements.clear();
			resolver.clear();
		}
	}
	/*
	 * Full reset, typically between tests or after hot reload. Forgets all mounts.
	 */
	public void reset() {
		synchronized (lock) {
			clearCaches();
			tracker.cleanup();
		}
	}
	@Override
	public String toString() {
		return getClass().getSimpleName() + ": " + elements + ", " + tracker;
	}
}
