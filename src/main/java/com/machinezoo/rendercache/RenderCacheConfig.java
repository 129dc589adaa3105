// Part of Rendercache
package com.machinezoo.rendercache;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import com.machinezoo.rendercache.eviction.*;
import com.machinezoo.stagean.*;

/*
 * Configuration follows the usual accessor pair pattern: getter without parameters, fluent setter with one parameter.
 * Configuration is read when RenderCacheContext is constructed. Later changes have no effect on existing contexts.
 */
/**
 * Tuning parameters and pluggable environment signals for {@link RenderCacheContext}.
 */
@StubDocs
public class RenderCacheConfig {
	private int resolutionLimit = 500;
	public int resolutionLimit() {
		return resolutionLimit;
	}
	public RenderCacheConfig resolutionLimit(int resolutionLimit) {
		this.resolutionLimit = resolutionLimit;
		return this;
	}
	private int resolutionBatch = 50;
	public int resolutionBatch() {
		return resolutionBatch;
	}
	public RenderCacheConfig resolutionBatch(int resolutionBatch) {
		this.resolutionBatch = resolutionBatch;
		return this;
	}
	private int pathLimit = 500;
	public int pathLimit() {
		return pathLimit;
	}
	public RenderCacheConfig pathLimit(int pathLimit) {
		this.pathLimit = pathLimit;
		return this;
	}
	private int pathBatch = 50;
	public int pathBatch() {
		return pathBatch;
	}
	public RenderCacheConfig pathBatch(int pathBatch) {
		this.pathBatch = pathBatch;
		return this;
	}
	/*
	 * Resolution caching is meant for server-side rendering, where the same graph instances are resolved repeatedly.
	 */
	private boolean resolutionCaching;
	public boolean resolutionCaching() {
		return resolutionCaching;
	}
	public RenderCacheConfig resolutionCaching(boolean resolutionCaching) {
		this.resolutionCaching = resolutionCaching;
		return this;
	}
	private Duration debounce = Duration.ofMillis(100);
	public Duration debounce() {
		return debounce;
	}
	public RenderCacheConfig debounce(Duration debounce) {
		Objects.requireNonNull(debounce);
		this.debounce = debounce;
		return this;
	}
	private Duration visibilityDelay = Duration.ofSeconds(5);
	public Duration visibilityDelay() {
		return visibilityDelay;
	}
	public RenderCacheConfig visibilityDelay(Duration visibilityDelay) {
		Objects.requireNonNull(visibilityDelay);
		this.visibilityDelay = visibilityDelay;
		return this;
	}
	private boolean memoryMonitoring = true;
	public boolean memoryMonitoring() {
		return memoryMonitoring;
	}
	public RenderCacheConfig memoryMonitoring(boolean memoryMonitoring) {
		this.memoryMonitoring = memoryMonitoring;
		return this;
	}
	private Duration memoryInterval = Duration.ofSeconds(30);
	public Duration memoryInterval() {
		return memoryInterval;
	}
	public RenderCacheConfig memoryInterval(Duration memoryInterval) {
		Objects.requireNonNull(memoryInterval);
		this.memoryInterval = memoryInterval;
		return this;
	}
	private double highWaterMark = 0.85;
	public double highWaterMark() {
		return highWaterMark;
	}
	public RenderCacheConfig highWaterMark(double highWaterMark) {
		if (!(highWaterMark > 0 && highWaterMark <= 1))
			throw new IllegalArgumentException("High-water mark must be in range (0, 1].");
		this.highWaterMark = highWaterMark;
		return this;
	}
	private boolean finalizationHook = true;
	public boolean finalizationHook() {
		return finalizationHook;
	}
	public RenderCacheConfig finalizationHook(boolean finalizationHook) {
		this.finalizationHook = finalizationHook;
		return this;
	}
	/*
	 * Enables warnings about lifecycle inconsistencies. Intended for development.
	 */
	private boolean diagnostics;
	public boolean diagnostics() {
		return diagnostics;
	}
	public RenderCacheConfig diagnostics(boolean diagnostics) {
		this.diagnostics = diagnostics;
		return this;
	}
	private EvictionListener evictionListener;
	public EvictionListener evictionListener() {
		return evictionListener;
	}
	public RenderCacheConfig evictionListener(EvictionListener evictionListener) {
		this.evictionListener = evictionListener;
		return this;
	}
	/*
	 * Null means the default adapter over PlatformHistory.
	 */
	private NavigationAdapter navigationAdapter;
	public NavigationAdapter navigationAdapter() {
		return navigationAdapter;
	}
	public RenderCacheConfig navigationAdapter(NavigationAdapter navigationAdapter) {
		this.navigationAdapter = navigationAdapter;
		return this;
	}
	private MemoryPressure memoryPressure = HeapMemoryPressure.INSTANCE;
	public MemoryPressure memoryPressure() {
		return memoryPressure;
	}
	public RenderCacheConfig memoryPressure(MemoryPressure memoryPressure) {
		Objects.requireNonNull(memoryPressure);
		this.memoryPressure = memoryPressure;
		return this;
	}
	/*
	 * Null means the shared daemon scheduler.
	 */
	private ScheduledExecutorService scheduler;
	public ScheduledExecutorService scheduler() {
		return scheduler;
	}
	public RenderCacheConfig scheduler(ScheduledExecutorService scheduler) {
		this.scheduler = scheduler;
		return this;
	}
	@Override
	public String toString() {
		return getClass().getSimpleName() + ": resolution " + resolutionLimit + "+" + resolutionBatch + ", debounce " + debounce;
	}
}
