// Part of Rendercache
package com.machinezoo.rendercache.eviction;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.rendercache.*;
import com.machinezoo.rendercache.utils.*;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.Timer;
import io.opentracing.*;
import io.opentracing.util.*;

/*
 * Eviction removes element cache entries whose keys are not mounted. Mount state is checked at sweep time
 * under the context lock, so a slot that was re-mounted between the signal and the sweep is kept.
 *
 * Signals (navigation, finalization of owners) are debounced. Every signal cancels the pending sweep and schedules a new one,
 * so bursts of navigation events (redirect chains, replaceState storms) result in a single sweep.
 * All timers run on one daemon thread. Sweeps never run on the caller's thread except for explicit sweep() calls.
 *
 * Signals received while the controller is stopped are ignored. Only explicit sweeps work without start().
 */
/**
 * Triggers eviction sweeps in response to environment signals.
 */
public class EvictionController {
	private static final Logger logger = LoggerFactory.getLogger(EvictionController.class);
	private static final Timer timer = Metrics.timer("rendercache.sweeps");
	private static final Counter evictedCount = Metrics.counter("rendercache.sweeps.evicted");
	private static final ScheduledExecutorService shared = Executors.newScheduledThreadPool(1, new DaemonThreads("rendercache-eviction"));
	private final RenderCacheContext context;
	private final ScheduledExecutorService executor;
	private final Duration debounce;
	private final Duration visibilityDelay;
	private final NavigationAdapter navigation;
	private final MemoryPressure memory;
	private final boolean monitoring;
	private final Duration memoryInterval;
	private final double highWaterMark;
	private final EvictionListener listener;
	/*
	 * One listener reference for the whole lifetime of the controller,
	 * so that adapters can recognize repeated registrations.
	 */
	private final Consumer<NavigationKind> signals = this::navigated;
	private boolean started;
	private boolean attached;
	private ScheduledFuture<?> pending;
	private SweepKind pendingKind;
	private ScheduledFuture<?> visibility;
	private ScheduledFuture<?> polling;
	public EvictionController(RenderCacheContext context) {
		Objects.requireNonNull(context);
		this.context = context;
		RenderCacheConfig config = context.config();
		executor = config.scheduler() != null ? config.scheduler() : shared;
		debounce = config.debounce();
		visibilityDelay = config.visibilityDelay();
		navigation = config.navigationAdapter() != null ? config.navigationAdapter() : new HistoryNavigationAdapter();
		memory = config.memoryPressure();
		monitoring = config.memoryMonitoring();
		memoryInterval = config.memoryInterval();
		highWaterMark = config.highWaterMark();
		listener = config.evictionListener();
	}
	public synchronized boolean started() {
		return started;
	}
	public synchronized void start() {
		if (started)
			return;
		/*
		 * Interception conflict only costs us navigation signals. Other triggers keep working.
		 */
		try {
			navigation.attach(signals);
			attached = true;
		} catch (IllegalStateException ex) {
			logger.warn("Cannot attach navigation adapter {}. Eviction will not react to navigation.", navigation, ex);
		}
		if (monitoring && memory.usage().isPresent()) {
			long interval = Math.max(1, memoryInterval.toMillis());
			polling = executor.scheduleWithFixedDelay(ExceptionLogging.log(logger).runnable(this::poll), interval, interval, TimeUnit.MILLISECONDS);
		}
		started = true;
		logger.info("Eviction controller started with {} navigation adapter.", navigation);
	}
	public synchronized void stop() {
		if (!started)
			return;
		started = false;
		if (attached) {
			navigation.detach();
			attached = false;
		}
		pending = cancel(pending);
		pendingKind = null;
		visibility = cancel(visibility);
		polling = cancel(polling);
		logger.info("Eviction controller stopped.");
	}
	private static ScheduledFuture<?> cancel(ScheduledFuture<?> future) {
		if (future != null)
			future.cancel(false);
		return null;
	}
	/*
	 * Host routers call this directly. History adapters call it too.
	 */
	public void navigated(NavigationKind kind) {
		Objects.requireNonNull(kind);
		logger.trace("{} navigation detected.", kind);
		request(SweepKind.NAVIGATION);
	}
	/*
	 * Sweep runs only if the page is still hidden when the delay elapses.
	 */
	public synchronized void visibilityChanged(boolean hidden) {
		if (!started)
			return;
		if (hidden) {
			if (visibility == null)
				visibility = executor.schedule(ExceptionLogging.log(logger).runnable(this::hiddenLong), Math.max(1, visibilityDelay.toMillis()), TimeUnit.MILLISECONDS);
		} else
			visibility = cancel(visibility);
	}
	private void hiddenLong() {
		synchronized (this) {
			if (visibility == null)
				return;
			visibility = null;
		}
		sweep(SweepKind.VISIBILITY);
	}
	/*
	 * Called by the finalization hook when an owner registered with node cache was collected.
	 */
	public void ownerCollected() {
		request(SweepKind.FINALIZATION);
	}
	private synchronized void request(SweepKind kind) {
		if (!started)
			return;
		pending = cancel(pending);
		pendingKind = kind;
		pending = executor.schedule(ExceptionLogging.log(logger).runnable(new WeakRunnable<>(this, EvictionController::debounced)), Math.max(1, debounce.toMillis()), TimeUnit.MILLISECONDS);
	}
	private void debounced() {
		SweepKind kind;
		synchronized (this) {
			if (pending == null)
				return;
			kind = pendingKind;
			pending = null;
			pendingKind = null;
		}
		sweep(kind);
	}
	private void poll() {
		OptionalDouble usage = memory.usage();
		if (usage.isPresent() && usage.getAsDouble() > highWaterMark) {
			int evicted = emergencySweep();
			logger.warn("High memory usage ({}%). Emergency sweep evicted {} entries.", String.format("%.1f", 100 * usage.getAsDouble()), evicted);
		}
	}
	/**
	 * Immediately evicts all cached elements that are not mounted.
	 *
	 * @return number of evicted elements
	 */
	public int sweep() {
		return sweep(SweepKind.MANUAL);
	}
	/**
	 * Evicts all unmounted elements and purges theme resolution caches.
	 *
	 * @return number of evicted elements
	 */
	public int emergencySweep() {
		return sweep(SweepKind.EMERGENCY);
	}
	private int sweep(SweepKind kind) {
		Span span = GlobalTracer.get().buildSpan("rendercache.sweep")
			.withTag("component", "rendercache")
			.withTag("kind", kind.name())
			.start();
		try (Scope trace = GlobalTracer.get().activateSpan(span)) {
			Timer.Sample sample = Timer.start();
			int evicted;
			synchronized (context.lock()) {
				MountTracker tracker = context.tracker();
				evicted = context.elements().removeIf(key -> !tracker.isMounted(key));
				if (kind == SweepKind.EMERGENCY)
					context.resolver().clear();
			}
			sample.stop(timer);
			evictedCount.increment(evicted);
			span.setTag("evicted", evicted);
			if (evicted > 0)
				logger.debug("{} sweep evicted {} unmounted elements.", kind, evicted);
			if (listener != null)
				ExceptionLogging.log(logger).run(() -> listener.swept(kind, evicted));
			return evicted;
		} finally {
			span.finish();
		}
	}
	/*
	 * Equivalent of page unload. Stops all signals and drops all caches.
	 */
	public void unload() {
		stop();
		context.clearCaches();
	}
	@Override
	public synchronized String toString() {
		return getClass().getSimpleName() + (started ? ": started" : ": stopped");
	}
}
