// Part of Rendercache
package com.machinezoo.rendercache.eviction;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;

/*
 * History API is intercepted at most once per process, no matter how many adapters are attached.
 * Interception state is therefore static. The interceptor forwards every push and replace to the original API
 * and then notifies all attached adapters. The original API is restored when the last adapter detaches.
 *
 * Traversals are observed through popstate listeners. Every adapter reuses a single listener reference,
 * so repeated attach() calls never register the listener twice.
 */
/**
 * Default {@link NavigationAdapter} observing {@link PlatformHistory}.
 */
public class HistoryNavigationAdapter implements NavigationAdapter {
	private static final Logger logger = LoggerFactory.getLogger(HistoryNavigationAdapter.class);
	private static final Object patchLock = new Object();
	private static boolean patched;
	private static PlatformHistory patchedHistory;
	private static PlatformHistory.Api original;
	private static final Set<HistoryNavigationAdapter> attached = new CopyOnWriteArraySet<>();
	private final PlatformHistory history;
	private final Runnable popstate = this::passive;
	private volatile Consumer<NavigationKind> listener;
	public HistoryNavigationAdapter(PlatformHistory history) {
		Objects.requireNonNull(history);
		this.history = history;
	}
	public HistoryNavigationAdapter() {
		this(PlatformHistory.global());
	}
	public static boolean patched() {
		synchronized (patchLock) {
			return patched;
		}
	}
	@Override
	public void attach(Consumer<NavigationKind> listener) {
		Objects.requireNonNull(listener);
		synchronized (patchLock) {
			if (patched && patchedHistory != history)
				throw new IllegalStateException("Another history instance is already intercepted.");
			this.listener = listener;
			attached.add(this);
			if (!patched) {
				original = history.api();
				PlatformHistory.Api delegate = original;
				history.api(new PlatformHistory.Api() {
					@Override
					public void pushState(Object state, String url) {
						delegate.pushState(state, url);
						active();
					}
					@Override
					public void replaceState(Object state, String url) {
						delegate.replaceState(state, url);
						active();
					}
					@Override
					public String toString() {
						return "intercepted " + delegate;
					}
				});
				patchedHistory = history;
				patched = true;
				logger.debug("Intercepted history API of {}.", history);
			}
		}
		history.addPopStateListener(popstate);
	}
	@Override
	public void detach() {
		history.removePopStateListener(popstate);
		synchronized (patchLock) {
			attached.remove(this);
			if (patched && patchedHistory == history && attached.isEmpty()) {
				history.api(original);
				original = null;
				patchedHistory = null;
				patched = false;
				logger.debug("Restored original history API of {}.", history);
			}
		}
		listener = null;
	}
	private static void active() {
		for (HistoryNavigationAdapter adapter : attached)
			adapter.signal(NavigationKind.ACTIVE);
	}
	private void passive() {
		signal(NavigationKind.PASSIVE);
	}
	private void signal(NavigationKind kind) {
		Consumer<NavigationKind> current = listener;
		if (current != null)
			ExceptionLogging.log(logger).run(() -> current.accept(kind));
	}
	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + history + ")";
	}
}
