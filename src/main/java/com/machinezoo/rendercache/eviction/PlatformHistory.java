// Part of Rendercache
package com.machinezoo.rendercache.eviction;

import java.util.*;
import java.util.concurrent.*;
import org.slf4j.*;
import com.machinezoo.noexception.slf4j.*;
import com.machinezoo.stagean.*;

/*
 * Session history modeled after browser history: a list of entries with a cursor.
 * Hosts that bridge to a real platform history replace the API (see api(Api)) and report traversals via popState().
 *
 * Push and replace go through a swappable API object, so that navigation adapters can intercept them
 * and later restore the original. Traversal (back, forward) is reported to popstate listeners.
 */
/**
 * Process-wide navigation history of the host application.
 */
@DraftApi("bridge to platform history of real hosts")
public class PlatformHistory {
	private static final Logger logger = LoggerFactory.getLogger(PlatformHistory.class);
	/**
	 * Mutating operations of the history that can be intercepted.
	 */
	public interface Api {
		void pushState(Object state, String url);
		void replaceState(Object state, String url);
	}
	private static final PlatformHistory global = new PlatformHistory();
	public static PlatformHistory global() {
		return global;
	}
	private static class Entry {
		final Object state;
		final String url;
		Entry(Object state, String url) {
			this.state = state;
			this.url = url;
		}
	}
	private final List<Entry> entries = new ArrayList<>();
	private int cursor;
	private final Set<Runnable> listeners = new CopyOnWriteArraySet<>();
	public PlatformHistory() {
		entries.add(new Entry(null, ""));
	}
	/*
	 * The default API edits local entries. Push truncates forward entries just like browsers do.
	 */
	private final Api session = new Api() {
		@Override
		public void pushState(Object state, String url) {
			synchronized (PlatformHistory.this) {
				entries.subList(cursor + 1, entries.size()).clear();
				entries.add(new Entry(state, url));
				++cursor;
			}
		}
		@Override
		public void replaceState(Object state, String url) {
			synchronized (PlatformHistory.this) {
				entries.set(cursor, new Entry(state, url));
			}
		}
		@Override
		public String toString() {
			return "session history";
		}
	};
	private volatile Api api = session;
	public Api api() {
		return api;
	}
	public void api(Api api) {
		Objects.requireNonNull(api);
		this.api = api;
	}
	public void pushState(Object state, String url) {
		api.pushState(state, url);
	}
	public void replaceState(Object state, String url) {
		api.replaceState(state, url);
	}
	public synchronized Object state() {
		return entries.get(cursor).state;
	}
	public synchronized String url() {
		return entries.get(cursor).url;
	}
	public synchronized int length() {
		return entries.size();
	}
	public boolean back() {
		return go(-1);
	}
	public boolean forward() {
		return go(1);
	}
	/*
	 * Returns false without firing popstate if there's no entry in the requested direction.
	 */
	public boolean go(int delta) {
		synchronized (this) {
			int target = cursor + delta;
			if (delta == 0 || target < 0 || target >= entries.size())
				return false;
			cursor = target;
		}
		popState();
		return true;
	}
	/*
	 * Listeners run outside of the lock. Exceptions are logged, so that one broken listener doesn't block others.
	 */
	public void popState() {
		for (Runnable listener : listeners)
			ExceptionLogging.log(logger).run(listener);
	}
	public void addPopStateListener(Runnable listener) {
		Objects.requireNonNull(listener);
		listeners.add(listener);
	}
	public void removePopStateListener(Runnable listener) {
		listeners.remove(listener);
	}
	@Override
	public synchronized String toString() {
		return getClass().getSimpleName() + "(" + (cursor + 1) + "/" + entries.size() + ")";
	}
}
