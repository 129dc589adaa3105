// Part of Rendercache
package com.machinezoo.rendercache.utils;

import static org.awaitility.Awaitility.*;
import static org.junit.jupiter.api.Assertions.*;
import java.lang.ref.*;
import java.util.concurrent.atomic.*;
import org.junit.jupiter.api.*;

public class WeakRunnableTest {
	static class Target {
		final AtomicInteger calls;
		Target(AtomicInteger calls) {
			this.calls = calls;
		}
		void call() {
			calls.incrementAndGet();
		}
	}
	@Test
	public void live() {
		AtomicInteger calls = new AtomicInteger();
		Target target = new Target(calls);
		Runnable runnable = new WeakRunnable<>(target, Target::call);
		runnable.run();
		runnable.run();
		assertEquals(2, calls.get());
		assertThrows(NullPointerException.class, () -> new WeakRunnable<Target>(null, Target::call));
		assertThrows(NullPointerException.class, () -> new WeakRunnable<>(target, null));
	}
	@Test
	public void collected() {
		AtomicInteger calls = new AtomicInteger();
		Target target = new Target(calls);
		WeakReference<Target> reference = new WeakReference<>(target);
		Runnable runnable = new WeakRunnable<>(target, Target::call);
		target = null;
		// Runnable doesn't keep its target alive.
		await().until(() -> {
			System.gc();
			return reference.get() == null;
		});
		runnable.run();
		assertEquals(0, calls.get());
	}
}
