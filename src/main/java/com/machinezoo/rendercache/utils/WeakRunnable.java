// Part of Rendercache
package com.machinezoo.rendercache.utils;

import java.lang.ref.*;
import java.util.*;
import java.util.function.*;
import com.machinezoo.stagean.*;

/*
 * Cleaner actions and scheduled tasks must not strongly reference the object they notify.
 * Cleaner actions in particular would otherwise keep the controller reachable for as long as any registered owner lives.
 * This class makes it easy to create weak Runnable from instance method references.
 */
/**
 * Weak reference to an instance method.
 * 
 * @param <T>
 *            type of object that defines the method
 */
@StubDocs
public class WeakRunnable<T> implements Runnable {
	private final WeakReference<T> weakref;
	private final Consumer<T> method;
	/*
	 * Bound method references cannot be split automatically, so target and method are passed separately.
	 */
	public WeakRunnable(T target, Consumer<T> method) {
		Objects.requireNonNull(target);
		Objects.requireNonNull(method);
		weakref = new WeakReference<>(target);
		this.method = method;
	}
	@Override
	public void run() {
		T target = weakref.get();
		if (target != null)
			method.accept(target);
	}
}
