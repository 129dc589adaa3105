// Part of Rendercache
package com.machinezoo.rendercache.utils;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

/**
 * Thread factory producing named daemon threads, so that background maintenance never keeps the JVM alive.
 */
public class DaemonThreads implements ThreadFactory {
	private final String name;
	private final AtomicInteger counter = new AtomicInteger();
	public DaemonThreads(String name) {
		Objects.requireNonNull(name);
		this.name = name;
	}
	@Override
	public Thread newThread(Runnable runnable) {
		Thread thread = new Thread(runnable);
		thread.setDaemon(true);
		int index = counter.getAndIncrement();
		thread.setName(index == 0 ? name : name + "-" + index);
		return thread;
	}
}
