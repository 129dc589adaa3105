// Part of Rendercache
package com.machinezoo.rendercache.eviction;

import java.lang.management.*;
import java.util.*;
import org.slf4j.*;

/*
 * Heap usage includes garbage that hasn't been collected yet, so the reading overestimates pressure.
 */
/**
 * {@link MemoryPressure} derived from JVM heap usage.
 */
public class HeapMemoryPressure implements MemoryPressure {
	private static final Logger logger = LoggerFactory.getLogger(HeapMemoryPressure.class);
	public static final HeapMemoryPressure INSTANCE = new HeapMemoryPressure();
	private final MemoryMXBean bean;
	private HeapMemoryPressure() {
		MemoryMXBean found = null;
		try {
			found = ManagementFactory.getMemoryMXBean();
		} catch (RuntimeException | LinkageError ex) {
			logger.debug("Memory MXBean is not available. Memory pressure monitoring is disabled.", ex);
		}
		bean = found;
	}
	@Override
	public OptionalDouble usage() {
		if (bean == null)
			return OptionalDouble.empty();
		MemoryUsage heap = bean.getHeapMemoryUsage();
		/*
		 * Maximum is -1 when undefined.
		 */
		if (heap.getMax() <= 0)
			return OptionalDouble.empty();
		return OptionalDouble.of((double)heap.getUsed() / heap.getMax());
	}
	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
