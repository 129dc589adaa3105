// Part of Rendercache
package com.machinezoo.rendercache.eviction;

import java.util.*;

/**
 * Optional source of memory usage information.
 */
@FunctionalInterface
public interface MemoryPressure {
	/**
	 * Fraction of available memory that is currently in use.
	 * 
	 * @return usage in range [0, 1] or empty value if usage cannot be determined
	 */
	OptionalDouble usage();
}
