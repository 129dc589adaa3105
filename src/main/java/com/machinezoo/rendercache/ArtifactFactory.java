// Part of Rendercache
package com.machinezoo.rendercache;

import java.util.*;

/**
 * Platform-specific production of render artifacts from resolved properties.
 * Rendercache calls it only on cache misses.
 * 
 * @param <A>
 *            type of produced artifacts
 */
@FunctionalInterface
public interface ArtifactFactory<A> {
	A build(Object elementType, Map<String, Object> props);
}
