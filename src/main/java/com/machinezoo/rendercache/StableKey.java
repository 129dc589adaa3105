// Part of Rendercache
package com.machinezoo.rendercache;

import java.util.*;

/*
 * Stable key identifies a slot in the UI tree, not its content. Content is captured by signatures.
 * Derived keys append structural position to the parent key, so that siblings get distinct keys
 * and the same position gets the same key in every render.
 * Separators mirror the two ways children are addressed: by index in a child list and by explicit name.
 */
/**
 * Identity of a node slot that correlates render calls over time to the same logical UI position.
 * 
 * @param value
 *            textual form of the key
 */
public record StableKey(String value) {
	public StableKey {
		Objects.requireNonNull(value);
		if (value.isEmpty())
			throw new IllegalArgumentException("Stable key must not be empty.");
	}
	public static StableKey of(String value) {
		return new StableKey(value);
	}
	public StableKey child(int index) {
		if (index < 0)
			throw new IllegalArgumentException("Child index must not be negative.");
		return new StableKey(value + "_" + index);
	}
	public StableKey child(String name) {
		Objects.requireNonNull(name);
		return new StableKey(value + ":" + name);
	}
	@Override
	public String toString() {
		return value;
	}
}
