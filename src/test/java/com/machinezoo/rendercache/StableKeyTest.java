// Part of Rendercache
package com.machinezoo.rendercache;

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.*;

public class StableKeyTest {
	@Test
	public void derived() {
		StableKey root = StableKey.of("page");
		assertEquals("page_0", root.child(0).value());
		assertEquals("page:header", root.child("header").value());
		// Same position yields the same key in every render.
		assertEquals(root.child(2).child("icon"), StableKey.of("page").child(2).child("icon"));
		assertNotEquals(root.child(1), root.child(2));
	}
	@Test
	public void validation() {
		assertThrows(NullPointerException.class, () -> StableKey.of(null));
		assertThrows(IllegalArgumentException.class, () -> StableKey.of(""));
		assertThrows(IllegalArgumentException.class, () -> StableKey.of("list").child(-1));
	}
}
