// Part of Rendercache
package com.machinezoo.rendercache;

import static org.junit.jupiter.api.Assertions.*;
import java.util.*;
import org.junit.jupiter.api.*;

public class MountTrackerTest {
	MountTracker tracker = new MountTracker(true);
	StableKey key = StableKey.of("card");
	@Test
	public void tracking() {
		assertFalse(tracker.isMounted(key));
		tracker.trackMount(key);
		assertTrue(tracker.isMounted(key));
		assertEquals(Set.of(key), tracker.mounted());
		assertTrue(tracker.untrackMount(key));
		assertFalse(tracker.isMounted(key));
		assertFalse(tracker.isMounted(null));
	}
	@Test
	public void counting() {
		// Two boundaries for the same key are mounted at once, for example after caches were cleared.
		tracker.trackMount(key);
		tracker.trackMount(key);
		assertEquals(1, tracker.size());
		assertTrue(tracker.untrackMount(key));
		assertTrue(tracker.isMounted(key));
		assertTrue(tracker.untrackMount(key));
		assertFalse(tracker.isMounted(key));
		assertFalse(tracker.untrackMount(key));
	}
	@Test
	public void redundantUntrack() {
		tracker.trackMount(key);
		assertTrue(tracker.untrackMount(key));
		// Redundant unmounts are reported, but they never throw.
		assertFalse(tracker.untrackMount(key));
		assertFalse(tracker.untrackMount(key));
		assertFalse(new MountTracker().untrackMount(key));
	}
	@Test
	public void cleanup() {
		tracker.trackMount(key);
		tracker.trackMount(key.child(0));
		tracker.cleanup();
		assertEquals(0, tracker.size());
		assertFalse(tracker.isMounted(key));
	}
}
