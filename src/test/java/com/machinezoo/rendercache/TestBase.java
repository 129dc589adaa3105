// Part of Rendercache
package com.machinezoo.rendercache;

import static org.awaitility.Awaitility.*;
import org.awaitility.pollinterval.*;
import org.junit.jupiter.api.*;
import com.machinezoo.noexception.*;

public abstract class TestBase {
	@BeforeAll
	public static void awaitility() {
		setDefaultPollInterval(new FibonacciPollInterval());
	}
	public static void sleep(int millis) {
		Exceptions.sneak().run(() -> Thread.sleep(millis));
	}
	/*
	 * Long enough for debounced sweeps configured in tests to fire.
	 */
	public static void settle() {
		sleep(300);
	}
}
