// Part of Rendercache
package com.machinezoo.rendercache.encoding;

import java.util.function.*;
import com.machinezoo.rendercache.theme.*;

/*
 * Function behavior is never serialized. Decoding therefore produces a stub that remembers what it replaced
 * and fails with a descriptive message if anything tries to call it.
 * It implements the functional shapes the encoder recognizes, so that it can stand wherever the original function stood.
 */
/**
 * Stand-in for a function leaf restored by {@link CanonicalEncoder#decode(Signature)}.
 */
public final class FunctionPlaceholder implements ThemeFunction, Runnable, Supplier<Object>, Function<Object, Object> {
	private final String name;
	private final int id;
	FunctionPlaceholder(String name, int id) {
		this.name = name;
		this.id = id;
	}
	public String name() {
		return name;
	}
	public int id() {
		return id;
	}
	private IllegalStateException fail() {
		return new IllegalStateException("Function placeholder called: " + (name.isEmpty() ? "anonymous" : name) + "#" + id);
	}
	@Override
	public Object apply(Theme theme) {
		throw fail();
	}
	@Override
	public Object apply(Object argument) {
		throw fail();
	}
	@Override
	public void run() {
		throw fail();
	}
	@Override
	public Object get() {
		throw fail();
	}
	@Override
	public String toString() {
		return "FunctionPlaceholder(" + name + "#" + id + ")";
	}
}
