// Part of Rendercache
package com.machinezoo.rendercache;

import java.time.*;
import java.util.*;
import com.machinezoo.rendercache.encoding.*;

/**
 * Cached artifact of one node slot along with the signature it was produced for.
 * The artifact may be reused only if the incoming signature equals {@link #signature()}.
 * 
 * @param <A>
 *            type of the cached artifact
 */
public class CacheEntry<A> {
	private final LifecycleBoundary<A> boundary;
	private final Instant created = Instant.now();
	private volatile Signature signature;
	private volatile long accesses;
	CacheEntry(Signature signature, LifecycleBoundary<A> boundary) {
		Objects.requireNonNull(signature);
		Objects.requireNonNull(boundary);
		this.signature = signature;
		this.boundary = boundary;
	}
	public Signature signature() {
		return signature;
	}
	public LifecycleBoundary<A> boundary() {
		return boundary;
	}
	public A artifact() {
		return boundary.artifact();
	}
	public Instant created() {
		return created;
	}
	public long accesses() {
		return accesses;
	}
	/*
	 * Always called under context lock.
	 */
	void hit() {
		++accesses;
	}
	void replace(Signature signature, A artifact) {
		Objects.requireNonNull(signature);
		boundary.artifact(artifact);
		this.signature = signature;
	}
	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + boundary.key() + ", " + accesses + " hits)";
	}
}
