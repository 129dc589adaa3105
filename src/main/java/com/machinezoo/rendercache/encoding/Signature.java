// Part of Rendercache
package com.machinezoo.rendercache.encoding;

import java.nio.charset.*;
import java.security.*;
import java.util.*;
import com.machinezoo.noexception.*;

/*
 * Signature text is the canonical encoding itself, so it can be decoded again.
 * Cache keys only need equality, so they are built from the much shorter digest.
 * Digest is SHA-256 of the UTF-8 text in URL-safe BASE64 without padding.
 */
/**
 * Deterministic encoding of a value graph produced by {@link CanonicalEncoder}.
 * Equal graphs produce equal signatures.
 */
public record Signature(String text) {
	public Signature {
		Objects.requireNonNull(text);
	}
	public String digest() {
		byte[] hash = Exceptions.sneak().get(() -> MessageDigest.getInstance("SHA-256")).digest(text.getBytes(StandardCharsets.UTF_8));
		return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
	}
	@Override
	public String toString() {
		return text;
	}
}
