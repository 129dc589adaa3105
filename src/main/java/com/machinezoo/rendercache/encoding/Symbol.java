// Part of Rendercache
package com.machinezoo.rendercache.encoding;

import java.util.*;
import com.machinezoo.stagean.*;

/*
 * Symbols are unique tokens with an optional description. Two symbols with the same description are still different symbols,
 * which is why equals() and hashCode() are inherited from Object.
 * Encoding captures only the description, so decoded symbols are fresh instances.
 */
/**
 * Unique property token identified by reference and described by a string.
 */
@StubDocs
public final class Symbol {
	private final String description;
	public Symbol(String description) {
		this.description = Objects.requireNonNullElse(description, "");
	}
	public String description() {
		return description;
	}
	@Override
	public String toString() {
		return "Symbol(" + description + ")";
	}
}
