// Part of Rendercache
package com.machinezoo.rendercache.theme;

import java.util.*;

/*
 * Mode is kept apart from the dictionary, because the same dictionary object is often shared by light and dark themes
 * while the application still expects them to be cached separately.
 */
/**
 * Theme dictionary together with its display mode.
 * 
 * @param mode
 *            display mode, e.g. {@code light} or {@code dark}, may be {@code null}
 * @param system
 *            nested dictionary consulted by {@code theme.a.b} placeholders, {@code null} is treated as empty
 */
public record Theme(String mode, Map<String, Object> system) {
	public Theme {
		if (system == null)
			system = Collections.emptyMap();
	}
	public Theme(Map<String, Object> system) {
		this(null, system);
	}
	public boolean empty() {
		return system.isEmpty();
	}
}
