// Part of Rendercache
package com.machinezoo.rendercache.theme;

/**
 * Theme-aware property value computed from the active {@link Theme}.
 * Such functions are invoked by {@link ThemeGraphResolver} when function processing is enabled.
 * String results may contain further {@code theme.} placeholders.
 */
@FunctionalInterface
public interface ThemeFunction {
	Object apply(Theme theme);
}
