// Part of Rendercache
package com.machinezoo.rendercache.eviction;

import java.util.function.*;

/*
 * Adapters are attached and detached repeatedly as the controller is started and stopped.
 * Implementations must tolerate repeated attach() and detach() without duplicating listeners.
 */
/**
 * Source of navigation signals for {@link EvictionController}.
 */
public interface NavigationAdapter {
	void attach(Consumer<NavigationKind> listener);
	void detach();
}
