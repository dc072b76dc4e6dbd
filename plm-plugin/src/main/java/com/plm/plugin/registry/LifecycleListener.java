package com.plm.plugin.registry;

/**
 * Observes every state written to a registry entry, in order.
 */
@FunctionalInterface
public interface LifecycleListener {

    void onTransition(String plugin, LifecycleState from, LifecycleState to);
}
