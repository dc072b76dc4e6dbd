package com.plm.plugin.registry;

/**
 * Lifecycle state of a registry entry.
 *
 * <pre>
 * UNREGISTERED -> REGISTERED -> INITIALIZED <-> INSTALLED
 *                               INITIALIZED | INSTALLED -> SHUTTING_DOWN -> SHUTDOWN
 * </pre>
 *
 * {@link #UNREGISTERED} and {@link #SHUTDOWN} are terminal: the entry no
 * longer accepts operations and the plugin has to be registered again.
 */
public enum LifecycleState {

    UNREGISTERED,

    REGISTERED,

    INITIALIZED,

    INSTALLED,

    /** The plugin's shutdown hook is running. */
    SHUTTING_DOWN,

    SHUTDOWN;

    public boolean isTerminal() {
        return this == UNREGISTERED || this == SHUTDOWN;
    }
}
