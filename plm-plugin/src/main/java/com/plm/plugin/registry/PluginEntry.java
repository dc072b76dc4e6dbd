package com.plm.plugin.registry;

import com.plm.common.config.PluginConfig;
import com.plm.plugin.Plugin;
import com.plm.plugin.PluginMetadata;

import java.time.Instant;

/**
 * Registry row: the plugin instance, its lifecycle state and its config.
 *
 * <p>
 * State is only written by {@link PluginRegistry} while it holds this entry's
 * operation gate. Callers queue on the gate in arrival order without
 * blocking a thread.
 * </p>
 */
public final class PluginEntry {

    private final String name;
    private final Plugin plugin;
    private final long sequence;
    private final Instant registeredAt;
    private final OperationGate gate = new OperationGate();

    private volatile LifecycleState state = LifecycleState.REGISTERED;
    private volatile PluginConfig config;
    private volatile String lastError;

    PluginEntry(String name, Plugin plugin, PluginConfig config, long sequence) {
        this.name = name;
        this.plugin = plugin;
        this.config = config;
        this.sequence = sequence;
        this.registeredAt = Instant.now();
    }

    public String getName() {
        return name;
    }

    public Plugin getPlugin() {
        return plugin;
    }

    public LifecycleState getState() {
        return state;
    }

    public PluginConfig getConfig() {
        return config;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    long getSequence() {
        return sequence;
    }

    OperationGate gate() {
        return gate;
    }

    void setState(LifecycleState state) {
        this.state = state;
    }

    void setConfig(PluginConfig config) {
        this.config = config;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    /**
     * Build a read-only view. Metadata failures are reported in the
     * summary instead of being thrown.
     */
    public PluginSummary summarize() {
        String version = null;
        String description = null;
        String author = null;
        String error = lastError;
        try {
            PluginMetadata metadata = plugin.metadata();
            if (metadata != null) {
                version = metadata.version();
                description = metadata.description();
                author = metadata.author();
            }
        } catch (RuntimeException e) {
            error = "metadata unavailable: " + e.getMessage();
        }
        PluginConfig cfg = config;
        return new PluginSummary(name, version, description, author, state,
                cfg != null, cfg == null || cfg.isEnabled(), registeredAt, error);
    }
}
