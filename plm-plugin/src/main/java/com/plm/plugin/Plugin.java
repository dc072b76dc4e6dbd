package com.plm.plugin;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Capability interface every plugin implementation satisfies.
 *
 * <p>
 * Hooks are asynchronous; the manager awaits the returned futures while it
 * holds the plugin's operation permit, so a plugin never sees two lifecycle
 * calls at once. A hook that throws is treated like one whose future fails.
 * Plugins are supplied by the host (directly, through a {@link PluginFactory},
 * or via {@link java.util.ServiceLoader}).
 * </p>
 */
public interface Plugin {

    /** Pure, callable in any state. */
    PluginMetadata metadata();

    CompletableFuture<Void> initialize();

    /** Release resources acquired since {@link #initialize()}. */
    CompletableFuture<Void> shutdown();

    /**
     * Perform the version-specific installation.
     *
     * @return an opaque descriptor of what was installed
     */
    CompletableFuture<String> install(String version, InstallOptions options);

    CompletableFuture<Void> uninstall(String version);

    /**
     * JSON-Schema-like description of the plugin's config payload
     * ({@code type}, {@code properties}, {@code required},
     * {@code additionalProperties}). Empty means "anything goes".
     */
    default Map<String, Object> configSchema() {
        return Map.of();
    }
}
