package com.plm.plugin.registry;

import java.time.Instant;

/**
 * Read-only view of a registry entry.
 */
public record PluginSummary(
        String name,
        String version,
        String description,
        String author,
        LifecycleState state,
        boolean configured,
        boolean enabled,
        Instant registeredAt,
        String lastError) {
}
