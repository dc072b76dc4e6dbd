package com.plm.plugin;

import java.util.List;

/**
 * Descriptive information a plugin reports about itself.
 *
 * @param name        unique plugin name, used as the registry key
 * @param version     semantic version of the plugin implementation
 * @param description human-readable description
 * @param author      plugin author
 * @param homepage    optional project page
 * @param tags        free-form classification tags
 */
public record PluginMetadata(
        String name,
        String version,
        String description,
        String author,
        String homepage,
        List<String> tags) {

    public PluginMetadata {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public PluginMetadata(String name, String version, String description, String author) {
        this(name, version, description, author, null, List.of());
    }
}
