package com.plm.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration of a PLM project, persisted as {@code plm.json}.
 *
 * <p>
 * Plugin entries are keyed by plugin name and keep insertion order, which is
 * also the order they are written back to disk.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProjectConfig {

    private ProjectInfo project;

    private Settings settings = new Settings();

    private Map<String, PluginConfig> plugins = new LinkedHashMap<>();

    /**
     * Build a default configuration for a project rooted at {@code rootPath}.
     */
    public static ProjectConfig defaultFor(String name, String rootPath) {
        ProjectConfig config = new ProjectConfig();
        config.setProject(ProjectInfo.builder()
                .name(name)
                .version("1.0.0")
                .rootPath(rootPath)
                .build());
        return config;
    }

    // --- Nested config types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProjectInfo {
        private String name;
        private String version;
        @JsonProperty("root_path")
        private String rootPath;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Settings {
        /** Plugin manifest directory, relative to the project root unless absolute. */
        @Builder.Default
        @JsonProperty("plugin_dir")
        private String pluginDir = "plugins";

        /** Register manifest-only plugins found under {@link #pluginDir}. */
        @Builder.Default
        @JsonProperty("auto_discovery")
        private boolean autoDiscovery = true;

        /** Run the validator on a plugin before its install hook. */
        @Builder.Default
        @JsonProperty("validate_on_install")
        private boolean validateOnInstall = true;

        @Builder.Default
        @JsonProperty("operation_timeout_seconds")
        private long operationTimeoutSeconds = 300;
    }
}
