package com.plm.plugin.discovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Plugin manifest loading from {@code plm-plugin.json} files found in the
 * project's plugin directory.
 */
public final class PluginManifest {

    private PluginManifest() {
    }

    public static final String MANIFEST_FILENAME = "plm-plugin.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    // =========================================================================
    // Manifest model
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Manifest {
        private String name;
        private String version;
        private String description;
        private String author;
    }

    // =========================================================================
    // Load result
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LoadResult {
        private boolean ok;
        private Manifest manifest;
        private Path manifestPath;
        private String error;
    }

    // =========================================================================
    // Public API
    // =========================================================================

    public static Path resolveManifestPath(Path pluginDir) {
        return pluginDir.resolve(MANIFEST_FILENAME);
    }

    public static boolean hasManifest(Path pluginDir) {
        return Files.isRegularFile(resolveManifestPath(pluginDir));
    }

    /**
     * Load and parse the manifest in {@code pluginDir}. Never throws; problems
     * are reported through {@link LoadResult#getError()}.
     */
    public static LoadResult load(Path pluginDir) {
        Path manifestPath = resolveManifestPath(pluginDir);

        if (!Files.isRegularFile(manifestPath)) {
            return failed(manifestPath, "plugin manifest not found: " + manifestPath);
        }

        Manifest manifest;
        try {
            manifest = MAPPER.readValue(Files.readString(manifestPath), Manifest.class);
        } catch (IOException e) {
            return failed(manifestPath, "failed to parse plugin manifest " + manifestPath + ": " + e.getMessage());
        }

        if (manifest == null || manifest.getName() == null || manifest.getName().isBlank()) {
            return failed(manifestPath, "plugin manifest requires name: " + manifestPath);
        }
        return LoadResult.builder()
                .ok(true)
                .manifest(manifest)
                .manifestPath(manifestPath)
                .build();
    }

    private static LoadResult failed(Path manifestPath, String error) {
        return LoadResult.builder()
                .ok(false)
                .manifestPath(manifestPath)
                .error(error)
                .build();
    }
}
