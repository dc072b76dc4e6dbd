package com.plm.plugin.discovery;

import com.plm.common.config.PluginConfig;
import com.plm.common.config.ProjectConfig;
import com.plm.common.infra.ErrorUtils;
import com.plm.plugin.Plugin;
import com.plm.plugin.PluginException;
import com.plm.plugin.PluginFactory;
import com.plm.plugin.PluginMetadata;
import com.plm.plugin.registry.PluginRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Plugin discovery: turns declared plugin configs, cross-checked against the
 * manifests in the project's plugin directory, into registry entries.
 *
 * <p>
 * A candidate that cannot be instantiated is recorded in the report and the
 * scan moves on. Discovery only ever adds registrations.
 * </p>
 */
@Slf4j
public final class PluginDiscovery {

    private PluginDiscovery() {
    }

    static final String SOURCE_CONFIG = "config";
    static final String SOURCE_MANIFEST = "manifest";

    private record ManifestScan(Map<String, PluginManifest.Manifest> manifests, Set<String> broken) {
    }

    // =========================================================================
    // Discovery
    // =========================================================================

    /**
     * Register every enabled, not yet registered candidate of {@code config}.
     *
     * @param config    iterated without locking, so pass a {@code ConfigStore} snapshot
     * @param factories consulted in order; the first one supporting a name wins
     */
    public static DiscoveryReport discover(PluginRegistry registry, ProjectConfig config,
            List<PluginFactory> factories) {
        DiscoveryReport report = DiscoveryReport.builder().build();
        ManifestScan scan = scanPluginDir(config, report);

        for (PluginConfig candidate : List.copyOf(config.getPlugins().values())) {
            String name = candidate.getName();
            if (!candidate.isEnabled()) {
                report.getSkippedDisabled().add(name);
                continue;
            }
            if (registry.contains(name)) {
                report.getAlreadyRegistered().add(name);
                continue;
            }
            if (scan.broken().contains(name)) {
                continue;
            }
            PluginManifest.Manifest manifest = scan.manifests().get(name);
            if (manifest != null && candidate.getVersion() != null && manifest.getVersion() != null
                    && !candidate.getVersion().equals(manifest.getVersion())) {
                report.warn(name, "manifest version " + manifest.getVersion()
                        + " differs from configured version " + candidate.getVersion());
            }
            instantiate(registry, candidate, candidate, SOURCE_CONFIG, factories, report);
        }

        if (config.getSettings() != null && config.getSettings().isAutoDiscovery()) {
            for (PluginManifest.Manifest manifest : scan.manifests().values()) {
                String name = manifest.getName();
                if (config.getPlugins().containsKey(name)) {
                    continue;
                }
                if (registry.contains(name)) {
                    report.getAlreadyRegistered().add(name);
                    continue;
                }
                instantiate(registry, PluginConfig.of(name, manifest.getVersion()), null,
                        SOURCE_MANIFEST, factories, report);
            }
        }

        log.info("Discovery registered {} plugin(s), skipped {} disabled, {} already registered, {} failed",
                report.registeredCount(), report.getSkippedDisabled().size(),
                report.getAlreadyRegistered().size(), report.getFailures().size());
        for (DiscoveryReport.Failure failure : report.getFailures()) {
            log.warn("Discovery failed for {} ({}): {}", failure.plugin(), failure.source(), failure.reason());
        }
        return report;
    }

    // =========================================================================
    // Manifest scanning
    // =========================================================================

    /**
     * Resolve {@code settings.plugin_dir} against {@code project.root_path}.
     *
     * @return the directory, or null if no plugin directory is configured
     */
    public static Path resolvePluginDir(ProjectConfig config) {
        String pluginDir = config.getSettings() != null ? config.getSettings().getPluginDir() : null;
        if (pluginDir == null || pluginDir.isBlank()) {
            return null;
        }
        String rootPath = config.getProject() != null ? config.getProject().getRootPath() : null;
        Path root = rootPath == null || rootPath.isBlank() ? Path.of(".") : Path.of(rootPath);
        return root.resolve(pluginDir).normalize();
    }

    private static ManifestScan scanPluginDir(ProjectConfig config, DiscoveryReport report) {
        Map<String, PluginManifest.Manifest> manifests = new LinkedHashMap<>();
        Set<String> broken = new HashSet<>();
        Path dir = resolvePluginDir(config);
        if (dir == null || !Files.isDirectory(dir)) {
            log.debug("No plugin directory to scan: {}", dir);
            return new ManifestScan(manifests, broken);
        }

        try (Stream<Path> children = Files.list(dir)) {
            children.filter(Files::isDirectory)
                    .filter(PluginManifest::hasManifest)
                    .sorted()
                    .forEach(child -> {
                        String dirName = child.getFileName().toString();
                        PluginManifest.LoadResult result = PluginManifest.load(child);
                        if (!result.isOk()) {
                            broken.add(dirName);
                            report.fail(dirName, SOURCE_MANIFEST, result.getError());
                            return;
                        }
                        PluginManifest.Manifest manifest = result.getManifest();
                        if (manifests.containsKey(manifest.getName())) {
                            report.warn(manifest.getName(), "duplicate manifest ignored: " + result.getManifestPath());
                            return;
                        }
                        manifests.put(manifest.getName(), manifest);
                    });
        } catch (IOException e) {
            report.warn(null, "failed to scan plugin directory " + dir + ": " + e.getMessage());
        }
        return new ManifestScan(manifests, broken);
    }

    // =========================================================================
    // Instantiation
    // =========================================================================

    private static void instantiate(PluginRegistry registry, PluginConfig candidate, PluginConfig attach,
            String source, List<PluginFactory> factories, DiscoveryReport report) {
        String name = candidate.getName();
        PluginFactory factory = factories.stream()
                .filter(f -> f.supports(name))
                .findFirst()
                .orElse(null);
        if (factory == null) {
            report.fail(name, source, "no factory supports plugin " + name);
            return;
        }

        Plugin plugin;
        PluginMetadata metadata;
        try {
            factory.validateConfig(candidate);
            plugin = Objects.requireNonNull(factory.create(candidate), "factory returned no plugin");
            metadata = plugin.metadata();
        } catch (Exception e) {
            report.fail(name, source, "cannot create plugin " + name + ": " + ErrorUtils.formatErrorMessage(e));
            return;
        }
        if (metadata == null || !name.equals(metadata.name())) {
            report.fail(name, source, "plugin metadata name '" + (metadata != null ? metadata.name() : null)
                    + "' does not match '" + name + "'");
            return;
        }

        try {
            registry.register(name, plugin, attach);
            report.getRegistered().add(name);
            log.debug("Discovered plugin {} from {}", name, source);
        } catch (PluginException e) {
            if (e.getKind() == PluginException.Kind.ALREADY_REGISTERED) {
                report.getAlreadyRegistered().add(name);
            } else {
                report.fail(name, source, e.getMessage());
            }
        }
    }
}
