package com.plm.plugin;

import com.plm.common.config.ConfigStore;
import com.plm.common.config.PluginConfig;
import com.plm.common.config.ProjectConfig;
import com.plm.plugin.discovery.DiscoveryReport;
import com.plm.plugin.discovery.PluginDiscovery;
import com.plm.plugin.install.InstallOrchestrator;
import com.plm.plugin.registry.BatchReport;
import com.plm.plugin.registry.LifecycleListener;
import com.plm.plugin.registry.LifecycleOutcome;
import com.plm.plugin.registry.LifecycleState;
import com.plm.plugin.registry.PluginEntry;
import com.plm.plugin.registry.PluginRegistry;
import com.plm.plugin.registry.PluginSummary;
import com.plm.plugin.validation.PluginValidator;
import com.plm.plugin.validation.ValidationSummary;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point for hosts: ties the config store, registry, discovery,
 * validator and install orchestrator together.
 *
 * <p>
 * Typical use:
 * </p>
 *
 * <pre>
 * PluginManager manager = PluginManager.fromConfigFile(Path.of("plm.json"));
 * manager.registerFactory(PluginFactory.of("alpha", cfg -&gt; new AlphaPlugin()));
 * manager.initialize().join();
 * manager.installPlugin("alpha", null, InstallOptions.defaults()).join();
 * ...
 * manager.shutdown().join();
 * </pre>
 */
@Slf4j
public class PluginManager {

    private final ConfigStore configStore;
    private final PluginRegistry registry;
    private final InstallOrchestrator orchestrator;
    private final List<PluginFactory> factories = new CopyOnWriteArrayList<>();
    private final PluginFactory serviceLoaderFactory;

    private volatile DiscoveryReport lastDiscovery;

    public PluginManager(ConfigStore configStore) {
        this(configStore, new ServiceLoaderPluginFactory());
    }

    /**
     * @param serviceLoaderFactory consulted after every host factory, or null
     */
    public PluginManager(ConfigStore configStore, PluginFactory serviceLoaderFactory) {
        this.configStore = configStore;
        this.registry = new PluginRegistry();
        this.orchestrator = new InstallOrchestrator(registry);
        this.serviceLoaderFactory = serviceLoaderFactory;
        orchestrator.applySettings(configStore.getConfig().getSettings());
    }

    public static PluginManager createDefault() {
        return new PluginManager(new ConfigStore());
    }

    /**
     * Create a manager for the project described by the config file at
     * {@code path}.
     */
    public static PluginManager fromConfigFile(Path path) {
        try {
            return new PluginManager(ConfigStore.open(path));
        } catch (ConfigStore.ConfigError e) {
            throw configError(e);
        }
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Discover plugins if auto-discovery is enabled, then initialize every
     * registered plugin. Individual failures are reported, not thrown.
     */
    public CompletableFuture<BatchReport> initialize() {
        ProjectConfig.Settings settings = configStore.getConfig().getSettings();
        if (settings == null || settings.isAutoDiscovery()) {
            discoverPlugins();
        }

        List<String> pending = new ArrayList<>();
        for (PluginEntry entry : registry.entries()) {
            if (entry.getState() != LifecycleState.REGISTERED) {
                continue;
            }
            PluginConfig config = entry.getConfig();
            if (config != null && !config.isEnabled()) {
                log.debug("Plugin {} is disabled, not initializing", entry.getName());
                continue;
            }
            pending.add(entry.getName());
        }

        log.info("Initializing {} plugin(s)", pending.size());
        return BatchReport.collect(pending, registry::initializeOne, PluginException.Kind.INITIALIZATION_FAILED)
                .thenApply(report -> {
                    for (BatchReport.Failure failure : report.failures()) {
                        log.error("Plugin {} failed to initialize: {}", failure.plugin(), failure.reason());
                    }
                    return report;
                });
    }

    /**
     * Shut down every active plugin.
     */
    public CompletableFuture<BatchReport> shutdown() {
        log.info("Shutting down {} plugin(s)", registry.size());
        return registry.shutdownAll();
    }

    // =========================================================================
    // Discovery & validation
    // =========================================================================

    /**
     * @return number of newly registered plugins
     */
    public int discoverPlugins() {
        DiscoveryReport report = PluginDiscovery.discover(registry, configStore.snapshot(), factories());
        lastDiscovery = report;
        return report.registeredCount();
    }

    /** Report of the most recent discovery pass, or null if none ran. */
    public DiscoveryReport getLastDiscoveryReport() {
        return lastDiscovery;
    }

    public ValidationSummary validateAllPlugins() {
        return PluginValidator.validateAll(registry);
    }

    // =========================================================================
    // Plugins
    // =========================================================================

    public List<PluginSummary> listPlugins() {
        return registry.listPlugins();
    }

    public Optional<PluginSummary> describePlugin(String name) {
        return registry.describe(name);
    }

    /**
     * Register a plugin under its metadata name, linking the config of the
     * same name if one exists.
     */
    public PluginEntry registerPlugin(Plugin plugin) {
        PluginMetadata metadata = plugin != null ? plugin.metadata() : null;
        return registerPlugin(metadata != null ? metadata.name() : null, plugin);
    }

    public PluginEntry registerPlugin(String name, Plugin plugin) {
        PluginConfig config = name != null ? configStore.getPluginConfig(name).orElse(null) : null;
        return registry.register(name, plugin, config);
    }

    public CompletableFuture<LifecycleOutcome> initializePlugin(String name) {
        return registry.initializeOne(name);
    }

    /**
     * @param version version to install, or null for the configured / declared one
     */
    public CompletableFuture<LifecycleOutcome> installPlugin(String name, String version, InstallOptions options) {
        return orchestrator.installPlugin(name, version, options);
    }

    public CompletableFuture<LifecycleOutcome> uninstallPlugin(String name, String version, InstallOptions options) {
        return orchestrator.uninstallPlugin(name, version, options);
    }

    public CompletableFuture<LifecycleOutcome> shutdownPlugin(String name) {
        return registry.shutdownOne(name);
    }

    // =========================================================================
    // Configuration
    // =========================================================================

    public Optional<PluginConfig> getPluginConfig(String name) {
        return configStore.getPluginConfig(name);
    }

    /**
     * Add or replace a plugin config. A registered plugin of the same name
     * picks it up immediately. Memory only until {@link #saveConfig(Path)}.
     */
    public Optional<PluginConfig> addPluginConfig(PluginConfig config) {
        Optional<PluginConfig> replaced;
        try {
            replaced = configStore.addPluginConfig(config);
        } catch (IllegalArgumentException e) {
            throw new PluginException(PluginException.Kind.INVALID_ARGUMENT,
                    config != null ? config.getName() : null, e.getMessage(), e);
        }
        registry.attachConfig(config);
        return replaced;
    }

    public Optional<PluginConfig> removePluginConfig(String name) {
        Optional<PluginConfig> removed = configStore.removePluginConfig(name);
        removed.ifPresent(c -> registry.detachConfig(name));
        return removed;
    }

    public boolean setPluginEnabled(String name, boolean enabled) {
        return configStore.setPluginEnabled(name, enabled);
    }

    public ProjectConfig getConfig() {
        return configStore.getConfig();
    }

    /**
     * Replace the whole project config in memory.
     */
    public void updateConfig(ProjectConfig config) {
        try {
            configStore.setConfig(config);
        } catch (ConfigStore.ConfigError e) {
            throw configError(e);
        }
        relinkConfigs();
    }

    public void saveConfig(Path path) {
        try {
            configStore.save(path);
        } catch (ConfigStore.ConfigError e) {
            throw configError(e);
        }
    }

    /**
     * Load the config at {@code path}, replacing the current one. Registered
     * plugins are relinked to the new plugin configs.
     */
    public void loadConfig(Path path) {
        try {
            configStore.loadFromFile(path);
        } catch (ConfigStore.ConfigError e) {
            throw configError(e);
        }
        relinkConfigs();
    }

    // =========================================================================
    // Extension points
    // =========================================================================

    /**
     * Add a factory used by discovery. Factories are consulted in the order
     * they were added.
     */
    public void registerFactory(PluginFactory factory) {
        factories.add(factory);
    }

    public void addLifecycleListener(LifecycleListener listener) {
        registry.addListener(listener);
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    public InstallOrchestrator getOrchestrator() {
        return orchestrator;
    }

    // =========================================================================
    // Internal
    // =========================================================================

    private List<PluginFactory> factories() {
        List<PluginFactory> all = new ArrayList<>(factories);
        if (serviceLoaderFactory != null) {
            all.add(serviceLoaderFactory);
        }
        return all;
    }

    private void relinkConfigs() {
        ProjectConfig config = configStore.snapshot();
        for (PluginEntry entry : registry.entries()) {
            PluginConfig pc = config.getPlugins().get(entry.getName());
            if (pc != null) {
                registry.attachConfig(pc);
            } else {
                registry.detachConfig(entry.getName());
            }
        }
        orchestrator.applySettings(config.getSettings());
    }

    private static PluginException configError(ConfigStore.ConfigError e) {
        return new PluginException(PluginException.Kind.CONFIG_ERROR, null, e.getMessage(), e);
    }
}
