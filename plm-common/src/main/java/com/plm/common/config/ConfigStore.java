package com.plm.common.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.plm.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds the project configuration in memory and persists it as a JSON
 * document.
 *
 * <p>
 * Plugin-config mutations only touch memory; nothing is written until
 * {@link #save(Path)} is called. File reads and writes are serialized by a
 * store-wide lock.
 * </p>
 *
 * <p>
 * Plugin payloads are kept in document form: whatever goes in is normalized
 * to what a reload of the saved file would produce, so {@code 3L} is stored
 * as {@code 3}. Scalars are never coerced on load; {@code "name": 42} or
 * {@code "enabled": 0} make the document malformed.
 * </p>
 */
@Slf4j
public class ConfigStore {

    public static final String DEFAULT_CONFIG_FILENAME = "plm.json";

    // =========================================================================
    // Errors
    // =========================================================================

    /**
     * Configuration document could not be read, parsed or written.
     */
    public static class ConfigError extends RuntimeException {

        public enum Reason {
            NOT_FOUND, MALFORMED, IO
        }

        private final Reason reason;
        private final Path path;

        public ConfigError(Reason reason, Path path, String message, Throwable cause) {
            super(message, cause);
            this.reason = reason;
            this.path = path;
        }

        public ConfigError(Reason reason, Path path, String message) {
            this(reason, path, message, null);
        }

        public Reason getReason() {
            return reason;
        }

        public Path getPath() {
            return path;
        }
    }

    // =========================================================================
    // State
    // =========================================================================

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ReentrantLock ioLock = new ReentrantLock();
    private ProjectConfig config;

    public ConfigStore() {
        this(ProjectConfig.defaultFor("default", "."));
    }

    public ConfigStore(ProjectConfig config) {
        this.objectMapper = strictMapper();
        this.config = config != null ? config : ProjectConfig.defaultFor("default", ".");
    }

    private static ObjectMapper strictMapper() {
        ObjectMapper mapper = JsonMapper.builder()
                .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        mapper.coercionConfigFor(LogicalType.Boolean)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail);
        return mapper;
    }

    /**
     * Create a store backed by the document at {@code path}.
     */
    public static ConfigStore open(Path path) {
        ConfigStore store = new ConfigStore();
        store.loadFromFile(path);
        return store;
    }

    // =========================================================================
    // Load / save
    // =========================================================================

    /**
     * Load the document at {@code path} and make it the current configuration.
     * On any failure the current configuration is left as it was.
     */
    public ProjectConfig loadFromFile(Path path) {
        ioLock.lock();
        try {
            String raw;
            try {
                raw = Files.readString(path);
            } catch (NoSuchFileException e) {
                throw new ConfigError(ConfigError.Reason.NOT_FOUND, path,
                        "config file not found: " + path, e);
            } catch (IOException e) {
                throw new ConfigError(ConfigError.Reason.IO, path,
                        "failed to read config file " + path + ": " + e.getMessage(), e);
            }
            ProjectConfig loaded = parse(raw, path);
            synchronized (this) {
                config = loaded;
            }
            log.info("Config loaded from: {} ({} plugins)", path, loaded.getPlugins().size());
            return loaded;
        } finally {
            ioLock.unlock();
        }
    }

    /**
     * Write the current configuration to {@code path}.
     */
    public void save(Path path) {
        ioLock.lock();
        try {
            ObjectNode document;
            synchronized (this) {
                checkShape(config, path);
                try {
                    normalizePayloads(config);
                } catch (IllegalArgumentException e) {
                    throw malformed(path, e.getMessage(), e);
                }
                document = toDocument(config);
            }
            try {
                JsonFile.saveAtomically(path, document);
            } catch (IOException e) {
                throw new ConfigError(ConfigError.Reason.IO, path,
                        "failed to write config file " + path + ": " + e.getMessage(), e);
            }
            log.info("Config saved to: {}", path);
        } finally {
            ioLock.unlock();
        }
    }

    /**
     * Write a default {@code plm.json} into {@code rootDir}.
     *
     * @return path of the written file
     */
    public static Path initProject(Path rootDir, String projectName) {
        Path target = rootDir.resolve(DEFAULT_CONFIG_FILENAME);
        new ConfigStore(ProjectConfig.defaultFor(projectName, rootDir.toString())).save(target);
        return target;
    }

    // =========================================================================
    // In-memory access
    // =========================================================================

    public synchronized ProjectConfig getConfig() {
        return config;
    }

    /**
     * A copy of the current configuration whose plugin map can be iterated
     * while other threads add or remove entries. Project info, settings and
     * the {@link PluginConfig} instances are shared with the live config.
     */
    public synchronized ProjectConfig snapshot() {
        return new ProjectConfig(config.getProject(), config.getSettings(),
                new LinkedHashMap<>(config.getPlugins()));
    }

    public synchronized void setConfig(ProjectConfig config) {
        checkShape(config, null);
        try {
            normalizePayloads(config);
        } catch (IllegalArgumentException e) {
            throw malformed(null, e.getMessage(), e);
        }
        this.config = config;
    }

    /**
     * Add a plugin config, replacing any existing entry with the same name.
     *
     * @return the replaced entry, if any
     */
    public synchronized Optional<PluginConfig> addPluginConfig(PluginConfig pluginConfig) {
        if (pluginConfig == null || isBlank(pluginConfig.getName())) {
            throw new IllegalArgumentException("plugin config requires a name");
        }
        pluginConfig.setConfig(normalize(pluginConfig.getName(), pluginConfig.getConfig()));
        return Optional.ofNullable(config.getPlugins().put(pluginConfig.getName(), pluginConfig));
    }

    public synchronized Optional<PluginConfig> removePluginConfig(String name) {
        return Optional.ofNullable(config.getPlugins().remove(name));
    }

    public synchronized Optional<PluginConfig> getPluginConfig(String name) {
        return Optional.ofNullable(config.getPlugins().get(name));
    }

    public synchronized List<PluginConfig> listPluginConfigs() {
        return List.copyOf(config.getPlugins().values());
    }

    /**
     * Toggle the enabled flag of a configured plugin.
     *
     * @return false if no config exists for {@code name}
     */
    public synchronized boolean setPluginEnabled(String name, boolean enabled) {
        PluginConfig pc = config.getPlugins().get(name);
        if (pc == null) {
            return false;
        }
        pc.setEnabled(enabled);
        return true;
    }

    /**
     * Set a single key of a plugin's payload.
     *
     * @return false if no config exists for {@code name}
     */
    public synchronized boolean updatePluginSetting(String name, String key, Object value) {
        PluginConfig pc = config.getPlugins().get(name);
        if (pc == null) {
            return false;
        }
        Map<String, Object> updated = new LinkedHashMap<>(pc.getConfig() != null ? pc.getConfig() : Map.of());
        updated.put(key, value);
        pc.setConfig(normalize(name, updated));
        return true;
    }

    // =========================================================================
    // Document mapping
    // =========================================================================

    ProjectConfig parse(String raw, Path path) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw malformed(path, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw malformed(path, "expected a JSON object at the document root", null);
        }

        JsonNode projectNode = root.get("project");
        if (projectNode == null || !projectNode.isObject()) {
            throw malformed(path, "missing required object \"project\"", null);
        }

        ProjectConfig result = new ProjectConfig();
        try {
            result.setProject(objectMapper.treeToValue(projectNode, ProjectConfig.ProjectInfo.class));

            JsonNode settingsNode = root.get("settings");
            if (settingsNode != null && !settingsNode.isNull()) {
                if (!settingsNode.isObject()) {
                    throw malformed(path, "\"settings\" must be an object", null);
                }
                result.setSettings(objectMapper.treeToValue(settingsNode, ProjectConfig.Settings.class));
            }

            JsonNode pluginsNode = root.get("plugins");
            Map<String, PluginConfig> plugins = new LinkedHashMap<>();
            if (pluginsNode != null && !pluginsNode.isNull()) {
                if (!pluginsNode.isArray()) {
                    throw malformed(path, "\"plugins\" must be an array", null);
                }
                int index = 0;
                for (JsonNode pluginNode : pluginsNode) {
                    if (!pluginNode.isObject()) {
                        throw malformed(path, "plugins[" + index + "] must be an object", null);
                    }
                    PluginConfig pc = objectMapper.treeToValue(pluginNode, PluginConfig.class);
                    if (isBlank(pc.getName())) {
                        throw malformed(path, "plugins[" + index + "].name is required", null);
                    }
                    if (plugins.containsKey(pc.getName())) {
                        throw malformed(path, "duplicate plugin name: " + pc.getName(), null);
                    }
                    if (pc.getConfig() == null) {
                        pc.setConfig(new LinkedHashMap<>());
                    }
                    plugins.put(pc.getName(), pc);
                    index++;
                }
            }
            result.setPlugins(plugins);
        } catch (JsonProcessingException e) {
            throw malformed(path, e.getOriginalMessage(), e);
        }

        if (isBlank(result.getProject().getName())) {
            throw malformed(path, "project.name is required", null);
        }
        return result;
    }

    private void normalizePayloads(ProjectConfig cfg) {
        for (PluginConfig pc : cfg.getPlugins().values()) {
            pc.setConfig(normalize(pc.getName(), pc.getConfig()));
        }
    }

    /**
     * Pass a payload through the document mapping so that it holds exactly
     * the types a reload would produce.
     *
     * @throws IllegalArgumentException if the payload cannot be written as JSON
     */
    private LinkedHashMap<String, Object> normalize(String plugin, Map<String, Object> payload) {
        if (payload == null) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(payload), PAYLOAD_TYPE);
        } catch (IOException e) {
            throw new IllegalArgumentException("config payload of plugin " + plugin
                    + " is not representable as JSON: " + e.getMessage(), e);
        }
    }

    private ObjectNode toDocument(ProjectConfig cfg) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("project", objectMapper.valueToTree(cfg.getProject()));
        ProjectConfig.Settings settings = cfg.getSettings() != null
                ? cfg.getSettings()
                : new ProjectConfig.Settings();
        root.set("settings", objectMapper.valueToTree(settings));
        ArrayNode plugins = root.putArray("plugins");
        for (PluginConfig pc : new ArrayList<>(cfg.getPlugins().values())) {
            plugins.add(objectMapper.valueToTree(pc));
        }
        return root;
    }

    private static void checkShape(ProjectConfig cfg, Path path) {
        if (cfg == null || cfg.getProject() == null || isBlank(cfg.getProject().getName())) {
            throw malformed(path, "project.name is required", null);
        }
        if (cfg.getPlugins() == null) {
            throw malformed(path, "plugins must not be null", null);
        }
        for (var entry : cfg.getPlugins().entrySet()) {
            PluginConfig pc = entry.getValue();
            if (pc == null || !entry.getKey().equals(pc.getName())) {
                throw malformed(path, "plugin name mismatch: key '" + entry.getKey() + "' vs config '"
                        + (pc != null ? pc.getName() : null) + "'", null);
            }
        }
    }

    private static ConfigError malformed(Path path, String detail, Throwable cause) {
        String where = path != null ? " (" + path + ")" : "";
        return new ConfigError(ConfigError.Reason.MALFORMED, path,
                "malformed config" + where + ": " + detail, cause);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
