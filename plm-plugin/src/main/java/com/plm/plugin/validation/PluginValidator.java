package com.plm.plugin.validation;

import com.plm.common.config.PluginConfig;
import com.plm.common.config.SemanticVersion;
import com.plm.plugin.PluginMetadata;
import com.plm.plugin.registry.PluginEntry;
import com.plm.plugin.registry.PluginRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only structural checks over registered plugins. Safe to run before
 * any plugin has been initialized.
 */
@Slf4j
public final class PluginValidator {

    private PluginValidator() {
    }

    public static ValidationSummary validateAll(PluginRegistry registry) {
        int valid = 0;
        List<ValidationFailure> failures = new ArrayList<>();
        for (PluginEntry entry : registry.entries()) {
            List<String> problems = validateEntry(entry);
            if (problems.isEmpty()) {
                valid++;
            } else {
                String reason = String.join("; ", problems);
                failures.add(new ValidationFailure(entry.getName(), reason));
                log.warn("Plugin {} failed validation: {}", entry.getName(), reason);
            }
        }
        log.info("Validated {} plugin(s): {} valid, {} invalid", valid + failures.size(), valid, failures.size());
        return new ValidationSummary(valid, failures.size(), failures);
    }

    /**
     * @return the problems found, empty if the entry is valid
     */
    public static List<String> validateEntry(PluginEntry entry) {
        List<String> problems = new ArrayList<>();
        String key = entry.getName();

        PluginMetadata metadata;
        try {
            metadata = entry.getPlugin().metadata();
        } catch (RuntimeException e) {
            problems.add("metadata unavailable: " + e.getMessage());
            return problems;
        }
        if (metadata == null) {
            problems.add("metadata unavailable");
            return problems;
        }

        if (metadata.name() == null || metadata.name().isBlank()) {
            problems.add("plugin name is empty");
        } else if (!metadata.name().equals(key)) {
            problems.add("metadata name '" + metadata.name() + "' does not match registry key '" + key + "'");
        }
        if (!SemanticVersion.isValid(metadata.version())) {
            problems.add("invalid version '" + metadata.version() + "'");
        }

        PluginConfig config = entry.getConfig();
        if (config != null && !key.equals(config.getName())) {
            problems.add("config name '" + config.getName() + "' does not match registry key '" + key + "'");
        }

        if (entry.getState() == null || entry.getState().isTerminal()) {
            problems.add("plugin is in state " + entry.getState());
        }

        Map<String, Object> schema;
        try {
            schema = entry.getPlugin().configSchema();
        } catch (RuntimeException e) {
            problems.add("config schema unavailable: " + e.getMessage());
            return problems;
        }
        if (schema != null && !schema.isEmpty()) {
            Object payload = config != null ? config.getConfig() : Map.of();
            if (PluginSchemaValidator.validate(schema, payload) instanceof PluginSchemaValidator.ValidationResult.Fail fail) {
                problems.add("invalid config: " + String.join(", ", fail.errors()));
            }
        }
        return problems;
    }
}
