package com.plm.plugin.validation;

import com.plm.common.config.PluginConfig;
import com.plm.plugin.InstallOptions;
import com.plm.plugin.Plugin;
import com.plm.plugin.PluginMetadata;
import com.plm.plugin.TestPlugin;
import com.plm.plugin.registry.LifecycleState;
import com.plm.plugin.registry.PluginRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class PluginValidatorTest {

    PluginRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
    }

    @Test
    void validPluginsPass() {
        registry.register(new TestPlugin("alpha"));
        registry.register(new TestPlugin("beta", "2.1.0-rc.1"));

        ValidationSummary summary = PluginValidator.validateAll(registry);

        assertTrue(summary.isAllValid());
        assertEquals(2, summary.validPlugins());
        assertEquals(2, summary.totalPlugins());
        assertTrue(summary.failures().isEmpty());
    }

    @Test
    void emptyRegistryIsValid() {
        ValidationSummary summary = PluginValidator.validateAll(registry);

        assertTrue(summary.isAllValid());
        assertEquals(0, summary.totalPlugins());
    }

    @Test
    void reportsEachInvalidPlugin() {
        registry.register(new TestPlugin("alpha"));
        registry.register("beta", new TestPlugin("not-beta"));
        registry.register(new TestPlugin("gamma", "one.two"));

        ValidationSummary summary = PluginValidator.validateAll(registry);

        assertFalse(summary.isAllValid());
        assertEquals(1, summary.validPlugins());
        assertEquals(2, summary.invalidPlugins());
        assertEquals(List.of("beta", "gamma"), summary.failures().stream().map(ValidationFailure::plugin).toList());
        assertTrue(summary.failures().get(0).reason().contains("does not match"));
        assertTrue(summary.failures().get(1).reason().contains("invalid version"));
    }

    @Test
    void unreadableMetadataIsAFailure() {
        registry.register("broken", new Plugin() {
            @Override
            public PluginMetadata metadata() {
                throw new IllegalStateException("no metadata");
            }

            @Override
            public CompletableFuture<Void> initialize() {
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public CompletableFuture<Void> shutdown() {
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public CompletableFuture<String> install(String version, InstallOptions options) {
                return CompletableFuture.completedFuture(version);
            }

            @Override
            public CompletableFuture<Void> uninstall(String version) {
                return CompletableFuture.completedFuture(null);
            }
        });

        ValidationSummary summary = PluginValidator.validateAll(registry);

        assertEquals(1, summary.invalidPlugins());
        assertTrue(summary.failures().get(0).reason().contains("metadata unavailable"));
    }

    @Test
    void validationNeverChangesState() {
        TestPlugin alpha = new TestPlugin("alpha");
        registry.register(alpha);

        PluginValidator.validateAll(registry);

        assertEquals(LifecycleState.REGISTERED, registry.require("alpha").getState());
        assertEquals(0, alpha.initializeCalls.get());
    }

    @Nested
    class ConfigSchema {

        TestPlugin alpha;

        @BeforeEach
        void setUp() {
            alpha = new TestPlugin("alpha").withSchema(Map.of(
                    "type", "object",
                    "required", List.of("endpoint"),
                    "additionalProperties", false,
                    "properties", Map.of(
                            "endpoint", Map.of("type", "string"),
                            "retries", Map.of("type", "integer"))));
            registry.register(alpha);
        }

        private List<String> problemsWith(Map<String, Object> payload) {
            PluginConfig config = PluginConfig.of("alpha", "1.0.0");
            payload.forEach(config::setSetting);
            registry.attachConfig(config);
            return PluginValidator.validateEntry(registry.require("alpha"));
        }

        @Test
        void matchingPayloadIsValid() {
            assertEquals(List.of(), problemsWith(Map.of("endpoint", "https://example.org", "retries", 3)));
        }

        @Test
        void missingRequiredKey() {
            List<String> problems = problemsWith(Map.of("retries", 3));

            assertEquals(1, problems.size());
            assertTrue(problems.get(0).contains("endpoint: required"), problems.get(0));
        }

        @Test
        void unexpectedKey() {
            List<String> problems = problemsWith(Map.of("endpoint", "x", "colour", "blue"));

            assertTrue(problems.get(0).contains("colour: unexpected property"), problems.get(0));
        }

        @Test
        void wrongType() {
            List<String> problems = problemsWith(Map.of("endpoint", "x", "retries", "three"));

            assertTrue(problems.get(0).contains("retries: expected integer"), problems.get(0));
        }

        @Test
        void noConfigMeansEmptyPayload() {
            List<String> problems = PluginValidator.validateEntry(registry.require("alpha"));

            assertTrue(problems.get(0).contains("endpoint: required"), problems.get(0));
        }
    }
}
