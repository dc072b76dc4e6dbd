package com.plm.plugin;

import com.plm.common.config.PluginConfig;

import java.util.Objects;
import java.util.function.Function;

/**
 * Creates plugin instances for candidates found during discovery.
 */
public interface PluginFactory {

    boolean supports(String pluginName);

    Plugin create(PluginConfig config) throws Exception;

    /**
     * Reject a candidate before it is instantiated.
     */
    default void validateConfig(PluginConfig config) {
    }

    /**
     * Factory for a single plugin name.
     */
    static PluginFactory of(String pluginName, Function<PluginConfig, Plugin> creator) {
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(creator, "creator");
        return new PluginFactory() {
            @Override
            public boolean supports(String name) {
                return pluginName.equals(name);
            }

            @Override
            public Plugin create(PluginConfig config) {
                return creator.apply(config);
            }
        };
    }
}
