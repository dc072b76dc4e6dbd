package com.plm.plugin;

import com.plm.common.config.PluginConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Factory backed by Java SPI: plugins listed in
 * {@code META-INF/services/com.plm.plugin.Plugin} are matched by the name in
 * their metadata. Every {@link #create} call yields a fresh instance.
 */
@Slf4j
public class ServiceLoaderPluginFactory implements PluginFactory {

    private final ClassLoader classLoader;
    private volatile Set<String> names;

    public ServiceLoaderPluginFactory() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ServiceLoaderPluginFactory(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public boolean supports(String pluginName) {
        return availableNames().contains(pluginName);
    }

    @Override
    public Plugin create(PluginConfig config) {
        for (Plugin plugin : ServiceLoader.load(Plugin.class, classLoader)) {
            if (config.getName().equals(plugin.metadata().name())) {
                return plugin;
            }
        }
        throw new PluginException(PluginException.Kind.NOT_FOUND, config.getName(),
                "no service provider for plugin " + config.getName());
    }

    /**
     * Names of all plugins visible through the service loader.
     */
    public Set<String> availableNames() {
        Set<String> current = names;
        if (current == null) {
            Set<String> found = new LinkedHashSet<>();
            try {
                for (Plugin plugin : ServiceLoader.load(Plugin.class, classLoader)) {
                    found.add(plugin.metadata().name());
                }
            } catch (ServiceConfigurationError e) {
                log.warn("Failed to load plugin service providers: {}", e.getMessage());
            }
            current = Collections.unmodifiableSet(found);
            names = current;
        }
        return current;
    }
}
