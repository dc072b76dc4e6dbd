package com.plm.plugin;

import java.util.concurrent.CompletableFuture;

/**
 * Plugin published through {@code META-INF/services} for service loader tests.
 */
public class SpiEchoPlugin implements Plugin {

    public static final String NAME = "spi-echo";

    @Override
    public PluginMetadata metadata() {
        return new PluginMetadata(NAME, "0.3.1", "echoes its install version", "tests");
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
        return CompletableFuture.completedFuture("echo@" + version);
    }

    @Override
    public CompletableFuture<Void> uninstall(String version) {
        return CompletableFuture.completedFuture(null);
    }
}
