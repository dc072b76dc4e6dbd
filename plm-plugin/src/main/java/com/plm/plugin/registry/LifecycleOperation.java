package com.plm.plugin.registry;

import com.plm.plugin.PluginException;

/**
 * Operations that drive a registry entry through its lifecycle.
 */
public enum LifecycleOperation {

    INITIALIZE("initialize", PluginException.Kind.INITIALIZATION_FAILED),
    INSTALL("install", PluginException.Kind.INSTALL_FAILED),
    UNINSTALL("uninstall", PluginException.Kind.UNINSTALL_FAILED),
    SHUTDOWN("shutdown", PluginException.Kind.SHUTDOWN_FAILED);

    private final String label;
    private final PluginException.Kind failureKind;

    LifecycleOperation(String label, PluginException.Kind failureKind) {
        this.label = label;
        this.failureKind = failureKind;
    }

    public String label() {
        return label;
    }

    /** Error kind reported when the plugin's own hook fails. */
    public PluginException.Kind failureKind() {
        return failureKind;
    }
}
