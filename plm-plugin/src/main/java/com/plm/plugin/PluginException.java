package com.plm.plugin;

import com.plm.common.infra.ErrorUtils;

/**
 * Failure of a plugin lifecycle operation.
 *
 * <p>
 * When an operation fails with a {@code PluginException} nothing changed: the
 * registry entry is still in the state it had before the call.
 * </p>
 */
public class PluginException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        ALREADY_REGISTERED,
        INVALID_STATE,
        INVALID_ARGUMENT,
        INITIALIZATION_FAILED,
        INSTALL_FAILED,
        UNINSTALL_FAILED,
        SHUTDOWN_FAILED,
        CONFIG_ERROR,
        VALIDATION_FAILED,
        TIMEOUT
    }

    private final Kind kind;
    private final String pluginName;

    public PluginException(Kind kind, String pluginName, String message) {
        this(kind, pluginName, message, null);
    }

    public PluginException(Kind kind, String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.pluginName = pluginName;
    }

    public Kind getKind() {
        return kind;
    }

    /** Name of the plugin the failure refers to, or null for project-level errors. */
    public String getPluginName() {
        return pluginName;
    }

    public static PluginException notFound(String name) {
        return new PluginException(Kind.NOT_FOUND, name, "plugin not found: " + name);
    }

    /**
     * Recover the {@code PluginException} carried by a failed future, if any.
     *
     * @return the unwrapped exception, or null if the root cause is something else
     */
    public static PluginException unwrap(Throwable err) {
        Throwable root = ErrorUtils.unwrap(err);
        return root instanceof PluginException pe ? pe : null;
    }
}
