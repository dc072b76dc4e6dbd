package com.plm.plugin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Per-call options for install and uninstall. Not persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstallOptions {

    /** Bypass the "already installed" / "not installed" guards. */
    private boolean force;

    /** Validate and report without invoking the plugin hook or changing state. */
    private boolean dryRun;

    /** Record and log a step-by-step trace of the operation. */
    private boolean verbose;

    /** Optional target directory handed through to the plugin. */
    private String installDir;

    /** Extra environment variables handed through to the plugin. */
    @Builder.Default
    private Map<String, String> env = Map.of();

    public static InstallOptions defaults() {
        return new InstallOptions();
    }
}
