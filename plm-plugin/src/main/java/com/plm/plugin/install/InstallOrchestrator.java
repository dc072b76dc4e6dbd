package com.plm.plugin.install;

import com.plm.common.config.PluginConfig;
import com.plm.common.config.ProjectConfig;
import com.plm.common.infra.ErrorUtils;
import com.plm.plugin.InstallOptions;
import com.plm.plugin.PluginException;
import com.plm.plugin.PluginMetadata;
import com.plm.plugin.registry.LifecycleOperation;
import com.plm.plugin.registry.LifecycleOutcome;
import com.plm.plugin.registry.OperationTrace;
import com.plm.plugin.registry.PluginEntry;
import com.plm.plugin.registry.PluginRegistry;
import com.plm.plugin.validation.PluginValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Install / uninstall orchestration on top of the registry's transitions.
 *
 * <p>
 * Adds version resolution (explicit, then the attached config, then the
 * plugin's metadata), the validate-on-install gate, verbose tracing and a
 * caller-facing timeout. When the timeout fires the caller gets
 * {@code TIMEOUT} while the hook keeps running; the registry still writes
 * the final state and releases the plugin's permit once the hook finishes.
 * </p>
 */
@Slf4j
public class InstallOrchestrator {

    private final PluginRegistry registry;

    private volatile Duration operationTimeout = PluginRegistry.DEFAULT_PERMIT_TIMEOUT;
    private volatile boolean validateOnInstall = true;

    public InstallOrchestrator(PluginRegistry registry) {
        this.registry = registry;
    }

    /**
     * Take timeout and validation behavior from the project settings.
     */
    public void applySettings(ProjectConfig.Settings settings) {
        if (settings == null) {
            return;
        }
        if (settings.getOperationTimeoutSeconds() > 0) {
            setOperationTimeout(Duration.ofSeconds(settings.getOperationTimeoutSeconds()));
        }
        this.validateOnInstall = settings.isValidateOnInstall();
    }

    public void setOperationTimeout(Duration timeout) {
        registry.setPermitTimeout(timeout);
        this.operationTimeout = timeout;
    }

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public void setValidateOnInstall(boolean validateOnInstall) {
        this.validateOnInstall = validateOnInstall;
    }

    // =========================================================================
    // Operations
    // =========================================================================

    /**
     * Install {@code name} at {@code version}, or at its configured or
     * declared version when {@code version} is null.
     */
    public CompletableFuture<LifecycleOutcome> installPlugin(String name, String version, InstallOptions options) {
        InstallOptions opts = options != null ? options : InstallOptions.defaults();
        PluginEntry entry = registry.require(name);
        String resolved = resolveVersion(entry, version);
        OperationTrace trace = OperationTrace.of(opts.isVerbose());

        if (validateOnInstall) {
            List<String> problems = PluginValidator.validateEntry(entry);
            if (!problems.isEmpty()) {
                String reason = String.join("; ", problems);
                if (opts.isDryRun()) {
                    trace.record(OperationTrace.Step.DRY_RUN, reason);
                    return CompletableFuture.completedFuture(LifecycleOutcome.unchanged(name,
                            LifecycleOperation.INSTALL, entry.getState(), null,
                            "dry run: install of " + name + " would be rejected: " + reason, trace));
                }
                throw new PluginException(PluginException.Kind.VALIDATION_FAILED, name,
                        "plugin " + name + " failed validation: " + reason);
            }
        }

        log.debug("Install {}@{} (force={}, dryRun={})", name, resolved, opts.isForce(), opts.isDryRun());
        return awaitWithTimeout(name, LifecycleOperation.INSTALL,
                registry.install(name, resolved, opts, trace));
    }

    public CompletableFuture<LifecycleOutcome> uninstallPlugin(String name, String version, InstallOptions options) {
        InstallOptions opts = options != null ? options : InstallOptions.defaults();
        PluginEntry entry = registry.require(name);
        String resolved = resolveVersion(entry, version);
        OperationTrace trace = OperationTrace.of(opts.isVerbose());

        log.debug("Uninstall {}@{} (force={}, dryRun={})", name, resolved, opts.isForce(), opts.isDryRun());
        return awaitWithTimeout(name, LifecycleOperation.UNINSTALL,
                registry.uninstall(name, resolved, opts, trace));
    }

    // =========================================================================
    // Internal
    // =========================================================================

    static String resolveVersion(PluginEntry entry, String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        PluginConfig config = entry.getConfig();
        if (config != null && config.getVersion() != null && !config.getVersion().isBlank()) {
            return config.getVersion();
        }
        try {
            PluginMetadata metadata = entry.getPlugin().metadata();
            return metadata != null ? metadata.version() : null;
        } catch (RuntimeException e) {
            log.debug("Metadata of {} unavailable while resolving version: {}", entry.getName(), e.getMessage());
            return null;
        }
    }

    private CompletableFuture<LifecycleOutcome> awaitWithTimeout(String name, LifecycleOperation op,
            CompletableFuture<LifecycleOutcome> operation) {
        Duration timeout = operationTimeout;
        return operation.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((outcome, err) -> {
                    if (err == null) {
                        logTrace(outcome);
                        return outcome;
                    }
                    if (ErrorUtils.unwrap(err) instanceof TimeoutException) {
                        log.warn("{} of {} did not finish within {}; the hook is still running",
                                op.label(), name, timeout);
                        throw new PluginException(PluginException.Kind.TIMEOUT, name,
                                op.label() + " of plugin " + name + " timed out after " + timeout);
                    }
                    throw err instanceof CompletionException ce ? ce : new CompletionException(err);
                });
    }

    private static void logTrace(LifecycleOutcome outcome) {
        OperationTrace trace = outcome.trace();
        if (trace == null || !trace.isEnabled()) {
            return;
        }
        String steps = trace.entries().stream()
                .map(e -> e.detail() != null ? e.step() + "(" + e.detail() + ")" : e.step().name())
                .collect(Collectors.joining(" > "));
        log.info("{} {}: {} [{}]", outcome.operation().label(), outcome.plugin(), outcome.message(), steps);
    }
}
