package com.plm.plugin.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.plm.common.config.PluginConfig;
import com.plm.common.config.SemanticVersion;
import com.plm.common.infra.ErrorUtils;
import com.plm.plugin.InstallOptions;
import com.plm.plugin.Plugin;
import com.plm.plugin.PluginException;
import com.plm.plugin.PluginMetadata;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Plugin registry: owns the name to entry mapping and every lifecycle
 * transition.
 *
 * <p>
 * Two levels of exclusion apply. The registry lock guards structural changes
 * of the mapping and is never held while a plugin hook runs. Each entry's
 * operation gate is held from the state check until the new state has been
 * written, so at most one lifecycle operation per plugin is in flight. A
 * second caller queues on the gate in arrival order without blocking its
 * thread; if it waits longer than the permit timeout its future fails with
 * {@code TIMEOUT}. Operations on different plugins never wait on each other.
 * </p>
 *
 * <p>
 * Structural problems (unknown name, illegal transition, bad arguments) are
 * thrown synchronously before any hook runs when they are detectable at call
 * time; a queued operation reports them through its future. Hook failures complete the
 * returned future exceptionally with the matching {@code *_FAILED} kind and
 * roll the entry back to its previous state.
 * </p>
 */
@Slf4j
public class PluginRegistry {

    public static final Duration DEFAULT_PERMIT_TIMEOUT = Duration.ofMinutes(5);

    private static final int RETIRED_CAPACITY = 256;

    private static final Set<LifecycleState> INSTALL_FROM = EnumSet.of(LifecycleState.INITIALIZED);
    private static final Set<LifecycleState> REINSTALL_FROM = EnumSet.of(
            LifecycleState.INITIALIZED, LifecycleState.INSTALLED);
    private static final Set<LifecycleState> UNINSTALL_FROM = EnumSet.of(LifecycleState.INSTALLED);
    private static final Set<LifecycleState> FORCE_UNINSTALL_FROM = EnumSet.of(
            LifecycleState.INITIALIZED, LifecycleState.INSTALLED);
    private static final Set<LifecycleState> SHUTDOWN_FROM = EnumSet.of(
            LifecycleState.INITIALIZED, LifecycleState.INSTALLED);

    // =========================================================================
    // State
    // =========================================================================

    private final Map<String, PluginEntry> entries = new ConcurrentHashMap<>();
    private final ReentrantLock structureLock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();
    private final Cache<String, PluginSummary> retired = Caffeine.newBuilder()
            .maximumSize(RETIRED_CAPACITY)
            .build();
    private final List<LifecycleListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Duration permitTimeout = DEFAULT_PERMIT_TIMEOUT;

    public void setPermitTimeout(Duration permitTimeout) {
        if (permitTimeout == null || permitTimeout.isNegative() || permitTimeout.isZero()) {
            throw new IllegalArgumentException("permit timeout must be positive");
        }
        this.permitTimeout = permitTimeout;
    }

    public Duration getPermitTimeout() {
        return permitTimeout;
    }

    public void addListener(LifecycleListener listener) {
        listeners.add(listener);
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Register a plugin under the name from its own metadata.
     */
    public PluginEntry register(Plugin plugin) {
        if (plugin == null) {
            throw new PluginException(PluginException.Kind.INVALID_ARGUMENT, null, "plugin is required");
        }
        PluginMetadata metadata = plugin.metadata();
        return register(metadata != null ? metadata.name() : null, plugin, null);
    }

    public PluginEntry register(String name, Plugin plugin) {
        return register(name, plugin, null);
    }

    /**
     * Register {@code plugin} under {@code name}: UNREGISTERED -> REGISTERED.
     *
     * @param config config entry to link, or null
     */
    public PluginEntry register(String name, Plugin plugin, PluginConfig config) {
        if (name == null || name.isBlank()) {
            throw new PluginException(PluginException.Kind.INVALID_ARGUMENT, name, "plugin name is required");
        }
        if (plugin == null) {
            throw new PluginException(PluginException.Kind.INVALID_ARGUMENT, name, "plugin is required");
        }
        if (config != null && !name.equals(config.getName())) {
            throw new PluginException(PluginException.Kind.INVALID_ARGUMENT, name,
                    "config name '" + config.getName() + "' does not match plugin name '" + name + "'");
        }

        PluginEntry entry;
        structureLock.lock();
        try {
            if (entries.containsKey(name)) {
                throw new PluginException(PluginException.Kind.ALREADY_REGISTERED, name,
                        "plugin already registered: " + name);
            }
            entry = new PluginEntry(name, plugin, config, sequence.incrementAndGet());
            entries.put(name, entry);
            retired.invalidate(name);
        } finally {
            structureLock.unlock();
        }

        notifyListeners(name, LifecycleState.UNREGISTERED, LifecycleState.REGISTERED);
        log.debug("Registered plugin: {}", name);
        return entry;
    }

    /**
     * Link a config to the registered plugin of the same name, if any.
     */
    public void attachConfig(PluginConfig config) {
        PluginEntry entry = entries.get(config.getName());
        if (entry != null) {
            entry.setConfig(config);
        }
    }

    public void detachConfig(String name) {
        PluginEntry entry = entries.get(name);
        if (entry != null) {
            entry.setConfig(null);
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public Optional<PluginEntry> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(entries.get(name));
    }

    public PluginEntry require(String name) {
        return find(name).orElseThrow(() -> PluginException.notFound(name));
    }

    public boolean contains(String name) {
        return name != null && entries.containsKey(name);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Active entries in registration order.
     */
    public List<PluginEntry> entries() {
        List<PluginEntry> list = new ArrayList<>(entries.values());
        list.sort(Comparator.comparingLong(PluginEntry::getSequence));
        return list;
    }

    public List<PluginSummary> listPlugins() {
        return entries().stream().map(PluginEntry::summarize).toList();
    }

    /**
     * Entries that were shut down or unregistered, most recent per name.
     */
    public List<PluginSummary> listRetired() {
        List<PluginSummary> list = new ArrayList<>(retired.asMap().values());
        list.sort(Comparator.comparing(PluginSummary::name));
        return Collections.unmodifiableList(list);
    }

    /**
     * Summary of an active entry, falling back to the retired audit list.
     */
    public Optional<PluginSummary> describe(String name) {
        PluginEntry entry = entries.get(name);
        if (entry != null) {
            return Optional.of(entry.summarize());
        }
        return Optional.ofNullable(retired.getIfPresent(name));
    }

    // =========================================================================
    // Transitions
    // =========================================================================

    public CompletableFuture<LifecycleOutcome> initializeOne(String name) {
        return initializeOne(name, OperationTrace.disabled());
    }

    /**
     * REGISTERED -> INITIALIZED. On hook failure the entry stays REGISTERED so
     * the call can be retried.
     */
    public CompletableFuture<LifecycleOutcome> initializeOne(String name, OperationTrace trace) {
        PluginEntry entry = require(name);
        return runExclusive(entry, trace, () -> transition(entry, LifecycleOperation.INITIALIZE,
                EnumSet.of(LifecycleState.REGISTERED), null, LifecycleState.INITIALIZED,
                () -> entry.getPlugin().initialize(), trace));
    }

    /**
     * INITIALIZED -> INSTALLED, or INSTALLED -> INSTALLED with {@code force}.
     * A dry run only validates and reports.
     */
    public CompletableFuture<LifecycleOutcome> install(String name, String version,
            InstallOptions options, OperationTrace trace) {
        PluginEntry entry = require(name);
        InstallOptions opts = options != null ? options : InstallOptions.defaults();
        Set<LifecycleState> allowed = opts.isForce() ? REINSTALL_FROM : INSTALL_FROM;

        if (opts.isDryRun()) {
            return CompletableFuture.completedFuture(simulate(entry, LifecycleOperation.INSTALL,
                    version, opts, allowed, LifecycleState.INSTALLED, trace));
        }
        checkArguments(name, version, opts);
        return runExclusive(entry, trace, () -> transition(entry, LifecycleOperation.INSTALL,
                allowed, null, LifecycleState.INSTALLED,
                () -> entry.getPlugin().install(version, opts), trace));
    }

    /**
     * INSTALLED -> INITIALIZED; {@code force} also accepts INITIALIZED.
     */
    public CompletableFuture<LifecycleOutcome> uninstall(String name, String version,
            InstallOptions options, OperationTrace trace) {
        PluginEntry entry = require(name);
        InstallOptions opts = options != null ? options : InstallOptions.defaults();
        Set<LifecycleState> allowed = opts.isForce() ? FORCE_UNINSTALL_FROM : UNINSTALL_FROM;

        if (opts.isDryRun()) {
            return CompletableFuture.completedFuture(simulate(entry, LifecycleOperation.UNINSTALL,
                    version, opts, allowed, LifecycleState.INITIALIZED, trace));
        }
        checkArguments(name, version, opts);
        return runExclusive(entry, trace, () -> transition(entry, LifecycleOperation.UNINSTALL,
                allowed, null, LifecycleState.INITIALIZED,
                () -> entry.getPlugin().uninstall(version), trace));
    }

    public CompletableFuture<LifecycleOutcome> shutdownOne(String name) {
        return shutdownOne(name, OperationTrace.disabled());
    }

    /**
     * INITIALIZED | INSTALLED -> SHUTTING_DOWN -> SHUTDOWN, calling the
     * plugin's shutdown hook exactly once. The entry then leaves the active
     * set. An entry that was never initialized is unregistered without
     * calling the hook.
     */
    public CompletableFuture<LifecycleOutcome> shutdownOne(String name, OperationTrace trace) {
        PluginEntry entry = require(name);
        return runExclusive(entry, trace, () -> {
            requireActive(entry);
            LifecycleState from = entry.getState();
            if (from == LifecycleState.REGISTERED) {
                writeState(entry, LifecycleState.UNREGISTERED);
                trace.record(OperationTrace.Step.STATE_WRITTEN, LifecycleState.UNREGISTERED.name());
                retire(entry);
                log.info("Unregistered plugin {} (never initialized)", name);
                return CompletableFuture.completedFuture(LifecycleOutcome.applied(name,
                        LifecycleOperation.SHUTDOWN, from, LifecycleState.UNREGISTERED, null, trace));
            }
            return transition(entry, LifecycleOperation.SHUTDOWN, SHUTDOWN_FROM,
                    LifecycleState.SHUTTING_DOWN, LifecycleState.SHUTDOWN,
                    () -> entry.getPlugin().shutdown(), trace);
        });
    }

    /**
     * Remove a plugin from the registry, shutting it down first if needed.
     */
    public CompletableFuture<LifecycleOutcome> unregister(String name) {
        return shutdownOne(name, OperationTrace.disabled());
    }

    /**
     * Shut down every active entry. Failures are collected in the report and
     * never stop the remaining shutdowns.
     */
    public CompletableFuture<BatchReport> shutdownAll() {
        List<String> names = entries().stream().map(PluginEntry::getName).toList();
        return BatchReport.collect(names, this::shutdownOne, PluginException.Kind.SHUTDOWN_FAILED)
                .thenApply(report -> {
                    if (!report.isSuccess()) {
                        log.warn("Shutdown finished with {} failure(s): {}", report.failures().size(), report.failures());
                    }
                    return report;
                });
    }

    // =========================================================================
    // Internal
    // =========================================================================

    /**
     * Run {@code body} while holding the entry's operation gate. The gate is
     * released when the returned future completes, whichever thread completes
     * it, or immediately if {@code body} throws.
     *
     * <p>
     * If the gate is free, {@code body} runs on the calling thread and its
     * structural errors are thrown directly. Otherwise the call returns at once
     * and {@code body} runs when the gate is handed over; waiting longer than
     * the permit timeout fails the future with {@code TIMEOUT}.
     * </p>
     */
    private <T> CompletableFuture<T> runExclusive(PluginEntry entry, OperationTrace trace,
            Supplier<CompletableFuture<T>> body) {
        trace.record(OperationTrace.Step.PERMIT_REQUESTED);
        CompletableFuture<Void> permit = entry.gate().acquire();
        if (permit.isDone()) {
            return runHolding(entry, trace, body);
        }

        Duration timeout = permitTimeout;
        log.debug("Operation on {} queued behind an in-flight operation", entry.getName());
        return permit.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((granted, err) -> {
                    if (err != null) {
                        throw new PluginException(PluginException.Kind.TIMEOUT, entry.getName(),
                                "operation on " + entry.getName() + " still in flight after " + timeout);
                    }
                    return granted;
                })
                .thenCompose(granted -> runHolding(entry, trace, body));
    }

    private <T> CompletableFuture<T> runHolding(PluginEntry entry, OperationTrace trace,
            Supplier<CompletableFuture<T>> body) {
        trace.record(OperationTrace.Step.PERMIT_ACQUIRED);
        CompletableFuture<T> result;
        try {
            result = body.get();
        } catch (RuntimeException e) {
            release(entry, trace);
            throw e;
        }
        return result.whenComplete((value, err) -> release(entry, trace));
    }

    private void release(PluginEntry entry, OperationTrace trace) {
        trace.record(OperationTrace.Step.PERMIT_RELEASED);
        entry.gate().release();
    }

    /**
     * Check state, invoke the hook, write the new state. The caller holds the
     * entry's permit.
     */
    private CompletableFuture<LifecycleOutcome> transition(PluginEntry entry, LifecycleOperation op,
            Set<LifecycleState> allowedFrom, LifecycleState intermediate, LifecycleState target,
            Supplier<CompletableFuture<?>> hook, OperationTrace trace) {
        String name = entry.getName();
        requireActive(entry);
        LifecycleState from = entry.getState();
        if (!allowedFrom.contains(from)) {
            throw invalidState(name, op, from, allowedFrom);
        }

        if (intermediate != null) {
            writeState(entry, intermediate);
        }
        trace.record(OperationTrace.Step.HOOK_INVOKED, op.label());

        return invoke(hook).handle((result, err) -> {
            if (err != null) {
                String reason = ErrorUtils.formatErrorMessage(err);
                trace.record(OperationTrace.Step.HOOK_FAILED, reason);
                if (entry.getState() != from) {
                    writeState(entry, from);
                }
                entry.setLastError(reason);
                log.warn("Plugin {} {} failed: {}", name, op.label(), reason);
                throw new PluginException(op.failureKind(), name,
                        op.label() + " of plugin " + name + " failed: " + reason, ErrorUtils.unwrap(err));
            }

            trace.record(OperationTrace.Step.HOOK_COMPLETED);
            writeState(entry, target);
            trace.record(OperationTrace.Step.STATE_WRITTEN, target.name());
            entry.setLastError(null);
            if (target == LifecycleState.SHUTDOWN) {
                retire(entry);
            }
            log.info("Plugin {} {}: {} -> {}", name, op.label(), from, target);
            return LifecycleOutcome.applied(name, op, from, target,
                    result instanceof String descriptor ? descriptor : null, trace);
        });
    }

    private static CompletableFuture<Object> invoke(Supplier<CompletableFuture<?>> hook) {
        try {
            CompletableFuture<?> future = hook.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("hook returned no future"));
            }
            return future.thenApply(value -> (Object) value);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private LifecycleOutcome simulate(PluginEntry entry, LifecycleOperation op, String version,
            InstallOptions opts, Set<LifecycleState> allowed, LifecycleState target, OperationTrace trace) {
        String name = entry.getName();
        LifecycleState state = entry.getState();
        String problem = null;
        if (!SemanticVersion.isValid(version)) {
            problem = "malformed version '" + version + "'";
        } else if (opts.getInstallDir() != null && opts.getInstallDir().isBlank()) {
            problem = "install directory must not be blank";
        } else if (!allowed.contains(state)) {
            problem = "requires " + allowed + " but plugin is " + state;
        }

        trace.record(OperationTrace.Step.DRY_RUN, problem);
        if (problem != null) {
            return LifecycleOutcome.unchanged(name, op, state, null,
                    "dry run: " + op.label() + " of " + name + " would be rejected: " + problem, trace);
        }
        return LifecycleOutcome.unchanged(name, op, state, "dry-run:" + name + "@" + version,
                "dry run: " + op.label() + " of " + name + "@" + version + " would move " + state
                        + " -> " + target,
                trace);
    }

    private static void checkArguments(String name, String version, InstallOptions opts) {
        if (version == null || version.isBlank()) {
            throw new PluginException(PluginException.Kind.INVALID_ARGUMENT, name, "version is required");
        }
        if (!SemanticVersion.isValid(version)) {
            throw new PluginException(PluginException.Kind.INVALID_ARGUMENT, name,
                    "malformed version '" + version + "' for plugin " + name);
        }
        if (opts.getInstallDir() != null && opts.getInstallDir().isBlank()) {
            throw new PluginException(PluginException.Kind.INVALID_ARGUMENT, name,
                    "install directory must not be blank");
        }
    }

    private void requireActive(PluginEntry entry) {
        if (entries.get(entry.getName()) != entry) {
            throw PluginException.notFound(entry.getName());
        }
    }

    private static PluginException invalidState(String name, LifecycleOperation op,
            LifecycleState current, Set<LifecycleState> allowed) {
        return new PluginException(PluginException.Kind.INVALID_STATE, name,
                "cannot " + op.label() + " plugin " + name + " in state " + current + " (requires " + allowed + ")");
    }

    private void writeState(PluginEntry entry, LifecycleState to) {
        LifecycleState from = entry.getState();
        entry.setState(to);
        if (from != to) {
            log.debug("Plugin {} state {} -> {}", entry.getName(), from, to);
            notifyListeners(entry.getName(), from, to);
        }
    }

    private void retire(PluginEntry entry) {
        structureLock.lock();
        try {
            entries.remove(entry.getName(), entry);
            retired.put(entry.getName(), entry.summarize());
        } finally {
            structureLock.unlock();
        }
    }

    private void notifyListeners(String name, LifecycleState from, LifecycleState to) {
        for (LifecycleListener listener : listeners) {
            try {
                listener.onTransition(name, from, to);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener failed for {} ({} -> {}): {}", name, from, to, e.getMessage());
            }
        }
    }
}
