package com.plm.plugin.registry;

import java.util.List;

/**
 * Result of a lifecycle operation that did not fail.
 *
 * <p>
 * {@code applied} separates "state changed, here is the new state" from
 * "nothing changed, here is why" (dry runs). Failed operations are reported
 * as {@link com.plm.plugin.PluginException} instead.
 * </p>
 */
public record LifecycleOutcome(
        String plugin,
        LifecycleOperation operation,
        LifecycleState previousState,
        LifecycleState state,
        boolean applied,
        String descriptor,
        String message,
        OperationTrace trace) {

    public static LifecycleOutcome applied(String plugin, LifecycleOperation operation,
            LifecycleState from, LifecycleState to, String descriptor, OperationTrace trace) {
        return new LifecycleOutcome(plugin, operation, from, to, true, descriptor,
                operation.label() + " " + plugin + ": " + from + " -> " + to, trace);
    }

    public static LifecycleOutcome unchanged(String plugin, LifecycleOperation operation,
            LifecycleState state, String descriptor, String message, OperationTrace trace) {
        return new LifecycleOutcome(plugin, operation, state, state, false, descriptor, message, trace);
    }

    public List<OperationTrace.Step> traceSteps() {
        return trace != null ? trace.steps() : List.of();
    }
}
