package com.plm.plugin.registry;

import com.plm.common.infra.ErrorUtils;
import com.plm.plugin.PluginException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Aggregate result of an operation applied to many plugins. One plugin's
 * failure never prevents the others from being processed.
 */
public record BatchReport(List<LifecycleOutcome> outcomes, List<Failure> failures) {

    public record Failure(String plugin, PluginException.Kind kind, String reason) {
    }

    public BatchReport {
        outcomes = List.copyOf(outcomes);
        failures = List.copyOf(failures);
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    /**
     * Run {@code operation} for each plugin in order and gather the results.
     * Synchronous throws and failed futures both become {@link Failure}s.
     *
     * @param fallbackKind kind reported for failures that carry no {@link PluginException}
     */
    public static CompletableFuture<BatchReport> collect(List<String> plugins,
            Function<String, CompletableFuture<LifecycleOutcome>> operation, PluginException.Kind fallbackKind) {
        List<CompletableFuture<Object>> pending = new ArrayList<>();
        for (String plugin : plugins) {
            CompletableFuture<Object> result;
            try {
                result = operation.apply(plugin).thenApply(outcome -> (Object) outcome);
            } catch (RuntimeException e) {
                result = CompletableFuture.failedFuture(e);
            }
            pending.add(result.exceptionally(err -> failureOf(plugin, err, fallbackKind)));
        }

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<LifecycleOutcome> outcomes = new ArrayList<>();
                    List<Failure> failures = new ArrayList<>();
                    for (CompletableFuture<Object> f : pending) {
                        Object value = f.join();
                        if (value instanceof LifecycleOutcome outcome) {
                            outcomes.add(outcome);
                        } else {
                            failures.add((Failure) value);
                        }
                    }
                    return new BatchReport(outcomes, failures);
                });
    }

    private static Failure failureOf(String plugin, Throwable err, PluginException.Kind fallbackKind) {
        PluginException pe = PluginException.unwrap(err);
        return new Failure(plugin, pe != null ? pe.getKind() : fallbackKind, ErrorUtils.formatErrorMessage(err));
    }
}
