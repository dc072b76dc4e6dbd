package com.plm.plugin.registry;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Step-by-step record of a lifecycle operation, filled in only when verbose
 * output was requested. Recording never affects the operation itself.
 */
public final class OperationTrace {

    public enum Step {
        PERMIT_REQUESTED,
        PERMIT_ACQUIRED,
        HOOK_INVOKED,
        HOOK_COMPLETED,
        HOOK_FAILED,
        STATE_WRITTEN,
        PERMIT_RELEASED,
        DRY_RUN
    }

    public record Entry(Step step, Instant at, String detail) {
    }

    private static final OperationTrace DISABLED = new OperationTrace(false);

    private final boolean enabled;
    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    private OperationTrace(boolean enabled) {
        this.enabled = enabled;
    }

    public static OperationTrace recording() {
        return new OperationTrace(true);
    }

    public static OperationTrace disabled() {
        return DISABLED;
    }

    public static OperationTrace of(boolean verbose) {
        return verbose ? recording() : disabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void record(Step step, String detail) {
        if (enabled) {
            entries.add(new Entry(step, Instant.now(), detail));
        }
    }

    public void record(Step step) {
        record(step, null);
    }

    public List<Entry> entries() {
        return List.copyOf(entries);
    }

    public List<Step> steps() {
        return entries.stream().map(Entry::step).toList();
    }
}
