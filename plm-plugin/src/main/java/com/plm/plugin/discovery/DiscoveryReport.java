package com.plm.plugin.discovery;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What a discovery pass did with each candidate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscoveryReport {

    public record Failure(String plugin, String source, String reason) {
    }

    public record Diagnostic(String level, String plugin, String message) {
    }

    @Builder.Default
    private List<String> registered = new ArrayList<>();
    @Builder.Default
    private List<String> skippedDisabled = new ArrayList<>();
    @Builder.Default
    private List<String> alreadyRegistered = new ArrayList<>();
    @Builder.Default
    private List<Failure> failures = new ArrayList<>();
    @Builder.Default
    private List<Diagnostic> diagnostics = new ArrayList<>();

    public int registeredCount() {
        return registered.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    void fail(String plugin, String source, String reason) {
        failures.add(new Failure(plugin, source, reason));
    }

    void warn(String plugin, String message) {
        diagnostics.add(new Diagnostic("warn", plugin, message));
    }
}
