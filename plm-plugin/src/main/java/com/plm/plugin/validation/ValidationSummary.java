package com.plm.plugin.validation;

import java.util.List;

/**
 * Outcome of validating every registered plugin.
 */
public record ValidationSummary(int validPlugins, int invalidPlugins, List<ValidationFailure> failures) {

    public ValidationSummary {
        failures = List.copyOf(failures);
    }

    public boolean isAllValid() {
        return invalidPlugins == 0;
    }

    public int totalPlugins() {
        return validPlugins + invalidPlugins;
    }
}
