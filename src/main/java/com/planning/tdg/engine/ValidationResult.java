package com.planning.tdg.engine;

import java.util.List;

/** Outcome of {@link TaskGraph#validate()}. */
public record ValidationResult(boolean valid, List<String> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }
}
