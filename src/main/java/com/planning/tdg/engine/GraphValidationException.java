package com.planning.tdg.engine;

import java.util.List;

/**
 * Structural inconsistency: a residual cycle found by the topological sort, or
 * the error list produced by {@link TaskGraph#validate()}.
 */
public class GraphValidationException extends TaskGraphException {
    private final List<String> errors;

    public GraphValidationException(String message) {
        this(message, List.of(message));
    }

    public GraphValidationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
