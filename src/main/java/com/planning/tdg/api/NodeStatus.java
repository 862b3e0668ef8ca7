package com.planning.tdg.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution status of a task node.
 *
 * The wire form is the lower-case constant name ({@code "pending"},
 * {@code "running"}, ...).
 */
public enum NodeStatus {
    PENDING,
    READY,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    BLOCKED;

    /** COMPLETED, FAILED and CANCELLED are final. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static NodeStatus fromString(String text) {
        for (NodeStatus s : values()) {
            if (s.name().equalsIgnoreCase(text)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown NodeStatus: " + text);
    }
}
