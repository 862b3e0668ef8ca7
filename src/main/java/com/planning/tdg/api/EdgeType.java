package com.planning.tdg.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relationship carried by an edge between two task nodes.
 *
 * <ul>
 * <li>{@link #DEPENDENCY}: the source must complete before the target.</li>
 * <li>{@link #CONSTRAINT}: timing or resource constraint.</li>
 * <li>{@link #DATA_FLOW}: data produced by the source feeds the target.</li>
 * <li>{@link #CONDITIONAL}: the target depends on the source only under some
 * condition.</li>
 * <li>{@link #WEAK}: preferred ordering, not required.</li>
 * </ul>
 *
 * Only DEPENDENCY and CONSTRAINT edges are cycle-significant: inserting one of
 * them triggers the acyclicity check in {@code TaskGraph.addEdge}.
 */
public enum EdgeType {
    DEPENDENCY("dependency"),
    CONSTRAINT("constraint"),
    DATA_FLOW("data_flow"),
    CONDITIONAL("conditional"),
    WEAK("weak");

    private final String wireValue;

    EdgeType(String wireValue) {
        this.wireValue = wireValue;
    }

    public boolean isCycleSignificant() {
        return this == DEPENDENCY || this == CONSTRAINT;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static EdgeType fromString(String text) {
        for (EdgeType t : values()) {
            if (t.wireValue.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown EdgeType: " + text);
    }
}
