package com.planning.tdg.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/** Whether a bottleneck gathers many inputs or fans out to many outputs. */
public enum BottleneckKind {
    CONVERGENCE,
    DIVERGENCE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
