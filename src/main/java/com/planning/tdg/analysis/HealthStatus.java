package com.planning.tdg.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/** Banding of the 0-100 health score. */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public static HealthStatus forScore(double score) {
        if (score >= 80.0)
            return HEALTHY;
        if (score >= 50.0)
            return DEGRADED;
        return UNHEALTHY;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
