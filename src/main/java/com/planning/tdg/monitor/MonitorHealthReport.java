package com.planning.tdg.monitor;

import com.planning.tdg.analysis.HealthStatus;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Structural health joined with execution progress, stamped at creation. */
public record MonitorHealthReport(
        @JsonProperty("graph_id") String graphId,
        @JsonProperty("health_score") double healthScore,
        @JsonProperty("status") HealthStatus status,
        @JsonProperty("issues") List<String> issues,
        @JsonProperty("execution_progress") double executionProgress,
        @JsonProperty("nodes_failed") int nodesFailed,
        @JsonProperty("timestamp") Instant timestamp) {

    public MonitorHealthReport {
        issues = List.copyOf(issues);
    }
}
