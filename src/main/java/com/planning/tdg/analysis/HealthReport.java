package com.planning.tdg.analysis;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Composite structural health of a graph, as computed by {@link GraphAnalyzer#calculateGraphHealth()}. */
public record HealthReport(
        @JsonProperty("health_score") double score,
        @JsonProperty("status") HealthStatus status,
        @JsonProperty("issues") List<String> issues,
        @JsonProperty("parallelization_index") double parallelizationIndex,
        @JsonProperty("cycle_count") int cycleCount,
        @JsonProperty("bottleneck_count") int bottleneckCount,
        @JsonProperty("isolated_count") int isolatedCount) {

    public HealthReport {
        issues = List.copyOf(issues);
    }
}
