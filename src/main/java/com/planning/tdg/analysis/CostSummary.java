package com.planning.tdg.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resource totals over all nodes.
 *
 * @param sequentialDuration sum of every node's estimated duration.
 * @param efficiencyRatio    critical-path duration over sequential duration,
 *                           0 when the sequential duration is 0.
 */
public record CostSummary(
        @JsonProperty("total_duration_sequential") double sequentialDuration,
        @JsonProperty("critical_path_duration") double criticalPathDuration,
        @JsonProperty("total_cost") double totalCost,
        @JsonProperty("total_cpu_units") double totalCpuUnits,
        @JsonProperty("total_memory_mb") double totalMemoryMb,
        @JsonProperty("total_io_operations") long totalIoOperations,
        @JsonProperty("efficiency_ratio") double efficiencyRatio) {
}
