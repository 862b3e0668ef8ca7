package com.planning.tdg.monitor;

import com.planning.tdg.analysis.CostSummary;
import com.planning.tdg.analysis.QualityReport;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Everything an oversight layer reads from one monitor in a single call. */
public record MonitorMetrics(
        @JsonProperty("graph_id") String graphId,
        @JsonProperty("quality") QualityReport quality,
        @JsonProperty("costs") CostSummary costs,
        @JsonProperty("live_stats") LiveStats liveStats,
        @JsonProperty("health") MonitorHealthReport health,
        @JsonProperty("parallelization_index") double parallelizationIndex) {
}
