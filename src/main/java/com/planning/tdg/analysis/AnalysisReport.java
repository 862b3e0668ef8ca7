package com.planning.tdg.analysis;

import com.planning.tdg.engine.GraphStats;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Everything {@link GraphAnalyzer} knows about one graph version, in one value.
 *
 * On a cyclic graph the order-dependent parts (critical nodes, parallel
 * stages) are empty and the parallelization index is 0.
 */
@JsonPropertyOrder({ "graph_id", "stats", "health", "quality", "costs", "bottlenecks", "critical_nodes",
        "influential_nodes", "resource_hotspots", "parallel_stages", "parallelization_index", "redundancy_score",
        "cycles" })
public record AnalysisReport(
        @JsonProperty("graph_id") String graphId,
        @JsonProperty("stats") GraphStats stats,
        @JsonProperty("health") HealthReport health,
        @JsonProperty("quality") QualityReport quality,
        @JsonProperty("costs") CostSummary costs,
        @JsonProperty("bottlenecks") List<Bottleneck> bottlenecks,
        @JsonProperty("critical_nodes") List<String> criticalNodes,
        @JsonProperty("influential_nodes") List<InfluenceRank> influentialNodes,
        @JsonProperty("resource_hotspots") List<ResourceHotspot> resourceHotspots,
        @JsonProperty("parallel_stages") Map<Integer, List<String>> parallelStages,
        @JsonProperty("parallelization_index") double parallelizationIndex,
        @JsonProperty("redundancy_score") double redundancyScore,
        @JsonProperty("cycles") List<List<String>> cycles) {
}
