package com.planning.tdg.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Degree statistics of a graph.
 *
 * @param balanced root and leaf counts differ by at most two.
 * @param density  edges over n(n-1); 0 for fewer than two nodes.
 */
public record QualityReport(
        @JsonProperty("node_count") int nodeCount,
        @JsonProperty("edge_count") int edgeCount,
        @JsonProperty("avg_fan_in") double avgFanIn,
        @JsonProperty("avg_fan_out") double avgFanOut,
        @JsonProperty("max_fan_in") int maxFanIn,
        @JsonProperty("max_fan_out") int maxFanOut,
        @JsonProperty("root_count") int rootCount,
        @JsonProperty("leaf_count") int leafCount,
        @JsonProperty("is_balanced") boolean balanced,
        @JsonProperty("density") double density) {
}
