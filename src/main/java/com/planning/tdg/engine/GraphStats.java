package com.planning.tdg.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Structural counters of a graph, as read by exporters and monitors. */
public record GraphStats(
        @JsonProperty("graph_id") String graphId,
        @JsonProperty("node_count") int nodeCount,
        @JsonProperty("edge_count") int edgeCount,
        @JsonProperty("root_count") int rootCount,
        @JsonProperty("leaf_count") int leafCount,
        @JsonProperty("is_acyclic") boolean acyclic) {
}
