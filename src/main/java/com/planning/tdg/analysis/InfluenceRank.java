package com.planning.tdg.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A node and its normalized PageRank influence. */
public record InfluenceRank(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("influence_score") double score) {
}
