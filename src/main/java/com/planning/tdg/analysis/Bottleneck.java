package com.planning.tdg.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A node whose fan-in or fan-out reaches the bottleneck threshold.
 *
 * @param score fan-in plus fan-out.
 */
public record Bottleneck(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("node_name") String nodeName,
        @JsonProperty("fan_in") int fanIn,
        @JsonProperty("fan_out") int fanOut,
        @JsonProperty("bottleneck_score") int score,
        @JsonProperty("type") BottleneckKind kind) {
}
