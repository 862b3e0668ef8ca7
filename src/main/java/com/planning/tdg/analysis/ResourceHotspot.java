package com.planning.tdg.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ResourceHotspot(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("node_name") String nodeName,
        @JsonProperty("duration") double duration,
        @JsonProperty("cost") double cost,
        @JsonProperty("cpu_units") double cpuUnits,
        @JsonProperty("memory_mb") double memoryMb,
        @JsonProperty("total_cost") double totalCost) {
}
