package com.planning.tdg.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution counters as seen by a {@link GraphMonitor}.
 *
 * @param pending nodes neither completed, failed nor running.
 */
public record LiveStats(
        @JsonProperty("graph_id") String graphId,
        @JsonProperty("total_nodes") int totalNodes,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("running") int running,
        @JsonProperty("pending") int pending,
        @JsonProperty("total_duration") double totalDuration,
        @JsonProperty("progress_percent") double progressPercent) {
}
