package com.planning.tdg.io;

import com.planning.tdg.api.EdgeType;
import com.planning.tdg.api.NodeStatus;
import com.planning.tdg.engine.CostModel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Data;

/**
 * POJO representation of a serialized task graph.
 *
 * Keys are snake_case on the wire. Nodes are keyed by id in insertion order;
 * edges keep insertion order.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({ "graph_id", "metadata", "nodes", "edges", "node_count", "edge_count" })
public final class GraphDocument {
    private String graphId = "default";
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private Map<String, NodeDoc> nodes = new LinkedHashMap<>();
    private List<EdgeDoc> edges = new ArrayList<>();
    private int nodeCount;
    private int edgeCount;

    /** One task node with its status, timing and derived analysis fields. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonPropertyOrder({ "node_id", "name", "node_type", "priority", "status", "cost_model", "metadata",
            "dependencies", "dependents", "level", "critical_path", "influence_score", "parallelization_factor",
            "start_time", "end_time", "actual_duration", "error_message" })
    public static final class NodeDoc {
        private String nodeId;
        private String name;
        private String nodeType = "generic";
        private int priority = 5;
        private NodeStatus status = NodeStatus.PENDING;
        private CostModel costModel = new CostModel();
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private List<String> dependencies = new ArrayList<>();
        private List<String> dependents = new ArrayList<>();
        private Integer level;
        private boolean criticalPath;
        private double influenceScore;
        private double parallelizationFactor = 1.0;
        private Instant startTime;
        private Instant endTime;
        private Double actualDuration;
        private String errorMessage;
    }

    /** One directed edge. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonPropertyOrder({ "source_id", "target_id", "edge_type", "weight", "constraints", "metadata" })
    public static final class EdgeDoc {
        private String sourceId;
        private String targetId;
        private EdgeType edgeType = EdgeType.DEPENDENCY;
        private double weight = 1.0;
        private Map<String, Object> constraints = new LinkedHashMap<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();
    }
}
