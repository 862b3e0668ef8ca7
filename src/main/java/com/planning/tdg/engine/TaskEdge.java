package com.planning.tdg.engine;

import com.planning.tdg.api.EdgeType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed relationship between two task nodes.
 *
 * Endpoints and type are fixed at construction; weight, constraints and
 * metadata are free-form annotations that no graph algorithm depends on
 * (except the exporter's rendering).
 */
public final class TaskEdge {
    public static final String MAX_DELAY = "max_delay";
    public static final String MIN_DELAY = "min_delay";

    private final String sourceId;
    private final String targetId;
    private final EdgeType edgeType;
    private double weight;
    private final Map<String, Object> constraints;
    private final Map<String, Object> metadata;

    public TaskEdge(String sourceId, String targetId) {
        this(sourceId, targetId, EdgeType.DEPENDENCY);
    }

    public TaskEdge(String sourceId, String targetId, EdgeType edgeType) {
        this(sourceId, targetId, edgeType, 1.0, null, null);
    }

    public TaskEdge(String sourceId, String targetId, EdgeType edgeType, double weight,
            Map<String, Object> constraints, Map<String, Object> metadata) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.edgeType = edgeType != null ? edgeType : EdgeType.DEPENDENCY;
        this.weight = weight;
        this.constraints = constraints != null ? new LinkedHashMap<>(constraints) : new LinkedHashMap<>();
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public String sourceId() {
        return sourceId;
    }

    public String targetId() {
        return targetId;
    }

    public EdgeType edgeType() {
        return edgeType;
    }

    public double weight() {
        return weight;
    }

    public void setWeight(double weight) {
        this.weight = weight;
    }

    public boolean isDependency() {
        return edgeType == EdgeType.DEPENDENCY;
    }

    public boolean isConditional() {
        return edgeType == EdgeType.CONDITIONAL;
    }

    public boolean isWeak() {
        return edgeType == EdgeType.WEAK;
    }

    /** True for edge types whose insertion is checked for cycles. */
    public boolean isCycleSignificant() {
        return edgeType.isCycleSignificant();
    }

    public boolean connects(String source, String target) {
        return sourceId.equals(source) && targetId.equals(target);
    }

    public boolean touches(String nodeId) {
        return sourceId.equals(nodeId) || targetId.equals(nodeId);
    }

    public Object getConstraint(String key) {
        return constraints.get(key);
    }

    public Object getConstraint(String key, Object defaultValue) {
        return constraints.getOrDefault(key, defaultValue);
    }

    public void setConstraint(String key, Object value) {
        constraints.put(key, value);
    }

    public boolean hasTimingConstraint() {
        return constraints.containsKey(MAX_DELAY) || constraints.containsKey(MIN_DELAY);
    }

    /** Live view; callers may annotate the edge through it. */
    public Map<String, Object> constraints() {
        return constraints;
    }

    /** Live view; callers may annotate the edge through it. */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /** Same endpoints, type and annotations, under new endpoint ids. */
    public TaskEdge relabel(String newSourceId, String newTargetId) {
        return new TaskEdge(newSourceId, newTargetId, edgeType, weight, constraints, metadata);
    }

    @Override
    public String toString() {
        return sourceId + " -> " + targetId + " (" + edgeType.wireValue() + ")";
    }
}
