package com.planning.tdg.engine;

import com.planning.tdg.api.NodeStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.Getter;

/**
 * A unit of work in a task dependency graph.
 *
 * <p>
 * A node carries three kinds of state:
 * <ul>
 * <li><b>Identity and estimates:</b> id, name, type, priority and the
 * {@link CostModel}.</li>
 * <li><b>Execution status:</b> status, timestamps, measured duration and
 * error message, driven by the {@code mark*} transitions.</li>
 * <li><b>Derived fields:</b> level, critical-path flag, influence score and
 * parallelization factor, written by the graph and its analyzer.</li>
 * </ul>
 *
 * <p>
 * The dependency and dependent sets mirror the owning graph's adjacency. They
 * are exposed read-only; only {@link TaskGraph} mutates them.
 */
@Getter
public final class TaskNode {
    public static final String DEFAULT_TYPE = "generic";
    public static final int DEFAULT_PRIORITY = 5;

    private final String id;
    private final String name;
    private final String nodeType;
    private final int priority;
    private final CostModel costModel;
    private final Map<String, Object> metadata;

    @Getter(lombok.AccessLevel.NONE)
    private final SortedSet<String> dependencies = new TreeSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final SortedSet<String> dependents = new TreeSet<>();

    private NodeStatus status = NodeStatus.PENDING;
    private Instant startTime;
    private Instant endTime;
    private Double actualDuration;
    private String errorMessage;

    private Integer level;
    private boolean onCriticalPath;
    private double influenceScore;
    private double parallelizationFactor = 1.0;

    public TaskNode(String id) {
        this(id, id);
    }

    public TaskNode(String id, String name) {
        this(id, name, DEFAULT_TYPE, DEFAULT_PRIORITY, null, null);
    }

    public TaskNode(String id, String name, String nodeType, int priority, CostModel costModel,
            Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.nodeType = nodeType != null ? nodeType : DEFAULT_TYPE;
        this.priority = priority;
        this.costModel = costModel != null ? costModel : new CostModel();
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    /** Shorthand for a generic node whose only estimate is its duration. */
    public static TaskNode withDuration(String id, double estimatedDuration) {
        return new TaskNode(id, id, DEFAULT_TYPE, DEFAULT_PRIORITY, CostModel.ofDuration(estimatedDuration), null);
    }

    // ---- Adjacency mirrors ----

    /** Ids of the nodes this node depends on, in sorted order. */
    public SortedSet<String> getDependencies() {
        return Collections.unmodifiableSortedSet(dependencies);
    }

    /** Ids of the nodes depending on this node, in sorted order. */
    public SortedSet<String> getDependents() {
        return Collections.unmodifiableSortedSet(dependents);
    }

    SortedSet<String> dependencySet() {
        return dependencies;
    }

    SortedSet<String> dependentSet() {
        return dependents;
    }

    // ---- Status transitions ----

    public void markReady() {
        status = NodeStatus.READY;
    }

    public void markRunning() {
        markRunning(Instant.now());
    }

    public void markRunning(Instant at) {
        status = NodeStatus.RUNNING;
        startTime = at;
    }

    public void markCompleted() {
        markCompleted(null, Instant.now());
    }

    public void markCompleted(Double duration) {
        markCompleted(duration, Instant.now());
    }

    /**
     * Marks the node completed at {@code at}. Without an explicit duration the
     * elapsed time since {@link #markRunning()} is recorded, if the node was
     * started.
     */
    public void markCompleted(Double duration, Instant at) {
        status = NodeStatus.COMPLETED;
        endTime = at;
        if (duration != null) {
            actualDuration = duration;
        } else if (startTime != null) {
            actualDuration = secondsBetween(startTime, endTime);
        }
    }

    public void markFailed(String message) {
        markFailed(message, Instant.now());
    }

    public void markFailed(String message, Instant at) {
        status = NodeStatus.FAILED;
        errorMessage = message;
        endTime = at;
        if (startTime != null) {
            actualDuration = secondsBetween(startTime, endTime);
        }
    }

    public void markCancelled() {
        status = NodeStatus.CANCELLED;
    }

    public void markBlocked() {
        status = NodeStatus.BLOCKED;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canExecute() {
        return status == NodeStatus.READY;
    }

    private static double secondsBetween(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / 1e9;
    }

    // ---- Direct setters (restore and analysis write-back) ----

    public void setStatus(NodeStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public void setActualDuration(Double actualDuration) {
        this.actualDuration = actualDuration;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public void setLevel(Integer level) {
        this.level = level;
    }

    public void setOnCriticalPath(boolean onCriticalPath) {
        this.onCriticalPath = onCriticalPath;
    }

    public void setInfluenceScore(double influenceScore) {
        this.influenceScore = influenceScore;
    }

    public void setParallelizationFactor(double parallelizationFactor) {
        this.parallelizationFactor = parallelizationFactor;
    }

    // ---- Metadata ----

    public Object getMetadata(String key) {
        return metadata.get(key);
    }

    public Object getMetadata(String key, Object defaultValue) {
        return metadata.getOrDefault(key, defaultValue);
    }

    public void setMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public void updateMetadata(Map<String, ?> values) {
        metadata.putAll(values);
    }

    @Override
    public String toString() {
        return "TaskNode{" + id + ", " + nodeType + ", " + status.wireValue() + "}";
    }
}
