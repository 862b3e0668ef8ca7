package com.planning.tdg.monitor;

import com.planning.tdg.analysis.GraphAnalyzer;
import com.planning.tdg.analysis.HealthReport;
import com.planning.tdg.api.GraphListener;
import com.planning.tdg.api.NodeStatus;
import com.planning.tdg.engine.TaskGraph;
import com.planning.tdg.engine.TaskNode;
import com.planning.tdg.util.CompositeGraphListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * GraphMonitor: applies execution-status events to a {@link TaskGraph} and
 * reports live progress.
 *
 * <p>
 * Each event drives the matching {@link TaskNode} transition, updates the
 * counters, appends to the event log and notifies the registered
 * {@link GraphListener}s. Events for ids that are not in the graph are logged
 * and ignored.
 *
 * <p>
 * Not thread-safe. Feed it from one thread, for example through
 * {@link com.planning.tdg.wiring.StatusFeed}.
 */
@Log4j2
public final class GraphMonitor {
    private final TaskGraph graph;
    private final GraphAnalyzer analyzer;
    private final Clock clock;
    private final CompositeGraphListener listeners = new CompositeGraphListener();
    private final List<NodeEventRecord> events = new ArrayList<>();

    private Instant executionStart;
    private Instant executionEnd;

    private int completed;
    private int failed;
    private int running;
    private double totalDuration;
    // Status each node is currently counted under, and its counted duration
    private final Map<String, NodeStatus> tracked = new HashMap<>();
    private final Map<String, Double> durations = new HashMap<>();

    public GraphMonitor(TaskGraph graph) {
        this(graph, new GraphAnalyzer(graph), Clock.systemUTC());
    }

    public GraphMonitor(TaskGraph graph, GraphAnalyzer analyzer, Clock clock) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TaskGraph graph() {
        return graph;
    }

    public void addListener(GraphListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(GraphListener listener) {
        return listeners.remove(listener);
    }

    // ---- Status events ----

    public void onNodeStart(String nodeId) {
        TaskNode node = lookup(nodeId);
        if (node == null || isDuplicate(nodeId, NodeStatus.RUNNING))
            return;
        Instant now = clock.instant();
        node.markRunning(now);
        track(nodeId, NodeStatus.RUNNING);
        events.add(NodeEventRecord.started(nodeId, now));
        listeners.onNodeStarted(graph.id(), nodeId);
        log.info("Node {} started", nodeId);
    }

    /**
     * A repeated completion is ignored. A node that failed earlier is moved
     * from the failed count to the completed count.
     *
     * @param duration reported duration in seconds; when null the node's
     *                 measured duration is used, if it was started.
     */
    public void onNodeComplete(String nodeId, Double duration) {
        TaskNode node = lookup(nodeId);
        if (node == null || isDuplicate(nodeId, NodeStatus.COMPLETED))
            return;
        Instant now = clock.instant();
        node.markCompleted(duration, now);
        track(nodeId, NodeStatus.COMPLETED);
        Double effective = duration != null ? duration : node.getActualDuration();
        if (effective != null) {
            durations.put(nodeId, effective);
            totalDuration += effective;
        }
        events.add(NodeEventRecord.completed(nodeId, now, duration));
        listeners.onNodeCompleted(graph.id(), nodeId, effective);
        log.info("Node {} completed in {}s", nodeId, effective);
    }

    /** A repeated failure is ignored; a completed node is moved to the failed count. */
    public void onNodeFail(String nodeId, String errorMessage) {
        TaskNode node = lookup(nodeId);
        if (node == null || isDuplicate(nodeId, NodeStatus.FAILED))
            return;
        Instant now = clock.instant();
        node.markFailed(errorMessage, now);
        track(nodeId, NodeStatus.FAILED);
        events.add(NodeEventRecord.failed(nodeId, now, errorMessage));
        listeners.onNodeFailed(graph.id(), nodeId, errorMessage);
        log.error("Node {} failed: {}", nodeId, errorMessage);
    }

    private boolean isDuplicate(String nodeId, NodeStatus status) {
        if (tracked.get(nodeId) != status)
            return false;
        log.debug("Ignoring repeated {} event for node {}", status.wireValue(), nodeId);
        return true;
    }

    /** Moves the node's count from the status it was last counted under to {@code to}. */
    private void track(String nodeId, NodeStatus to) {
        NodeStatus from = tracked.put(nodeId, to);
        if (from != null)
            count(from, -1);
        count(to, 1);
        if (from == NodeStatus.COMPLETED) {
            Double previous = durations.remove(nodeId);
            if (previous != null)
                totalDuration -= previous;
        }
    }

    private void count(NodeStatus status, int delta) {
        switch (status) {
            case RUNNING -> running += delta;
            case COMPLETED -> completed += delta;
            case FAILED -> failed += delta;
            default -> {
            }
        }
    }

    /** Sets a status directly, without touching counters or timestamps. */
    public void updateNodeStatus(String nodeId, NodeStatus status) {
        TaskNode node = lookup(nodeId);
        if (node == null)
            return;
        NodeStatus old = node.getStatus();
        node.setStatus(status);
        events.add(new NodeEventRecord(nodeId, NodeEventRecord.Kind.STATUS_CHANGED, clock.instant(), null, null));
        listeners.onStatusChanged(graph.id(), nodeId, old, status);
        log.info("Node {} status: {} -> {}", nodeId, old.wireValue(), status.wireValue());
    }

    private TaskNode lookup(String nodeId) {
        TaskNode node = graph.findNode(nodeId).orElse(null);
        if (node == null)
            log.warn("Node {} not found in graph {}", nodeId, graph.id());
        return node;
    }

    // ---- Live metrics ----

    public LiveStats getLiveStats() {
        int total = graph.nodeCount();
        int pending = total - completed - failed - running;
        return new LiveStats(graph.id(), total, completed, failed, running, pending, totalDuration,
                getProgress());
    }

    /** Completed nodes as a percentage of all nodes; 0 for an empty graph. */
    public double getProgress() {
        int total = graph.nodeCount();
        return total == 0 ? 0.0 : completed * 100.0 / total;
    }

    /**
     * Seconds since {@link #startMonitoring()}, up to {@link #stopMonitoring()}
     * if stopped; null if never started.
     */
    public Double getExecutionTime() {
        if (executionStart == null)
            return null;
        Instant end = executionEnd != null ? executionEnd : clock.instant();
        return Duration.between(executionStart, end).toNanos() / 1e9;
    }

    public List<NodeEventRecord> events() {
        return Collections.unmodifiableList(events);
    }

    public MonitorHealthReport getHealthReport() {
        HealthReport health = analyzer.calculateGraphHealth();
        return new MonitorHealthReport(graph.id(), health.score(), health.status(), health.issues(), getProgress(),
                failed, clock.instant());
    }

    public MonitorMetrics getMetrics() {
        return new MonitorMetrics(graph.id(), analyzer.checkGraphQuality(), analyzer.calculateTotalCost(),
                getLiveStats(), getHealthReport(), analyzer.calculateParallelizationIndex());
    }

    // ---- Execution control ----

    /** Starts the execution clock and clears counters and the event log. */
    public void startMonitoring() {
        executionStart = clock.instant();
        executionEnd = null;
        clearCounters();
        log.info("Started monitoring graph {}", graph.id());
    }

    public void stopMonitoring() {
        executionEnd = clock.instant();
        log.info("Stopped monitoring graph {}", graph.id());
    }

    public void reset() {
        executionStart = null;
        executionEnd = null;
        clearCounters();
        log.info("Monitor state reset for graph {}", graph.id());
    }

    private void clearCounters() {
        completed = 0;
        failed = 0;
        running = 0;
        totalDuration = 0.0;
        tracked.clear();
        durations.clear();
        events.clear();
    }
}
