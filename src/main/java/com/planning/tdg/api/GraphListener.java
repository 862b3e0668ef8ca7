package com.planning.tdg.api;

/**
 * Observability hook for execution-status changes reported into a task graph.
 *
 * Implementations are registered with {@code GraphMonitor} and are called on
 * whichever thread applies the status transition (the {@code StatusFeed}
 * consumer thread when events arrive through the ring buffer). Keep them
 * cheap: they run inline with the transition.
 */
public interface GraphListener {

    /**
     * Called after a node has been marked running.
     *
     * @param graphId The graph the node belongs to.
     * @param nodeId  The node that started.
     */
    void onNodeStarted(String graphId, String nodeId);

    /**
     * Called after a node has been marked completed.
     *
     * @param graphId         The graph the node belongs to.
     * @param nodeId          The node that completed.
     * @param durationSeconds Reported or measured duration, or null if unknown.
     */
    void onNodeCompleted(String graphId, String nodeId, Double durationSeconds);

    /**
     * Called after a node has been marked failed.
     *
     * @param graphId      The graph the node belongs to.
     * @param nodeId       The node that failed.
     * @param errorMessage The reported failure.
     */
    void onNodeFailed(String graphId, String nodeId, String errorMessage);

    /**
     * Called when a status is set directly rather than through a start,
     * complete or fail event.
     */
    default void onStatusChanged(String graphId, String nodeId, NodeStatus from, NodeStatus to) {
    }
}
