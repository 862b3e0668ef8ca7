package com.planning.tdg.wiring;

import com.planning.tdg.api.NodeStatus;

/**
 * A mutable holder for one execution-status report, used within the LMAX
 * Disruptor RingBuffer.
 *
 * Pattern: Flyweight / Mutable Event
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every report. Producers fill one through a {@code set*} method; the consumer
 * applies it and then calls {@link #clear()} so it holds no references while
 * waiting for reuse.
 */
public final class StatusEvent {

    public enum Kind {
        NONE,
        STARTED,
        COMPLETED,
        FAILED,
        STATUS
    }

    private Kind kind = Kind.NONE;
    private String nodeId;
    private double duration = Double.NaN;
    private String errorMessage;
    private NodeStatus status;
    private long sequenceId;

    public void setStarted(String nodeId, long seqId) {
        reset(Kind.STARTED, nodeId, seqId);
    }

    /**
     * @param duration reported seconds, or {@code Double.NaN} to let the node
     *                 measure its own.
     */
    public void setCompleted(String nodeId, double duration, long seqId) {
        reset(Kind.COMPLETED, nodeId, seqId);
        this.duration = duration;
    }

    public void setFailed(String nodeId, String errorMessage, long seqId) {
        reset(Kind.FAILED, nodeId, seqId);
        this.errorMessage = errorMessage;
    }

    public void setStatus(String nodeId, NodeStatus status, long seqId) {
        reset(Kind.STATUS, nodeId, seqId);
        this.status = status;
    }

    private void reset(Kind kind, String nodeId, long seqId) {
        this.kind = kind;
        this.nodeId = nodeId;
        this.duration = Double.NaN;
        this.errorMessage = null;
        this.status = null;
        this.sequenceId = seqId;
    }

    public Kind kind() {
        return kind;
    }

    public String nodeId() {
        return nodeId;
    }

    public double duration() {
        return duration;
    }

    public boolean hasDuration() {
        return !Double.isNaN(duration);
    }

    public String errorMessage() {
        return errorMessage;
    }

    public NodeStatus status() {
        return status;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        reset(Kind.NONE, null, 0);
    }

    @Override
    public String toString() {
        return "StatusEvent{" + kind + ", " + nodeId + ", seq=" + sequenceId + "}";
    }
}
