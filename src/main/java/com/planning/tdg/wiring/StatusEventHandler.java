package com.planning.tdg.wiring;

import com.lmax.disruptor.EventHandler;
import com.planning.tdg.monitor.GraphMonitor;
import com.planning.tdg.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that applies {@link StatusEvent}s to a
 * {@link GraphMonitor}.
 *
 * Runs on the single consumer thread, which therefore owns every mutation of
 * the monitored graph's node statuses. A malformed event or a failing
 * transition is logged (throttled) and dropped; the handler never rethrows, so
 * the consumer thread stays alive.
 */
public final class StatusEventHandler implements EventHandler<StatusEvent> {
    private static final Logger log = LogManager.getLogger(StatusEventHandler.class);

    private final GraphMonitor monitor;
    private final ErrorRateLimiter errorLimiter;

    private PostBatchCallback postBatch;
    private int appliedInBatch;
    private long applied;
    private long dropped;

    public StatusEventHandler(GraphMonitor monitor) {
        this(monitor, new ErrorRateLimiter(log, 1000));
    }

    public StatusEventHandler(GraphMonitor monitor, ErrorRateLimiter errorLimiter) {
        this.monitor = monitor;
        this.errorLimiter = errorLimiter;
    }

    /** Sets a callback invoked at the end of every ring-buffer batch. */
    public void setPostBatchCallback(PostBatchCallback cb) {
        this.postBatch = cb;
    }

    @Override
    public void onEvent(StatusEvent event, long sequence, boolean endOfBatch) {
        try {
            apply(event);
            appliedInBatch++;
            applied++;
        } catch (RuntimeException e) {
            dropped++;
            errorLimiter.log("Dropped status event " + event + ": " + e.getMessage(), e);
        } finally {
            event.clear();
        }

        if (endOfBatch) {
            int n = appliedInBatch;
            appliedInBatch = 0;
            if (postBatch != null)
                postBatch.onBatchApplied(sequence, n);
        }
    }

    private void apply(StatusEvent event) {
        if (event.nodeId() == null)
            throw new IllegalArgumentException("Status event without node id");
        switch (event.kind()) {
            case STARTED -> monitor.onNodeStart(event.nodeId());
            case COMPLETED -> monitor.onNodeComplete(event.nodeId(),
                    event.hasDuration() ? Double.valueOf(event.duration()) : null);
            case FAILED -> monitor.onNodeFail(event.nodeId(), event.errorMessage());
            case STATUS -> {
                if (event.status() == null)
                    throw new IllegalArgumentException("Status event for " + event.nodeId() + " without status");
                monitor.updateNodeStatus(event.nodeId(), event.status());
            }
            case NONE -> throw new IllegalArgumentException("Unset status event for " + event.nodeId());
        }
    }

    /** Events applied since creation. Read from the consumer thread or after shutdown. */
    public long appliedCount() {
        return applied;
    }

    /** Events dropped since creation. Read from the consumer thread or after shutdown. */
    public long droppedCount() {
        return dropped;
    }

    /**
     * Callback interface for post-batch actions.
     */
    @FunctionalInterface
    public interface PostBatchCallback {
        /**
         * Called on the consumer thread after a batch of events was applied.
         *
         * @param lastSequence   Sequence of the last event in the batch.
         * @param eventsApplied  Events applied in this batch (dropped ones excluded).
         */
        void onBatchApplied(long lastSequence, int eventsApplied);
    }
}
