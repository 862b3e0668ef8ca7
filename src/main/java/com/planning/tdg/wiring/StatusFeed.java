package com.planning.tdg.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.planning.tdg.api.NodeStatus;
import com.planning.tdg.monitor.GraphMonitor;

import lombok.extern.log4j.Log4j2;

/**
 * StatusFeed: funnels execution-status reports from any number of producer
 * threads into one {@link GraphMonitor} through an LMAX Disruptor ring buffer.
 *
 * <p>
 * A single consumer thread runs {@link StatusEventHandler}, so the monitor and
 * its graph are only ever mutated from that thread. Producers call the
 * {@code publish*} methods, which claim a slot, fill the pre-allocated
 * {@link StatusEvent} and publish it.
 *
 * <p>
 * Lifecycle: construct, {@link #start()}, publish, {@link #shutdown()}.
 * Shutdown waits until every published event has been applied.
 */
@Log4j2
public final class StatusFeed implements AutoCloseable {
    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final Disruptor<StatusEvent> disruptor;
    private final StatusEventHandler handler;
    private volatile RingBuffer<StatusEvent> ringBuffer;

    public StatusFeed(GraphMonitor monitor) {
        this(monitor, DEFAULT_BUFFER_SIZE);
    }

    /** @param bufferSize ring size, a power of two. */
    public StatusFeed(GraphMonitor monitor, int bufferSize) {
        this(new StatusEventHandler(monitor), bufferSize);
    }

    public StatusFeed(StatusEventHandler handler, int bufferSize) {
        this.handler = handler;
        this.disruptor = new Disruptor<>(
                StatusEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(handler);
    }

    public StatusEventHandler handler() {
        return handler;
    }

    public synchronized void start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Status feed already started");
        ringBuffer = disruptor.start();
        log.info("Status feed started (buffer size {})", ringBuffer.getBufferSize());
    }

    public boolean isStarted() {
        return ringBuffer != null;
    }

    public void publishStarted(String nodeId) {
        RingBuffer<StatusEvent> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setStarted(nodeId, seq);
        } finally {
            rb.publish(seq);
        }
    }

    public void publishCompleted(String nodeId, double durationSeconds) {
        RingBuffer<StatusEvent> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setCompleted(nodeId, durationSeconds, seq);
        } finally {
            rb.publish(seq);
        }
    }

    /** Completion without a reported duration; the node measures its own. */
    public void publishCompleted(String nodeId) {
        publishCompleted(nodeId, Double.NaN);
    }

    public void publishFailed(String nodeId, String errorMessage) {
        RingBuffer<StatusEvent> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setFailed(nodeId, errorMessage, seq);
        } finally {
            rb.publish(seq);
        }
    }

    public void publishStatus(String nodeId, NodeStatus status) {
        RingBuffer<StatusEvent> rb = requireStarted();
        long seq = rb.next();
        try {
            rb.get(seq).setStatus(nodeId, status, seq);
        } finally {
            rb.publish(seq);
        }
    }

    private RingBuffer<StatusEvent> requireStarted() {
        RingBuffer<StatusEvent> rb = ringBuffer;
        if (rb == null)
            throw new IllegalStateException("Status feed not started");
        return rb;
    }

    /** Waits for every published event to be applied, then stops the consumer. */
    public void shutdown() {
        disruptor.shutdown();
        log.info("Status feed stopped: {} applied, {} dropped", handler.appliedCount(), handler.droppedCount());
    }

    @Override
    public void close() {
        if (isStarted())
            shutdown();
    }
}
