package com.planning.tdg.util;

import org.apache.logging.log4j.Logger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Limits the rate of error logging.
 * Used on the status feed consumer so a producer flooding bad events cannot
 * flood the log; suppressed occurrences are counted and reported with the
 * next line that gets through.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime;
    private final LongAdder suppressed = new LongAdder();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.lastLogTime = new AtomicLong(System.nanoTime() - minIntervalNanos - 1);
    }

    /** @return true if the line was logged, false if it was suppressed. */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        // Only one thread wins the interval.
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.sumThenReset();
            if (dropped > 0)
                logger.error("{} (Throttled, {} similar suppressed)", message, dropped, t);
            else
                logger.error("{} (Throttled)", message, t);
            return true;
        }
        suppressed.increment();
        return false;
    }

    public long suppressedCount() {
        return suppressed.sum();
    }
}
