package com.syncline.core.ordering;

/**
 * Tuning for {@link SequenceOrderingBuffer}.
 *
 * @param timeoutMs    how long a gap may stay open before the queue is force-released
 * @param maxQueueSize queued envelopes per stream that trigger an immediate forced release
 */
public record OrderingOptions(long timeoutMs, int maxQueueSize) {

    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 1000;

    public OrderingOptions {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        if (maxQueueSize <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be positive: " + maxQueueSize);
        }
    }

    public static OrderingOptions defaults() {
        return new OrderingOptions(DEFAULT_TIMEOUT_MS, DEFAULT_MAX_QUEUE_SIZE);
    }
}
