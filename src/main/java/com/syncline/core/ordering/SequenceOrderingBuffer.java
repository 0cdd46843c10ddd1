package com.syncline.core.ordering;

import com.syncline.core.events.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Releases envelopes of each stream in strictly increasing sequence order.
 * <p>
 * Envelopes that arrive ahead of a gap are held until the gap closes. Liveness wins over
 * strict order in two cases: when a stream's queue reaches {@link OrderingOptions#maxQueueSize()}
 * the whole queue is released at once, and when a gap stays open for
 * {@link OrderingOptions#timeoutMs()} the {@link TimeoutCallback} is invoked so its owner can
 * {@link #forceRelease(String) force-release} the queue.
 * <p>
 * Sequences start at 1: a stream with no history treats 0 as already processed.
 * Thread-safe; the callback is never invoked while the buffer's monitor is held.
 */
public class SequenceOrderingBuffer {

    private static final Logger log = LoggerFactory.getLogger(SequenceOrderingBuffer.class);

    private final OrderingOptions options;
    private final ScheduledExecutorService scheduler;
    private final TimeoutCallback timeoutCallback;

    private final Map<String, StreamState> streams = new HashMap<>();

    public SequenceOrderingBuffer(OrderingOptions options,
                                  ScheduledExecutorService scheduler,
                                  TimeoutCallback timeoutCallback) {
        this.options = options;
        this.scheduler = scheduler;
        this.timeoutCallback = timeoutCallback;
    }

    /**
     * Adds an envelope and returns every envelope that can be applied now, in order.
     *
     * @return releasable envelopes; empty when the envelope is stale, duplicate or queued
     */
    public synchronized List<EventEnvelope> addEvent(EventEnvelope envelope) {
        if (!envelope.isOrdered()) {
            return List.of(envelope);
        }

        String streamId = envelope.streamId();
        long sequence = envelope.sequence();
        StreamState state = streams.computeIfAbsent(streamId, k -> new StreamState());

        if (sequence <= state.lastProcessed || state.queue.containsKey(sequence)) {
            log.debug("Dropping stale or duplicate sequence {} on stream {} (last processed {})",
                    sequence, streamId, state.lastProcessed);
            return List.of();
        }

        if (sequence == state.lastProcessed + 1) {
            List<EventEnvelope> released = new ArrayList<>();
            released.add(envelope);
            state.lastProcessed = sequence;

            long next = sequence + 1;
            EventEnvelope queued;
            while ((queued = state.queue.remove(next)) != null) {
                released.add(queued);
                state.lastProcessed = next;
                next++;
            }

            cancelTimer(state);
            return released;
        }

        state.queue.put(sequence, envelope);

        if (state.queue.size() >= options.maxQueueSize()) {
            log.info("Ordering queue for stream {} reached {} envelopes, releasing past the gap at {}",
                    streamId, state.queue.size(), state.lastProcessed + 1);
            return drain(state);
        }

        armTimer(streamId, state);
        return List.of();
    }

    /**
     * Releases the whole queue of a stream in ascending order regardless of gaps and advances
     * the last processed sequence to the highest released one.
     */
    public synchronized List<EventEnvelope> forceRelease(String streamId) {
        StreamState state = streams.get(streamId);
        if (state == null || state.queue.isEmpty()) {
            return List.of();
        }
        log.info("Force-releasing {} queued envelopes on stream {} (gap at {})",
                state.queue.size(), streamId, state.lastProcessed + 1);
        return drain(state);
    }

    public synchronized int queueSize(String streamId) {
        StreamState state = streams.get(streamId);
        return state != null ? state.queue.size() : 0;
    }

    public synchronized long lastProcessed(String streamId) {
        StreamState state = streams.get(streamId);
        return state != null ? state.lastProcessed : 0L;
    }

    public synchronized OrderingStats stats(String streamId) {
        StreamState state = streams.get(streamId);
        if (state == null) {
            return new OrderingStats(0, 0L, 1L, null);
        }
        Long oldest = state.queue.isEmpty() ? null : state.queue.firstKey();
        return new OrderingStats(state.queue.size(), state.lastProcessed, state.lastProcessed + 1, oldest);
    }

    /** Streams that currently hold queued envelopes. */
    public synchronized Set<String> streamIds() {
        Set<String> result = new TreeSet<>();
        streams.forEach((id, state) -> {
            if (!state.queue.isEmpty()) {
                result.add(id);
            }
        });
        return result;
    }

    /**
     * Drops all state of one stream: its queue is discarded without release and its timer cancelled.
     */
    public synchronized void clearSession(String streamId) {
        StreamState state = streams.remove(streamId);
        if (state != null) {
            cancelTimer(state);
        }
    }

    /**
     * Discards the queue of one stream without release and cancels its timer. The last processed
     * sequence is kept, so sequences at or below it stay stale.
     *
     * @return number of envelopes discarded
     */
    public synchronized int discardQueue(String streamId) {
        StreamState state = streams.get(streamId);
        if (state == null) {
            return 0;
        }
        int discarded = state.queue.size();
        state.queue.clear();
        cancelTimer(state);
        return discarded;
    }

    /** Drops the state of every stream. */
    public synchronized void clear() {
        for (StreamState state : streams.values()) {
            cancelTimer(state);
        }
        streams.clear();
    }

    private List<EventEnvelope> drain(StreamState state) {
        List<EventEnvelope> released = new ArrayList<>(state.queue.values());
        state.lastProcessed = Math.max(state.lastProcessed, state.queue.lastKey());
        state.queue.clear();
        cancelTimer(state);
        return released;
    }

    private void armTimer(String streamId, StreamState state) {
        cancelTimer(state);
        final ScheduledFuture<?>[] holder = new ScheduledFuture<?>[1];
        holder[0] = scheduler.schedule(() -> fireTimer(streamId, holder),
                options.timeoutMs(), TimeUnit.MILLISECONDS);
        state.timer = holder[0];
    }

    private void fireTimer(String streamId, ScheduledFuture<?>[] holder) {
        synchronized (this) {
            StreamState state = streams.get(streamId);
            ScheduledFuture<?> self = holder[0];
            // superseded by progress, a newer timer or teardown
            if (state == null || state.timer != self) {
                return;
            }
            state.timer = null;
            if (state.queue.isEmpty()) {
                return;
            }
        }
        log.debug("Ordering gap on stream {} timed out after {}ms", streamId, options.timeoutMs());
        try {
            timeoutCallback.onTimeout(streamId);
        } catch (RuntimeException e) {
            log.error("Timeout callback failed for stream {}: {}", streamId, e.getMessage(), e);
        }
    }

    private static void cancelTimer(StreamState state) {
        if (state.timer != null) {
            state.timer.cancel(false);
            state.timer = null;
        }
    }

    private static final class StreamState {
        private long lastProcessed;
        private final TreeMap<Long, EventEnvelope> queue = new TreeMap<>();
        private ScheduledFuture<?> timer;
    }
}
