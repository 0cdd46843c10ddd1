package com.syncline.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub channel for envelopes that do not mutate the projection
 * (permission and question lifecycle, server notices, unknown types).
 * <p>
 * Supports per-stream subscriptions and global subscriptions that receive all envelopes.
 * Envelopes are delivered verbatim. Thread-safe for concurrent publish and subscribe.
 */
@Service
public class NotificationBus {

    private static final Logger log = LoggerFactory.getLogger(NotificationBus.class);

    /** Per-stream subscribers keyed by streamId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<EventEnvelope>>> streamSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive envelopes from all streams. */
    private final CopyOnWriteArrayList<Consumer<EventEnvelope>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an envelope to all matching subscribers (stream-specific and global).
     * Envelopes without a stream id reach global subscribers only.
     *
     * @param envelope the envelope to publish
     */
    public void publish(EventEnvelope envelope) {
        log.debug("Publishing notification: {} for stream {}", envelope.type(), envelope.streamId());

        if (envelope.streamId() != null) {
            List<Consumer<EventEnvelope>> streamSubs = streamSubscribers.get(envelope.streamId());
            if (streamSubs != null) {
                for (Consumer<EventEnvelope> subscriber : streamSubs) {
                    deliverSafely(subscriber, envelope);
                }
            }
        }

        for (Consumer<EventEnvelope> subscriber : globalSubscribers) {
            deliverSafely(subscriber, envelope);
        }
    }

    /**
     * Subscribe to notifications for a specific stream.
     *
     * @param streamId the stream to subscribe to
     * @param consumer callback invoked for each envelope
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String streamId, Consumer<EventEnvelope> consumer) {
        streamSubscribers.computeIfAbsent(streamId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to stream {}", streamId);
        return () -> {
            CopyOnWriteArrayList<Consumer<EventEnvelope>> subs = streamSubscribers.get(streamId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to notifications from all streams.
     *
     * @param consumer callback invoked for each envelope regardless of stream
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<EventEnvelope> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all notifications (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<EventEnvelope> subscriber, EventEnvelope envelope) {
        try {
            subscriber.accept(envelope);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing notification {}: {}",
                    envelope.type(), e.getMessage(), e);
        }
    }
}
