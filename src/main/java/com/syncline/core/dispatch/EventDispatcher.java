package com.syncline.core.dispatch;

import com.syncline.core.config.SynclineProperties;
import com.syncline.core.dedup.EventDeduplicator;
import com.syncline.core.events.EnvelopeValidator;
import com.syncline.core.events.EventEnvelope;
import com.syncline.core.events.NotificationBus;
import com.syncline.core.events.ValidationResult;
import com.syncline.core.logging.MdcContext;
import com.syncline.core.metrics.SynclineMetrics;
import com.syncline.core.ordering.OrderingStats;
import com.syncline.core.ordering.SequenceOrderingBuffer;
import com.syncline.core.store.Projection;
import com.syncline.core.store.ProjectionChange;
import com.syncline.core.store.ProjectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point of the synchronization pipeline: validate, deduplicate, order, then apply.
 * <p>
 * All work for one stream is serialized by a per-stream lock, both when an envelope arrives and
 * when the ordering timer drains a stream, so releases of the same stream are applied strictly
 * in the order they were released. Each release is applied inside one projection batch.
 * Envelopes without a handler are forwarded to the {@link NotificationBus} after the batch.
 */
@Service
public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final EnvelopeValidator validator;
    private final EventDeduplicator deduplicator;
    private final EventRouter router;
    private final Projection projection;
    private final PendingPartBuffer pendingParts;
    private final NotificationBus notificationBus;
    private final SynclineMetrics metrics;
    private final SequenceOrderingBuffer orderingBuffer;

    private final ConcurrentHashMap<String, ReentrantLock> streamLocks = new ConcurrentHashMap<>();

    public EventDispatcher(EnvelopeValidator validator,
                           EventDeduplicator deduplicator,
                           EventRouter router,
                           Projection projection,
                           PendingPartBuffer pendingParts,
                           NotificationBus notificationBus,
                           SynclineMetrics metrics,
                           SynclineProperties properties,
                           ScheduledExecutorService orderingScheduler) {
        this.validator = validator;
        this.deduplicator = deduplicator;
        this.router = router;
        this.projection = projection;
        this.pendingParts = pendingParts;
        this.notificationBus = notificationBus;
        this.metrics = metrics;
        this.orderingBuffer = new SequenceOrderingBuffer(
                properties.toOrderingOptions(), orderingScheduler, this::onOrderingTimeout);

        projection.sessions().onDelete(session -> discardQueuedState(session.id()));
        projection.addListener(new ProjectionListener() {
            @Override
            public void onChange(ProjectionChange change) {
            }

            @Override
            public void onRejected(String store, String entityId, String reason) {
                metrics.recordStoreRejection(store);
            }
        });
    }

    /**
     * Runs one envelope through the pipeline.
     */
    public DispatchResult dispatch(EventEnvelope envelope) {
        try {
            if (envelope != null) {
                MdcContext.setEvent(envelope);
            }
            return record(process(envelope));
        } finally {
            MdcContext.clear();
        }
    }

    public List<DispatchResult> dispatchAll(List<EventEnvelope> envelopes) {
        List<DispatchResult> results = new ArrayList<>(envelopes.size());
        for (EventEnvelope envelope : envelopes) {
            results.add(dispatch(envelope));
        }
        return results;
    }

    private DispatchResult process(EventEnvelope envelope) {
        ValidationResult validation = validator.validate(envelope);
        if (!validation.valid()) {
            log.warn("Dropping malformed envelope {}: {}",
                    envelope != null ? envelope.eventId() : null, validation.error());
            return DispatchResult.invalid(validation.error());
        }

        if (deduplicator.isDuplicate(envelope.eventId())) {
            log.debug("Dropping duplicate envelope {}", envelope.eventId());
            return DispatchResult.duplicate();
        }

        if (!envelope.isOrdered()) {
            apply(List.of(envelope));
            return DispatchResult.applied(1);
        }

        String streamId = envelope.streamId();
        ReentrantLock lock = lockStream(streamId);
        try {
            long expected = orderingBuffer.lastProcessed(streamId) + 1;
            int queuedBefore = orderingBuffer.queueSize(streamId);

            List<EventEnvelope> released = orderingBuffer.addEvent(envelope);
            if (released.isEmpty()) {
                if (orderingBuffer.queueSize(streamId) > queuedBefore) {
                    log.debug("Queued sequence {} on stream {}, waiting for {}",
                            envelope.sequence(), streamId, expected);
                    return DispatchResult.queued();
                }
                return DispatchResult.stale();
            }
            if (released.get(0).sequence() != expected) {
                metrics.recordForcedRelease("capacity");
            }
            apply(released);
            return DispatchResult.applied(released.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tears a stream down: removes its session with everything it owns, discards queued
     * envelopes without applying them and forgets the stream's sequence position, so the
     * stream id can be reused from sequence 1.
     *
     * @return true if the session existed
     */
    public boolean teardownStream(String streamId) {
        ReentrantLock lock = lockStream(streamId);
        try {
            boolean removed = projection.batch(() -> projection.sessions().remove(streamId));
            orderingBuffer.clearSession(streamId);
            pendingParts.clearStream(streamId);
            streamLocks.remove(streamId, lock);
            log.info("Tore down stream {}", streamId);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Force-releases every stream still waiting on a gap, as if each timer had fired now.
     *
     * @return number of envelopes applied
     */
    public int flushBacklog() {
        int applied = 0;
        for (String streamId : orderingBuffer.streamIds()) {
            applied += drainStream(streamId, "flush");
        }
        return applied;
    }

    public OrderingStats orderingStats(String streamId) {
        return orderingBuffer.stats(streamId);
    }

    /** Streams that currently hold out-of-order envelopes. */
    public Set<String> backloggedStreams() {
        return orderingBuffer.streamIds();
    }

    public EventDeduplicator.Stats dedupStats() {
        return deduplicator.stats();
    }

    public int pendingPartCount() {
        return pendingParts.size();
    }

    void onOrderingTimeout(String streamId) {
        drainStream(streamId, "timeout");
    }

    private int drainStream(String streamId, String reason) {
        ReentrantLock lock = lockStream(streamId);
        try {
            MdcContext.setStream(streamId);
            List<EventEnvelope> released = orderingBuffer.forceRelease(streamId);
            if (released.isEmpty()) {
                return 0;
            }
            metrics.recordForcedRelease(reason);
            apply(released);
            return released.size();
        } finally {
            lock.unlock();
            MdcContext.clear();
        }
    }

    private void apply(List<EventEnvelope> released) {
        metrics.recordBatchSize(released.size());
        List<EventEnvelope> unhandled = new ArrayList<>();

        projection.batch(() -> {
            for (EventEnvelope envelope : released) {
                MdcContext.setEvent(envelope);
                try {
                    if (!router.route(envelope)) {
                        unhandled.add(envelope);
                    }
                } catch (RuntimeException e) {
                    log.error("Handler failed for {} {}: {}", envelope.type(), envelope.eventId(), e.getMessage(), e);
                    metrics.recordHandlerFailure(envelope.type());
                }
            }
        });

        for (EventEnvelope envelope : unhandled) {
            notificationBus.publish(envelope);
            metrics.recordNotificationForwarded();
        }
    }

    /**
     * A deleted session keeps its sequence position: anything at or below it is still stale, so
     * retransmissions cannot bring deleted records back.
     */
    private void discardQueuedState(String streamId) {
        int discarded = orderingBuffer.discardQueue(streamId);
        pendingParts.clearStream(streamId);
        if (discarded > 0) {
            log.info("Discarded {} queued envelopes of deleted session {}", discarded, streamId);
        }
    }

    private DispatchResult record(DispatchResult result) {
        metrics.recordEnvelope(result.outcome().tag());
        return result;
    }

    /**
     * Acquires the lock of a stream. A lock dropped by {@link #teardownStream} while another
     * thread was waiting on it is no longer the stream's lock, so the waiter retries.
     */
    private ReentrantLock lockStream(String streamId) {
        while (true) {
            ReentrantLock lock = streamLocks.computeIfAbsent(streamId, k -> new ReentrantLock());
            lock.lock();
            if (streamLocks.get(streamId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    int lockCount() {
        return streamLocks.size();
    }
}
