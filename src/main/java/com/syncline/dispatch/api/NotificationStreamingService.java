package com.syncline.dispatch.api;

import com.syncline.core.events.EventEnvelope;
import com.syncline.core.events.EventTypes;
import com.syncline.core.events.NotificationBus;
import com.syncline.core.store.Projection;
import com.syncline.core.store.ProjectionChange;
import com.syncline.core.store.ProjectionListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link NotificationBus} subscriptions and projection changes to {@link SseEmitter}s.
 * <p>
 * Each forwarded envelope becomes an SSE frame named after the envelope type. Every completed
 * projection batch produces one {@code projection.changed} frame per touched stream so clients
 * know when to re-read a snapshot. Heartbeats are sent as SSE comments, which EventSource
 * clients ignore, to keep idle connections open through proxies.
 */
@Service
public class NotificationStreamingService {

    private static final Logger log = LoggerFactory.getLogger(NotificationStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final NotificationBus notificationBus;
    private final Projection projection;
    private final long timeoutMs;

    private final ProjectionListener projectionListener = this::onProjectionChange;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public NotificationStreamingService(NotificationBus notificationBus, Projection projection) {
        this(notificationBus, projection, DEFAULT_TIMEOUT_MS);
    }

    NotificationStreamingService(NotificationBus notificationBus, Projection projection, long timeoutMs) {
        this.notificationBus = notificationBus;
        this.projection = projection;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void start() {
        projection.addListener(projectionListener);
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stop() {
        projection.removeListener(projectionListener);
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SSE heartbeat scheduler stopped");
    }

    /**
     * Creates an SSE emitter for one stream, or for every stream when {@code streamId} is null.
     */
    public SseEmitter createEmitter(String streamId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        NotificationBus.Subscription subscription = streamId != null
                ? notificationBus.subscribe(streamId, envelope -> sendEnvelope(emitter, envelope))
                : notificationBus.subscribeAll(envelope -> sendEnvelope(emitter, envelope));

        var registration = new EmitterRegistration(streamId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for stream {}", label(streamId));
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for stream {}: {}", label(streamId), ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for stream {}: {}", label(streamId), e.getMessage());
        }

        log.info("SSE emitter created for stream {} (timeout={}ms)", label(streamId), timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    void onProjectionChange(ProjectionChange change) {
        for (EmitterRegistration registration : activeRegistrations) {
            for (String streamId : change.streamIds()) {
                if (registration.streamId() == null || registration.streamId().equals(streamId)) {
                    send(registration.emitter(), EventTypes.PROJECTION_CHANGED, Map.of("streamId", streamId));
                }
            }
        }
    }

    void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // lifecycle callbacks remove dead emitters
                log.debug("Heartbeat failed for stream {}: {}", label(registration.streamId()), e.getMessage());
            }
        }
    }

    private void sendEnvelope(SseEmitter emitter, EventEnvelope envelope) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("eventId", envelope.eventId());
        if (envelope.streamId() != null) {
            data.put("streamId", envelope.streamId());
        }
        data.put("properties", envelope.properties());
        data.put("timestamp", envelope.timestamp());
        send(emitter, envelope.type(), data);
    }

    private void send(SseEmitter emitter, String name, Object data) {
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {}: {}", name, e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for stream {}", label(registration.streamId()));
    }

    private static String label(String streamId) {
        return streamId != null ? streamId : "*";
    }

    private record EmitterRegistration(
            String streamId,
            SseEmitter emitter,
            NotificationBus.Subscription subscription
    ) {}
}
