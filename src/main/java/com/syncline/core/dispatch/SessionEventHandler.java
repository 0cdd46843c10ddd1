package com.syncline.core.dispatch;

import com.syncline.core.events.EventEnvelope;
import com.syncline.core.events.EventTypes;
import com.syncline.core.metrics.SynclineMetrics;
import com.syncline.core.model.Message;
import com.syncline.core.model.MessageRole;
import com.syncline.core.model.Part;
import com.syncline.core.model.Session;
import com.syncline.core.model.SessionStatus;
import com.syncline.core.optimistic.OrphanSweeper;
import com.syncline.core.store.Projection;
import com.syncline.core.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session lifecycle and status. Going idle triggers an orphan sweep of the stream.
 * <p>
 * Retry statuses are counted once per distinct attempt. The first idle after a retry records
 * whether the session recovered or gave up, judged by an error part on the latest assistant
 * message.
 */
@Component
public class SessionEventHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionEventHandler.class);

    private final Projection projection;
    private final PayloadReader reader;
    private final OrphanSweeper orphanSweeper;
    private final SynclineMetrics metrics;

    // last retry signature per session, present while a retry is unresolved
    private final Map<String, String> retrySignatures = new ConcurrentHashMap<>();

    public SessionEventHandler(Projection projection, PayloadReader reader, OrphanSweeper orphanSweeper,
                               SynclineMetrics metrics) {
        this.projection = projection;
        this.reader = reader;
        this.orphanSweeper = orphanSweeper;
        this.metrics = metrics;
        projection.sessions().onDelete(session -> retrySignatures.remove(session.id()));
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(EventTypes.SESSION_CREATED, EventTypes.SESSION_UPDATED,
                EventTypes.SESSION_STATUS, EventTypes.SESSION_DELETED);
    }

    @Override
    public void handle(EventEnvelope envelope) {
        switch (envelope.type()) {
            case EventTypes.SESSION_CREATED, EventTypes.SESSION_UPDATED -> upsertSession(envelope);
            case EventTypes.SESSION_STATUS -> updateStatus(envelope);
            case EventTypes.SESSION_DELETED -> deleteSession(envelope);
            default -> throw new IllegalArgumentException("Unsupported event type: " + envelope.type());
        }
    }

    private void upsertSession(EventEnvelope envelope) {
        SessionStore sessions = projection.sessions();
        String sessionId = envelope.stringProperty("sessionID");

        Session session = reader.sessionInfo(envelope)
                .filter(info -> info.resolvedId() != null)
                .map(info -> new Session(info.resolvedId(), info.directory()))
                .orElse(sessionId != null
                        ? new Session(sessionId, envelope.stringProperty("directory"))
                        : null);
        if (session != null) {
            sessions.upsert(session);
        }

        if (sessionId != null) {
            SessionStatus status = SessionStatus.parse(envelope.properties().get("status"));
            if (status != null) {
                sessions.setStatus(sessionId, status);
            }
        }
    }

    private void updateStatus(EventEnvelope envelope) {
        String sessionId = envelope.stringProperty("sessionID");
        SessionStatus status = SessionStatus.parse(envelope.properties().get("status"));
        if (sessionId == null || status == null) {
            log.warn("Ignoring session.status without a recognizable status: {}", envelope.properties().get("status"));
            return;
        }
        SessionStore sessions = projection.sessions();
        sessions.getOrCreate(sessionId, directoryOf(envelope));
        sessions.setStatus(sessionId, status);
        trackRetry(sessionId, status);

        if (status.type() == SessionStatus.Type.IDLE) {
            orphanSweeper.sweep(sessionId);
        }
    }

    private void trackRetry(String sessionId, SessionStatus status) {
        if (status.type() == SessionStatus.Type.RETRY) {
            String signature = status.attempt() + ":" + status.next() + ":" + status.message();
            String previous = retrySignatures.put(sessionId, signature);
            if (!signature.equals(previous)) {
                metrics.recordSessionRetry("attempt");
                log.debug("Session {} retrying, attempt {}: {}", sessionId, status.attempt(), status.message());
            }
        } else if (status.type() == SessionStatus.Type.IDLE && retrySignatures.remove(sessionId) != null) {
            String outcome = latestAssistantFailed(sessionId) ? "exhausted" : "recovered";
            metrics.recordSessionRetry(outcome);
            log.info("Session {} went idle after retrying: {}", sessionId, outcome);
        }
    }

    private boolean latestAssistantFailed(String sessionId) {
        List<Message> messages = projection.messages().byStream(sessionId);
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.role() == MessageRole.ASSISTANT) {
                return projection.parts().byMessage(message.id()).stream()
                        .anyMatch(part -> Part.ERROR.equals(part.type()));
            }
        }
        return false;
    }

    private void deleteSession(EventEnvelope envelope) {
        String sessionId = reader.sessionInfo(envelope)
                .map(SessionInfoPayload::resolvedId)
                .orElse(envelope.stringProperty("sessionID"));
        if (sessionId == null) {
            sessionId = envelope.streamId();
        }
        if (sessionId != null && projection.sessions().remove(sessionId)) {
            log.info("Session {} deleted", sessionId);
        }
    }

    static String directoryOf(EventEnvelope envelope) {
        String directory = envelope.stringProperty("directory");
        return directory != null ? directory : envelope.directory();
    }
}
