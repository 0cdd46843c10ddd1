package com.syncline.core.dispatch;

import com.syncline.core.correlation.CorrelationMatch;
import com.syncline.core.events.EventEnvelope;
import com.syncline.core.events.EventTypes;
import com.syncline.core.metrics.SynclineMetrics;
import com.syncline.core.model.EventOrigin;
import com.syncline.core.model.Message;
import com.syncline.core.model.Part;
import com.syncline.core.reconciliation.ReconciliationEngine;
import com.syncline.core.reconciliation.ReconciliationResult;
import com.syncline.core.store.MessageStore;
import com.syncline.core.store.Projection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Applies canonical messages, replacing the optimistic placeholders they confirm.
 * <p>
 * When a canonical message matches an optimistic one by correlation, the canonical message is
 * written first, the placeholder's parts are moved onto it and only then is the placeholder
 * removed, so streamed parts survive the swap. An exact-id match is simply overwritten.
 */
@Component
public class MessageEventHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(MessageEventHandler.class);

    private final Projection projection;
    private final PayloadReader reader;
    private final ReconciliationEngine engine;
    private final PendingPartBuffer pendingParts;
    private final PartEventHandler partHandler;
    private final SynclineMetrics metrics;
    private final Clock clock;

    public MessageEventHandler(Projection projection, PayloadReader reader, ReconciliationEngine engine,
                               PendingPartBuffer pendingParts, PartEventHandler partHandler,
                               SynclineMetrics metrics, Clock clock) {
        this.projection = projection;
        this.reader = reader;
        this.engine = engine;
        this.pendingParts = pendingParts;
        this.partHandler = partHandler;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(EventTypes.MESSAGE_UPDATED, EventTypes.MESSAGE_REMOVED);
    }

    @Override
    public void handle(EventEnvelope envelope) {
        if (EventTypes.MESSAGE_REMOVED.equals(envelope.type())) {
            removeMessage(envelope);
        } else {
            updateMessage(envelope);
        }
    }

    private void updateMessage(EventEnvelope envelope) {
        Optional<MessageInfoPayload> payload = reader.messageInfo(envelope);
        if (payload.isEmpty() || payload.get().id() == null) {
            return;
        }
        MessageInfoPayload info = payload.get();
        MessageStore messages = projection.messages();

        String streamId = resolveStreamId(info, envelope);
        if (streamId == null) {
            log.warn("Dropping message {}: cannot resolve its session", info.id());
            return;
        }
        projection.sessions().getOrCreate(streamId, SessionEventHandler.directoryOf(envelope));

        Optional<Message> current = messages.getById(info.id());
        long fallbackCreatedAt = current.map(Message::createdAt).orElseGet(clock::millis);
        Message canonical = info.toMessage(streamId, fallbackCreatedAt)
                .withOrigin(new EventOrigin(envelope.sequence(), envelope.timestamp()));

        if (current.isPresent() && !current.get().isOptimistic() && current.get().sameContentAs(canonical)) {
            log.debug("Message {} unchanged, skipping write", canonical.id());
            return;
        }

        ReconciliationResult<Message> result =
                engine.reconcileMessages(List.of(canonical), messages.optimisticByStream(streamId));
        if (!messages.upsert(result.toUpsert().get(0))) {
            return;
        }

        for (int i = 0; i < result.toRemove().size(); i++) {
            String optimisticId = result.toRemove().get(i);
            CorrelationMatch<Message> match = result.matches().get(i);
            metrics.recordReconciliationMatch("message", match.strategy());
            if (optimisticId.equals(canonical.id())) {
                continue;
            }
            int moved = projection.parts().reparent(optimisticId, canonical.id());
            messages.remove(optimisticId);
            log.debug("Replaced optimistic message {} with {} ({}), moved {} parts",
                    optimisticId, canonical.id(), match.strategy(), moved);
        }
        if (result.stats().stale() > 0) {
            log.debug("Message reconciliation on stream {}: {}", streamId, result.stats());
        }

        for (Part pending : pendingParts.drain(canonical.id())) {
            partHandler.apply(pending);
        }
    }

    private void removeMessage(EventEnvelope envelope) {
        String messageId = envelope.stringProperty("messageID");
        if (messageId == null) {
            return;
        }
        if (projection.messages().remove(messageId)) {
            log.debug("Removed message {}", messageId);
        }
        int dropped = pendingParts.drain(messageId).size();
        if (dropped > 0) {
            log.debug("Dropped {} held parts of removed message {}", dropped, messageId);
        }
    }

    /**
     * info.sessionID, then properties.sessionID, then the envelope stream, then the stream of the
     * parent message.
     */
    private String resolveStreamId(MessageInfoPayload info, EventEnvelope envelope) {
        if (info.sessionId() != null) {
            return info.sessionId();
        }
        String fromProperties = envelope.stringProperty("sessionID");
        if (fromProperties != null) {
            return fromProperties;
        }
        if (envelope.streamId() != null) {
            return envelope.streamId();
        }
        if (info.parentId() == null) {
            return null;
        }
        return projection.messages().getById(info.parentId()).map(Message::streamId).orElse(null);
    }
}
