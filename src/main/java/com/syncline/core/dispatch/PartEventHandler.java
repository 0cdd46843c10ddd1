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
import com.syncline.core.store.PartStore;
import com.syncline.core.store.Projection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Applies canonical parts. Parts of a message that is not known yet are held in the
 * {@link PendingPartBuffer} until the message arrives.
 */
@Component
public class PartEventHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(PartEventHandler.class);

    private final Projection projection;
    private final PayloadReader reader;
    private final ReconciliationEngine engine;
    private final PendingPartBuffer pendingParts;
    private final SynclineMetrics metrics;

    public PartEventHandler(Projection projection, PayloadReader reader, ReconciliationEngine engine,
                            PendingPartBuffer pendingParts, SynclineMetrics metrics) {
        this.projection = projection;
        this.reader = reader;
        this.engine = engine;
        this.pendingParts = pendingParts;
        this.metrics = metrics;
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(EventTypes.PART_UPDATED, EventTypes.PART_REMOVED);
    }

    @Override
    public void handle(EventEnvelope envelope) {
        if (EventTypes.PART_REMOVED.equals(envelope.type())) {
            String partId = envelope.stringProperty("partID");
            if (partId != null) {
                projection.parts().remove(partId);
            }
            return;
        }

        Optional<PartPayload> payload = reader.part(envelope);
        if (payload.isEmpty()) {
            return;
        }
        Part part = reader.toPart(payload.get(), envelope)
                .withOrigin(new EventOrigin(envelope.sequence(), envelope.timestamp()));
        if (part.messageId() == null) {
            log.warn("Dropping part {}: no messageID", part.id());
            return;
        }
        apply(part);
    }

    /**
     * Writes a canonical part, reconciling it against the optimistic parts of its message.
     */
    void apply(Part part) {
        Optional<Message> message = projection.messages().getById(part.messageId());
        if (message.isEmpty()) {
            if (pendingParts.hold(part)) {
                log.debug("Holding part {} until message {} arrives", part.id(), part.messageId());
            } else {
                log.warn("Dropping part {}: message {} is unknown and no session is named",
                        part.id(), part.messageId());
            }
            return;
        }
        if (part.streamId() == null) {
            part = part.withStreamId(message.get().streamId());
        }

        PartStore parts = projection.parts();
        Optional<Part> current = parts.getById(part.id());
        if (current.isPresent() && !current.get().isOptimistic() && current.get().sameContentAs(part)) {
            log.debug("Part {} unchanged, skipping write", part.id());
            return;
        }

        List<Part> optimistic = parts.byMessage(part.messageId()).stream()
                .filter(Part::isOptimistic)
                .toList();
        ReconciliationResult<Part> result = engine.reconcileParts(List.of(part), optimistic);

        for (int i = 0; i < result.toRemove().size(); i++) {
            String optimisticId = result.toRemove().get(i);
            CorrelationMatch<Part> match = result.matches().get(i);
            metrics.recordReconciliationMatch("part", match.strategy());
            if (optimisticId.equals(part.id())) {
                continue;
            }
            parts.remove(optimisticId);
            log.debug("Replaced optimistic part {} with {} ({})", optimisticId, part.id(), match.strategy());
        }
        parts.upsert(result.toUpsert().get(0));
    }
}
