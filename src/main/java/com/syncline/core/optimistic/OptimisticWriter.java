package com.syncline.core.optimistic;

import com.syncline.core.correlation.CorrelationKeys;
import com.syncline.core.model.Message;
import com.syncline.core.model.MessageRole;
import com.syncline.core.model.OptimisticMetadata;
import com.syncline.core.model.OptimisticSource;
import com.syncline.core.model.Part;
import com.syncline.core.store.Projection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Writes placeholder entities for local intent before the server confirms it. The canonical
 * entities that arrive later replace them through reconciliation.
 */
@Service
public class OptimisticWriter {

    private static final Logger log = LoggerFactory.getLogger(OptimisticWriter.class);

    public static final String ID_PREFIX = "optimistic-";

    private final Projection projection;
    private final Clock clock;

    public OptimisticWriter(Projection projection, Clock clock) {
        this.projection = projection;
        this.clock = clock;
    }

    /**
     * Creates an optimistic user message with a single text part, creating the session if needed.
     */
    public Message submitUserMessage(String streamId, String text, String parentId) {
        long now = clock.millis();
        String messageId = ID_PREFIX + UUID.randomUUID();
        var messageMeta = new OptimisticMetadata(OptimisticSource.LOCAL_SUBMIT,
                CorrelationKeys.forMessage(MessageRole.USER, parentId, now), now);
        Message message = new Message(messageId, MessageRole.USER, streamId, parentId, now, null,
                null, null, messageMeta, null);

        String partId = ID_PREFIX + UUID.randomUUID();
        var partMeta = new OptimisticMetadata(OptimisticSource.LOCAL_SUBMIT,
                CorrelationKeys.forPart(messageId, Part.TEXT, null, null), now);
        Part part = Part.text(partId, messageId, streamId, text).withOptimisticMetadata(partMeta);

        projection.batch(() -> {
            projection.sessions().getOrCreate(streamId, null);
            projection.messages().upsert(message);
            projection.parts().upsert(part);
        });
        log.debug("Submitted optimistic message {} on stream {}", messageId, streamId);
        return message;
    }

    /**
     * Upserts {@code part} as an optimistic entity of an existing message.
     *
     * @return the stored part, or {@code null} when its message is unknown
     */
    public Part addOptimisticPart(Part part) {
        long now = clock.millis();
        var meta = new OptimisticMetadata(OptimisticSource.USER_ACTION,
                CorrelationKeys.forPart(part.messageId(), part.type(), part.callId(), part.reasoningId()), now);
        Part optimistic = part.withOptimisticMetadata(meta);
        boolean stored = projection.batch(() -> projection.parts().upsert(optimistic));
        return stored ? optimistic : null;
    }
}
