package com.syncline.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A chat message owned by a stream; parent of {@link Part}s.
 *
 * @param id                 message identifier
 * @param role               author role
 * @param streamId           owning stream (session) id
 * @param parentId           id of the message this one answers, if any
 * @param createdAt          epoch millis of creation
 * @param completedAt        epoch millis of completion, if completed
 * @param model              model that produced the message, if known
 * @param provider           provider that served the model, if known
 * @param optimisticMetadata present only while the message is an unconfirmed local placeholder
 * @param origin             envelope that last wrote this message (canonical only)
 */
public record Message(
    String id,
    MessageRole role,
    String streamId,
    String parentId,
    long createdAt,
    Long completedAt,
    String model,
    String provider,
    OptimisticMetadata optimisticMetadata,
    EventOrigin origin
) implements OptimisticEntity, Serializable {

    public Message withOrigin(EventOrigin newOrigin) {
        return new Message(id, role, streamId, parentId, createdAt, completedAt,
                model, provider, optimisticMetadata, newOrigin);
    }

    public Message withStreamId(String newStreamId) {
        return new Message(id, role, newStreamId, parentId, createdAt, completedAt,
                model, provider, optimisticMetadata, origin);
    }

    /** Returns this message without optimistic metadata. */
    public Message asCanonical() {
        if (optimisticMetadata == null) {
            return this;
        }
        return new Message(id, role, streamId, parentId, createdAt, completedAt,
                model, provider, null, origin);
    }

    /**
     * Compares the fields that matter to consumers, ignoring {@link #origin()}.
     */
    public boolean sameContentAs(Message other) {
        return other != null
                && Objects.equals(withOrigin(null), other.withOrigin(null));
    }
}
