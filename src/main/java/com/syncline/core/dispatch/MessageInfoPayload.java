package com.syncline.core.dispatch;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.syncline.core.model.Message;
import com.syncline.core.model.MessageRole;

/**
 * Wire shape of {@code message.updated} {@code properties.info}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageInfoPayload(
    String id,
    String role,
    @JsonAlias("sessionID") String sessionId,
    @JsonAlias("parentID") String parentId,
    Time time,
    @JsonAlias("modelID") String model,
    @JsonAlias("providerID") String provider
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Time(Long created, Long completed) {}

    /**
     * Builds the canonical message. A missing creation time falls back to {@code fallbackCreatedAt}.
     */
    public Message toMessage(String streamId, long fallbackCreatedAt) {
        long createdAt = time != null && time.created() != null ? time.created() : fallbackCreatedAt;
        Long completedAt = time != null ? time.completed() : null;
        return new Message(id, MessageRole.fromWire(role), streamId, parentId, createdAt, completedAt,
                model, provider, null, null);
    }
}
