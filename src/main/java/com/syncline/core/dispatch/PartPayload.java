package com.syncline.core.dispatch;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Wire shape of {@code message.part.updated} {@code properties.part}.
 * Free-form fields (tool output, errors) stay untyped until {@link PayloadReader} renders them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PartPayload(
    String id,
    @JsonAlias("messageID") String messageId,
    @JsonAlias("sessionID") String sessionId,
    String type,
    String text,
    @JsonAlias("reasoningID") String reasoningId,
    String tool,
    @JsonAlias("callID") String callId,
    State state,
    Integer attempt,
    Long next,
    Object error
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record State(String status, Map<String, Object> input, Object output, Object error) {}
}
