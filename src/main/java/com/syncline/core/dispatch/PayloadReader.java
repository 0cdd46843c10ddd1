package com.syncline.core.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncline.core.events.EventEnvelope;
import com.syncline.core.model.Part;
import com.syncline.core.model.ToolState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Converts loosely typed envelope properties into payload records.
 * Unreadable payloads are logged and reported as empty.
 */
@Component
public class PayloadReader {

    private static final Logger log = LoggerFactory.getLogger(PayloadReader.class);

    private final ObjectMapper objectMapper;

    public PayloadReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<MessageInfoPayload> messageInfo(EventEnvelope envelope) {
        return read(envelope, "info", MessageInfoPayload.class);
    }

    public Optional<SessionInfoPayload> sessionInfo(EventEnvelope envelope) {
        return read(envelope, "info", SessionInfoPayload.class);
    }

    public Optional<PartPayload> part(EventEnvelope envelope) {
        return read(envelope, "part", PartPayload.class);
    }

    /**
     * Builds a canonical part. The stream falls back to the envelope's stream when the payload
     * does not name one.
     */
    public Part toPart(PartPayload payload, EventEnvelope envelope) {
        String streamId = payload.sessionId() != null ? payload.sessionId() : envelope.streamId();
        ToolState state = null;
        if (payload.state() != null) {
            PartPayload.State s = payload.state();
            state = new ToolState(s.status(), s.input() != null ? s.input() : Map.of(),
                    render(s.output()), render(s.error()));
        }
        return new Part(payload.id(), payload.messageId(), streamId, payload.type(), payload.text(),
                payload.reasoningId(), payload.tool(), payload.callId(), state,
                payload.attempt(), payload.next(), render(payload.error()), null, null);
    }

    private <T> Optional<T> read(EventEnvelope envelope, String key, Class<T> type) {
        Object raw = envelope.properties() != null ? envelope.properties().get(key) : null;
        if (!(raw instanceof Map<?, ?>)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.convertValue(raw, type));
        } catch (IllegalArgumentException e) {
            log.warn("Unreadable {} payload in {} {}: {}", key, envelope.type(), envelope.eventId(), e.getMessage());
            return Optional.empty();
        }
    }

    private String render(Object value) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
