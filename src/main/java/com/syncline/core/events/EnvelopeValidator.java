package com.syncline.core.events;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Structural validation of incoming envelopes: integrity fields first, then the payload
 * shape of the types whose handlers depend on specific properties.
 */
@Component
public class EnvelopeValidator {

    public ValidationResult validate(EventEnvelope envelope) {
        if (envelope == null) {
            return ValidationResult.invalid("envelope is null");
        }
        List<String> errors = new ArrayList<>();
        if (isBlank(envelope.type())) {
            errors.add("type is required");
        }
        if (isBlank(envelope.eventId())) {
            errors.add("eventId is required");
        }
        if (envelope.sequence() == null || envelope.sequence() < 0) {
            errors.add("sequence must be a non-negative integer");
        }
        if (envelope.timestamp() == null || envelope.timestamp() <= 0) {
            errors.add("timestamp must be a positive integer");
        }
        if (envelope.properties() == null) {
            errors.add("properties are required");
        }
        if (envelope.streamId() != null && envelope.streamId().isBlank()) {
            errors.add("streamId must not be blank when present");
        }
        if (!errors.isEmpty()) {
            return ValidationResult.invalid(String.join(", ", errors));
        }

        String payloadError = validatePayload(envelope.type(), envelope.properties());
        return payloadError == null
                ? ValidationResult.ok()
                : ValidationResult.invalid("Invalid payload: " + payloadError);
    }

    private String validatePayload(String type, Map<String, Object> properties) {
        switch (type) {
            case EventTypes.MESSAGE_UPDATED: {
                if (!(properties.get("info") instanceof Map<?, ?> info)) {
                    return "info is required";
                }
                return info.get("id") instanceof String ? null : "info.id is required";
            }
            case EventTypes.PART_UPDATED: {
                if (!(properties.get("part") instanceof Map<?, ?> part)) {
                    return "part is required";
                }
                if (!(part.get("id") instanceof String)) {
                    return "part.id is required";
                }
                return part.get("type") instanceof String ? null : "part.type is required";
            }
            case EventTypes.SESSION_STATUS: {
                if (!(properties.get("sessionID") instanceof String)) {
                    return "sessionID is required";
                }
                return properties.get("status") != null ? null : "status is required";
            }
            default:
                return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
