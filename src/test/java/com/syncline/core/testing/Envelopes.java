package com.syncline.core.testing;

import com.syncline.core.events.EventEnvelope;
import com.syncline.core.events.EventTypes;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for wire-shaped envelopes.
 */
public final class Envelopes {

    public static final long T0 = 1_700_000_000_000L;

    private Envelopes() {}

    public static EventEnvelope envelope(String type, String streamId, long sequence, Map<String, Object> properties) {
        return new EventEnvelope(type, properties, "evt-" + streamId + "-" + sequence,
                sequence, T0 + sequence, streamId, null);
    }

    public static EventEnvelope ordered(String streamId, long sequence) {
        return envelope("test.event", streamId, sequence, Map.of());
    }

    public static EventEnvelope sessionCreated(String streamId, long sequence, String directory) {
        return envelope(EventTypes.SESSION_CREATED, streamId, sequence,
                Map.of("info", Map.of("id", streamId, "directory", directory)));
    }

    public static EventEnvelope sessionStatus(String streamId, long sequence, Object status) {
        return envelope(EventTypes.SESSION_STATUS, streamId, sequence,
                Map.of("sessionID", streamId, "status", status));
    }

    public static EventEnvelope sessionDeleted(String streamId, long sequence) {
        return envelope(EventTypes.SESSION_DELETED, streamId, sequence,
                Map.of("info", Map.of("id", streamId)));
    }

    public static EventEnvelope messageUpdated(String streamId, long sequence, String messageId,
                                               String role, String parentId, long createdAt) {
        Map<String, Object> info = new HashMap<>();
        info.put("id", messageId);
        info.put("role", role);
        info.put("sessionID", streamId);
        info.put("time", Map.of("created", createdAt));
        if (parentId != null) {
            info.put("parentID", parentId);
        }
        return envelope(EventTypes.MESSAGE_UPDATED, streamId, sequence, Map.of("info", info));
    }

    public static EventEnvelope partUpdated(String streamId, long sequence, Map<String, Object> part) {
        return envelope(EventTypes.PART_UPDATED, streamId, sequence, Map.of("part", part));
    }

    public static Map<String, Object> textPart(String id, String messageId, String streamId, String text) {
        Map<String, Object> part = new LinkedHashMap<>();
        part.put("id", id);
        part.put("messageID", messageId);
        part.put("sessionID", streamId);
        part.put("type", "text");
        part.put("text", text);
        return part;
    }

    public static Map<String, Object> toolPart(String id, String messageId, String streamId,
                                               String tool, String callId, String status) {
        Map<String, Object> part = new LinkedHashMap<>();
        part.put("id", id);
        part.put("messageID", messageId);
        part.put("sessionID", streamId);
        part.put("type", "tool");
        part.put("tool", tool);
        part.put("callID", callId);
        part.put("state", Map.of("status", status, "input", Map.of()));
        return part;
    }
}
