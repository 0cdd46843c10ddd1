package com.syncline.core.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncline.core.events.EventEnvelope;
import com.syncline.core.events.EventTypes;
import com.syncline.core.model.MessageRole;
import com.syncline.core.model.Part;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadReaderTest {

    private final PayloadReader reader = new PayloadReader(new ObjectMapper());

    private static EventEnvelope envelope(String type, Map<String, Object> properties) {
        return new EventEnvelope(type, properties, "evt_01", 1L, 1L, "ses_env", null);
    }

    @Test
    @DisplayName("reads message info with wire aliases")
    void messageInfo() {
        var info = reader.messageInfo(envelope(EventTypes.MESSAGE_UPDATED, Map.of("info", Map.of(
                "id", "msg_01", "role", "user", "sessionID", "ses_01", "parentID", "msg_00",
                "modelID", "sonnet", "providerID", "anthropic", "extra", true,
                "time", Map.of("created", 10, "completed", 20))))).orElseThrow();

        var message = info.toMessage("ses_01", 99L);
        assertEquals(MessageRole.USER, message.role());
        assertEquals("msg_00", message.parentId());
        assertEquals("sonnet", message.model());
        assertEquals("anthropic", message.provider());
        assertEquals(10L, message.createdAt());
        assertEquals(20L, message.completedAt());
    }

    @Test
    @DisplayName("missing creation time falls back to now")
    void creationTimeFallback() {
        var info = reader.messageInfo(envelope(EventTypes.MESSAGE_UPDATED,
                Map.of("info", Map.of("id", "msg_01")))).orElseThrow();
        assertEquals(99L, info.toMessage("ses_01", 99L).createdAt());
    }

    @Test
    @DisplayName("absent or non-object payloads read as empty")
    void absentPayload() {
        assertTrue(reader.messageInfo(envelope(EventTypes.MESSAGE_UPDATED, Map.of())).isEmpty());
        assertTrue(reader.part(envelope(EventTypes.PART_UPDATED, Map.of("part", "prt_01"))).isEmpty());
    }

    @Test
    @DisplayName("unconvertible payloads read as empty")
    void unreadablePayload() {
        assertTrue(reader.part(envelope(EventTypes.PART_UPDATED,
                Map.of("part", Map.of("id", "prt_01", "attempt", "not-a-number")))).isEmpty());
    }

    @Test
    @DisplayName("tool output objects are rendered as JSON and the stream falls back to the envelope")
    void toolPart() {
        Map<String, Object> part = new LinkedHashMap<>();
        part.put("id", "prt_01");
        part.put("messageID", "msg_01");
        part.put("type", "tool");
        part.put("tool", "grep");
        part.put("callID", "call_01");
        part.put("state", Map.of("status", "completed", "output", Map.of("matches", List.of(1, 2))));
        EventEnvelope env = envelope(EventTypes.PART_UPDATED, Map.of("part", part));

        Part result = reader.toPart(reader.part(env).orElseThrow(), env);

        assertEquals("ses_env", result.streamId());
        assertEquals("call_01", result.callId());
        assertEquals("completed", result.state().status());
        assertEquals("{\"matches\":[1,2]}", result.state().output());
        assertEquals(Map.of(), result.state().input());
    }

    @Test
    @DisplayName("retry parts keep attempt, next and error")
    void retryPart() {
        EventEnvelope env = envelope(EventTypes.PART_UPDATED, Map.of("part", Map.of(
                "id", "prt_02", "messageID", "msg_01", "sessionID", "ses_01", "type", "retry",
                "attempt", 2, "next", 5000, "error", "overloaded")));

        Part result = reader.toPart(reader.part(env).orElseThrow(), env);

        assertEquals("ses_01", result.streamId());
        assertEquals(2, result.attempt());
        assertEquals(5000L, result.next());
        assertEquals("overloaded", result.error());
    }
}
