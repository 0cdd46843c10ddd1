package com.syncline.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the projection's domain records and enums.
 */
class ModelTest {

    @Nested
    @DisplayName("MessageRole")
    class MessageRoleTests {

        @Test
        @DisplayName("parses wire roles case-insensitively")
        void parsesWireRoles() {
            assertEquals(MessageRole.USER, MessageRole.fromWire("user"));
            assertEquals(MessageRole.SYSTEM, MessageRole.fromWire("SYSTEM"));
            assertEquals(MessageRole.ASSISTANT, MessageRole.fromWire("assistant"));
        }

        @Test
        @DisplayName("unknown and missing roles fall back to assistant")
        void fallsBackToAssistant() {
            assertEquals(MessageRole.ASSISTANT, MessageRole.fromWire("tool"));
            assertEquals(MessageRole.ASSISTANT, MessageRole.fromWire(null));
        }

        @Test
        @DisplayName("wire name is lowercase")
        void wireName() {
            assertEquals("user", MessageRole.USER.wireName());
        }
    }

    @Nested
    @DisplayName("SessionStatus")
    class SessionStatusTests {

        @Test
        @DisplayName("parses legacy string forms")
        void parsesLegacyStrings() {
            assertEquals(SessionStatus.idle(), SessionStatus.parse("idle"));
            assertEquals(SessionStatus.idle(), SessionStatus.parse("error"));
            assertEquals(SessionStatus.busy(), SessionStatus.parse("running"));
            assertNull(SessionStatus.parse("sleeping"));
        }

        @Test
        @DisplayName("parses object forms")
        void parsesObjects() {
            assertEquals(SessionStatus.busy(), SessionStatus.parse(Map.of("type", "busy")));
            assertEquals(SessionStatus.retry(2, "rate limited", 1_000L),
                    SessionStatus.parse(Map.of("type", "retry", "attempt", 2,
                            "message", "rate limited", "next", 1_000L)));
        }

        @Test
        @DisplayName("rejects incomplete retry and unrecognized values")
        void rejectsMalformed() {
            assertNull(SessionStatus.parse(Map.of("type", "retry", "attempt", 2)));
            assertNull(SessionStatus.parse(Map.of("kind", "idle")));
            assertNull(SessionStatus.parse(42));
            assertNull(SessionStatus.parse(null));
        }
    }

    @Nested
    @DisplayName("Session")
    class SessionTests {

        @Test
        @DisplayName("blank or missing directory defaults")
        void defaultDirectory() {
            assertEquals(Session.DEFAULT_DIRECTORY, new Session("s1", null).directory());
            assertEquals(Session.DEFAULT_DIRECTORY, new Session("s1", " ").directory());
            assertEquals("/work", new Session("s1", "/work").directory());
        }
    }

    @Nested
    @DisplayName("Message and Part")
    class EntityTests {

        private final OptimisticMetadata metadata =
                new OptimisticMetadata(OptimisticSource.LOCAL_SUBMIT, "user:s1", 5L);

        @Test
        @DisplayName("asCanonical strips optimistic metadata")
        void asCanonical() {
            Message optimistic = new Message("m1", MessageRole.USER, "s1", null, 5L,
                    null, null, null, metadata, null);

            assertTrue(optimistic.isOptimistic());
            assertFalse(optimistic.asCanonical().isOptimistic());
            assertTrue(metadata.optimistic());

            Part part = Part.text("p1", "m1", "s1", "hi").withOptimisticMetadata(metadata);
            assertNull(part.asCanonical().optimisticMetadata());
        }

        @Test
        @DisplayName("sameContentAs ignores the origin but not the content")
        void sameContentIgnoresOrigin() {
            Part first = Part.text("p1", "m1", "s1", "hi").withOrigin(new EventOrigin(1, 10));
            Part replay = Part.text("p1", "m1", "s1", "hi").withOrigin(new EventOrigin(7, 70));
            Part edited = Part.text("p1", "m1", "s1", "hello").withOrigin(new EventOrigin(1, 10));

            assertTrue(first.sameContentAs(replay));
            assertFalse(first.sameContentAs(edited));
            assertFalse(first.sameContentAs(null));
        }

        @Test
        @DisplayName("tool and tool-call parts are both tool types")
        void toolTypes() {
            assertTrue(Part.tool("p1", "m1", "s1", "bash", "call-1", ToolState.pending()).isToolType());
            assertFalse(Part.text("p1", "m1", "s1", "x").isToolType());
            assertFalse(Part.reasoning("p1", "m1", "s1", "r1", "x").isToolType());
        }
    }
}
