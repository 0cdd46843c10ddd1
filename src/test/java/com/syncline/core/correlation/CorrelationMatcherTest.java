package com.syncline.core.correlation;

import com.syncline.core.model.Message;
import com.syncline.core.model.MessageRole;
import com.syncline.core.model.OptimisticMetadata;
import com.syncline.core.model.OptimisticSource;
import com.syncline.core.model.Part;
import com.syncline.core.model.ToolState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CorrelationMatcher}.
 */
class CorrelationMatcherTest {

    private static final long NOW = 1_700_000_000_000L;

    private final CorrelationMatcher matcher = new CorrelationMatcher();

    private static OptimisticMetadata meta(long timestamp) {
        return new OptimisticMetadata(OptimisticSource.LOCAL_SUBMIT, "key", timestamp);
    }

    private static Message message(String id, MessageRole role, String parentId, long createdAt) {
        return new Message(id, role, "s1", parentId, createdAt, null, null, null, null, null);
    }

    private static Message optimisticMessage(String id, MessageRole role, String parentId, long timestamp) {
        return new Message(id, role, "s1", parentId, timestamp, null, null, null, meta(timestamp), null);
    }

    private static Part optimistic(Part part) {
        return part.withOptimisticMetadata(meta(NOW));
    }

    @Nested
    @DisplayName("messages")
    class MessageTests {

        @Test
        @DisplayName("matches by correlation within the window")
        void correlationWithinWindow() {
            var optimistic = optimisticMessage("opt-1", MessageRole.USER, null, NOW);
            var canonical = message("msg-1", MessageRole.USER, null, NOW + 30_000);

            assertTrue(matcher.matchMessageByCorrelation(optimistic, canonical));
        }

        @Test
        @DisplayName("does not match outside the window")
        void correlationOutsideWindow() {
            var optimistic = optimisticMessage("opt-1", MessageRole.USER, null, NOW);
            var canonical = message("msg-1", MessageRole.USER, null, NOW + 30_001);

            assertFalse(matcher.matchMessageByCorrelation(optimistic, canonical));
        }

        @Test
        @DisplayName("requires the same role and parent")
        void roleAndParent() {
            var optimistic = optimisticMessage("opt-1", MessageRole.USER, "p1", NOW);

            assertFalse(matcher.matchMessageByCorrelation(optimistic, message("m", MessageRole.ASSISTANT, "p1", NOW)));
            assertFalse(matcher.matchMessageByCorrelation(optimistic, message("m", MessageRole.USER, "p2", NOW)));
            assertFalse(matcher.matchMessageByCorrelation(optimistic, message("m", MessageRole.USER, null, NOW)));
            assertTrue(matcher.matchMessageByCorrelation(optimistic, message("m", MessageRole.USER, "p1", NOW)));
        }

        @Test
        @DisplayName("never correlates a canonical candidate")
        void canonicalCandidateNeverCorrelates() {
            var candidate = message("other", MessageRole.USER, null, NOW);
            assertFalse(matcher.matchMessageByCorrelation(candidate, message("m", MessageRole.USER, null, NOW)));
        }

        @Test
        @DisplayName("exact id beats correlation regardless of candidate order")
        void exactBeatsCorrelation() {
            var correlated = optimisticMessage("opt-1", MessageRole.USER, null, NOW);
            var exact = optimisticMessage("msg-1", MessageRole.USER, null, NOW - 60_000);
            var canonical = message("msg-1", MessageRole.USER, null, NOW);

            var match = matcher.findMatchingMessage(List.of(correlated, exact), canonical).orElseThrow();

            assertSame(exact, match.entity());
            assertEquals(MatchConfidence.EXACT, match.confidence());
            assertEquals(CorrelationMatcher.STRATEGY_EXACT_ID, match.strategy());
        }

        @Test
        @DisplayName("no candidate is a valid result")
        void noMatch() {
            assertTrue(matcher.findMatchingMessage(List.of(), message("m", MessageRole.USER, null, NOW)).isEmpty());
        }
    }

    @Nested
    @DisplayName("parts")
    class PartTests {

        @Test
        @DisplayName("tool parts match only on the same call id")
        void toolCallIdExclusivity() {
            var call1 = optimistic(Part.tool("opt-a", "msg-1", "s1", "bash", "call-1", ToolState.pending()));
            var call2 = optimistic(Part.tool("opt-b", "msg-1", "s1", "bash", "call-2", ToolState.pending()));
            var canonical = Part.tool("prt-1", "msg-1", "s1", "bash", "call-2", ToolState.pending());

            var match = matcher.findMatchingPart(List.of(call1, call2), canonical).orElseThrow();

            assertSame(call2, match.entity());
            assertEquals(CorrelationMatcher.STRATEGY_MESSAGE_CALL_ID, match.strategy());
            assertTrue(matcher.findMatchingPart(List.of(call1),
                    Part.tool("prt-9", "msg-1", "s1", "bash", "call-9", ToolState.pending())).isEmpty());
        }

        @Test
        @DisplayName("tool and tool-call types correlate with each other")
        void toolCallType() {
            var optimistic = optimistic(new Part("opt-a", "msg-1", "s1", Part.TOOL_CALL, null, null, "bash",
                    "call-1", null, null, null, null, null, null));
            assertTrue(matcher.matchToolPartByCallId(optimistic, "msg-1", "call-1"));
        }

        @Test
        @DisplayName("text parts match the first optimistic text part of the message")
        void textByMessage() {
            var first = optimistic(Part.text("opt-a", "msg-1", "s1", "a"));
            var second = optimistic(Part.text("opt-b", "msg-1", "s1", "b"));
            var otherMessage = optimistic(Part.text("opt-c", "msg-2", "s1", "c"));

            var match = matcher.findMatchingPart(List.of(otherMessage, first, second),
                    Part.text("prt-1", "msg-1", "s1", "final")).orElseThrow();

            assertSame(first, match.entity());
            assertEquals(CorrelationMatcher.STRATEGY_MESSAGE_TYPE, match.strategy());
        }

        @Test
        @DisplayName("reasoning parts match by reasoning id when the canonical part carries one")
        void reasoningById() {
            var r1 = optimistic(Part.reasoning("opt-a", "msg-1", "s1", "r1", "thinking"));
            var r2 = optimistic(Part.reasoning("opt-b", "msg-1", "s1", "r2", "thinking"));

            var match = matcher.findMatchingPart(List.of(r1, r2),
                    Part.reasoning("prt-1", "msg-1", "s1", "r2", "done")).orElseThrow();
            assertSame(r2, match.entity());

            var any = matcher.findMatchingPart(List.of(r1, r2),
                    Part.reasoning("prt-2", "msg-1", "s1", null, "done")).orElseThrow();
            assertSame(r1, any.entity());
            assertEquals(CorrelationMatcher.STRATEGY_MESSAGE_REASONING_ID, any.strategy());
        }

        @Test
        @DisplayName("exact id wins over type-specific rules")
        void exactIdFirst() {
            var text = optimistic(Part.text("opt-a", "msg-1", "s1", "a"));
            var exact = optimistic(Part.text("prt-1", "msg-1", "s1", "b"));

            var match = matcher.findMatchingPart(List.of(text, exact),
                    Part.text("prt-1", "msg-1", "s1", "final")).orElseThrow();

            assertSame(exact, match.entity());
            assertEquals(MatchConfidence.EXACT, match.confidence());
        }
    }

    @Test
    @DisplayName("correlation keys are built from role, parent and time")
    void correlationKeys() {
        assertEquals("msg:user:no-parent:42", CorrelationKeys.forMessage(MessageRole.USER, null, 42));
        assertEquals("msg:assistant:p1:42", CorrelationKeys.forMessage(MessageRole.ASSISTANT, "p1", 42));
        assertEquals("part:m1:tool:call-1", CorrelationKeys.forPart("m1", "tool", "call-1", null));
        assertEquals("part:m1:text:default", CorrelationKeys.forPart("m1", "text", null, null));
    }
}
