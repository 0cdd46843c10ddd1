package com.syncline.core.correlation;

import com.syncline.core.model.Message;
import com.syncline.core.model.Part;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure matching rules between a canonical entity and locally created optimistic entities.
 * <p>
 * Messages match by exact id, then by role + parent + creation time window.
 * Parts match by exact id, then by a type-specific rule: call id for tool parts, the single
 * active text part of the message, or the reasoning block id.
 */
public class CorrelationMatcher {

    public static final long DEFAULT_WINDOW_MS = 30_000L;

    public static final String STRATEGY_EXACT_ID = "exact-id";
    public static final String STRATEGY_PARENT_WINDOW_ROLE = "parent-window-role";
    public static final String STRATEGY_MESSAGE_CALL_ID = "message-callid";
    public static final String STRATEGY_MESSAGE_TYPE = "message-type";
    public static final String STRATEGY_MESSAGE_REASONING_ID = "message-reasoningid";

    private final long windowMs;

    public CorrelationMatcher() {
        this(DEFAULT_WINDOW_MS);
    }

    public CorrelationMatcher(long windowMs) {
        this.windowMs = windowMs;
    }

    public long windowMs() {
        return windowMs;
    }

    // -- Messages -------------------------------------------------------------

    public boolean matchMessageByExactId(Message optimistic, String canonicalId) {
        return optimistic.id().equals(canonicalId);
    }

    public boolean matchMessageByCorrelation(Message optimistic, Message canonical) {
        if (!optimistic.isOptimistic()) {
            return false;
        }
        if (optimistic.role() != canonical.role()) {
            return false;
        }
        if (!Objects.equals(optimistic.parentId(), canonical.parentId())) {
            return false;
        }
        long age = Math.abs(canonical.createdAt() - optimistic.optimisticMetadata().timestamp());
        return age <= windowMs;
    }

    /**
     * Finds the best optimistic counterpart of a canonical message.
     */
    public Optional<CorrelationMatch<Message>> findMatchingMessage(List<Message> optimistic, Message canonical) {
        for (Message candidate : optimistic) {
            if (matchMessageByExactId(candidate, canonical.id())) {
                return Optional.of(new CorrelationMatch<>(candidate, MatchConfidence.EXACT, STRATEGY_EXACT_ID));
            }
        }
        for (Message candidate : optimistic) {
            if (matchMessageByCorrelation(candidate, canonical)) {
                return Optional.of(new CorrelationMatch<>(candidate, MatchConfidence.CORRELATION,
                        STRATEGY_PARENT_WINDOW_ROLE));
            }
        }
        return Optional.empty();
    }

    // -- Parts ----------------------------------------------------------------

    public boolean matchPartByExactId(Part optimistic, String canonicalId) {
        return optimistic.id().equals(canonicalId);
    }

    public boolean matchToolPartByCallId(Part optimistic, String messageId, String callId) {
        return optimistic.isOptimistic()
                && optimistic.isToolType()
                && Objects.equals(optimistic.messageId(), messageId)
                && Objects.equals(optimistic.callId(), callId);
    }

    public boolean matchTextPartByMessage(Part optimistic, String messageId) {
        return optimistic.isOptimistic()
                && Part.TEXT.equals(optimistic.type())
                && Objects.equals(optimistic.messageId(), messageId);
    }

    public boolean matchReasoningPart(Part optimistic, String messageId, String reasoningId) {
        if (!optimistic.isOptimistic()
                || !Part.REASONING.equals(optimistic.type())
                || !Objects.equals(optimistic.messageId(), messageId)) {
            return false;
        }
        return reasoningId == null || reasoningId.equals(optimistic.reasoningId());
    }

    /**
     * Finds the best optimistic counterpart of a canonical part.
     */
    public Optional<CorrelationMatch<Part>> findMatchingPart(List<Part> optimistic, Part canonical) {
        for (Part candidate : optimistic) {
            if (matchPartByExactId(candidate, canonical.id())) {
                return Optional.of(new CorrelationMatch<>(candidate, MatchConfidence.EXACT, STRATEGY_EXACT_ID));
            }
        }

        if (canonical.isToolType() && canonical.callId() != null) {
            for (Part candidate : optimistic) {
                if (matchToolPartByCallId(candidate, canonical.messageId(), canonical.callId())) {
                    return correlation(candidate, STRATEGY_MESSAGE_CALL_ID);
                }
            }
        }

        if (Part.TEXT.equals(canonical.type())) {
            for (Part candidate : optimistic) {
                if (matchTextPartByMessage(candidate, canonical.messageId())) {
                    return correlation(candidate, STRATEGY_MESSAGE_TYPE);
                }
            }
        }

        if (Part.REASONING.equals(canonical.type())) {
            for (Part candidate : optimistic) {
                if (matchReasoningPart(candidate, canonical.messageId(), canonical.reasoningId())) {
                    return correlation(candidate, STRATEGY_MESSAGE_REASONING_ID);
                }
            }
        }

        return Optional.empty();
    }

    private static Optional<CorrelationMatch<Part>> correlation(Part candidate, String strategy) {
        return Optional.of(new CorrelationMatch<>(candidate, MatchConfidence.CORRELATION, strategy));
    }
}
