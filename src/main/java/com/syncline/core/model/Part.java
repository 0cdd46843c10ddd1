package com.syncline.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A fragment of a message: text, reasoning, a tool call or a retry notice.
 * Only the fields relevant to {@link #type()} are populated.
 *
 * @param id                 part identifier
 * @param messageId          owning message
 * @param streamId           owning stream (session)
 * @param type               {@code text}, {@code reasoning}, {@code tool}, {@code tool-call}, {@code retry}, {@code error}, ...
 * @param text               text or reasoning content
 * @param reasoningId        reasoning block id (reasoning parts)
 * @param tool               tool name (tool parts)
 * @param callId             tool call id (tool parts)
 * @param state              tool execution state (tool parts)
 * @param attempt            retry attempt (retry parts)
 * @param next               epoch millis of the next retry (retry parts)
 * @param error              retry error description (retry parts)
 * @param optimisticMetadata present only while the part is an unconfirmed local placeholder
 * @param origin             envelope that last wrote this part (canonical only)
 */
public record Part(
    String id,
    String messageId,
    String streamId,
    String type,
    String text,
    String reasoningId,
    String tool,
    String callId,
    ToolState state,
    Integer attempt,
    Long next,
    String error,
    OptimisticMetadata optimisticMetadata,
    EventOrigin origin
) implements OptimisticEntity, Serializable {

    public static final String TEXT = "text";
    public static final String REASONING = "reasoning";
    public static final String TOOL = "tool";
    public static final String TOOL_CALL = "tool-call";
    public static final String RETRY = "retry";
    public static final String ERROR = "error";

    public static Part text(String id, String messageId, String streamId, String text) {
        return new Part(id, messageId, streamId, TEXT, text, null, null, null,
                null, null, null, null, null, null);
    }

    public static Part reasoning(String id, String messageId, String streamId,
                                 String reasoningId, String text) {
        return new Part(id, messageId, streamId, REASONING, text, reasoningId, null, null,
                null, null, null, null, null, null);
    }

    public static Part tool(String id, String messageId, String streamId,
                            String tool, String callId, ToolState state) {
        return new Part(id, messageId, streamId, TOOL, null, null, tool, callId,
                state, null, null, null, null, null);
    }

    public boolean isToolType() {
        return TOOL.equals(type) || TOOL_CALL.equals(type);
    }

    public Part withOrigin(EventOrigin newOrigin) {
        return new Part(id, messageId, streamId, type, text, reasoningId, tool, callId,
                state, attempt, next, error, optimisticMetadata, newOrigin);
    }

    public Part withMessageId(String newMessageId) {
        return new Part(id, newMessageId, streamId, type, text, reasoningId, tool, callId,
                state, attempt, next, error, optimisticMetadata, origin);
    }

    public Part withStreamId(String newStreamId) {
        return new Part(id, messageId, newStreamId, type, text, reasoningId, tool, callId,
                state, attempt, next, error, optimisticMetadata, origin);
    }

    public Part withOptimisticMetadata(OptimisticMetadata metadata) {
        return new Part(id, messageId, streamId, type, text, reasoningId, tool, callId,
                state, attempt, next, error, metadata, origin);
    }

    /** Returns this part without optimistic metadata. */
    public Part asCanonical() {
        return optimisticMetadata == null ? this : withOptimisticMetadata(null);
    }

    /**
     * Compares the fields that matter to consumers, ignoring {@link #origin()}.
     */
    public boolean sameContentAs(Part other) {
        return other != null
                && Objects.equals(withOrigin(null), other.withOrigin(null));
    }
}
