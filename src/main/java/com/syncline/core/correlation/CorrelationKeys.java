package com.syncline.core.correlation;

import com.syncline.core.model.MessageRole;

/**
 * Builds the informational correlation keys carried in optimistic metadata.
 */
public final class CorrelationKeys {

    private CorrelationKeys() {}

    public static String forMessage(MessageRole role, String parentId, long createdAt) {
        return String.join(":", "msg", role.wireName(),
                parentId != null ? parentId : "no-parent",
                Long.toString(createdAt));
    }

    public static String forPart(String messageId, String partType, String callId, String reasoningId) {
        String discriminator = callId != null ? callId : reasoningId != null ? reasoningId : "default";
        return String.join(":", "part", messageId, partType, discriminator);
    }
}
