package com.syncline.core.store;

import com.syncline.core.model.Message;
import com.syncline.core.model.Part;
import com.syncline.core.model.Session;
import com.syncline.core.model.SessionStatus;

import java.util.List;

/**
 * Consistent read-only view of one stream.
 *
 * @param session  the session, or {@code null} if unknown
 * @param status   its current status, or {@code null} if never reported
 * @param messages messages in insertion order with their parts
 */
public record StreamSnapshot(Session session, SessionStatus status, List<MessageView> messages) {

    public record MessageView(Message message, List<Part> parts) {}

    public boolean exists() {
        return session != null;
    }
}
