package com.syncline.core.events;

import java.util.Set;

/**
 * Wire names of the event types the projection understands.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String SESSION_CREATED = "session.created";
    public static final String SESSION_UPDATED = "session.updated";
    public static final String SESSION_STATUS = "session.status";
    public static final String SESSION_DELETED = "session.deleted";

    public static final String MESSAGE_UPDATED = "message.updated";
    public static final String MESSAGE_REMOVED = "message.removed";
    public static final String PART_UPDATED = "message.part.updated";
    public static final String PART_REMOVED = "message.part.removed";

    public static final String PERMISSION_ASKED = "permission.asked";
    public static final String PERMISSION_REPLIED = "permission.replied";
    public static final String QUESTION_ASKED = "question.asked";
    public static final String QUESTION_REPLIED = "question.replied";
    public static final String QUESTION_REJECTED = "question.rejected";

    public static final String SERVER_CONNECTED = "server.connected";
    public static final String SERVER_HEARTBEAT = "server.heartbeat";

    /** Emitted on the notification channel after a batch changed the projection. */
    public static final String PROJECTION_CHANGED = "projection.changed";

    /** Permission and question lifecycle events, forwarded to the notification channel. */
    public static final Set<String> AUXILIARY = Set.of(
            PERMISSION_ASKED, PERMISSION_REPLIED,
            QUESTION_ASKED, QUESTION_REPLIED, QUESTION_REJECTED);
}
