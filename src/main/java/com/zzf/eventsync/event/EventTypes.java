package com.zzf.eventsync.event;

import java.util.Set;

/**
 * Event type discriminants understood by the router.
 */
public final class EventTypes {

    public static final String SESSION_CREATED = "session.created";
    public static final String SESSION_UPDATED = "session.updated";
    public static final String SESSION_STATUS = "session.status";
    public static final String MESSAGE_UPDATED = "message.updated";
    public static final String MESSAGE_PART_UPDATED = "message.part.updated";
    public static final String MESSAGE_PART_REMOVED = "message.part.removed";
    public static final String PERMISSION_ASKED = "permission.asked";
    public static final String PERMISSION_REPLIED = "permission.replied";
    public static final String QUESTION_ASKED = "question.asked";
    public static final String QUESTION_REPLIED = "question.replied";
    public static final String QUESTION_REJECTED = "question.rejected";

    // global control events, no session and no routing effect
    public static final String SERVER_CONNECTED = "server.connected";
    public static final String SERVER_HEARTBEAT = "server.heartbeat";

    /** Types whose envelope must carry a sessionID so they are ordered with their session. */
    public static final Set<String> SESSION_SCOPED = Set.of(
            MESSAGE_PART_UPDATED,
            MESSAGE_PART_REMOVED
    );

    private EventTypes() {}
}
