package com.zzf.eventsync.state;

import java.util.Optional;

/**
 * Session state container mutated by the router.
 */
public interface SessionStore {

    /** Inserts the session or merges the record into an existing one, keeping its status. */
    void upsert(SessionRecord record);

    Optional<SessionRecord> getById(String sessionID);

    /** Applies a status to a known session. Returns {@code false} when the session does not exist. */
    boolean setStatus(String sessionID, SessionStatusInfo status);
}
