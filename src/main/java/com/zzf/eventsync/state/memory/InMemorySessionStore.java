package com.zzf.eventsync.state.memory;

import com.zzf.eventsync.state.SessionRecord;
import com.zzf.eventsync.state.SessionStatusInfo;
import com.zzf.eventsync.state.SessionStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySessionStore implements SessionStore {

    private final Map<String, SessionRecord> sessions = new ConcurrentHashMap<>();

    @Override
    public void upsert(SessionRecord record) {
        if (record == null || record.getSessionID() == null) {
            return;
        }
        sessions.merge(record.getSessionID(), record.toBuilder().build(), (existing, incoming) ->
                existing.toBuilder()
                        .directory(incoming.getDirectory() != null ? incoming.getDirectory() : existing.getDirectory())
                        .build());
    }

    @Override
    public Optional<SessionRecord> getById(String sessionID) {
        if (sessionID == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionID));
    }

    @Override
    public boolean setStatus(String sessionID, SessionStatusInfo status) {
        if (sessionID == null || status == null) {
            return false;
        }
        return sessions.computeIfPresent(sessionID, (id, existing) -> existing.toBuilder().status(status).build()) != null;
    }

    public List<SessionRecord> list() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
