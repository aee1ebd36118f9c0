package com.zzf.eventsync.state.memory;

import com.zzf.eventsync.state.MessageRecord;
import com.zzf.eventsync.state.MessageStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryMessageStore implements MessageStore {

    private final Map<String, MessageRecord> messages = new ConcurrentHashMap<>();

    @Override
    public void upsert(MessageRecord message) {
        if (message == null || message.getId() == null) {
            return;
        }
        messages.put(message.getId(), message);
    }

    @Override
    public Optional<MessageRecord> getById(String messageID) {
        if (messageID == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(messages.get(messageID));
    }

    /** Messages of a session ordered by creation time, then id. */
    public List<MessageRecord> listBySession(String sessionID) {
        return messages.values().stream()
                .filter(m -> Objects.equals(sessionID, m.getSessionID()))
                .sorted(Comparator
                        .comparingLong((MessageRecord m) -> m.getTime() != null ? m.getTime().getCreated() : 0L)
                        .thenComparing(MessageRecord::getId))
                .collect(Collectors.toList());
    }

    public int size() {
        return messages.size();
    }
}
