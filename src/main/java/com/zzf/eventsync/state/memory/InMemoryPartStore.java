package com.zzf.eventsync.state.memory;

import com.zzf.eventsync.state.PartRecord;
import com.zzf.eventsync.state.PartStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPartStore implements PartStore {

    // messageID -> (partID -> part), parts kept in first-arrival order
    private final Map<String, Map<String, PartRecord>> partsByMessage = new ConcurrentHashMap<>();

    @Override
    public void upsert(PartRecord part) {
        if (part == null || part.getId() == null || part.getMessageID() == null) {
            return;
        }
        Map<String, PartRecord> parts = partsByMessage.computeIfAbsent(part.getMessageID(), k -> new LinkedHashMap<>());
        synchronized (parts) {
            parts.put(part.getId(), part);
        }
    }

    @Override
    public void remove(String partID, String messageID) {
        if (partID == null || messageID == null) {
            return;
        }
        partsByMessage.computeIfPresent(messageID, (id, parts) -> {
            synchronized (parts) {
                parts.remove(partID);
                return parts.isEmpty() ? null : parts;
            }
        });
    }

    public List<PartRecord> list(String messageID) {
        Map<String, PartRecord> parts = partsByMessage.get(messageID);
        if (parts == null) {
            return new ArrayList<>();
        }
        synchronized (parts) {
            return new ArrayList<>(parts.values());
        }
    }

    public Optional<PartRecord> get(String messageID, String partID) {
        Map<String, PartRecord> parts = partsByMessage.get(messageID);
        if (parts == null) {
            return Optional.empty();
        }
        synchronized (parts) {
            return Optional.ofNullable(parts.get(partID));
        }
    }

    public int count() {
        int total = 0;
        for (Map<String, PartRecord> parts : partsByMessage.values()) {
            synchronized (parts) {
                total += parts.size();
            }
        }
        return total;
    }
}
