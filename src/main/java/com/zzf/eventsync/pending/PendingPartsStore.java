package com.zzf.eventsync.pending;

import com.zzf.eventsync.state.PartRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Holding area for parts whose owning message has not been created yet, keyed by message id.
 * <p>
 * Within one message, parts keep arrival order and a part with an id already held replaces the
 * earlier one in place. Both dimensions are bounded: a message holds at most
 * {@code maxPartsPerMessage} parts (oldest dropped first) and at most {@code maxMessages} message
 * ids are tracked (the longest-held id is dropped first).
 * <p>
 * Not thread-safe; the pipeline serialises access.
 */
@Slf4j
public class PendingPartsStore {

    public static final int DEFAULT_MAX_PARTS_PER_MESSAGE = 200;
    public static final int DEFAULT_MAX_MESSAGES = 1000;

    private final int maxPartsPerMessage;
    private final int maxMessages;
    private final Map<String, List<PartRecord>> partsByMessage = new LinkedHashMap<>();
    private long evictedParts;

    public PendingPartsStore() {
        this(DEFAULT_MAX_PARTS_PER_MESSAGE, DEFAULT_MAX_MESSAGES);
    }

    public PendingPartsStore(int maxPartsPerMessage, int maxMessages) {
        if (maxPartsPerMessage <= 0) {
            throw new IllegalArgumentException("maxPartsPerMessage must be positive: " + maxPartsPerMessage);
        }
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive: " + maxMessages);
        }
        this.maxPartsPerMessage = maxPartsPerMessage;
        this.maxMessages = maxMessages;
    }

    public void hold(String messageId, PartRecord part) {
        Objects.requireNonNull(messageId, "messageId");
        Objects.requireNonNull(part, "part");
        List<PartRecord> queue = partsByMessage.get(messageId);
        if (queue == null) {
            if (partsByMessage.size() >= maxMessages) {
                evictOldestMessage();
            }
            queue = new ArrayList<>();
            partsByMessage.put(messageId, queue);
        }
        for (int i = 0; i < queue.size(); i++) {
            if (Objects.equals(queue.get(i).getId(), part.getId())) {
                queue.set(i, part);
                return;
            }
        }
        queue.add(part);
        if (queue.size() > maxPartsPerMessage) {
            PartRecord dropped = queue.remove(0);
            evictedParts++;
            log.warn("event.pending.evict messageID={} partID={} reason=per-message-cap", messageId, dropped.getId());
        }
    }

    /** Removes and returns the parts held for the message, in arrival order. */
    public List<PartRecord> drain(String messageId) {
        List<PartRecord> queue = partsByMessage.remove(messageId);
        return queue == null ? Collections.emptyList() : queue;
    }

    /**
     * Forgets one held part so it is not replayed when its message arrives.
     *
     * @return whether a held part was removed
     */
    public boolean remove(String messageId, String partId) {
        List<PartRecord> queue = partsByMessage.get(messageId);
        if (queue == null) {
            return false;
        }
        boolean removed = queue.removeIf(part -> Objects.equals(partId, part.getId()));
        if (queue.isEmpty()) {
            partsByMessage.remove(messageId);
        }
        return removed;
    }

    public void dropForSession(String sessionId) {
        Iterator<Map.Entry<String, List<PartRecord>>> it = partsByMessage.entrySet().iterator();
        while (it.hasNext()) {
            List<PartRecord> queue = it.next().getValue();
            queue.removeIf(part -> Objects.equals(sessionId, part.getSessionID()));
            if (queue.isEmpty()) {
                it.remove();
            }
        }
    }

    public boolean contains(String messageId) {
        return partsByMessage.containsKey(messageId);
    }

    public List<PartRecord> peek(String messageId) {
        List<PartRecord> queue = partsByMessage.get(messageId);
        return queue == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(queue));
    }

    public PendingPartsStats getStats() {
        int parts = 0;
        for (List<PartRecord> queue : partsByMessage.values()) {
            parts += queue.size();
        }
        return new PendingPartsStats(partsByMessage.size(), parts, evictedParts);
    }

    public void clear() {
        partsByMessage.clear();
        evictedParts = 0;
    }

    private void evictOldestMessage() {
        Iterator<Map.Entry<String, List<PartRecord>>> it = partsByMessage.entrySet().iterator();
        Map.Entry<String, List<PartRecord>> oldest = it.next();
        it.remove();
        evictedParts += oldest.getValue().size();
        log.warn("event.pending.evict messageID={} parts={} reason=message-cap", oldest.getKey(), oldest.getValue().size());
    }
}
