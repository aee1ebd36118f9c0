package com.zzf.eventsync.dedup;

import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Bounded memory of applied event ids.
 * <p>
 * Eviction is strict FIFO by insertion order: once {@code maxSize} ids are tracked, recording a new
 * id forgets the oldest one. A duplicate delayed past that window is treated as new, so routed
 * mutations stay upsert-by-id.
 * <p>
 * Not thread-safe; the pipeline serialises access.
 */
@Slf4j
public class EventDeduplicator {

    public static final int DEFAULT_MAX_SIZE = 1000;

    private final int maxSize;
    private final Set<String> seen = new LinkedHashSet<>();
    private long evicted;

    public EventDeduplicator() {
        this(DEFAULT_MAX_SIZE);
    }

    public EventDeduplicator(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * Returns {@code true} when the id was already recorded. On first sight records it and returns
     * {@code false}. A {@code null} id is never a duplicate and is not recorded.
     */
    public boolean isDuplicate(String eventId) {
        if (eventId == null) {
            return false;
        }
        if (seen.contains(eventId)) {
            return true;
        }
        if (seen.size() >= maxSize) {
            Iterator<String> oldest = seen.iterator();
            String dropped = oldest.next();
            oldest.remove();
            evicted++;
            log.trace("event.dedup.evict eventId={}", dropped);
        }
        seen.add(eventId);
        return false;
    }

    public DeduplicatorStats getStats() {
        return new DeduplicatorStats(seen.size(), maxSize, evicted);
    }

    public void clear() {
        seen.clear();
        evicted = 0;
    }
}
