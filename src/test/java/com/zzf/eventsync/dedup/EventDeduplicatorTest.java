package com.zzf.eventsync.dedup;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventDeduplicatorTest {

    @Test
    void shouldRecordOnFirstSightAndReportRepeats() {
        EventDeduplicator dedup = new EventDeduplicator(10);

        assertFalse(dedup.isDuplicate("e1"));
        assertTrue(dedup.isDuplicate("e1"));
        assertTrue(dedup.isDuplicate("e1"));
        assertEquals(1, dedup.getStats().getSize());
    }

    @Test
    void shouldEvictOldestInsertionFirstRegardlessOfAccess() {
        EventDeduplicator dedup = new EventDeduplicator(3);
        dedup.isDuplicate("a");
        dedup.isDuplicate("b");
        dedup.isDuplicate("c");
        // a repeat lookup must not refresh "a"
        assertTrue(dedup.isDuplicate("a"));

        assertFalse(dedup.isDuplicate("d"));

        DeduplicatorStats stats = dedup.getStats();
        assertEquals(3, stats.getSize());
        assertEquals(3, stats.getMaxSize());
        assertEquals(1, stats.getEvicted());
        assertTrue(dedup.isDuplicate("b"));
        assertTrue(dedup.isDuplicate("c"));
        assertTrue(dedup.isDuplicate("d"));
        assertFalse(dedup.isDuplicate("a"), "evicted id is treated as new");
    }

    @Test
    void shouldIgnoreNullIds() {
        EventDeduplicator dedup = new EventDeduplicator(2);
        assertFalse(dedup.isDuplicate(null));
        assertFalse(dedup.isDuplicate(null));
        assertEquals(0, dedup.getStats().getSize());
    }

    @Test
    void clearShouldForgetEverything() {
        EventDeduplicator dedup = new EventDeduplicator(1);
        dedup.isDuplicate("x");
        dedup.isDuplicate("y");
        dedup.clear();

        assertEquals(0, dedup.getStats().getSize());
        assertEquals(0, dedup.getStats().getEvicted());
        assertFalse(dedup.isDuplicate("y"));
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new EventDeduplicator(0));
    }
}
