package com.zzf.eventsync.pending;

import com.zzf.eventsync.state.PartRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PendingPartsStoreTest {

    private static PartRecord part(String sessionID, String messageID, String id, String type) {
        return PartRecord.builder().id(id).messageID(messageID).sessionID(sessionID).type(type).build();
    }

    private static List<String> ids(List<PartRecord> parts) {
        return parts.stream().map(PartRecord::getId).collect(Collectors.toList());
    }

    @Test
    void shouldKeepArrivalOrderAndReplaceById() {
        PendingPartsStore store = new PendingPartsStore();
        store.hold("m1", part("s1", "m1", "p1", "text"));
        store.hold("m1", part("s1", "m1", "p2", "text"));
        store.hold("m1", part("s1", "m1", "p1", "reasoning"));

        List<PartRecord> held = store.peek("m1");
        assertEquals(List.of("p1", "p2"), ids(held));
        assertEquals("reasoning", held.get(0).getType());
    }

    @Test
    void drainShouldRemoveTheEntry() {
        PendingPartsStore store = new PendingPartsStore();
        store.hold("m1", part("s1", "m1", "p1", "text"));

        assertEquals(List.of("p1"), ids(store.drain("m1")));
        assertFalse(store.contains("m1"));
        assertTrue(store.drain("m1").isEmpty());
        assertEquals(0, store.getStats().getMessageCount());
    }

    @Test
    void removeShouldForgetOneHeldPart() {
        PendingPartsStore store = new PendingPartsStore();
        store.hold("m1", part("s1", "m1", "p1", "text"));
        store.hold("m1", part("s1", "m1", "p2", "text"));

        assertTrue(store.remove("m1", "p1"));
        assertFalse(store.remove("m1", "p1"));
        assertFalse(store.remove("m9", "p1"));
        assertEquals(List.of("p2"), ids(store.peek("m1")));

        assertTrue(store.remove("m1", "p2"));
        assertFalse(store.contains("m1"));
    }

    @Test
    void dropForSessionShouldOnlyRemoveThatSessionsParts() {
        PendingPartsStore store = new PendingPartsStore();
        store.hold("m1", part("s1", "m1", "p1", "text"));
        store.hold("m2", part("s2", "m2", "p2", "text"));

        store.dropForSession("s1");

        assertFalse(store.contains("m1"));
        assertTrue(store.contains("m2"));
        assertEquals(1, store.getStats().getPartCount());
    }

    @Test
    void shouldDropOldestPartPastPerMessageCap() {
        PendingPartsStore store = new PendingPartsStore(2, 10);
        store.hold("m1", part("s1", "m1", "p1", "text"));
        store.hold("m1", part("s1", "m1", "p2", "text"));
        store.hold("m1", part("s1", "m1", "p3", "text"));

        assertEquals(List.of("p2", "p3"), ids(store.peek("m1")));
        assertEquals(1L, store.getStats().getEvictedParts());
    }

    @Test
    void shouldEvictLongestHeldMessagePastMessageCap() {
        PendingPartsStore store = new PendingPartsStore(10, 2);
        store.hold("m1", part("s1", "m1", "p1", "text"));
        store.hold("m1", part("s1", "m1", "p2", "text"));
        store.hold("m2", part("s1", "m2", "p3", "text"));
        store.hold("m3", part("s1", "m3", "p4", "text"));

        assertFalse(store.contains("m1"));
        assertTrue(store.contains("m2"));
        assertTrue(store.contains("m3"));
        PendingPartsStats stats = store.getStats();
        assertEquals(2, stats.getMessageCount());
        assertEquals(2, stats.getPartCount());
        assertEquals(2L, stats.getEvictedParts());
    }

    @Test
    void clearShouldResetEverything() {
        PendingPartsStore store = new PendingPartsStore(1, 1);
        store.hold("m1", part("s1", "m1", "p1", "text"));
        store.hold("m1", part("s1", "m1", "p2", "text"));
        store.clear();

        assertEquals(new PendingPartsStats(0, 0, 0L), store.getStats());
    }

    @Test
    void shouldRejectInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new PendingPartsStore(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new PendingPartsStore(1, 0));
        PendingPartsStore store = new PendingPartsStore();
        assertThrows(NullPointerException.class, () -> store.hold(null, part("s1", "m1", "p1", "text")));
    }
}
