package com.zzf.eventsync.state.memory;

import com.zzf.eventsync.state.MessageRecord;
import com.zzf.eventsync.state.PartRecord;
import com.zzf.eventsync.state.PermissionRequest;
import com.zzf.eventsync.state.QuestionRequest;
import com.zzf.eventsync.state.RequestStatus;
import com.zzf.eventsync.state.SessionRecord;
import com.zzf.eventsync.state.SessionStatusInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.zzf.eventsync.support.TestEvents.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryStoresTest {

    @Test
    void sessionStatusShouldOnlyApplyToKnownSessions() {
        InMemorySessionStore store = new InMemorySessionStore();

        assertFalse(store.setStatus("s1", SessionStatusInfo.busy()));
        store.upsert(SessionRecord.minimal("s1", null));
        assertTrue(store.setStatus("s1", SessionStatusInfo.busy()));

        SessionRecord session = store.getById("s1").orElseThrow();
        assertEquals("default", session.getDirectory());
        assertEquals(SessionStatusInfo.busy(), session.getStatus());
    }

    @Test
    void messagesShouldListBySessionInCreationOrder() {
        InMemoryMessageStore store = new InMemoryMessageStore();
        store.upsert(message("m2", "s1", 200L));
        store.upsert(message("m1", "s1", 100L));
        store.upsert(message("m3", "s2", 50L));
        store.upsert(message("m1", "s1", 100L));

        List<String> ids = store.listBySession("s1").stream().map(MessageRecord::getId).collect(Collectors.toList());
        assertEquals(List.of("m1", "m2"), ids);
        assertEquals(3, store.size());
    }

    @Test
    void partsShouldUpsertInPlaceAndRemove() {
        InMemoryPartStore store = new InMemoryPartStore();
        store.upsert(part("p1", "m1", "text"));
        store.upsert(part("p2", "m1", "text"));
        store.upsert(part("p1", "m1", "reasoning"));

        assertEquals(List.of("p1", "p2"), store.list("m1").stream().map(PartRecord::getId).collect(Collectors.toList()));
        assertEquals("reasoning", store.get("m1", "p1").orElseThrow().getType());

        store.remove("p1", "m1");
        store.remove("p2", "m1");
        store.remove("p9", "m9");
        assertEquals(0, store.count());
        assertTrue(store.list("m1").isEmpty());
    }

    @Test
    void permissionResolveShouldIgnoreUnknownIds() {
        InMemoryPermissionRequestStore store = new InMemoryPermissionRequestStore();
        store.add(PermissionRequest.builder().id("perm-1").sessionID("s1").build());
        store.add(PermissionRequest.builder().id("perm-2").sessionID("s2").build());

        assertFalse(store.resolve("nope", true));
        assertTrue(store.resolve("perm-1", true));

        assertEquals(RequestStatus.APPROVED, store.get("perm-1").orElseThrow().getStatus());
        assertTrue(store.pending("s1").isEmpty());
        assertEquals(1, store.pending(null).size());
    }

    @Test
    void questionAnswerShouldDistinguishRejection() {
        InMemoryQuestionRequestStore store = new InMemoryQuestionRequestStore();
        store.add(QuestionRequest.builder().id("q1").sessionID("s1").question("Go?").build());
        store.add(QuestionRequest.builder().id("q2").sessionID("s1").question("Stop?").build());

        assertTrue(store.answer("q1", json("[\"yes\"]")));
        assertTrue(store.answer("q2", json("{\"rejected\":true}")));
        assertFalse(store.answer("q3", json("[]")));

        assertEquals(RequestStatus.ANSWERED, store.get("q1").orElseThrow().getStatus());
        assertEquals(RequestStatus.REJECTED, store.get("q2").orElseThrow().getStatus());
        assertTrue(store.pending("s1").isEmpty());
    }

    private static MessageRecord message(String id, String sessionID, long created) {
        return MessageRecord.builder()
                .id(id)
                .sessionID(sessionID)
                .time(MessageRecord.MessageTime.builder().created(created).build())
                .build();
    }

    private static PartRecord part(String id, String messageID, String type) {
        return PartRecord.builder().id(id).messageID(messageID).sessionID("s1").type(type).build();
    }
}
