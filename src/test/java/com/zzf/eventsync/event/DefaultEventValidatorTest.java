package com.zzf.eventsync.event;

import com.zzf.eventsync.support.TestEvents;
import org.junit.jupiter.api.Test;

import static com.zzf.eventsync.support.TestEvents.event;
import static com.zzf.eventsync.support.TestEvents.json;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultEventValidatorTest {

    private final DefaultEventValidator validator = new DefaultEventValidator();

    private boolean valid(ServerEvent event) {
        return validator.validate(event).isValid();
    }

    @Test
    void shouldAcceptWellFormedEvents() {
        ValidationResult result = validator.validate(TestEvents.partUpdated("e1", "s1", 1, "m1", "p1", "hi"));
        assertTrue(result.isValid());
        assertNull(result.getError());

        assertTrue(valid(event("e2", "server.connected", null, null, null)));
        assertTrue(valid(event("e3", EventTypes.SESSION_STATUS, null, null,
                json("{\"sessionID\":\"s1\",\"status\":\"idle\"}"))));
    }

    @Test
    void shouldRejectMissingEnvelopeFields() {
        assertFalse(valid(null));
        assertFalse(valid(event("e1", " ", null, null, null)));
        assertFalse(valid(event("", "session.created", null, null, null)));
    }

    @Test
    void shouldRejectNonObjectProperties() {
        ValidationResult result = validator.validate(event("e1", "session.created", null, null, json("[1,2]")));

        assertFalse(result.isValid());
        assertTrue(result.getError().contains("properties"));
    }

    @Test
    void shouldRejectBadSequences() {
        assertFalse(valid(event("e1", "message.updated", "s1", -1L, json("{}"))));
        assertFalse(valid(event("e1", "message.updated", "s1", null, json("{}"))));
        assertTrue(valid(event("e1", "message.updated", "s1", Long.MAX_VALUE - 1, json("{}"))));
    }

    @Test
    void shouldRejectSequenceWithNoSuccessor() {
        ValidationResult result = validator.validate(event("e1", "message.updated", "s1", Long.MAX_VALUE, json("{}")));

        assertFalse(result.isValid());
        assertTrue(result.getError().contains("out of range"));
    }

    @Test
    void partEventsShouldCarryEnvelopeSession() {
        assertFalse(valid(event("e1", EventTypes.MESSAGE_PART_REMOVED, null, null,
                json("{\"messageID\":\"m1\",\"partID\":\"p1\"}"))));
        assertFalse(valid(event("e1", EventTypes.SESSION_STATUS, null, null, json("{\"status\":\"idle\"}"))));
    }

    @Test
    void shouldRejectSessionMismatch() {
        ValidationResult result = validator.validate(event("e1", EventTypes.SESSION_STATUS, "s1", 1L,
                json("{\"sessionID\":\"s2\",\"status\":\"idle\"}")));

        assertFalse(result.isValid());
        assertTrue(result.getError().contains("mismatch"));
    }
}
