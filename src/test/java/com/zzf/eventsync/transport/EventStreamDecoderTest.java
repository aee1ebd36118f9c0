package com.zzf.eventsync.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.eventsync.event.ServerEvent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventStreamDecoderTest {

    private final EventStreamDecoder decoder = new EventStreamDecoder(new ObjectMapper());

    private static List<String> ids(List<ServerEvent> events) {
        return events.stream().map(ServerEvent::getEventId).collect(Collectors.toList());
    }

    @Test
    void shouldDecodeNewlineDelimitedJson() {
        String body = "{\"type\":\"session.status\",\"eventId\":\"e1\",\"sessionID\":\"s1\",\"sequence\":1,"
                + "\"properties\":{\"sessionID\":\"s1\",\"status\":\"idle\"},\"extra\":true}\n"
                + "\r\n"
                + "{\"type\":\"server.heartbeat\",\"eventId\":\"e2\"}\n";

        List<ServerEvent> events = decoder.decode(body);

        assertEquals(List.of("e1", "e2"), ids(events));
        assertEquals("s1", events.get(0).getSessionID());
        assertEquals(1L, events.get(0).getSequence());
        assertEquals("idle", events.get(0).getProperties().get("status").asText());
    }

    @Test
    void shouldDecodeServerSentEventFraming() {
        String body = ": keep-alive\n"
                + "event: message\n"
                + "id: 17\n"
                + "data: {\"type\":\"server.connected\",\"eventId\":\"c1\"}\n"
                + "\n"
                + "retry: 1000\n"
                + "data: {\"type\":\"session.created\",\n"
                + "data: \"eventId\":\"c2\"}\n"
                + "\n";

        assertEquals(List.of("c1", "c2"), ids(decoder.decode(body)));
    }

    @Test
    void shouldSkipUndecodableLines() {
        String body = "{not json}\n{\"type\":\"server.heartbeat\",\"eventId\":\"ok\"}";

        assertEquals(List.of("ok"), ids(decoder.decode(body)));
        assertFalse(decoder.decodeLine("[").isPresent());
        assertTrue(decoder.decode("  ").isEmpty());
    }
}
