package com.zzf.eventsync.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.eventsync.event.EventTypes;
import com.zzf.eventsync.event.ServerEvent;

/**
 * Builders for wire events used across the test suite.
 */
public final class TestEvents {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private TestEvents() {}

    public static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("bad test json: " + text, e);
        }
    }

    public static ObjectNode props() {
        return MAPPER.createObjectNode();
    }

    /** A session-scoped event with an empty properties object. */
    public static ServerEvent seq(String sessionID, long sequence) {
        return ServerEvent.builder()
                .type("test.marker")
                .eventId(sessionID + "-" + sequence)
                .sessionID(sessionID)
                .sequence(sequence)
                .properties(props())
                .build();
    }

    public static ServerEvent event(String eventId, String type, String sessionID, Long sequence, JsonNode properties) {
        return ServerEvent.builder()
                .type(type)
                .eventId(eventId)
                .sessionID(sessionID)
                .sequence(sequence)
                .properties(properties)
                .build();
    }

    public static ServerEvent messageUpdated(String eventId, String sessionID, long sequence, String messageID) {
        ObjectNode props = props();
        ObjectNode info = props.putObject("info");
        info.put("id", messageID);
        info.put("role", "assistant");
        info.put("sessionID", sessionID);
        info.putObject("time").put("created", 1_000L);
        return event(eventId, EventTypes.MESSAGE_UPDATED, sessionID, sequence, props);
    }

    public static ServerEvent partUpdated(String eventId, String sessionID, long sequence, String messageID, String partID, String text) {
        ObjectNode props = props();
        ObjectNode part = props.putObject("part");
        part.put("id", partID);
        part.put("messageID", messageID);
        part.put("sessionID", sessionID);
        part.put("type", "text");
        part.put("text", text);
        return event(eventId, EventTypes.MESSAGE_PART_UPDATED, sessionID, sequence, props);
    }

    public static ServerEvent sessionStatus(String eventId, String sessionID, long sequence, String status) {
        ObjectNode props = props();
        props.put("sessionID", sessionID);
        props.put("status", status);
        return event(eventId, EventTypes.SESSION_STATUS, sessionID, sequence, props);
    }
}
