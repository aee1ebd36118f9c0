package com.zzf.eventsync.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope checks: type and eventId present, properties an object, sequence non-negative, below
 * {@link Long#MAX_VALUE} and present whenever the event carries a sessionID, part events carrying
 * a sessionID, a status event naming its session somewhere, and no disagreement between the
 * envelope sessionID and {@code properties.sessionID}.
 * <p>
 * Payload shape beyond that is left to {@link EventDecoder}, which turns missing fields into no-ops.
 */
public class DefaultEventValidator implements EventValidator {

    @Override
    public ValidationResult validate(ServerEvent event) {
        if (event == null) {
            return ValidationResult.fail("event is null");
        }
        if (isBlank(event.getType())) {
            return ValidationResult.fail("type is required");
        }
        if (isBlank(event.getEventId())) {
            return ValidationResult.fail("eventId is required");
        }
        JsonNode props = event.getProperties();
        if (props != null && !props.isNull() && !props.isObject()) {
            return ValidationResult.fail("properties must be an object");
        }
        if (event.getSequence() != null && event.getSequence() < 0) {
            return ValidationResult.fail("sequence must be non-negative: " + event.getSequence());
        }
        // the ordering cursor sits one past the last emitted sequence
        if (event.getSequence() != null && event.getSequence() == Long.MAX_VALUE) {
            return ValidationResult.fail("sequence out of range: " + event.getSequence());
        }
        if (event.hasSession() && event.getSequence() == null) {
            return ValidationResult.fail("sequence is required for session events");
        }
        String propsSession = propsSessionID(props);
        if (EventTypes.SESSION_SCOPED.contains(event.getType()) && !event.hasSession()) {
            return ValidationResult.fail(event.getType() + " requires a sessionID");
        }
        if (EventTypes.SESSION_STATUS.equals(event.getType()) && !event.hasSession() && propsSession == null) {
            return ValidationResult.fail(event.getType() + " requires a sessionID");
        }
        if (event.hasSession() && propsSession != null && !propsSession.equals(event.getSessionID())) {
            return ValidationResult.fail("sessionID mismatch: envelope=" + event.getSessionID() + " properties=" + propsSession);
        }
        return ValidationResult.ok();
    }

    private static String propsSessionID(JsonNode props) {
        if (props == null || !props.isObject()) {
            return null;
        }
        JsonNode value = props.get("sessionID");
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
