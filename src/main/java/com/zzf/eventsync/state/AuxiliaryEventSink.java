package com.zzf.eventsync.state;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Fire-and-forget broadcast for observers outside the typed stores.
 */
@FunctionalInterface
public interface AuxiliaryEventSink {

    AuxiliaryEventSink NOOP = (type, properties) -> { };

    void publish(String type, JsonNode properties);
}
