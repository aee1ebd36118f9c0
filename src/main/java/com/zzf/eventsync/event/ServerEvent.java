package com.zzf.eventsync.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire-level event envelope as delivered by the transport: {@code { type, properties, ... }}.
 * <p>
 * {@code properties} stays an untyped JSON tree here; {@link EventDecoder} narrows it into a
 * {@link RoutedEvent} variant right before routing.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerEvent {
    private String type;
    private JsonNode properties;
    private String eventId;
    /** Strictly increasing within one session. Global events may omit it. */
    private Long sequence;
    private String sessionID;
    private Long timestamp;
    private String directory;

    public boolean hasSession() {
        return sessionID != null && !sessionID.isBlank();
    }
}
