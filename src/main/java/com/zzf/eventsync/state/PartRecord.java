package com.zzf.eventsync.state;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A message part. Identity is {@code (messageID, id)}; the full wire payload is kept in {@code data}
 * since the part kinds (text, reasoning, tool, file, step-start...) are rendered downstream.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PartRecord {
    private String id;
    private String messageID;
    private String sessionID;
    private String type;
    private JsonNode data;
}
