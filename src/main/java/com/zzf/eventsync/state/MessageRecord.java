package com.zzf.eventsync.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client-side message record. Its existence releases parts buffered for its id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageRecord {
    private String id;
    private MessageRole role;
    private String sessionID;
    private String parentID;
    private MessageTime time;
    private String model;
    private String provider;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MessageTime {
        private long created;
        private Long completed;
    }
}
