package com.zzf.eventsync.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QuestionRequest {
    private String id;
    private String sessionID;
    /** Originating message, or {@code question:<id>} when the tool call carried none. */
    private String messageID;
    private String question;
    private List<String> options;
    @Builder.Default
    private RequestStatus status = RequestStatus.PENDING;
    private long timestamp;
    private String callID;
    private JsonNode answer;
}
