package com.zzf.eventsync.state;

import com.fasterxml.jackson.databind.JsonNode;

public interface QuestionRequestSink {

    void add(QuestionRequest request);

    /**
     * Records the answer (or a {@code {rejected: true}} marker) for a pending question.
     * Unknown ids are ignored.
     *
     * @return whether a request was answered
     */
    boolean answer(String requestID, JsonNode payload);
}
