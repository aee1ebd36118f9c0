package com.zzf.eventsync.state.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.eventsync.state.QuestionRequest;
import com.zzf.eventsync.state.QuestionRequestSink;
import com.zzf.eventsync.state.RequestStatus;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryQuestionRequestStore implements QuestionRequestSink {

    private final Map<String, QuestionRequest> requests = new ConcurrentHashMap<>();

    @Override
    public void add(QuestionRequest request) {
        if (request == null || request.getId() == null) {
            return;
        }
        requests.put(request.getId(), request);
    }

    @Override
    public boolean answer(String requestID, JsonNode payload) {
        if (requestID == null) {
            return false;
        }
        RequestStatus status = isRejection(payload) ? RequestStatus.REJECTED : RequestStatus.ANSWERED;
        return requests.computeIfPresent(requestID, (id, existing) -> existing.toBuilder()
                .status(status)
                .answer(payload)
                .build()) != null;
    }

    public Optional<QuestionRequest> get(String requestID) {
        return Optional.ofNullable(requestID == null ? null : requests.get(requestID));
    }

    public List<QuestionRequest> pending(String sessionID) {
        return requests.values().stream()
                .filter(r -> r.getStatus() == RequestStatus.PENDING)
                .filter(r -> sessionID == null || Objects.equals(sessionID, r.getSessionID()))
                .collect(Collectors.toList());
    }

    private static boolean isRejection(JsonNode payload) {
        return payload != null && payload.isObject() && payload.path("rejected").asBoolean(false);
    }
}
