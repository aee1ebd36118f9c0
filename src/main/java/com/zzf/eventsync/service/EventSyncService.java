package com.zzf.eventsync.service;

import com.zzf.eventsync.event.ServerEvent;
import com.zzf.eventsync.pipeline.ApplyResult;
import com.zzf.eventsync.pipeline.EventPipeline;
import com.zzf.eventsync.router.StateContainers;
import com.zzf.eventsync.state.MessageRecord;
import com.zzf.eventsync.state.PermissionRequest;
import com.zzf.eventsync.state.QuestionRequest;
import com.zzf.eventsync.state.PartRecord;
import com.zzf.eventsync.state.SessionRecord;
import com.zzf.eventsync.state.memory.InMemoryMessageStore;
import com.zzf.eventsync.state.memory.InMemoryPartStore;
import com.zzf.eventsync.state.memory.InMemoryPermissionRequestStore;
import com.zzf.eventsync.state.memory.InMemoryQuestionRequestStore;
import com.zzf.eventsync.state.memory.InMemorySessionStore;
import com.zzf.eventsync.transport.EventStreamDecoder;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Binds the pipeline to the application's in-memory state containers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventSyncService {

    private final EventPipeline pipeline;
    private final StateContainers containers;
    private final EventStreamDecoder streamDecoder;
    private final InMemorySessionStore sessions;
    private final InMemoryMessageStore messages;
    private final InMemoryPartStore parts;
    private final InMemoryPermissionRequestStore permissions;
    private final InMemoryQuestionRequestStore questions;

    public ApplyResult apply(ServerEvent event) {
        return pipeline.applyEventToStores(event, containers);
    }

    /** Decodes an NDJSON or SSE body and applies each event in order of appearance. */
    public List<ApplyResult> applyStream(String body) {
        List<ServerEvent> events = streamDecoder.decode(body);
        List<ApplyResult> results = new ArrayList<>(events.size());
        for (ServerEvent event : events) {
            results.add(pipeline.applyEventToStores(event, containers));
        }
        log.info("event.stream.apply decoded={} results={}", events.size(), results.size());
        return results;
    }

    public ApplyResult flushSession(String sessionId) {
        return pipeline.flushSession(sessionId, containers);
    }

    public ApplyResult sweepStaleGaps() {
        return pipeline.sweepStaleGaps(containers);
    }

    public void clearAll() {
        pipeline.clearEventProcessingState();
    }

    public void clearSession(String sessionId) {
        pipeline.clearSessionState(sessionId);
    }

    public Map<String, Object> stats(String sessionId) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (sessionId != null && !sessionId.isBlank()) {
            out.put("ordering", pipeline.getOrderingStats(sessionId).orElse(null));
        } else {
            out.put("ordering", pipeline.getOrderingStats());
        }
        out.put("deduplicator", pipeline.getDeduplicatorStats());
        out.put("pendingParts", pipeline.getPendingPartsStats());
        return out;
    }

    public Optional<SessionView> sessionView(String sessionId) {
        return sessions.getById(sessionId).map(session -> {
            Map<String, List<PartRecord>> partsByMessage = new LinkedHashMap<>();
            List<MessageRecord> sessionMessages = messages.listBySession(sessionId);
            for (MessageRecord message : sessionMessages) {
                partsByMessage.put(message.getId(), parts.list(message.getId()));
            }
            return SessionView.builder()
                    .session(session)
                    .messages(sessionMessages)
                    .parts(partsByMessage)
                    .pendingPermissions(permissions.pending(sessionId))
                    .pendingQuestions(questions.pending(sessionId))
                    .build();
        });
    }

    @Data
    @Builder
    public static class SessionView {
        private SessionRecord session;
        private List<MessageRecord> messages;
        private Map<String, List<PartRecord>> parts;
        private List<PermissionRequest> pendingPermissions;
        private List<QuestionRequest> pendingQuestions;
    }
}
