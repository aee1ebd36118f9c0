package com.zzf.eventsync.api;

import com.zzf.eventsync.event.ServerEvent;
import com.zzf.eventsync.model.CustomException;
import com.zzf.eventsync.pipeline.ApplyResult;
import com.zzf.eventsync.pipeline.EventOutcome;
import com.zzf.eventsync.service.EventSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final EventSyncService eventSyncService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> submit(@RequestBody ServerEvent event) {
        if (event == null) {
            throw new CustomException("MALFORMED_EVENT", "event body is required");
        }
        return summarize(eventSyncService.apply(event));
    }

    @PostMapping(path = "/stream", consumes = {
            MediaType.TEXT_PLAIN_VALUE, "application/x-ndjson", MediaType.TEXT_EVENT_STREAM_VALUE})
    public Map<String, Object> submitStream(@RequestBody String body) {
        List<Map<String, Object>> results = new ArrayList<>();
        int applied = 0;
        for (ApplyResult result : eventSyncService.applyStream(body)) {
            results.add(summarize(result));
            applied += result.appliedEvents().size();
        }
        Map<String, Object> response = new HashMap<>();
        response.put("submitted", results.size());
        response.put("applied", applied);
        response.put("results", results);
        return response;
    }

    @PostMapping("/sessions/{sessionId}/flush")
    public Map<String, Object> flush(@PathVariable String sessionId) {
        return summarize(eventSyncService.flushSession(sessionId));
    }

    @GetMapping("/stats")
    public Map<String, Object> stats(@RequestParam(required = false) String sessionId) {
        return eventSyncService.stats(sessionId);
    }

    @DeleteMapping("/state")
    public Map<String, Object> clearAll() {
        eventSyncService.clearAll();
        return Map.of("status", "cleared");
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Map<String, Object> clearSession(@PathVariable String sessionId) {
        eventSyncService.clearSession(sessionId);
        return Map.of("status", "cleared", "sessionId", sessionId);
    }

    static Map<String, Object> summarize(ApplyResult result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("disposition", result.getDisposition().name().toLowerCase(Locale.ROOT));
        if (result.getError() != null) {
            response.put("error", result.getError());
        }
        List<Map<String, Object>> outcomes = new ArrayList<>();
        for (EventOutcome outcome : result.getOutcomes()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("eventId", outcome.getEvent().getEventId());
            item.put("type", outcome.getEvent().getType());
            item.put("sequence", outcome.getEvent().getSequence());
            item.put("status", outcome.getStatus().name().toLowerCase(Locale.ROOT));
            item.put("mutated", outcome.isMutated());
            if (!outcome.getWarnings().isEmpty()) {
                item.put("warnings", outcome.getWarnings());
            }
            if (outcome.getError() != null) {
                item.put("error", outcome.getError());
            }
            outcomes.add(item);
        }
        response.put("outcomes", outcomes);
        return response;
    }
}
