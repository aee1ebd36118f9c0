package com.zzf.eventsync.api;

import com.zzf.eventsync.model.CustomException;
import com.zzf.eventsync.service.EventSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of what the event stream has built for a session.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionStateController {

    private final EventSyncService eventSyncService;

    @GetMapping("/{sessionId}")
    public EventSyncService.SessionView get(@PathVariable String sessionId) {
        return eventSyncService.sessionView(sessionId)
                .orElseThrow(() -> new CustomException("SESSION_NOT_FOUND", "Unknown session: " + sessionId, HttpStatus.NOT_FOUND));
    }
}
