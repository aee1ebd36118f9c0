package com.zzf.eventsync.pipeline;

import com.zzf.eventsync.event.ServerEvent;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of routing one released event.
 */
@Value
public class EventOutcome {

    public enum Status {
        APPLIED,
        FAILED
    }

    ServerEvent event;
    Status status;
    /** Whether any state container changed. An applied no-op (unknown type, bad payload) is false. */
    boolean mutated;
    List<String> warnings;
    String error;

    static EventOutcome applied(ServerEvent event, boolean mutated, List<String> warnings) {
        return new EventOutcome(event, Status.APPLIED, mutated, warnings, null);
    }

    static EventOutcome failed(ServerEvent event, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new EventOutcome(event, Status.FAILED, false, Collections.emptyList(), message);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
