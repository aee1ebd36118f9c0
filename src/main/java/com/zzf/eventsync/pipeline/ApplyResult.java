package com.zzf.eventsync.pipeline;

import com.zzf.eventsync.event.ServerEvent;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of submitting one event to {@link EventPipeline#applyEventToStores}.
 */
@Value
public class ApplyResult {

    public enum Disposition {
        /** Failed validation; never reached dedup, ordering or routing. */
        REJECTED_INVALID,
        /** Event id already applied. */
        DUPLICATE,
        /**
         * Sequence behind the session cursor. {@link #getOutcomes()} lists events released by a
         * timeout flush the submission triggered, usually none.
         */
        STALE,
        /** Held by the ordering buffer waiting for a predecessor. */
        BUFFERED,
        /** One or more events were released and routed; see {@link #getOutcomes()}. */
        RELEASED
    }

    Disposition disposition;
    String error;
    List<EventOutcome> outcomes;

    static ApplyResult rejected(String error) {
        return new ApplyResult(Disposition.REJECTED_INVALID, error, Collections.emptyList());
    }

    static ApplyResult of(Disposition disposition) {
        return new ApplyResult(disposition, null, Collections.emptyList());
    }

    static ApplyResult of(Disposition disposition, List<EventOutcome> outcomes) {
        return new ApplyResult(disposition, null, Collections.unmodifiableList(outcomes));
    }

    static ApplyResult released(List<EventOutcome> outcomes) {
        return new ApplyResult(Disposition.RELEASED, null, Collections.unmodifiableList(outcomes));
    }

    /** Events released by ordering and routed without an exception, in application order. */
    public List<ServerEvent> appliedEvents() {
        return outcomes.stream()
                .filter(EventOutcome::isApplied)
                .map(EventOutcome::getEvent)
                .collect(Collectors.toList());
    }

    public List<EventOutcome> failures() {
        return outcomes.stream()
                .filter(o -> !o.isApplied())
                .collect(Collectors.toList());
    }
}
