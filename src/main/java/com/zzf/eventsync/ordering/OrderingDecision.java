package com.zzf.eventsync.ordering;

import com.zzf.eventsync.event.ServerEvent;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * What the ordering buffer did with one submitted event, plus the events it released.
 * <p>
 * {@code flushed} is set when the call also forced out held events past a gap. A stale or
 * in-order event can trigger such a flush when the session's gap has outlived the timeout, so
 * {@code released} is not necessarily empty for {@link Kind#STALE}.
 */
@Value
public class OrderingDecision {

    public enum Kind {
        /** No session or sequence: returned as-is. */
        PASS_THROUGH,
        /** In order: released together with any held successors. */
        EMITTED,
        /** Ahead of the cursor: held, nothing released. */
        HELD,
        /** Ahead of the cursor and over a limit: every held event released, this one included. */
        FLUSHED,
        /** Behind the cursor: dropped. */
        STALE
    }

    Kind kind;
    List<ServerEvent> released;
    boolean flushed;

    static OrderingDecision passThrough(ServerEvent event) {
        return new OrderingDecision(Kind.PASS_THROUGH, List.of(event), false);
    }

    static OrderingDecision held() {
        return new OrderingDecision(Kind.HELD, Collections.emptyList(), false);
    }

    static OrderingDecision stale() {
        return new OrderingDecision(Kind.STALE, Collections.emptyList(), false);
    }

    static OrderingDecision staleWithFlush(List<ServerEvent> flushed) {
        return new OrderingDecision(Kind.STALE, Collections.unmodifiableList(flushed), true);
    }

    static OrderingDecision emittedWithFlush(List<ServerEvent> events) {
        return new OrderingDecision(Kind.EMITTED, Collections.unmodifiableList(events), true);
    }

    static OrderingDecision released(Kind kind, List<ServerEvent> events) {
        return new OrderingDecision(kind, Collections.unmodifiableList(events), kind == Kind.FLUSHED);
    }
}
