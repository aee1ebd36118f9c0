package com.zzf.eventsync.ordering;

import com.zzf.eventsync.event.ServerEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-session reordering queue turning an out-of-order stream into ascending {@code sequence} order.
 * <p>
 * For each session the buffer keeps the next expected sequence, the events that arrived ahead of it
 * and the time the current gap opened. When more than {@code maxQueueSize} events are held, or the
 * gap has been open longer than {@code timeoutMs}, everything held is flushed in ascending order and
 * the missing sequences are treated as lost. Staleness is checked lazily on the next event for the
 * session, whether that event is held, emitted or stale (or by an explicit {@link #flushExpired()}
 * sweep); there is no timer.
 * <p>
 * Events without a session have no ordering domain and pass straight through.
 * <p>
 * Not thread-safe; the pipeline serialises access.
 */
@Slf4j
public class EventOrderingBuffer {

    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 1000;

    private final long timeoutMs;
    private final int maxQueueSize;
    private final Clock clock;
    private final Map<String, SessionCursor> sessions = new LinkedHashMap<>();

    public EventOrderingBuffer() {
        this(DEFAULT_TIMEOUT_MS, DEFAULT_MAX_QUEUE_SIZE, Clock.systemUTC());
    }

    public EventOrderingBuffer(long timeoutMs, int maxQueueSize, Clock clock) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        if (maxQueueSize <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be positive: " + maxQueueSize);
        }
        this.timeoutMs = timeoutMs;
        this.maxQueueSize = maxQueueSize;
        this.clock = clock;
    }

    /**
     * Submits one event and returns the events now ready to apply, in ascending sequence order.
     */
    public List<ServerEvent> addEvent(ServerEvent event) {
        return offer(event).getReleased();
    }

    /**
     * Same as {@link #addEvent(ServerEvent)} but also reports what happened to the submitted event.
     */
    public OrderingDecision offer(ServerEvent event) {
        if (!event.hasSession() || event.getSequence() == null) {
            return OrderingDecision.passThrough(event);
        }
        long sequence = event.getSequence();
        long now = clock.millis();
        SessionCursor cursor = sessions.get(event.getSessionID());
        if (cursor == null) {
            cursor = new SessionCursor(sequence);
            sessions.put(event.getSessionID(), cursor);
        }

        // the gap's age is judged before the event is classified, whatever its sequence
        boolean gapExpired = cursor.gapStartedAt != null && now - cursor.gapStartedAt > timeoutMs;

        if (sequence < cursor.expected) {
            cursor.staleDropped++;
            log.debug("event.ordering.stale sessionID={} sequence={} expected={} eventId={}",
                    event.getSessionID(), sequence, cursor.expected, event.getEventId());
            if (gapExpired) {
                logTimeoutFlush(event.getSessionID(), cursor);
                return OrderingDecision.staleWithFlush(flush(cursor));
            }
            return OrderingDecision.stale();
        }

        if (sequence == cursor.expected) {
            List<ServerEvent> released = new ArrayList<>();
            released.add(event);
            cursor.expected = sequence + 1;
            drain(cursor, released);
            if (gapExpired && !cursor.held.isEmpty()) {
                logTimeoutFlush(event.getSessionID(), cursor);
                released.addAll(flush(cursor));
                return OrderingDecision.emittedWithFlush(released);
            }
            // a partial drain leaves a new gap behind the cursor
            cursor.gapStartedAt = cursor.held.isEmpty() ? null : now;
            return OrderingDecision.released(OrderingDecision.Kind.EMITTED, released);
        }

        cursor.held.put(sequence, event);
        if (cursor.gapStartedAt == null) {
            cursor.gapStartedAt = now;
        }
        if (cursor.held.size() > maxQueueSize || gapExpired) {
            log.warn("event.ordering.flush sessionID={} reason={} held={} expected={}",
                    event.getSessionID(),
                    cursor.held.size() > maxQueueSize ? "overflow" : "timeout",
                    cursor.held.size(), cursor.expected);
            return OrderingDecision.released(OrderingDecision.Kind.FLUSHED, flush(cursor));
        }
        return OrderingDecision.held();
    }

    /**
     * Releases everything held for the session, accepting the gap. Empty when nothing is held.
     */
    public List<ServerEvent> flush(String sessionId) {
        SessionCursor cursor = sessions.get(sessionId);
        if (cursor == null || cursor.held.isEmpty()) {
            return Collections.emptyList();
        }
        log.info("event.ordering.flush sessionID={} reason=explicit held={} expected={}",
                sessionId, cursor.held.size(), cursor.expected);
        return flush(cursor);
    }

    /**
     * Flushes every session whose gap has been open longer than the timeout. Intended for a periodic
     * sweep so that a stalled session does not wait for its next event.
     */
    public Map<String, List<ServerEvent>> flushExpired() {
        long now = clock.millis();
        Map<String, List<ServerEvent>> out = new LinkedHashMap<>();
        for (Map.Entry<String, SessionCursor> entry : sessions.entrySet()) {
            SessionCursor cursor = entry.getValue();
            if (cursor.gapStartedAt != null && now - cursor.gapStartedAt > timeoutMs && !cursor.held.isEmpty()) {
                log.warn("event.ordering.flush sessionID={} reason=sweep held={} expected={}",
                        entry.getKey(), cursor.held.size(), cursor.expected);
                out.put(entry.getKey(), flush(cursor));
            }
        }
        return out;
    }

    public Optional<OrderingStats> getStats(String sessionId) {
        SessionCursor cursor = sessions.get(sessionId);
        if (cursor == null) {
            return Optional.empty();
        }
        return Optional.of(toStats(sessionId, cursor, clock.millis()));
    }

    public Map<String, OrderingStats> getStats() {
        long now = clock.millis();
        Map<String, OrderingStats> out = new LinkedHashMap<>();
        sessions.forEach((id, cursor) -> out.put(id, toStats(id, cursor, now)));
        return out;
    }

    /** Drops the session's buffering state without emitting held events. */
    public void clearSession(String sessionId) {
        sessions.remove(sessionId);
    }

    public void clear() {
        sessions.clear();
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    private void drain(SessionCursor cursor, List<ServerEvent> released) {
        ServerEvent next;
        while ((next = cursor.held.remove(cursor.expected)) != null) {
            released.add(next);
            cursor.expected++;
        }
    }

    private void logTimeoutFlush(String sessionId, SessionCursor cursor) {
        log.warn("event.ordering.flush sessionID={} reason=timeout held={} expected={}",
                sessionId, cursor.held.size(), cursor.expected);
    }

    private List<ServerEvent> flush(SessionCursor cursor) {
        List<ServerEvent> released = new ArrayList<>(cursor.held.values());
        long missing = cursor.held.lastKey() - cursor.expected + 1 - cursor.held.size();
        cursor.expected = cursor.held.lastKey() + 1;
        cursor.held.clear();
        cursor.gapStartedAt = null;
        cursor.flushes++;
        cursor.skipped += missing;
        return released;
    }

    private OrderingStats toStats(String sessionId, SessionCursor cursor, long now) {
        return OrderingStats.builder()
                .sessionId(sessionId)
                .expectedSequence(cursor.expected)
                .heldCount(cursor.held.size())
                .heldSequences(new ArrayList<>(cursor.held.keySet()))
                .gapAgeMs(cursor.gapStartedAt == null ? 0L : now - cursor.gapStartedAt)
                .staleDropped(cursor.staleDropped)
                .flushes(cursor.flushes)
                .skippedSequences(cursor.skipped)
                .build();
    }

    private static final class SessionCursor {
        private long expected;
        private final NavigableMap<Long, ServerEvent> held = new TreeMap<>();
        private Long gapStartedAt;
        private long staleDropped;
        private long flushes;
        private long skipped;

        private SessionCursor(long expected) {
            this.expected = expected;
        }
    }
}
