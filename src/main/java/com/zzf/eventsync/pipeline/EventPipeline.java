package com.zzf.eventsync.pipeline;

import com.zzf.eventsync.dedup.DeduplicatorStats;
import com.zzf.eventsync.event.EventDecoder;
import com.zzf.eventsync.event.EventValidator;
import com.zzf.eventsync.event.ServerEvent;
import com.zzf.eventsync.event.ValidationResult;
import com.zzf.eventsync.metrics.EventPipelineMetrics;
import com.zzf.eventsync.ordering.OrderingDecision;
import com.zzf.eventsync.ordering.OrderingStats;
import com.zzf.eventsync.pending.PendingPartsStats;
import com.zzf.eventsync.router.EventRouter;
import com.zzf.eventsync.router.RouteReport;
import com.zzf.eventsync.router.StateContainers;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for raw events: validate, deduplicate, order, route.
 * <p>
 * Calls are serialised, so the ordering buffer and pending-parts store always see one event at a
 * time. A failure while routing one released event is recorded in its {@link EventOutcome} and
 * does not stop the events released after it.
 */
@Slf4j
public class EventPipeline {

    private final PipelineState state;
    private final EventValidator validator;
    private final EventRouter router;
    private final EventPipelineMetrics metrics;

    public EventPipeline(PipelineState state, EventValidator validator, EventDecoder decoder, EventPipelineMetrics metrics) {
        this.state = state;
        this.validator = validator;
        this.router = new EventRouter(decoder, state.getPendingParts());
        this.metrics = metrics;
    }

    public synchronized ApplyResult applyEventToStores(ServerEvent event, StateContainers containers) {
        ValidationResult validation = validator.validate(event);
        if (!validation.isValid()) {
            log.warn("event.validation.fail eventId={} type={} err={}",
                    event == null ? null : event.getEventId(),
                    event == null ? null : event.getType(),
                    validation.getError());
            metrics.rejected();
            return ApplyResult.rejected(validation.getError());
        }

        if (state.getDeduplicator().isDuplicate(event.getEventId())) {
            log.debug("event.dedup.skip eventId={} type={}", event.getEventId(), event.getType());
            metrics.duplicate();
            return ApplyResult.of(ApplyResult.Disposition.DUPLICATE);
        }

        OrderingDecision decision = state.getOrderingBuffer().offer(event);
        if (decision.isFlushed()) {
            metrics.flushed();
        }
        switch (decision.getKind()) {
            case STALE -> {
                metrics.stale();
                // a timed-out gap may have been flushed on the way
                return ApplyResult.of(ApplyResult.Disposition.STALE, routeAll(decision.getReleased(), containers));
            }
            case HELD -> {
                log.debug("event.ordering.held sessionID={} sequence={} eventId={}",
                        event.getSessionID(), event.getSequence(), event.getEventId());
                metrics.buffered();
                return ApplyResult.of(ApplyResult.Disposition.BUFFERED);
            }
            default -> {
            }
        }
        return ApplyResult.released(routeAll(decision.getReleased(), containers));
    }

    /**
     * Releases and routes everything the ordering buffer holds for the session, accepting the gap.
     */
    public synchronized ApplyResult flushSession(String sessionId, StateContainers containers) {
        List<ServerEvent> released = state.getOrderingBuffer().flush(sessionId);
        if (released.isEmpty()) {
            return ApplyResult.released(new ArrayList<>());
        }
        metrics.flushed();
        return ApplyResult.released(routeAll(released, containers));
    }

    /**
     * Flushes and routes every session whose ordering gap outlived the timeout.
     */
    public synchronized ApplyResult sweepStaleGaps(StateContainers containers) {
        List<EventOutcome> outcomes = new ArrayList<>();
        for (List<ServerEvent> released : state.getOrderingBuffer().flushExpired().values()) {
            metrics.flushed();
            outcomes.addAll(routeAll(released, containers));
        }
        return ApplyResult.released(outcomes);
    }

    /** Resets deduplication, ordering and pending parts for every session. */
    public synchronized void clearEventProcessingState() {
        state.getOrderingBuffer().clear();
        state.getDeduplicator().clear();
        state.getPendingParts().clear();
        log.info("event.state.clear scope=all");
    }

    /**
     * Drops one session's ordering state and its pending parts. Other sessions and the
     * deduplication window are untouched; downstream stores are never modified.
     */
    public synchronized void clearSessionState(String sessionId) {
        state.getOrderingBuffer().clearSession(sessionId);
        state.getPendingParts().dropForSession(sessionId);
        log.info("event.state.clear scope=session sessionID={}", sessionId);
    }

    public synchronized Optional<OrderingStats> getOrderingStats(String sessionId) {
        return state.getOrderingBuffer().getStats(sessionId);
    }

    public synchronized Map<String, OrderingStats> getOrderingStats() {
        return state.getOrderingBuffer().getStats();
    }

    public synchronized DeduplicatorStats getDeduplicatorStats() {
        return state.getDeduplicator().getStats();
    }

    public synchronized PendingPartsStats getPendingPartsStats() {
        return state.getPendingParts().getStats();
    }

    private List<EventOutcome> routeAll(List<ServerEvent> released, StateContainers containers) {
        List<EventOutcome> outcomes = new ArrayList<>(released.size());
        for (ServerEvent evt : released) {
            MDC.put("eventId", evt.getEventId());
            if (evt.getSessionID() != null) {
                MDC.put("sessionID", evt.getSessionID());
            }
            try {
                RouteReport report = router.route(evt, containers);
                outcomes.add(EventOutcome.applied(evt, report.isMutated(), report.getWarnings()));
                metrics.applied();
                log.debug("event.apply.ok eventId={} type={} sequence={} sessionID={}",
                        evt.getEventId(), evt.getType(), evt.getSequence(), evt.getSessionID());
            } catch (RuntimeException e) {
                outcomes.add(EventOutcome.failed(evt, e));
                metrics.failed();
                log.error("event.apply.fail eventId={} type={}", evt.getEventId(), evt.getType(), e);
            } finally {
                MDC.remove("eventId");
                MDC.remove("sessionID");
            }
        }
        return outcomes;
    }
}
