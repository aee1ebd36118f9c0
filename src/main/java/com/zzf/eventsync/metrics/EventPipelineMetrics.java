package com.zzf.eventsync.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Counters for the pipeline, one {@code eventsync.events} series per outcome.
 */
public class EventPipelineMetrics {

    public static final String EVENTS = "eventsync.events";
    public static final String FLUSHES = "eventsync.ordering.flushes";

    private final Counter rejected;
    private final Counter duplicate;
    private final Counter stale;
    private final Counter buffered;
    private final Counter applied;
    private final Counter failed;
    private final Counter flushes;

    public EventPipelineMetrics(MeterRegistry registry) {
        this.rejected = outcome(registry, "rejected");
        this.duplicate = outcome(registry, "duplicate");
        this.stale = outcome(registry, "stale");
        this.buffered = outcome(registry, "buffered");
        this.applied = outcome(registry, "applied");
        this.failed = outcome(registry, "failed");
        this.flushes = Counter.builder(FLUSHES)
                .description("Forced releases of held out-of-order events")
                .register(registry);
    }

    /** Metrics backed by a private registry, for callers without a Spring context. */
    public static EventPipelineMetrics standalone() {
        return new EventPipelineMetrics(new SimpleMeterRegistry());
    }

    public void rejected() {
        rejected.increment();
    }

    public void duplicate() {
        duplicate.increment();
    }

    public void stale() {
        stale.increment();
    }

    public void buffered() {
        buffered.increment();
    }

    public void applied() {
        applied.increment();
    }

    public void failed() {
        failed.increment();
    }

    public void flushed() {
        flushes.increment();
    }

    private static Counter outcome(MeterRegistry registry, String outcome) {
        return Counter.builder(EVENTS)
                .description("Events submitted to the pipeline by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }
}
