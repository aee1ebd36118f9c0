package com.zzf.eventsync.pipeline;

import com.zzf.eventsync.dedup.EventDeduplicator;
import com.zzf.eventsync.ordering.EventOrderingBuffer;
import com.zzf.eventsync.pending.PendingPartsStore;
import lombok.Getter;

import java.time.Clock;

/**
 * Buffering and bookkeeping owned by one event stream: the deduplicator, the ordering buffer and
 * the pending-parts store. Independent streams get independent instances.
 */
@Getter
public class PipelineState {

    private final EventDeduplicator deduplicator;
    private final EventOrderingBuffer orderingBuffer;
    private final PendingPartsStore pendingParts;

    public PipelineState(EventDeduplicator deduplicator, EventOrderingBuffer orderingBuffer, PendingPartsStore pendingParts) {
        this.deduplicator = deduplicator;
        this.orderingBuffer = orderingBuffer;
        this.pendingParts = pendingParts;
    }

    public static PipelineState withDefaults(Clock clock) {
        return new PipelineState(
                new EventDeduplicator(),
                new EventOrderingBuffer(EventOrderingBuffer.DEFAULT_TIMEOUT_MS, EventOrderingBuffer.DEFAULT_MAX_QUEUE_SIZE, clock),
                new PendingPartsStore());
    }
}
