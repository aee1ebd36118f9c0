package com.zzf.eventsync.ordering;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class OrderingStats {
    String sessionId;
    long expectedSequence;
    int heldCount;
    List<Long> heldSequences;
    /** Milliseconds since the current gap opened, 0 when nothing is held. */
    long gapAgeMs;
    long staleDropped;
    long flushes;
    /** Sequence numbers given up as lost by flushes. */
    long skippedSequences;
}
