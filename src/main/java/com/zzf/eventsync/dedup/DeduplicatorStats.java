package com.zzf.eventsync.dedup;

import lombok.Value;

@Value
public class DeduplicatorStats {
    int size;
    int maxSize;
    /** Ids forgotten through FIFO eviction since the last clear. */
    long evicted;
}
