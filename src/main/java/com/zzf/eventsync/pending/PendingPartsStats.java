package com.zzf.eventsync.pending;

import lombok.Value;

@Value
public class PendingPartsStats {
    int messageCount;
    int partCount;
    long evictedParts;
}
