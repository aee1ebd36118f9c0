package com.zzf.eventsync.service;

import com.zzf.eventsync.pipeline.ApplyResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically releases ordering gaps that outlived the timeout, so a session whose stream went
 * quiet does not keep its held events until the next event arrives.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "eventsync.pipeline", name = "sweep-enabled", havingValue = "true")
public class StaleGapSweeper {

    private final EventSyncService eventSyncService;

    @Scheduled(fixedDelayString = "${eventsync.pipeline.sweep-interval-ms:5000}")
    public void sweep() {
        ApplyResult result = eventSyncService.sweepStaleGaps();
        if (!result.getOutcomes().isEmpty()) {
            log.info("event.ordering.sweep released={} failed={}", result.getOutcomes().size(), result.failures().size());
        }
    }
}
