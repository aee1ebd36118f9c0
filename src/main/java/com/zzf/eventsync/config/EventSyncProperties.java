package com.zzf.eventsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "eventsync.pipeline")
public class EventSyncProperties {
    private long orderingTimeoutMs = 30_000L;
    private int orderingMaxQueueSize = 1000;
    private int dedupMaxSize = 1000;
    private int pendingPartsMaxPerMessage = 200;
    private int pendingPartsMaxMessages = 1000;
    private boolean sweepEnabled = false;
    private long sweepIntervalMs = 5_000L;

    public long getOrderingTimeoutMs() {
        return orderingTimeoutMs;
    }

    public void setOrderingTimeoutMs(long orderingTimeoutMs) {
        this.orderingTimeoutMs = orderingTimeoutMs;
    }

    public int getOrderingMaxQueueSize() {
        return orderingMaxQueueSize;
    }

    public void setOrderingMaxQueueSize(int orderingMaxQueueSize) {
        this.orderingMaxQueueSize = orderingMaxQueueSize;
    }

    public int getDedupMaxSize() {
        return dedupMaxSize;
    }

    public void setDedupMaxSize(int dedupMaxSize) {
        this.dedupMaxSize = dedupMaxSize;
    }

    public int getPendingPartsMaxPerMessage() {
        return pendingPartsMaxPerMessage;
    }

    public void setPendingPartsMaxPerMessage(int pendingPartsMaxPerMessage) {
        this.pendingPartsMaxPerMessage = pendingPartsMaxPerMessage;
    }

    public int getPendingPartsMaxMessages() {
        return pendingPartsMaxMessages;
    }

    public void setPendingPartsMaxMessages(int pendingPartsMaxMessages) {
        this.pendingPartsMaxMessages = pendingPartsMaxMessages;
    }

    public boolean isSweepEnabled() {
        return sweepEnabled;
    }

    public void setSweepEnabled(boolean sweepEnabled) {
        this.sweepEnabled = sweepEnabled;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }
}
