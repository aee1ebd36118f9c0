package com.zzf.eventsync.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RequestStatus {
    PENDING,
    APPROVED,
    DENIED,
    ANSWERED,
    REJECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
