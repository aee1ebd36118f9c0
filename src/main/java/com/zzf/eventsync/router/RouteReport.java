package com.zzf.eventsync.router;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of routing one event: whether it changed anything and which non-fatal problems occurred
 * (for example a buffered part that failed to apply on replay).
 */
@Getter
public class RouteReport {

    private boolean mutated;
    private final List<String> warnings = new ArrayList<>();

    public static RouteReport noop() {
        return new RouteReport();
    }

    void markMutated() {
        this.mutated = true;
    }

    void warn(String warning) {
        warnings.add(warning);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
