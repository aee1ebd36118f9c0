package com.zzf.eventsync.event;

/**
 * Pure structural check run before an event reaches deduplication, ordering or routing.
 */
@FunctionalInterface
public interface EventValidator {

    ValidationResult validate(ServerEvent event);
}
