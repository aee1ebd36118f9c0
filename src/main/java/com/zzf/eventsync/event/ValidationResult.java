package com.zzf.eventsync.event;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {
    private static final ValidationResult OK = new ValidationResult(true, null);

    boolean valid;
    String error;

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(String error) {
        return new ValidationResult(false, error);
    }
}
