package com.zzf.eventsync.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Session status: {@code idle}, {@code busy} or {@code retry{attempt, message, next}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionStatusInfo {

    public enum Kind {
        IDLE,
        BUSY,
        RETRY;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private Kind type;
    // retry only
    private Integer attempt;
    private String message;
    private Long next;

    public static SessionStatusInfo idle() {
        return SessionStatusInfo.builder().type(Kind.IDLE).build();
    }

    public static SessionStatusInfo busy() {
        return SessionStatusInfo.builder().type(Kind.BUSY).build();
    }

    public static SessionStatusInfo retry(int attempt, String message, long next) {
        return SessionStatusInfo.builder()
                .type(Kind.RETRY)
                .attempt(attempt)
                .message(message)
                .next(next)
                .build();
    }
}
