package com.zzf.eventsync.state;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client-side session record. Created lazily on first reference, never deleted here.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {
    public static final String DEFAULT_DIRECTORY = "default";

    private String sessionID;
    private String directory;
    @Builder.Default
    private SessionStatusInfo status = SessionStatusInfo.idle();

    public static SessionRecord minimal(String sessionID, String directory) {
        return SessionRecord.builder()
                .sessionID(sessionID)
                .directory(directory != null ? directory : DEFAULT_DIRECTORY)
                .build();
    }
}
