package com.zzf.eventsync.router;

import com.zzf.eventsync.state.AuxiliaryEventSink;
import com.zzf.eventsync.state.MessageStore;
import com.zzf.eventsync.state.PartStore;
import com.zzf.eventsync.state.PermissionRequestSink;
import com.zzf.eventsync.state.QuestionRequestSink;
import com.zzf.eventsync.state.SessionStore;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.Optional;

/**
 * The typed stores the router mutates. Session, message and part stores are required; the request
 * sinks are optional and the auxiliary sink defaults to a no-op.
 */
@Getter
@Builder
public class StateContainers {
    @NonNull
    private final SessionStore sessions;
    @NonNull
    private final MessageStore messages;
    @NonNull
    private final PartStore parts;
    private final PermissionRequestSink permissions;
    private final QuestionRequestSink questions;
    @Builder.Default
    private final AuxiliaryEventSink auxiliary = AuxiliaryEventSink.NOOP;

    public Optional<PermissionRequestSink> permissionSink() {
        return Optional.ofNullable(permissions);
    }

    public Optional<QuestionRequestSink> questionSink() {
        return Optional.ofNullable(questions);
    }
}
