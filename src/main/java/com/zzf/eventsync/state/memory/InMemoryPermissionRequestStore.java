package com.zzf.eventsync.state.memory;

import com.zzf.eventsync.state.PermissionRequest;
import com.zzf.eventsync.state.PermissionRequestSink;
import com.zzf.eventsync.state.RequestStatus;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryPermissionRequestStore implements PermissionRequestSink {

    private final Map<String, PermissionRequest> requests = new ConcurrentHashMap<>();

    @Override
    public void add(PermissionRequest request) {
        if (request == null || request.getId() == null) {
            return;
        }
        requests.put(request.getId(), request);
    }

    @Override
    public boolean resolve(String requestID, boolean approved) {
        if (requestID == null) {
            return false;
        }
        RequestStatus status = approved ? RequestStatus.APPROVED : RequestStatus.DENIED;
        return requests.computeIfPresent(requestID, (id, existing) -> existing.toBuilder().status(status).build()) != null;
    }

    public Optional<PermissionRequest> get(String requestID) {
        return Optional.ofNullable(requestID == null ? null : requests.get(requestID));
    }

    public List<PermissionRequest> pending(String sessionID) {
        return requests.values().stream()
                .filter(r -> r.getStatus() == RequestStatus.PENDING)
                .filter(r -> sessionID == null || Objects.equals(sessionID, r.getSessionID()))
                .collect(Collectors.toList());
    }
}
