package com.zzf.eventsync.state;

public interface PermissionRequestSink {

    void add(PermissionRequest request);

    /**
     * Resolves a pending request. Unknown ids are ignored: the request may already have timed out
     * or been answered through another path.
     *
     * @return whether a request was resolved
     */
    boolean resolve(String requestID, boolean approved);
}
