package com.zzf.eventsync.state;

public interface PartStore {

    /** Inserts or replaces the part identified by {@code (messageID, id)}. */
    void upsert(PartRecord part);

    void remove(String partID, String messageID);
}
