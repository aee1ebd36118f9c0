package com.zzf.eventsync.state;

import java.util.Optional;

public interface MessageStore {

    void upsert(MessageRecord message);

    Optional<MessageRecord> getById(String messageID);
}
