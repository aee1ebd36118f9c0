package com.zzf.eventsync.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.eventsync.state.AuxiliaryEventSink;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-process broadcast of events the typed stores do not consume (permission and question prompts).
 * Subscribers register per event type or for {@code "*"}; a throwing subscriber is logged and does
 * not keep the event from the others.
 */
@Slf4j
public class AuxiliaryEventBus implements AuxiliaryEventSink {

    public static final String ALL = "*";

    private final Map<String, List<Subscription>> subscriptions = new ConcurrentHashMap<>();

    @Data
    @AllArgsConstructor
    public static class Notification {
        private String type;
        private JsonNode properties;
    }

    public interface Subscription extends Consumer<Notification> {}

    @Override
    public void publish(String type, JsonNode properties) {
        Notification notification = new Notification(type, properties);
        for (String key : Arrays.asList(type, ALL)) {
            List<Subscription> subs = subscriptions.getOrDefault(key, Collections.emptyList());
            for (Subscription sub : snapshot(subs)) {
                try {
                    sub.accept(notification);
                } catch (RuntimeException e) {
                    log.warn("event.aux.subscriber.fail type={} err={}", type, e.toString());
                }
            }
        }
    }

    /**
     * @return a handle that removes the subscription
     */
    public Runnable subscribe(String type, Subscription callback) {
        subscriptions.computeIfAbsent(type, k -> Collections.synchronizedList(new ArrayList<>())).add(callback);
        return () -> unsubscribe(type, callback);
    }

    public Runnable subscribeAll(Subscription callback) {
        return subscribe(ALL, callback);
    }

    private void unsubscribe(String type, Subscription callback) {
        List<Subscription> subs = subscriptions.get(type);
        if (subs != null) {
            subs.remove(callback);
        }
    }

    private static List<Subscription> snapshot(List<Subscription> subs) {
        synchronized (subs) {
            return new ArrayList<>(subs);
        }
    }
}
