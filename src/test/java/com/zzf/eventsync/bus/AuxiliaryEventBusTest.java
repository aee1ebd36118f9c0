package com.zzf.eventsync.bus;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.zzf.eventsync.support.TestEvents.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuxiliaryEventBusTest {

    @Test
    void shouldDeliverToTypeAndWildcardSubscribers() {
        AuxiliaryEventBus bus = new AuxiliaryEventBus();
        List<String> typed = new ArrayList<>();
        List<String> all = new ArrayList<>();
        bus.subscribe("permission.asked", n -> typed.add(n.getProperties().get("id").asText()));
        bus.subscribeAll(n -> all.add(n.getType()));

        bus.publish("permission.asked", json("{\"id\":\"perm-1\"}"));
        bus.publish("question.asked", json("{\"id\":\"q1\"}"));

        assertEquals(List.of("perm-1"), typed);
        assertEquals(List.of("permission.asked", "question.asked"), all);
    }

    @Test
    void failingSubscriberShouldNotBlockOthers() {
        AuxiliaryEventBus bus = new AuxiliaryEventBus();
        List<String> received = new ArrayList<>();
        bus.subscribe("question.asked", n -> {
            throw new IllegalStateException("subscriber broke");
        });
        bus.subscribe("question.asked", n -> received.add(n.getType()));

        bus.publish("question.asked", json("{}"));

        assertEquals(List.of("question.asked"), received);
    }

    @Test
    void unsubscribeHandleShouldStopDelivery() {
        AuxiliaryEventBus bus = new AuxiliaryEventBus();
        List<String> received = new ArrayList<>();
        Runnable unsubscribe = bus.subscribe("permission.replied", n -> received.add(n.getType()));

        unsubscribe.run();
        bus.publish("permission.replied", json("{}"));

        assertTrue(received.isEmpty());
    }
}
