package com.p14n.eventrelay.broker;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.p14n.eventrelay.data.Event;
import com.p14n.eventrelay.telemetry.TelemetryConfig;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 2, unit = TimeUnit.SECONDS)
class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus(TelemetryConfig.noop());
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static Event event(String type) {
        return Event.create(type, Map.of("host", "web-01"));
    }

    @Test
    void routesEventsByType() throws Exception {
        var states = new EventQueue("states", Set.of("StateChange"));
        var checks = new EventQueue("checks", Set.of("CheckResult"));
        bus.register(states);
        bus.register(checks);
        states.addClient(this);
        checks.addClient(this);

        var published = event("StateChange");
        bus.publish(published);

        assertEquals(published, states.waitForEvent(this, 100, TimeUnit.MILLISECONDS));
        assertEquals(0, checks.size());
    }

    @Test
    void unmatchedTypeIsDiscarded() {
        var states = new EventQueue("states", Set.of("StateChange"));
        bus.register(states);
        states.addClient(this);

        bus.publish(event("Notification"));

        assertEquals(0, states.size());
    }

    @Test
    void duplicateQueueNameIsRejected() {
        bus.register(new EventQueue("relay", Set.of("StateChange")));

        assertThrows(IllegalStateException.class,
                () -> bus.register(new EventQueue("relay", Set.of("CheckResult"))));
    }

    @Test
    void registerOnClosedBusFails() {
        bus.close();

        assertThrows(IllegalStateException.class,
                () -> bus.register(new EventQueue("relay", Set.of("StateChange"))));
    }

    @Test
    void unregisterOnlyWhenUnused() {
        var queue = new EventQueue("relay", Set.of("StateChange"));
        bus.register(queue);
        queue.addClient(this);

        assertFalse(bus.unregisterIfUnused("relay", queue));
        assertSame(queue, bus.getQueue("relay"));

        queue.removeClient(this);
        assertTrue(bus.unregisterIfUnused("relay", queue));
        assertNull(bus.getQueue("relay"));
        assertTrue(bus.getQueues().isEmpty());
    }

    @Test
    void failingSubscriberDoesNotBlockOthers() throws Exception {
        var failures = new int[1];
        bus.subscribe("StateChange", new MessageSubscriber<>() {
            @Override
            public void onMessage(Event message) {
                throw new RuntimeException("Fell over intentionally");
            }

            @Override
            public void onError(Throwable error) {
                failures[0]++;
            }
        });
        var queue = new EventQueue("relay", Set.of("StateChange"));
        bus.register(queue);
        queue.addClient(this);

        bus.publish(event("StateChange"));

        assertEquals(1, failures[0]);
        assertNotNull(queue.waitForEvent(this, 100, TimeUnit.MILLISECONDS));
    }

    @Test
    void publishNullFails() {
        assertThrows(IllegalArgumentException.class, () -> bus.publish((Event) null));
    }
}
