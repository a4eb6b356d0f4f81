package com.p14n.eventrelay.relay;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.eventrelay.codec.EventCodec;
import com.p14n.eventrelay.codec.EventCodecException;
import com.p14n.eventrelay.codec.JsonEventCodec;
import com.p14n.eventrelay.data.ConfigData;
import com.p14n.eventrelay.data.Event;
import com.p14n.eventrelay.data.KeySchema;
import com.p14n.eventrelay.store.FakeStore;
import com.p14n.eventrelay.telemetry.RelayMetrics;
import com.p14n.eventrelay.telemetry.TelemetryConfig;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventPublisherTest {

    private static final String REGISTRY = "icinga:subscription";

    private FakeStore store;
    private RelayMetrics metrics;
    private ConnectionManager connections;
    private SubscriptionRegistry registry;
    private EventPublisher publisher;

    @BeforeEach
    void setUp() {
        store = new FakeStore();
        metrics = new RelayMetrics(TelemetryConfig.noop().getMeter());
        connections = new ConnectionManager(new ConfigData("test"), store, metrics);
        registry = new SubscriptionRegistry(connections, KeySchema.defaults(), new ObjectMapper(), metrics);
        publisher = publisher(new JsonEventCodec());
    }

    private EventPublisher publisher(EventCodec codec) {
        return new EventPublisher(connections, registry, codec, KeySchema.defaults(), 3600, metrics,
                TelemetryConfig.noop());
    }

    private void connectWith(String... subscribers) {
        for (int i = 0; i < subscribers.length; i += 2) {
            store.putSubscriber(REGISTRY, subscribers[i], subscribers[i + 1]);
        }
        connections.connect();
        registry.refresh();
        store.clearCommands();
    }

    private static Event event(String type) {
        return Event.create(type, Map.of("host", "web-01", "service", "http"));
    }

    @Test
    void storesAndFansOutToMatchingSubscribers() {
        connectWith("sub1", "{\"eventTypes\":[\"StateChange\"]}");

        assertEquals(EventPublisher.Result.PUBLISHED, publisher.publish(event("StateChange")));
        assertEquals(EventPublisher.Result.PUBLISHED, publisher.publish(event("Notification")));

        assertEquals(List.of(
                "INCR icinga:event.idx",
                "SET icinga:event.1",
                "EXPIRE icinga:event.1 3600",
                "LPUSH icinga:event:sub1 1",
                "INCR icinga:event.idx",
                "SET icinga:event.2",
                "EXPIRE icinga:event.2 3600"), store.commands());
        assertEquals(List.of("1"), store.list("icinga:event:sub1"));
        assertEquals(3600L, store.ttl("icinga:event.2"));
    }

    @Test
    void storedBodyDecodesToOriginalEvent() {
        connectWith();
        var published = event("CheckResult");

        publisher.publish(published);

        var stored = new JsonEventCodec().decode(store.get("icinga:event.1"));
        assertEquals(published.id(), stored.id());
        assertEquals(published.type(), stored.type());
        assertEquals("web-01", stored.attributes().get("host"));
    }

    @Test
    void everyMatchingSubscriberGetsTheSameIndex() {
        connectWith(
                "sub1", "{\"eventTypes\":[\"StateChange\"]}",
                "sub2", "{\"eventTypes\":[\"StateChange\",\"Notification\"]}",
                "sub3", "{\"eventTypes\":[\"Notification\"]}");

        publisher.publish(event("StateChange"));

        assertEquals(List.of("1"), store.list("icinga:event:sub1"));
        assertEquals(List.of("1"), store.list("icinga:event:sub2"));
        assertTrue(store.list("icinga:event:sub3").isEmpty());
        assertEquals(1, store.commandsStartingWith("SET").size());
    }

    @Test
    void disconnectedPublishIssuesNoCommands() {
        assertEquals(EventPublisher.Result.SKIPPED, publisher.publish(event("StateChange")));

        assertTrue(store.commands().isEmpty());
    }

    @Test
    void transportFailureAbandonsEventAndLeavesGap() {
        connectWith("sub1", "{\"eventTypes\":[\"StateChange\"]}");
        store.failNext("SET", FakeStore.Failure.TRANSPORT);

        assertEquals(EventPublisher.Result.ABANDONED, publisher.publish(event("StateChange")));
        assertFalse(connections.isConnected());
        assertTrue(store.commandsStartingWith("EXPIRE").isEmpty());
        assertTrue(store.commandsStartingWith("LPUSH").isEmpty());

        assertEquals(EventPublisher.Result.SKIPPED, publisher.publish(event("StateChange")));

        connections.connect();
        assertEquals(EventPublisher.Result.PUBLISHED, publisher.publish(event("StateChange")));
        assertEquals(List.of("2"), store.list("icinga:event:sub1"));
    }

    @Test
    void transportFailureDuringFanOutStopsRemainingPushes() {
        connectWith(
                "sub1", "{\"eventTypes\":[\"StateChange\"]}",
                "sub2", "{\"eventTypes\":[\"StateChange\"]}");
        store.failNext("LPUSH", FakeStore.Failure.TRANSPORT);

        assertEquals(EventPublisher.Result.ABANDONED, publisher.publish(event("StateChange")));

        assertEquals(1, store.commandsStartingWith("LPUSH").size());
        assertFalse(connections.isConnected());
    }

    @Test
    void errorReplyOnPushContinuesWithNextSubscriber() {
        connectWith(
                "sub1", "{\"eventTypes\":[\"StateChange\"]}",
                "sub2", "{\"eventTypes\":[\"StateChange\"]}");
        store.failNext("LPUSH", FakeStore.Failure.ERROR);

        assertEquals(EventPublisher.Result.PUBLISHED, publisher.publish(event("StateChange")));

        assertTrue(store.list("icinga:event:sub1").isEmpty());
        assertEquals(List.of("1"), store.list("icinga:event:sub2"));
        assertTrue(connections.isConnected());
    }

    @Test
    void errorReplyOnSetStillExpiresAndPushes() {
        connectWith("sub1", "{\"eventTypes\":[\"StateChange\"]}");
        store.failNext("SET", FakeStore.Failure.ERROR);

        assertEquals(EventPublisher.Result.PUBLISHED, publisher.publish(event("StateChange")));

        assertEquals(1, store.commandsStartingWith("EXPIRE").size());
        assertEquals(List.of("1"), store.list("icinga:event:sub1"));
    }

    @Test
    void errorReplyOnIncrDropsEvent() {
        connectWith("sub1", "{\"eventTypes\":[\"StateChange\"]}");
        store.failNext("INCR", FakeStore.Failure.ERROR);

        assertEquals(EventPublisher.Result.DROPPED, publisher.publish(event("StateChange")));

        assertEquals(List.of("INCR icinga:event.idx"), store.commands());
        assertTrue(connections.isConnected());
    }

    @Test
    void encodeFailureOrphansAllocatedIndex() {
        EventCodec codec = mock(EventCodec.class);
        when(codec.encode(any())).thenThrow(new EventCodecException("boom"));
        connectWith("sub1", "{\"eventTypes\":[\"StateChange\"]}");

        assertEquals(EventPublisher.Result.ABANDONED, publisher(codec).publish(event("StateChange")));
        assertEquals(List.of("INCR icinga:event.idx"), store.commands());

        assertEquals(EventPublisher.Result.PUBLISHED, publisher.publish(event("StateChange")));
        assertEquals(List.of("2"), store.list("icinga:event:sub1"));
    }

    @Test
    void usesConfiguredPrefix() {
        var keys = new KeySchema("test:");
        var prefixed = new EventPublisher(connections,
                new SubscriptionRegistry(connections, keys, new ObjectMapper(), metrics),
                new JsonEventCodec(), keys, 60, metrics, TelemetryConfig.noop());
        connections.connect();

        prefixed.publish(event("CheckResult"));

        assertEquals(List.of("INCR test:event.idx", "SET test:event.1", "EXPIRE test:event.1 60"),
                store.commands());
    }
}
