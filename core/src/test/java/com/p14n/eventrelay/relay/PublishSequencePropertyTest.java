package com.p14n.eventrelay.relay;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.eventrelay.codec.JsonEventCodec;
import com.p14n.eventrelay.data.ConfigData;
import com.p14n.eventrelay.data.Event;
import com.p14n.eventrelay.data.KeySchema;
import com.p14n.eventrelay.store.FakeStore;
import com.p14n.eventrelay.telemetry.RelayMetrics;
import com.p14n.eventrelay.telemetry.TelemetryConfig;

import net.jqwik.api.*;

import static org.junit.jupiter.api.Assertions.*;

class PublishSequencePropertyTest {
    private static final Logger logger = LoggerFactory.getLogger(PublishSequencePropertyTest.class);
    private static final String REGISTRY = "icinga:subscription";
    private static final List<String> TYPES = new ArrayList<>(EventIngestionLoop.EVENT_TYPES);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String[] COMMANDS = { "INCR", "SET", "EXPIRE", "LPUSH" };

    @Provide
    Arbitrary<Long> randomSeeds() {
        return Arbitraries.longs().between(1L, Long.MAX_VALUE);
    }

    @Property(tries = 50)
    void indicesAreUniqueIncreasingAndRoutedByFilter(@ForAll("randomSeeds") long seed)
            throws JsonProcessingException {
        logger.atDebug().log("Testing with seed: {}", seed);
        Random random = new Random(seed);

        var store = new FakeStore();
        var metrics = new RelayMetrics(TelemetryConfig.noop().getMeter());
        var connections = new ConnectionManager(new ConfigData("prop"), store, metrics);
        var registry = new SubscriptionRegistry(connections, KeySchema.defaults(), new ObjectMapper(), metrics);
        var publisher = new EventPublisher(connections, registry, new JsonEventCodec(), KeySchema.defaults(),
                3600, metrics, TelemetryConfig.noop());

        Map<String, Set<String>> filters = new LinkedHashMap<>();
        int subscribers = random.nextInt(4) + 1;
        for (int s = 0; s < subscribers; s++) {
            Set<String> types = new HashSet<>();
            for (String type : TYPES) {
                if (random.nextInt(3) == 0) {
                    types.add(type);
                }
            }
            filters.put("sub" + s, types);
            store.putSubscriber(REGISTRY, "sub" + s, descriptor(types));
        }
        connections.connect();
        registry.refresh();

        Map<Long, String> typeByIndex = new LinkedHashMap<>();
        int events = random.nextInt(60) + 1;
        for (int i = 0; i < events; i++) {
            if (random.nextInt(10) == 0) {
                store.failNext(COMMANDS[random.nextInt(COMMANDS.length)], FakeStore.Failure.TRANSPORT);
            }
            if (!connections.isConnected() && random.nextBoolean()) {
                connections.connect();
            }
            String type = TYPES.get(random.nextInt(TYPES.size()));
            String sequenceBefore = store.get("icinga:event.idx");
            var result = publisher.publish(Event.create(type, Map.of("n", i)));
            String sequenceAfter = store.get("icinga:event.idx");
            if (result == EventPublisher.Result.PUBLISHED) {
                typeByIndex.put(Long.parseLong(sequenceAfter), type);
            }
            if (result == EventPublisher.Result.SKIPPED) {
                assertEquals(sequenceBefore, sequenceAfter);
            }
        }

        List<Long> setIndices = new ArrayList<>();
        for (String command : store.commandsStartingWith("SET")) {
            setIndices.add(Long.parseLong(command.substring(command.lastIndexOf('.') + 1)));
        }
        for (int i = 1; i < setIndices.size(); i++) {
            assertTrue(setIndices.get(i) > setIndices.get(i - 1), "indices must strictly increase");
        }

        for (var entry : filters.entrySet()) {
            List<String> pushed = store.list("icinga:event:" + entry.getKey());
            Set<String> seen = new HashSet<>();
            for (String value : pushed) {
                assertTrue(seen.add(value), "index pushed twice");
                long index = Long.parseLong(value);
                assertTrue(setIndices.contains(index), "pushed index without stored body");
            }
            for (var published : typeByIndex.entrySet()) {
                boolean expected = entry.getValue().contains(published.getValue());
                assertEquals(expected, seen.contains(Long.toString(published.getKey())));
            }
        }
    }

    private static String descriptor(Set<String> types) throws JsonProcessingException {
        return MAPPER.writeValueAsString(Map.of("eventTypes", types));
    }
}
