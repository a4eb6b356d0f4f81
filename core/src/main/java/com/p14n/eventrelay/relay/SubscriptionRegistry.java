package com.p14n.eventrelay.relay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.eventrelay.data.KeySchema;
import com.p14n.eventrelay.data.SubscriberFilter;
import com.p14n.eventrelay.telemetry.RelayMetrics;

/**
 * Subscriber to event-type filters, reloaded from the store's registry hash.
 *
 * <p>
 * Each hash field is a subscriber id, each value a JSON descriptor such as
 * {@code {"eventTypes": ["StateChange", "Notification"]}}. A successful
 * {@link #refresh()} swaps in a complete new mapping; a failed one keeps the
 * previous mapping.
 * </p>
 */
public class SubscriptionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    static final String EVENT_TYPES_FIELD = "eventTypes";
    static final String LEGACY_TYPES_FIELD = "types";

    private final ConnectionManager connections;
    private final KeySchema keys;
    private final ObjectMapper mapper;
    private final RelayMetrics metrics;
    private volatile Map<String, SubscriberFilter> subscriptions = Map.of();

    public SubscriptionRegistry(ConnectionManager connections, KeySchema keys, ObjectMapper mapper,
            RelayMetrics metrics) {
        this.connections = connections;
        this.keys = keys;
        this.mapper = mapper;
        this.metrics = metrics;
    }

    /**
     * Reloads the mapping from the store. Does nothing while disconnected.
     *
     * @return true if the mapping was replaced
     */
    public boolean refresh() {
        if (!connections.isConnected()) {
            return false;
        }

        String registryKey = keys.registryKey();
        Optional<Map<String, String>> reply = connections.execute("HGETALL " + registryKey,
                c -> c.hgetall(registryKey));
        if (reply.isEmpty()) {
            logger.atDebug().log("Keeping previous subscriptions");
            return false;
        }

        Map<String, SubscriberFilter> updated = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : reply.get().entrySet()) {
            updated.put(entry.getKey(), decode(entry.getKey(), entry.getValue()));
        }
        subscriptions = Collections.unmodifiableMap(updated);
        metrics.recordRefresh();

        logger.atDebug().addArgument(updated.size()).log("Loaded {} subscriptions");
        return true;
    }

    SubscriberFilter decode(String subscriberId, String descriptor) {
        JsonNode node;
        try {
            node = mapper.readTree(descriptor == null ? "" : descriptor);
        } catch (JsonProcessingException e) {
            logger.atWarn()
                    .addArgument(subscriberId)
                    .addArgument(e.getOriginalMessage())
                    .log("Malformed descriptor for subscriber {}: {}");
            return SubscriberFilter.empty(subscriberId);
        }
        if (node == null || !node.isObject()) {
            logger.atWarn().addArgument(subscriberId).log("Descriptor for subscriber {} is not a JSON object");
            return SubscriberFilter.empty(subscriberId);
        }

        JsonNode types = node.has(EVENT_TYPES_FIELD) ? node.get(EVENT_TYPES_FIELD) : node.get(LEGACY_TYPES_FIELD);
        if (types == null || types.isNull()) {
            return SubscriberFilter.empty(subscriberId);
        }
        if (!types.isArray()) {
            logger.atWarn().addArgument(subscriberId).log("Event types of subscriber {} are not an array");
            return SubscriberFilter.empty(subscriberId);
        }

        Set<String> eventTypes = new LinkedHashSet<>();
        for (JsonNode type : types) {
            if (type.isTextual()) {
                eventTypes.add(type.asText());
            } else {
                logger.atWarn()
                        .addArgument(type)
                        .addArgument(subscriberId)
                        .log("Ignoring event type {} of subscriber {}");
            }
        }
        return new SubscriberFilter(subscriberId, eventTypes);
    }

    /**
     * The mapping installed by the last successful refresh.
     *
     * @return an immutable subscriber id to filter map
     */
    public Map<String, SubscriberFilter> snapshot() {
        return subscriptions;
    }

    /**
     * Subscribers whose filter contains the type, in registry order.
     *
     * @param type the event type
     * @return matching subscriber ids
     */
    public List<String> subscribersFor(String type) {
        List<String> matching = new ArrayList<>();
        for (SubscriberFilter filter : subscriptions.values()) {
            if (filter.matches(type)) {
                matching.add(filter.subscriberId());
            }
        }
        return matching;
    }
}
