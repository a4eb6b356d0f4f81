package com.p14n.eventrelay.data;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Record representing a domain event travelling over the in-process bus.
 * The relay only interprets {@code type}; the attributes are opaque and are
 * copied into the stored body unchanged.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * Event event = Event.create("StateChange", Map.of(
 *         "host", "web-01",
 *         "service", "http",
 *         "state", 2));
 * bus.publish(event);
 * }</pre>
 *
 * @param id          Unique identifier for the event
 * @param type        Event type, for example {@code CheckResult}
 * @param timestamp   When the event occurred
 * @param attributes  Domain fields, never null
 * @param traceparent OpenTelemetry trace parent identifier, may be null
 */
public record Event(
        String id,
        String type,
        Instant timestamp,
        Map<String, Object> attributes,
        String traceparent) implements Traceable {

    /**
     * Subject attribute used for tracing, when present.
     */
    public static final String SUBJECT_ATTRIBUTE = "subject";

    public Event {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates a new event with a random id, the current time and no trace
     * context.
     *
     * @param type       Event type
     * @param attributes Domain fields
     * @return A new Event instance
     * @throws IllegalArgumentException if type is null or empty
     */
    public static Event create(String type, Map<String, Object> attributes) {
        return create(UUID.randomUUID().toString(), type, Instant.now(), attributes, null);
    }

    /**
     * Creates a new event with validation of required fields.
     *
     * @param id          Unique identifier for the event
     * @param type        Event type
     * @param timestamp   When the event occurred, defaults to now when null
     * @param attributes  Domain fields
     * @param traceparent OpenTelemetry trace parent identifier
     * @return A new Event instance
     * @throws IllegalArgumentException if id or type is null or empty
     */
    public static Event create(String id, String type, Instant timestamp, Map<String, Object> attributes,
            String traceparent) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("type cannot be null or empty");
        }
        return new Event(id, type, timestamp == null ? Instant.now() : timestamp, attributes, traceparent);
    }

    public Event withTraceparent(String traceparent) {
        return new Event(id, type, timestamp, attributes, traceparent);
    }

    @Override
    public String topic() {
        return type;
    }

    @Override
    public String subject() {
        Object subject = attributes.get(SUBJECT_ATTRIBUTE);
        return subject == null ? "" : subject.toString();
    }
}
