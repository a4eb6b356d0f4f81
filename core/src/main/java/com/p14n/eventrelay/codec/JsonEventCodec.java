package com.p14n.eventrelay.codec;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.eventrelay.data.Event;

/**
 * Encodes an event as a flat JSON object: the domain attributes plus the
 * reserved fields {@code type}, {@code id}, {@code timestamp} (ISO-8601) and,
 * when present, {@code traceparent}. Reserved fields win over attributes of
 * the same name.
 *
 * <pre>{@code
 * {"host":"web-01","state":2,"type":"StateChange","id":"4f1c...","timestamp":"2024-03-01T10:15:30Z"}
 * }</pre>
 */
public class JsonEventCodec implements EventCodec {

    static final String TYPE = "type";
    static final String ID = "id";
    static final String TIMESTAMP = "timestamp";
    static final String TRACEPARENT = "traceparent";

    private final ObjectMapper mapper;

    public JsonEventCodec() {
        this(new ObjectMapper());
    }

    public JsonEventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String encode(Event event) {
        try {
            ObjectNode node = mapper.valueToTree(event.attributes());
            node.put(TYPE, event.type());
            node.put(ID, event.id());
            node.put(TIMESTAMP, event.timestamp().toString());
            if (event.traceparent() != null) {
                node.put(TRACEPARENT, event.traceparent());
            }
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventCodecException("Cannot encode event " + event.id(), e);
        }
    }

    @Override
    public Event decode(String body) {
        JsonNode node;
        try {
            node = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EventCodecException("Malformed event body", e);
        }
        if (node == null || !node.isObject()) {
            throw new EventCodecException("Event body is not a JSON object");
        }
        ObjectNode object = (ObjectNode) node;
        String type = text(object.remove(TYPE));
        String id = text(object.remove(ID));
        String timestamp = text(object.remove(TIMESTAMP));
        String traceparent = text(object.remove(TRACEPARENT));
        if (type == null || id == null) {
            throw new EventCodecException("Event body lacks type or id");
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<String> names = object.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            attributes.put(name, mapper.convertValue(object.get(name), Object.class));
        }

        try {
            Instant time = timestamp == null ? null : Instant.parse(timestamp);
            return Event.create(id, type, time, attributes, traceparent);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new EventCodecException("Invalid event body", e);
        }
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
