package com.p14n.eventrelay.telemetry;

import io.opentelemetry.context.propagation.TextMapGetter;

import java.util.Map;

/**
 * Reads trace context entries from a String-to-String map carrier, used to
 * restore the {@code traceparent} an event was published with.
 */
public class MapTextMapGetter implements TextMapGetter<Map<String, String>> {

    @Override
    public String get(Map<String, String> carrier, String key) {
        return carrier == null ? null : carrier.get(key);
    }

    @Override
    public Iterable<String> keys(Map<String, String> carrier) {
        return carrier.keySet();
    }
}
