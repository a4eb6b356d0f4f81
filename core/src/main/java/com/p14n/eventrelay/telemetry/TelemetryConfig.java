package com.p14n.eventrelay.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;

/**
 * Supplies the OpenTelemetry instruments the relay records with.
 */
public interface TelemetryConfig {

    String INSTRUMENTATION_NAME = "com.p14n.eventrelay";

    Meter getMeter();

    Tracer getTracer();

    OpenTelemetry getOpenTelemetry();

    /**
     * A configuration that records nothing.
     *
     * @return a no-op telemetry configuration
     */
    static TelemetryConfig noop() {
        OpenTelemetry ot = OpenTelemetry.noop();
        return new TelemetryConfig() {
            @Override
            public Meter getMeter() {
                return ot.getMeter(INSTRUMENTATION_NAME);
            }

            @Override
            public Tracer getTracer() {
                return ot.getTracer(INSTRUMENTATION_NAME);
            }

            @Override
            public OpenTelemetry getOpenTelemetry() {
                return ot;
            }
        };
    }
}
