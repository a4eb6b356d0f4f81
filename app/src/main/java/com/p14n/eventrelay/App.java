package com.p14n.eventrelay;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.broker.EventBus;
import com.p14n.eventrelay.data.ConfigData;
import com.p14n.eventrelay.data.Event;
import com.p14n.eventrelay.data.KeySchema;
import com.p14n.eventrelay.relay.EventRelay;
import com.p14n.eventrelay.store.TransportStoreConnector;
import com.p14n.eventrelay.store.lettuce.LettuceStoreConnector;
import com.p14n.eventrelay.store.redisson.RedissonStoreConnector;
import com.p14n.eventrelay.telemetry.DefaultTelemetryConfig;
import com.p14n.eventrelay.telemetry.OpenTelemetryFunctions;
import com.p14n.eventrelay.telemetry.TelemetryConfig;

import io.opentelemetry.api.trace.Tracer;

public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static String[] envVals(String name) {
        var e = System.getenv(name);
        if (e != null && !e.isBlank()) {
            return e.split(",");
        }
        return new String[] {};
    }

    private static String envVal(String name, String fallback) {
        var vals = envVals(name);
        return vals.length > 0 ? vals[0].trim() : fallback;
    }

    private static int envInt(String name, int fallback) {
        var val = envVal(name, null);
        if (val == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + val, e);
        }
    }

    static ConfigData configFromEnv() {
        return new ConfigData(
                envVal("APP_RELAY_NAME", ConfigData.DEFAULT_NAME),
                envVal("APP_REDIS_HOST", ConfigData.DEFAULT_HOST),
                envInt("APP_REDIS_PORT", ConfigData.DEFAULT_PORT),
                envVal("APP_REDIS_PATH", ""),
                envVal("APP_REDIS_PASSWORD", ""),
                envVal("APP_KEY_PREFIX", KeySchema.DEFAULT_PREFIX),
                envInt("APP_RECONNECT_INTERVAL", ConfigData.DEFAULT_INTERVAL),
                envInt("APP_SUBSCRIPTION_INTERVAL", ConfigData.DEFAULT_INTERVAL),
                envInt("APP_EVENT_TTL", ConfigData.DEFAULT_EVENT_TTL));
    }

    public static void main(String[] args) throws Exception {
        var cfg = configFromEnv();
        var demoInterval = envInt("APP_DEMO_INTERVAL", 0);
        run(cfg, demoInterval);
    }

    private static void close(AutoCloseable c) {
        try {
            if (c != null)
                c.close();
        } catch (Exception e) {
            logger.atWarn().setCause(e).log("Error during shutdown");
        }
    }

    private static void publishContinuously(EventBus bus, TelemetryConfig telemetry, long gapMillis)
            throws InterruptedException {
        Tracer tracer = telemetry.getTracer();
        var states = new String[] { "OK", "WARNING", "CRITICAL", "UNKNOWN" };
        while (!Thread.currentThread().isInterrupted()) {
            OpenTelemetryFunctions.processWithTelemetry(tracer, "publish_demo_event", () -> {
                var state = states[ThreadLocalRandom.current().nextInt(states.length)];
                var event = Event.create("CheckResult", Map.of(
                        "host", "demo-host",
                        "service", "demo-service",
                        "state", state));
                bus.publish(event.withTraceparent(
                        OpenTelemetryFunctions.serializeTraceContext(telemetry.getOpenTelemetry())));
                return null;
            });
            Thread.sleep(gapMillis);
        }
    }

    private static void run(ConfigData cfg, int demoInterval) throws InterruptedException {
        var telemetry = new DefaultTelemetryConfig(cfg.name());
        var bus = new EventBus(telemetry);
        var relay = new EventRelay(cfg, bus,
                new TransportStoreConnector(new RedissonStoreConnector(), new LettuceStoreConnector()), telemetry);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            close(relay);
            close(bus);
            close(telemetry);
        }, "event-relay-shutdown"));

        relay.start();

        if (demoInterval > 0) {
            publishContinuously(bus, telemetry, demoInterval);
        } else {
            Thread.currentThread().join();
        }
    }

}
