package com.p14n.eventrelay.relay;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.codec.EventCodec;
import com.p14n.eventrelay.codec.EventCodecException;
import com.p14n.eventrelay.data.Event;
import com.p14n.eventrelay.data.KeySchema;
import com.p14n.eventrelay.telemetry.RelayMetrics;
import com.p14n.eventrelay.telemetry.TelemetryConfig;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.eventrelay.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Writes one event into the store.
 *
 * <p>
 * The publishing process:
 * </p>
 * <ol>
 * <li>{@code INCR} the global sequence key to obtain the event's index</li>
 * <li>{@code SET} the encoded body under the index's event key, then
 * {@code EXPIRE} it</li>
 * <li>{@code LPUSH} the index onto the list of every subscriber whose filter
 * contains the event type</li>
 * </ol>
 *
 * <p>
 * All subscribers share the single stored body. A transport failure at any
 * step tears the connection down and abandons the rest of the event; an
 * index that was already allocated is not reused. Error replies to
 * {@code SET}, {@code EXPIRE} and {@code LPUSH} are logged and publishing
 * carries on.
 * </p>
 */
public class EventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    /**
     * How far a single publish got.
     */
    public enum Result {
        /** Not connected, nothing was sent. */
        SKIPPED,
        /** No index could be allocated. */
        DROPPED,
        /** An index was allocated but a later step lost the connection. */
        ABANDONED,
        /** All steps ran. */
        PUBLISHED
    }

    private final ConnectionManager connections;
    private final SubscriptionRegistry registry;
    private final EventCodec codec;
    private final KeySchema keys;
    private final long ttlSeconds;
    private final RelayMetrics metrics;
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;

    public EventPublisher(ConnectionManager connections, SubscriptionRegistry registry, EventCodec codec,
            KeySchema keys, long ttlSeconds, RelayMetrics metrics, TelemetryConfig telemetry) {
        this.connections = connections;
        this.registry = registry;
        this.codec = codec;
        this.keys = keys;
        this.ttlSeconds = ttlSeconds;
        this.metrics = metrics;
        this.openTelemetry = telemetry.getOpenTelemetry();
        this.tracer = telemetry.getTracer();
    }

    public Result publish(Event event) {
        if (!connections.isConnected()) {
            metrics.recordDropped("disconnected");
            logger.atDebug().addArgument(event.id()).log("Not connected, dropping event {}");
            return Result.SKIPPED;
        }
        return processWithTelemetry(openTelemetry, tracer, event, "relay_publish", () -> doPublish(event));
    }

    private Result doPublish(Event event) {
        String sequenceKey = keys.sequenceKey();
        Optional<Long> allocated = connections.execute("INCR " + sequenceKey, c -> c.incr(sequenceKey));
        if (allocated.isEmpty()) {
            metrics.recordDropped("no_index");
            logger.atWarn().addArgument(event.id()).log("Could not allocate an index for event {}");
            return Result.DROPPED;
        }
        long index = allocated.get();

        String body;
        try {
            body = codec.encode(event);
        } catch (EventCodecException e) {
            metrics.recordDropped("encode");
            logger.atWarn()
                    .setCause(e)
                    .addArgument(event.id())
                    .addArgument(index)
                    .log("Cannot encode event {}, index {} stays unused");
            return Result.ABANDONED;
        }

        String eventKey = keys.eventKey(index);
        connections.execute("SET " + eventKey, c -> c.set(eventKey, body));
        if (!connections.isConnected()) {
            return abandoned(event, index);
        }
        connections.execute("EXPIRE " + eventKey, c -> c.expire(eventKey, ttlSeconds));
        if (!connections.isConnected()) {
            return abandoned(event, index);
        }
        metrics.recordPublished(event.type());

        List<String> subscribers = registry.subscribersFor(event.type());
        String value = Long.toString(index);
        for (String subscriberId : subscribers) {
            String listKey = keys.subscriberListKey(subscriberId);
            Optional<Long> length = connections.execute("LPUSH " + listKey, c -> c.lpush(listKey, value));
            if (!connections.isConnected()) {
                return abandoned(event, index);
            }
            if (length.isPresent()) {
                metrics.recordPush(subscriberId);
            }
        }

        logger.atDebug()
                .addArgument(event.type())
                .addArgument(index)
                .addArgument(subscribers.size())
                .log("Published {} as index {} to {} subscribers");
        return Result.PUBLISHED;
    }

    private Result abandoned(Event event, long index) {
        metrics.recordDropped("connection_lost");
        logger.atWarn()
                .addArgument(event.id())
                .addArgument(index)
                .log("Connection lost while publishing event {} (index {})");
        return Result.ABANDONED;
    }
}
