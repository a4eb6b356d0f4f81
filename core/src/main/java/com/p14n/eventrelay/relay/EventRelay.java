package com.p14n.eventrelay.relay;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.eventrelay.broker.AsyncExecutor;
import com.p14n.eventrelay.broker.DefaultExecutor;
import com.p14n.eventrelay.broker.EventBus;
import com.p14n.eventrelay.codec.EventCodec;
import com.p14n.eventrelay.codec.JsonEventCodec;
import com.p14n.eventrelay.data.Event;
import com.p14n.eventrelay.data.RelayConfig;
import com.p14n.eventrelay.store.StoreConnector;
import com.p14n.eventrelay.telemetry.RelayMetrics;
import com.p14n.eventrelay.telemetry.TelemetryConfig;

/**
 * Relays events from the in-process {@link EventBus} into the store.
 *
 * <p>
 * Three kinds of work reach the store, all through one
 * {@link CommandPipeline}:
 * </p>
 * <ul>
 * <li>reconnect attempts, every {@code reconnectInterval} seconds</li>
 * <li>subscription refreshes, every {@code subscriptionInterval} seconds</li>
 * <li>one publish per event taken off the bus</li>
 * </ul>
 * <p>
 * Both timers fire once immediately on {@link #start()}. Timer callbacks and
 * the ingestion thread only submit work; the pipeline worker is the only
 * thread that talks to the store.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var config = new ConfigData("relay", "127.0.0.1", 6379, "");
 * try (var relay = new EventRelay(config, bus, new RedissonStoreConnector(), telemetry)) {
 *     relay.start();
 *     bus.publish(Event.create("StateChange", Map.of("host", "web-01")));
 * }
 * }</pre>
 */
public class EventRelay implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventRelay.class);

    private final RelayConfig config;
    private final AsyncExecutor asyncExecutor;
    private final ConnectionManager connections;
    private final SubscriptionRegistry registry;
    private final EventPublisher publisher;
    private final CommandPipeline pipeline;
    private final EventIngestionLoop ingestion;
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    /**
     * Creates a relay with a default executor and JSON event bodies.
     *
     * @param config    relay configuration
     * @param bus       bus to take events from
     * @param connector opens store connections
     * @param telemetry metrics and tracing
     */
    public EventRelay(RelayConfig config, EventBus bus, StoreConnector connector, TelemetryConfig telemetry) {
        this(config, bus, connector, new DefaultExecutor(1), new JsonEventCodec(), telemetry);
    }

    /**
     * Creates a relay with a custom executor and codec.
     *
     * @param config        relay configuration
     * @param bus           bus to take events from
     * @param connector     opens store connections
     * @param asyncExecutor timers and the serial worker; owned by the relay
     * @param codec         encodes event bodies
     * @param telemetry     metrics and tracing
     */
    public EventRelay(RelayConfig config, EventBus bus, StoreConnector connector, AsyncExecutor asyncExecutor,
            EventCodec codec, TelemetryConfig telemetry) {
        this.config = config;
        this.asyncExecutor = asyncExecutor;

        RelayMetrics metrics = new RelayMetrics(telemetry.getMeter());
        this.connections = new ConnectionManager(config, connector, metrics);
        this.registry = new SubscriptionRegistry(connections, config.keys(), new ObjectMapper(), metrics);
        this.publisher = new EventPublisher(connections, registry, codec, config.keys(), config.eventTtl(),
                metrics, telemetry);
        this.pipeline = new CommandPipeline(asyncExecutor, telemetry.getTracer());
        this.ingestion = new EventIngestionLoop(bus, this::handleEvent, metrics);
    }

    /**
     * Starts the timers and the ingestion loop.
     *
     * @throws IllegalStateException if already started, or if the bus queue
     *                               cannot be registered
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Relay '" + config.name() + "' already started");
        }

        logger.atInfo().addArgument(config.name()).log("'{}' started.");

        timers.add(asyncExecutor.scheduleAtFixedRate(this::reconnectTimerHandler,
                0, config.reconnectInterval(), TimeUnit.SECONDS));
        timers.add(asyncExecutor.scheduleAtFixedRate(this::subscriptionTimerHandler,
                0, config.subscriptionInterval(), TimeUnit.SECONDS));

        try {
            ingestion.start();
        } catch (RuntimeException e) {
            logger.atError().setCause(e).addArgument(config.name()).log("Failed to start '{}'");
            stop();
            throw e;
        }
    }

    void reconnectTimerHandler() {
        pipeline.submit(WorkItem.of(WorkItem.Kind.RECONNECT, connections::connect));
    }

    void subscriptionTimerHandler() {
        pipeline.submit(WorkItem.of(WorkItem.Kind.REFRESH_SUBSCRIPTIONS, registry::refresh));
    }

    void handleEvent(Event event) {
        pipeline.submit(new WorkItem(WorkItem.Kind.PUBLISH_EVENT, event.type() + " " + event.id(),
                () -> publisher.publish(event)));
    }

    /**
     * Stops the ingestion loop and the timers, lets queued work finish, and
     * closes the store connection. Safe to call more than once.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        logger.atInfo().addArgument(config.name()).log("'{}' stopped.");

        ingestion.stop();
        for (ScheduledFuture<?> timer : timers) {
            timer.cancel(false);
        }
        timers.clear();

        pipeline.submit(WorkItem.of(WorkItem.Kind.TEARDOWN, connections::teardown));
        pipeline.close();
        try {
            asyncExecutor.close();
        } catch (Exception e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(asyncExecutor.getClass().getSimpleName())
                    .log("Error closing {}");
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Items queued on the pipeline and not yet finished.
     *
     * @return pending work item count
     */
    public int pendingWork() {
        return pipeline.pending();
    }

    /**
     * The subscription mapping currently in use.
     *
     * @return the registry
     */
    public SubscriptionRegistry getRegistry() {
        return registry;
    }

    public String getQueueName() {
        return ingestion.getQueueName();
    }

    @Override
    public void close() {
        stop();
    }
}
