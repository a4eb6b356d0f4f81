package com.p14n.eventrelay.relay;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.broker.EventBus;
import com.p14n.eventrelay.broker.EventQueue;
import com.p14n.eventrelay.data.Event;
import com.p14n.eventrelay.telemetry.RelayMetrics;

/**
 * Drains the relay's bus queue on a dedicated thread and forwards every event
 * to a handler. The loop never touches the store itself.
 *
 * <p>
 * On {@link #start()} a queue with a random unique name is registered on the
 * bus for {@link #EVENT_TYPES}. On {@link #stop()} the loop detaches from the
 * queue and unregisters it if nothing else uses it.
 * </p>
 */
public class EventIngestionLoop implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventIngestionLoop.class);

    /**
     * Event types the relay listens for and subscribers can filter on.
     */
    public static final Set<String> EVENT_TYPES = Set.of(
            "CheckResult",
            "StateChange",
            "Notification",
            "AcknowledgementSet",
            "AcknowledgementCleared",
            "CommentAdded",
            "CommentRemoved",
            "DowntimeAdded",
            "DowntimeRemoved",
            "DowntimeStarted",
            "DowntimeTriggered");

    private static final long DEFAULT_POLL_MILLIS = 500;

    private final EventBus bus;
    private final Consumer<Event> handler;
    private final RelayMetrics metrics;
    private final long pollMillis;
    private final String queueName = UUID.randomUUID().toString();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private EventQueue queue;
    private Thread thread;

    public EventIngestionLoop(EventBus bus, Consumer<Event> handler, RelayMetrics metrics) {
        this(bus, handler, metrics, DEFAULT_POLL_MILLIS);
    }

    public EventIngestionLoop(EventBus bus, Consumer<Event> handler, RelayMetrics metrics, long pollMillis) {
        this.bus = bus;
        this.handler = handler;
        this.metrics = metrics;
        this.pollMillis = pollMillis;
    }

    /**
     * Registers the queue and starts the listener thread.
     *
     * @throws IllegalStateException if already started or the queue cannot be
     *                               registered
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Ingestion loop already started");
        }
        EventQueue created = new EventQueue(queueName, EVENT_TYPES);
        try {
            bus.register(created);
        } catch (RuntimeException e) {
            running.set(false);
            throw new IllegalStateException("Cannot register event queue " + queueName, e);
        }
        created.addClient(this);
        queue = created;

        thread = new Thread(this::run, "event-relay-ingest-" + queueName.substring(0, 8));
        thread.setDaemon(true);
        thread.start();
        logger.atDebug().addArgument(queueName).log("Listening on event queue {}");
    }

    private void run() {
        while (running.get()) {
            Event event;
            try {
                event = queue.waitForEvent(this, pollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (event == null) {
                continue;
            }

            metrics.recordReceived(event.type());
            try {
                handler.accept(event);
            } catch (RuntimeException e) {
                logger.atError()
                        .setCause(e)
                        .addArgument(event.id())
                        .log("Failed to hand off event {}");
            }
        }
    }

    /**
     * Stops the listener thread and releases the queue. Events still buffered
     * in the queue are discarded.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        queue.removeClient(this);
        bus.unregisterIfUnused(queueName, queue);
        logger.atDebug().addArgument(queueName).log("Released event queue {}");
    }

    public String getQueueName() {
        return queueName;
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
    }
}
