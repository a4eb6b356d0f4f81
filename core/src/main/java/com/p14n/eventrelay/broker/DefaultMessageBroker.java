package com.p14n.eventrelay.broker;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.data.Traceable;
import com.p14n.eventrelay.telemetry.BrokerMetrics;
import com.p14n.eventrelay.telemetry.TelemetryConfig;

import static com.p14n.eventrelay.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * Abstract base implementation of an in-process publish-subscribe broker.
 *
 * <p>
 * Messages are delivered synchronously on the publishing thread, in
 * subscription order. Subscribers are expected to hand messages off quickly
 * (for example into a queue); a subscriber that throws has its
 * {@link MessageSubscriber#onError(Throwable)} called and does not prevent
 * delivery to the remaining subscribers.
 * </p>
 *
 * @param <InT>  The input message type, must implement {@link Traceable}
 * @param <OutT> The output message type delivered to subscribers
 */
public abstract class DefaultMessageBroker<InT extends Traceable, OutT>
        implements MessageBroker<InT, OutT>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMessageBroker.class);

    /**
     * Topic subscribers. Key is the topic name, value is a thread-safe set of
     * subscribers.
     */
    protected final ConcurrentHashMap<String, Set<MessageSubscriber<OutT>>> topicSubscribers = new ConcurrentHashMap<>();

    protected final AtomicBoolean closed = new AtomicBoolean(false);

    protected final BrokerMetrics metrics;

    protected final Tracer tracer;

    protected final OpenTelemetry openTelemetry;

    protected DefaultMessageBroker(TelemetryConfig telemetry) {
        this.metrics = new BrokerMetrics(telemetry.getMeter());
        this.tracer = telemetry.getTracer();
        this.openTelemetry = telemetry.getOpenTelemetry();
    }

    /**
     * Checks if a message can be processed for a given topic.
     *
     * @param topic   The topic to check
     * @param message The message to validate
     * @return true if the topic has subscribers
     * @throws IllegalStateException    if the broker is closed
     * @throws IllegalArgumentException if topic or message is null
     */
    protected boolean canProcess(String topic, InT message) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }

        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        Set<MessageSubscriber<OutT>> subscribers = topicSubscribers.get(topic);
        return subscribers != null && !subscribers.isEmpty();
    }

    @Override
    public void publish(String topic, InT message) {
        if (!canProcess(topic, message)) {
            return;
        }

        metrics.recordPublished(topic);

        Set<MessageSubscriber<OutT>> subscribers = topicSubscribers.get(topic);
        if (subscribers == null) {
            return;
        }
        processWithTelemetry(openTelemetry, tracer, message, "bus_publish", () -> {
            OutT converted = convert(message);
            for (MessageSubscriber<OutT> subscriber : subscribers) {
                try {
                    subscriber.onMessage(converted);
                    metrics.recordDelivered(topic);
                } catch (RuntimeException e) {
                    logger.atWarn()
                            .setCause(e)
                            .addArgument(message.id())
                            .addArgument(topic)
                            .log("Subscriber failed to accept message {} on {}");
                    try {
                        subscriber.onError(e);
                    } catch (RuntimeException nested) {
                        logger.atDebug().setCause(nested).log("Subscriber error handler failed");
                    }
                }
            }
            return null;
        });
    }

    /**
     * Subscribes a message handler to a specific topic.
     *
     * @param topic      The topic to subscribe to
     * @param subscriber The subscriber to add
     * @return true if the subscription was added, false if it already existed
     * @throws IllegalStateException    if the broker is closed
     * @throws IllegalArgumentException if topic or subscriber is null
     */
    @Override
    public boolean subscribe(String topic, MessageSubscriber<OutT> subscriber) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }

        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        boolean added = topicSubscribers
                .computeIfAbsent(topic, k -> new CopyOnWriteArraySet<>())
                .add(subscriber);

        if (added) {
            metrics.recordSubscriberAdded(topic);
        }

        return added;
    }

    /**
     * Unsubscribes a message handler from a specific topic. The topic entry is
     * dropped when its last subscriber leaves.
     *
     * @param topic      The topic to unsubscribe from
     * @param subscriber The subscriber to remove
     * @return true if the subscription was removed, false if it didn't exist
     * @throws IllegalArgumentException if topic or subscriber is null
     */
    @Override
    public boolean unsubscribe(String topic, MessageSubscriber<OutT> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        boolean[] removed = new boolean[1];
        topicSubscribers.computeIfPresent(topic, (t, subscribers) -> {
            removed[0] = subscribers.remove(subscriber);
            return subscribers.isEmpty() ? null : subscribers;
        });
        if (removed[0]) {
            metrics.recordSubscriberRemoved(topic);
        }
        return removed[0];
    }

    /**
     * Closes the broker and removes all subscribers.
     */
    @Override
    public void close() {
        closed.set(true);
        topicSubscribers.clear();
    }
}
