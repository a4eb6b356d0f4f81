package com.p14n.eventrelay.broker;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.data.Event;
import com.p14n.eventrelay.telemetry.TelemetryConfig;

/**
 * The in-process event bus. Events are routed by their type, which serves as
 * the topic. Listeners attach through named {@link EventQueue}s.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * EventBus bus = new EventBus(telemetry);
 * EventQueue queue = new EventQueue("relay", Set.of("CheckResult"));
 * bus.register(queue);
 * bus.publish(Event.create("CheckResult", Map.of("host", "web-01")));
 * }</pre>
 */
public class EventBus extends DefaultMessageBroker<Event, Event> {

    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, EventQueue> queues = new ConcurrentHashMap<>();

    public EventBus(TelemetryConfig telemetry) {
        super(telemetry);
    }

    @Override
    public Event convert(Event m) {
        return m;
    }

    /**
     * Publishes an event to every queue registered for its type.
     *
     * @param event the event to publish
     */
    public void publish(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        publish(event.type(), event);
    }

    /**
     * Registers a queue under its name and subscribes it to each of its types.
     *
     * @param queue the queue to register
     * @throws IllegalStateException if a queue with that name already exists or
     *                               the bus is closed
     */
    public void register(EventQueue queue) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
        if (queues.putIfAbsent(queue.getName(), queue) != null) {
            throw new IllegalStateException("Event queue '" + queue.getName() + "' is already registered");
        }
        for (String type : queue.getTypes()) {
            subscribe(type, queue);
        }
        logger.atDebug()
                .addArgument(queue.getName())
                .addArgument(queue.getTypes())
                .log("Registered event queue {} for {}");
    }

    /**
     * Removes a queue if no client is attached to it any more.
     *
     * @param name  the registered name
     * @param queue the queue expected under that name
     * @return true if the queue was removed
     */
    public boolean unregisterIfUnused(String name, EventQueue queue) {
        if (queue.hasClients()) {
            return false;
        }
        if (!queues.remove(name, queue)) {
            return false;
        }
        for (String type : queue.getTypes()) {
            unsubscribe(type, queue);
        }
        logger.atDebug().addArgument(name).log("Unregistered event queue {}");
        return true;
    }

    public EventQueue getQueue(String name) {
        return queues.get(name);
    }

    public Map<String, EventQueue> getQueues() {
        return Map.copyOf(queues);
    }

    @Override
    public void close() {
        super.close();
        queues.clear();
    }
}
