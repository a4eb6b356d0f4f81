package com.p14n.eventrelay.broker;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.data.Event;

/**
 * A named, type-filtered buffer of bus events that a listener drains one
 * event at a time.
 *
 * <p>
 * The queue only buffers while at least one client is attached; events
 * published while it has no clients are discarded. The set of types is fixed
 * at construction.
 * </p>
 *
 * <pre>{@code
 * EventQueue queue = new EventQueue(UUID.randomUUID().toString(), Set.of("StateChange"));
 * bus.register(queue);
 * queue.addClient(this);
 * Event event = queue.waitForEvent(this, 1, TimeUnit.SECONDS);
 * }</pre>
 */
public class EventQueue implements MessageSubscriber<Event> {

    private static final Logger logger = LoggerFactory.getLogger(EventQueue.class);

    private final String name;
    private final Set<String> types;
    private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
    private final Set<Object> clients = ConcurrentHashMap.newKeySet();

    public EventQueue(String name, Set<String> types) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Queue name cannot be null or empty");
        }
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("Queue needs at least one event type");
        }
        this.name = name;
        this.types = Collections.unmodifiableSet(new LinkedHashSet<>(types));
    }

    public String getName() {
        return name;
    }

    public Set<String> getTypes() {
        return types;
    }

    public boolean canProcessEvent(String type) {
        return types.contains(type);
    }

    @Override
    public void onMessage(Event event) {
        if (!canProcessEvent(event.type()) || clients.isEmpty()) {
            return;
        }
        events.offer(event);
    }

    @Override
    public void onError(Throwable error) {
        logger.atWarn().setCause(error).addArgument(name).log("Delivery to event queue {} failed");
    }

    public void addClient(Object client) {
        clients.add(client);
    }

    /**
     * Detaches a client. Buffered events are discarded once the last client
     * leaves.
     *
     * @param client the client to detach
     */
    public void removeClient(Object client) {
        clients.remove(client);
        if (clients.isEmpty()) {
            events.clear();
        }
    }

    public boolean hasClients() {
        return !clients.isEmpty();
    }

    /**
     * Waits for the next event.
     *
     * @param client  an attached client
     * @param timeout how long to wait
     * @param unit    unit of the timeout
     * @return the next event, or null if none arrived in time
     * @throws InterruptedException     if interrupted while waiting
     * @throws IllegalArgumentException if the client is not attached
     */
    public Event waitForEvent(Object client, long timeout, TimeUnit unit) throws InterruptedException {
        if (!clients.contains(client)) {
            throw new IllegalArgumentException("Client is not attached to event queue " + name);
        }
        return events.poll(timeout, unit);
    }

    public int size() {
        return events.size();
    }
}
