package com.p14n.eventrelay.data;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Event-type filter of one external subscriber, as read from the
 * subscription registry.
 *
 * @param subscriberId Registry key of the subscriber
 * @param eventTypes   Event types the subscriber wants, empty matches nothing
 */
public record SubscriberFilter(String subscriberId, Set<String> eventTypes) {

    public SubscriberFilter {
        if (subscriberId == null) {
            throw new IllegalArgumentException("subscriberId cannot be null");
        }
        eventTypes = eventTypes == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(eventTypes));
    }

    /**
     * Creates a filter that matches no event.
     *
     * @param subscriberId Registry key of the subscriber
     * @return an empty filter
     */
    public static SubscriberFilter empty(String subscriberId) {
        return new SubscriberFilter(subscriberId, Set.of());
    }

    public boolean matches(String type) {
        return type != null && eventTypes.contains(type);
    }
}
