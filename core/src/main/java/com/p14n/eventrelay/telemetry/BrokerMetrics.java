package com.p14n.eventrelay.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Metrics for the in-process event bus.
 *
 * <ul>
 * <li>bus_events_published: events handed to the bus per event type</li>
 * <li>bus_events_delivered: deliveries into event queues per event type</li>
 * <li>bus_queue_subscriptions: live queue subscriptions per event type</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> EVENT_TYPE = AttributeKey.stringKey("event_type");

        private final LongCounter publishedEvents;
        private final LongCounter deliveredEvents;
        private final LongUpDownCounter subscriptions;

        public BrokerMetrics(Meter meter) {
                publishedEvents = meter.counterBuilder("bus_events_published")
                                .setDescription("Number of events published on the bus")
                                .build();

                deliveredEvents = meter.counterBuilder("bus_events_delivered")
                                .setDescription("Number of events delivered to bus subscribers")
                                .build();

                subscriptions = meter.upDownCounterBuilder("bus_queue_subscriptions")
                                .setDescription("Number of active bus subscriptions")
                                .build();
        }

        public void recordPublished(String type) {
                publishedEvents.add(1, Attributes.of(EVENT_TYPE, type));
        }

        public void recordDelivered(String type) {
                deliveredEvents.add(1, Attributes.of(EVENT_TYPE, type));
        }

        public void recordSubscriberAdded(String type) {
                subscriptions.add(1, Attributes.of(EVENT_TYPE, type));
        }

        public void recordSubscriberRemoved(String type) {
                subscriptions.add(-1, Attributes.of(EVENT_TYPE, type));
        }
}
