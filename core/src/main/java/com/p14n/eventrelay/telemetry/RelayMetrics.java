package com.p14n.eventrelay.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for the relay itself.
 *
 * <p>
 * Counters:
 * </p>
 * <ul>
 * <li>relay_events_received: events taken off the bus, per event type</li>
 * <li>relay_events_published: events whose body was stored, per event type</li>
 * <li>relay_events_dropped: events abandoned, per reason</li>
 * <li>relay_subscriber_pushes: indices pushed onto subscriber lists</li>
 * <li>relay_connection_attempts / relay_connection_failures /
 * relay_connection_teardowns: store connection lifecycle</li>
 * <li>relay_subscription_refreshes: completed registry refreshes</li>
 * </ul>
 */
public class RelayMetrics {
        private static final AttributeKey<String> EVENT_TYPE = AttributeKey.stringKey("event_type");
        private static final AttributeKey<String> REASON = AttributeKey.stringKey("reason");
        private static final AttributeKey<String> SUBSCRIBER = AttributeKey.stringKey("subscriber");

        private final LongCounter eventsReceived;
        private final LongCounter eventsPublished;
        private final LongCounter eventsDropped;
        private final LongCounter subscriberPushes;
        private final LongCounter connectionAttempts;
        private final LongCounter connectionFailures;
        private final LongCounter connectionTeardowns;
        private final LongCounter subscriptionRefreshes;

        public RelayMetrics(Meter meter) {
                eventsReceived = meter.counterBuilder("relay_events_received")
                                .setDescription("Number of events taken off the bus")
                                .build();
                eventsPublished = meter.counterBuilder("relay_events_published")
                                .setDescription("Number of events stored under a sequence index")
                                .build();
                eventsDropped = meter.counterBuilder("relay_events_dropped")
                                .setDescription("Number of events abandoned before completion")
                                .build();
                subscriberPushes = meter.counterBuilder("relay_subscriber_pushes")
                                .setDescription("Number of indices pushed to subscriber lists")
                                .build();
                connectionAttempts = meter.counterBuilder("relay_connection_attempts")
                                .setDescription("Number of store connection attempts")
                                .build();
                connectionFailures = meter.counterBuilder("relay_connection_failures")
                                .setDescription("Number of failed store connection attempts")
                                .build();
                connectionTeardowns = meter.counterBuilder("relay_connection_teardowns")
                                .setDescription("Number of store connections torn down")
                                .build();
                subscriptionRefreshes = meter.counterBuilder("relay_subscription_refreshes")
                                .setDescription("Number of completed subscription registry refreshes")
                                .build();
        }

        public void recordReceived(String type) {
                eventsReceived.add(1, Attributes.of(EVENT_TYPE, type));
        }

        public void recordPublished(String type) {
                eventsPublished.add(1, Attributes.of(EVENT_TYPE, type));
        }

        public void recordDropped(String reason) {
                eventsDropped.add(1, Attributes.of(REASON, reason));
        }

        public void recordPush(String subscriberId) {
                subscriberPushes.add(1, Attributes.of(SUBSCRIBER, subscriberId));
        }

        public void recordConnectAttempt() {
                connectionAttempts.add(1);
        }

        public void recordConnectFailure() {
                connectionFailures.add(1);
        }

        public void recordTeardown() {
                connectionTeardowns.add(1);
        }

        public void recordRefresh() {
                subscriptionRefreshes.add(1);
        }
}
