package com.p14n.eventrelay.data;

/**
 * Interface for objects that can be traced and identified while they move
 * from the in-process bus into the store.
 *
 * <p>
 * Key attributes:
 * </p>
 * <ul>
 * <li>{@code id}: Unique identifier for the traceable object</li>
 * <li>{@code topic}: Routing identifier, the event type for relayed events</li>
 * <li>{@code subject}: Business entity the object refers to</li>
 * <li>{@code traceparent}: OpenTelemetry trace context identifier</li>
 * </ul>
 */
public interface Traceable {

    /**
     * Returns the unique identifier of the traceable object.
     *
     * @return the unique identifier string
     */
    String id();

    /**
     * Returns the routing identifier used on the bus.
     *
     * @return the topic string
     */
    String topic();

    /**
     * Returns the business entity identifier.
     *
     * @return the subject string
     */
    String subject();

    /**
     * Returns the OpenTelemetry trace parent identifier for distributed tracing.
     *
     * @return the trace parent string, or null when the object carries no
     *         trace context
     */
    String traceparent();
}
