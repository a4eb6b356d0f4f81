package com.p14n.eventrelay.codec;

import com.p14n.eventrelay.data.Event;

/**
 * Converts events to and from the text stored under an event key.
 */
public interface EventCodec {

    /**
     * Encodes an event into its stored body.
     *
     * @param event the event
     * @return the encoded body
     * @throws EventCodecException if the event cannot be encoded
     */
    String encode(Event event);

    /**
     * Decodes a stored body back into an event.
     *
     * @param body the stored body
     * @return the event
     * @throws EventCodecException if the body is malformed
     */
    Event decode(String body);
}
