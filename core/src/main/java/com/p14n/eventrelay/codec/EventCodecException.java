package com.p14n.eventrelay.codec;

/**
 * An event could not be encoded, or a stored body could not be decoded.
 */
public class EventCodecException extends RuntimeException {

    public EventCodecException(String message) {
        super(message);
    }

    public EventCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
