package com.p14n.eventrelay.broker;

/**
 * Interface for message subscribers that can receive messages and error
 * notifications.
 *
 * @param <T> The type of messages this subscriber handles
 */
public interface MessageSubscriber<T> {

    /**
     * Called when a new message is available for processing.
     *
     * @param message The message to process
     */
    void onMessage(T message);

    /**
     * Called when delivering a message to this subscriber failed.
     *
     * @param error The error that occurred
     */
    void onError(Throwable error);
}
