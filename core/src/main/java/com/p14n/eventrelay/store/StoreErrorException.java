package com.p14n.eventrelay.store;

/**
 * The store answered with an explicit error reply, for example a rejected
 * password or a wrong type. The connection itself stays usable.
 */
public class StoreErrorException extends StoreException {

    private final String reply;

    public StoreErrorException(String command, String reply) {
        super(command, command + ": " + reply, null);
        this.reply = reply;
    }

    public String getReply() {
        return reply;
    }
}
