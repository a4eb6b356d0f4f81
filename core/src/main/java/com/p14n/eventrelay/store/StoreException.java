package com.p14n.eventrelay.store;

/**
 * Base class for failures reported by a {@link StoreConnection}.
 */
public abstract class StoreException extends RuntimeException {

    private final String command;

    protected StoreException(String command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
    }

    /**
     * Returns the name of the command that failed.
     *
     * @return the command name, for example {@code INCR}
     */
    public String getCommand() {
        return command;
    }
}
