package com.p14n.eventrelay.relay;

/**
 * A deferred unit of store work executed by the {@link CommandPipeline}.
 *
 * @param kind        what the item does
 * @param description short label used in logs and span names
 * @param action      the work itself
 */
public record WorkItem(Kind kind, String description, Runnable action) {

    public enum Kind {
        RECONNECT,
        REFRESH_SUBSCRIPTIONS,
        PUBLISH_EVENT,
        TEARDOWN
    }

    public WorkItem {
        if (kind == null || action == null) {
            throw new IllegalArgumentException("kind and action are required");
        }
        description = description == null ? kind.name() : description;
    }

    public static WorkItem of(Kind kind, Runnable action) {
        return new WorkItem(kind, kind.name().toLowerCase(), action);
    }

    public String spanName() {
        return "relay_" + kind.name().toLowerCase();
    }
}
