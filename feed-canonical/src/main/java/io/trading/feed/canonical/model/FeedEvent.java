package io.trading.feed.canonical.model;

/**
 * Anything that flows through the dispatcher to sinks: canonical market events and
 * derived spread events.
 */
public interface FeedEvent {

    /**
     * Canonical symbol the event refers to.
     */
    Symbol symbol();

    /**
     * Event time in epoch milliseconds.
     */
    long timestamp();

    /**
     * Value of the {@code type} field on the wire.
     */
    String typeName();

    /**
     * Whether delivery of this event may be best-effort.
     */
    default boolean isAuxiliary() {
        return false;
    }
}
