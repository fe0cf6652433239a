package io.trading.feed.gateway.dispatch;

import io.trading.feed.canonical.model.FeedEvent;

/**
 * Receives events from the dispatcher on the consumer's own delivery thread.
 */
public interface EventConsumer {

    /**
     * Filter applied on the publishing thread. Rejected events are never queued.
     */
    default boolean accepts(FeedEvent event) {
        return true;
    }

    /**
     * Handles one event. Any exception is logged and counted against this consumer.
     */
    void onEvent(FeedEvent event) throws Exception;

    /**
     * Called once on the delivery thread after the last event.
     */
    default void onClose() {
    }
}
