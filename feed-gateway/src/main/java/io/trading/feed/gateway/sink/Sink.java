package io.trading.feed.gateway.sink;

import io.trading.feed.canonical.model.FeedEvent;

/**
 * Destination for canonical and spread events.
 *
 * <p>Each sink is driven by a single dispatcher delivery thread, so implementations need not
 * be thread-safe.
 */
public interface Sink extends AutoCloseable {

    String name();

    void write(FeedEvent event) throws SinkException;

    @Override
    void close() throws SinkException;
}
