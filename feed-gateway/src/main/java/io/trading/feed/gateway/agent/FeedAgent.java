package io.trading.feed.gateway.agent;

import io.trading.feed.canonical.model.Venue;

import java.util.List;

/**
 * One session against one venue.
 *
 * <p>Lifecycle: {@link #connect()}, then {@link #stream()} until it fails, then
 * {@link #close()}. The supervisor creates a fresh agent for every reconnect and always
 * closes the previous one, whatever the exit path.
 */
public interface FeedAgent extends AutoCloseable {

    Venue venue();

    /**
     * Venue-native symbols this agent streams.
     */
    List<String> symbols();

    /**
     * Establishes the session and sends subscriptions.
     *
     * @throws ConnectionException if the session is not up within the connect timeout
     */
    void connect() throws ConnectionException;

    /**
     * Raw events of the current session.
     */
    RawEventStream stream();

    /**
     * Releases the session. Idempotent, never throws.
     */
    @Override
    void close();
}
