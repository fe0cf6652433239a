package io.trading.feed.gateway.agent;

import io.trading.feed.gateway.FeedException;

/**
 * The transport closed. Terminal for the stream it was raised from.
 */
public class DisconnectedException extends FeedException {

    public DisconnectedException(String message) {
        super(message);
    }

    public DisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
