package io.trading.feed.gateway.agent;

import io.trading.feed.gateway.FeedException;

/**
 * A session could not be established within the connect timeout.
 */
public class ConnectionException extends FeedException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
