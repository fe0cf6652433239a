package io.trading.feed.gateway.sink;

import io.trading.feed.gateway.FeedException;

/**
 * A sink failed to accept an event. Logged and counted per sink, never propagated to
 * other consumers.
 */
public class SinkException extends FeedException {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
