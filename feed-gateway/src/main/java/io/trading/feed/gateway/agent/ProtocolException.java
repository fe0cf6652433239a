package io.trading.feed.gateway.agent;

import io.trading.feed.gateway.FeedException;

/**
 * The venue sent a malformed frame or an explicit error frame.
 */
public class ProtocolException extends FeedException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
