package io.trading.feed.gateway;

/**
 * Base type for the recoverable failures of the gateway. Each subtype is contained at the
 * smallest scope that can handle it: a connection, a sink, or startup.
 */
public class FeedException extends Exception {

    public FeedException(String message) {
        super(message);
    }

    public FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
