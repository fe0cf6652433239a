package io.trading.feed.gateway.config;

import io.trading.feed.gateway.FeedException;

/**
 * Invalid command line or environment. Fatal at startup.
 */
public class ConfigurationException extends FeedException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
