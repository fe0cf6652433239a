package io.trading.feed.gateway.analytics;

import io.trading.feed.canonical.model.SpreadEvent;

/**
 * Where detected spreads go besides subscriptions, normally the dispatcher.
 */
@FunctionalInterface
public interface SpreadPublisher {

    void publish(SpreadEvent event) throws InterruptedException;
}
