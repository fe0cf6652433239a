package io.trading.feed.gateway.agent;

import io.trading.feed.gateway.config.FeedSpec;

/**
 * Creates a fresh, unconnected agent for a feed. Called once per connection attempt.
 */
@FunctionalInterface
public interface AgentFactory {

    FeedAgent create(FeedSpec spec);
}
