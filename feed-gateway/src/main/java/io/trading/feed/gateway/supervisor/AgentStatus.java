package io.trading.feed.gateway.supervisor;

import io.trading.feed.gateway.config.FeedSpec;

/**
 * Point-in-time view of one supervised agent.
 *
 * @param name                Runner name, e.g. "binance-0"
 * @param feed                The configured feed
 * @param state               Current state
 * @param consecutiveFailures Failures since the last stable session
 * @param restarts            Reconnect attempts since start
 * @param messages            Raw events received since start
 * @param lastError           Message of the last failure, or {@code null}
 * @param stateSince          Epoch millis of the last state change
 */
public record AgentStatus(
    String name,
    FeedSpec feed,
    AgentState state,
    int consecutiveFailures,
    long restarts,
    long messages,
    String lastError,
    long stateSince
) {
}
