package io.trading.feed.gateway.dispatch;

/**
 * What a consumer queue does when it is full.
 */
public enum BackpressurePolicy {

    /**
     * Wait up to the offer timeout, then fail this delivery for this consumer only.
     */
    BOUNDED_BLOCK,

    /**
     * Evict the oldest queued event and enqueue the new one.
     */
    DROP_OLDEST
}
