package io.trading.feed.gateway.analytics;

import io.trading.feed.canonical.model.PriceLevel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Price-level book for one symbol on one venue.
 *
 * <p>Levels are keyed by numeric price, so {@code 100.0} and {@code 100.00} are the same
 * level. A zero quantity removes the level. Written by the book store thread, readable
 * from any thread.
 */
public final class OrderBook {

    private final NavigableMap<BigDecimal, BigDecimal> bids = new TreeMap<>(Collections.reverseOrder());
    private final NavigableMap<BigDecimal, BigDecimal> asks = new TreeMap<>();
    private long lastUpdate;

    /**
     * Replaces both sides.
     */
    public synchronized void applySnapshot(List<PriceLevel> bidLevels, List<PriceLevel> askLevels, long timestamp) {
        bids.clear();
        asks.clear();
        apply(bids, bidLevels);
        apply(asks, askLevels);
        lastUpdate = timestamp;
    }

    /**
     * Applies incremental level changes on top of the current book.
     */
    public synchronized void applyDiff(List<PriceLevel> bidLevels, List<PriceLevel> askLevels, long timestamp) {
        apply(bids, bidLevels);
        apply(asks, askLevels);
        lastUpdate = timestamp;
    }

    /**
     * Applies a top-of-book update as one level per side.
     */
    public synchronized void applyTicker(PriceLevel bid, PriceLevel ask, long timestamp) {
        apply(bids, bid);
        apply(asks, ask);
        lastUpdate = timestamp;
    }

    public synchronized Optional<PriceLevel> bestBid() {
        return first(bids);
    }

    public synchronized Optional<PriceLevel> bestAsk() {
        return first(asks);
    }

    /**
     * Bid levels, best first.
     */
    public synchronized List<PriceLevel> bids() {
        return levels(bids);
    }

    /**
     * Ask levels, best first.
     */
    public synchronized List<PriceLevel> asks() {
        return levels(asks);
    }

    public synchronized long lastUpdate() {
        return lastUpdate;
    }

    private static void apply(NavigableMap<BigDecimal, BigDecimal> side, List<PriceLevel> levels) {
        if (levels == null) {
            return;
        }
        for (PriceLevel level : levels) {
            apply(side, level);
        }
    }

    private static void apply(NavigableMap<BigDecimal, BigDecimal> side, PriceLevel level) {
        if (level.quantity().signum() == 0) {
            side.remove(level.price());
        } else {
            side.put(level.price(), level.quantity());
        }
    }

    private static Optional<PriceLevel> first(NavigableMap<BigDecimal, BigDecimal> side) {
        Map.Entry<BigDecimal, BigDecimal> entry = side.firstEntry();
        return entry == null ? Optional.empty() : Optional.of(new PriceLevel(entry.getKey(), entry.getValue()));
    }

    private static List<PriceLevel> levels(NavigableMap<BigDecimal, BigDecimal> side) {
        List<PriceLevel> out = new ArrayList<>(side.size());
        side.forEach((price, quantity) -> out.add(new PriceLevel(price, quantity)));
        return out;
    }
}
