package io.trading.feed.canonical.model;

import java.util.Locale;

/**
 * Supported market data venues.
 */
public enum Venue {
    BINANCE("binance"),
    COINBASE("coinbase"),
    DERIBIT("deribit"),
    ONCHAIN("onchain");

    private final String id;

    Venue(String id) {
        this.id = id;
    }

    /**
     * Lowercase identifier used on the wire ({@code agent} field) and in feed specs.
     */
    public String id() {
        return id;
    }

    /**
     * Resolves a venue from its wire identifier, ignoring case.
     *
     * @throws IllegalArgumentException if the identifier names no supported venue
     */
    public static Venue fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        for (Venue venue : values()) {
            if (venue.id.equals(lower)) {
                return venue;
            }
        }
        throw new IllegalArgumentException("Unknown venue: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
