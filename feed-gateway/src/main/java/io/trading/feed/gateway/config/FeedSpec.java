package io.trading.feed.gateway.config;

import io.trading.feed.canonical.model.Venue;

import java.util.Arrays;
import java.util.List;

/**
 * One configured feed: a venue and the venue-native symbols to stream from it.
 *
 * @param venue   The venue
 * @param symbols Venue-native symbols; empty selects the venue's default universe
 */
public record FeedSpec(
    Venue venue,
    List<String> symbols
) {
    public static final String ALL = "all";

    public FeedSpec {
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        if (symbols == null) {
            throw new IllegalArgumentException("symbols cannot be null");
        }
        symbols = List.copyOf(symbols);
    }

    /**
     * Parses a feed spec string.
     * Format: "venue:symbol1,symbol2" or "venue:all"
     * Example: "binance:btcusdt,ethusdt"
     */
    public static FeedSpec fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("feed spec cannot be empty");
        }
        int colon = value.indexOf(':');
        String venuePart = colon < 0 ? value : value.substring(0, colon);
        String symbolPart = colon < 0 ? "" : value.substring(colon + 1).trim();

        Venue venue = Venue.fromId(venuePart);
        if (symbolPart.isEmpty() || ALL.equalsIgnoreCase(symbolPart)) {
            return new FeedSpec(venue, List.of());
        }
        List<String> symbols = Arrays.stream(symbolPart.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .distinct()
            .toList();
        return new FeedSpec(venue, symbols);
    }

    public boolean isAll() {
        return symbols.isEmpty();
    }

    @Override
    public String toString() {
        return venue.id() + ":" + (isAll() ? ALL : String.join(",", symbols));
    }
}
