package io.trading.feed.canonical.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cross-venue price dislocation for one symbol.
 *
 * @param symbol    Canonical symbol
 * @param buyVenue  Venue with the lowest fresh price
 * @param sellVenue Venue with the highest fresh price
 * @param venues    All venues that took part in the comparison
 * @param buyPrice  Lowest fresh price
 * @param sellPrice Highest fresh price
 * @param spread    Relative spread {@code (sell - buy) / buy}
 * @param timestamp Timestamp of the trade that triggered the evaluation
 */
public record SpreadEvent(
    Symbol symbol,
    Venue buyVenue,
    Venue sellVenue,
    List<Venue> venues,
    BigDecimal buyPrice,
    BigDecimal sellPrice,
    BigDecimal spread,
    long timestamp
) implements FeedEvent {

    public static final String TYPE = "spread";

    public SpreadEvent {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        if (buyVenue == null || sellVenue == null) {
            throw new IllegalArgumentException("buyVenue and sellVenue cannot be null");
        }
        if (buyVenue == sellVenue) {
            throw new IllegalArgumentException("buyVenue and sellVenue must differ");
        }
        if (venues == null || venues.size() < 2) {
            throw new IllegalArgumentException("at least two venues are required");
        }
        if (buyPrice == null || sellPrice == null || spread == null) {
            throw new IllegalArgumentException("prices and spread cannot be null");
        }
        if (spread.signum() < 0) {
            throw new IllegalArgumentException("spread cannot be negative: " + spread);
        }
        venues = List.copyOf(venues);
    }

    @Override
    public String typeName() {
        return TYPE;
    }
}
