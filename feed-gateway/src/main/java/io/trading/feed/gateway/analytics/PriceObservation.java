package io.trading.feed.gateway.analytics;

import io.trading.feed.canonical.model.Venue;

import java.math.BigDecimal;

/**
 * Last trade price seen on one venue.
 *
 * @param venue          Venue of the trade
 * @param price          Trade price
 * @param eventTimestamp Venue event time in epoch milliseconds
 * @param receivedAt     Local receipt time in epoch milliseconds
 */
public record PriceObservation(
    Venue venue,
    BigDecimal price,
    long eventTimestamp,
    long receivedAt
) {
    public PriceObservation {
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("price must be non-negative: " + price);
        }
    }
}
