package io.trading.feed.canonical.model;

import java.math.BigDecimal;

/**
 * Single price level of an order book update.
 *
 * @param price    Price level
 * @param quantity Quantity at this level, zero meaning the level is removed
 */
public record PriceLevel(
    BigDecimal price,
    BigDecimal quantity
) {
    public PriceLevel {
        if (price == null) {
            throw new IllegalArgumentException("price cannot be null");
        }
        if (quantity == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price cannot be negative");
        }
        if (quantity.signum() < 0) {
            throw new IllegalArgumentException("quantity cannot be negative");
        }
    }
}
