package io.trading.feed.gateway.config;

import java.math.BigDecimal;

/**
 * Minimum relative spread that triggers a spread event, stored as a fraction.
 *
 * <p>Accepts either an explicit fraction ({@code 0.005}) or a percentage with a percent
 * sign ({@code 0.5%}). A bare value above 1 is rejected as it is almost certainly a
 * percentage missing its sign.
 *
 * @param fraction Threshold as a fraction, e.g. 0.005 for half a percent
 */
public record SpreadThreshold(BigDecimal fraction) {

    public static final SpreadThreshold DEFAULT = new SpreadThreshold(new BigDecimal("0.005"));

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public SpreadThreshold {
        if (fraction == null) {
            throw new IllegalArgumentException("fraction cannot be null");
        }
        if (fraction.signum() < 0) {
            throw new IllegalArgumentException("threshold cannot be negative: " + fraction);
        }
    }

    public static SpreadThreshold parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("threshold cannot be empty");
        }
        String text = value.trim();
        try {
            if (text.endsWith("%")) {
                BigDecimal percent = new BigDecimal(text.substring(0, text.length() - 1).trim());
                return new SpreadThreshold(percent.divide(HUNDRED));
            }
            BigDecimal fraction = new BigDecimal(text);
            if (fraction.compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException(
                    "threshold " + text + " is above 1; use a fraction (0.005) or a percentage (0.5%)");
            }
            return new SpreadThreshold(fraction);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid threshold: " + value, e);
        }
    }

    @Override
    public String toString() {
        return fraction.multiply(HUNDRED).stripTrailingZeros().toPlainString() + "%";
    }
}
