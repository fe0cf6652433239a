package io.trading.feed.canonical.model;

import java.util.regex.Pattern;

/**
 * Canonical trading pair in uppercase {@code BASE-QUOTE} form.
 *
 * <p>Instances can only hold the canonical shape; venue-native text goes through
 * {@link io.trading.feed.canonical.symbol.SymbolNormalizer}.
 *
 * @param base  Base asset (e.g., "BTC")
 * @param quote Quote asset (e.g., "USDT")
 */
public record Symbol(
    String base,
    String quote
) {
    private static final Pattern PART = Pattern.compile("[A-Z0-9]+");
    private static final Pattern CANONICAL = Pattern.compile("[A-Z0-9]+-[A-Z0-9]+");

    public Symbol {
        if (base == null || !PART.matcher(base).matches()) {
            throw new IllegalArgumentException("base must be non-empty uppercase alphanumeric: " + base);
        }
        if (quote == null || !PART.matcher(quote).matches()) {
            throw new IllegalArgumentException("quote must be non-empty uppercase alphanumeric: " + quote);
        }
    }

    /**
     * Parses an already canonical symbol such as {@code BTC-USDT}.
     *
     * @throws IllegalArgumentException if the text is not canonical
     */
    public static Symbol parse(String canonical) {
        if (canonical == null || !CANONICAL.matcher(canonical).matches()) {
            throw new IllegalArgumentException("Not a canonical symbol: " + canonical);
        }
        int dash = canonical.indexOf('-');
        return new Symbol(canonical.substring(0, dash), canonical.substring(dash + 1));
    }

    @Override
    public String toString() {
        return base + "-" + quote;
    }
}
