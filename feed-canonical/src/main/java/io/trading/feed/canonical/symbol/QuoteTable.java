package io.trading.feed.canonical.symbol;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ordered set of quote assets used to split concatenated venue symbols such as
 * {@code BTCUSDT}. Matching tries longer quotes first so that {@code FDUSD} wins over
 * {@code USD}.
 */
public final class QuoteTable {

    public static final QuoteTable BINANCE_DEFAULT = of(
        "USDT", "USDC", "BUSD", "FDUSD", "TUSD", "USD", "BTC", "ETH", "BNB", "EUR", "TRY");

    public static final QuoteTable COINBASE_DEFAULT = of(
        "USDT", "USDC", "USD", "EUR", "GBP", "BTC", "ETH");

    public static final QuoteTable DERIBIT_DEFAULT = of("USDC", "USDT", "USD", "BTC", "ETH");

    public static final QuoteTable ONCHAIN_DEFAULT = of("USDT", "USDC", "DAI", "WETH", "USD", "ETH", "BTC");

    private final List<String> quotes;

    private QuoteTable(List<String> quotes) {
        this.quotes = quotes.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();
    }

    public static QuoteTable of(String... quotes) {
        if (quotes.length == 0) {
            throw new IllegalArgumentException("quote table cannot be empty");
        }
        return new QuoteTable(Arrays.stream(quotes)
            .map(q -> q.trim().toUpperCase(Locale.ROOT))
            .peek(QuoteTable::requireAlphanumeric)
            .distinct()
            .toList());
    }

    /**
     * Parses a comma separated list such as {@code "usdt,usdc,btc"}.
     */
    public static QuoteTable fromString(String csv) {
        if (csv == null || csv.isBlank()) {
            throw new IllegalArgumentException("quote list cannot be empty");
        }
        return of(Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toArray(String[]::new));
    }

    private static void requireAlphanumeric(String quote) {
        if (quote.isEmpty() || !quote.chars().allMatch(c -> (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {
            throw new IllegalArgumentException("Invalid quote asset: " + quote);
        }
    }

    /**
     * Splits an uppercase concatenated symbol into base and quote.
     *
     * @return {@code [base, quote]}, or empty when no quote matches with a non-empty base
     */
    public Optional<String[]> split(String compact) {
        for (String quote : quotes) {
            if (compact.length() > quote.length() && compact.endsWith(quote)) {
                return Optional.of(new String[] {compact.substring(0, compact.length() - quote.length()), quote});
            }
        }
        return Optional.empty();
    }

    public boolean contains(String asset) {
        return quotes.contains(asset);
    }

    /**
     * Quotes in match order, longest first.
     */
    public List<String> quotes() {
        return quotes;
    }

    @Override
    public String toString() {
        return String.join(",", quotes);
    }
}
