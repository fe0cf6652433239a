package io.trading.feed.canonical.symbol;

import io.trading.feed.canonical.NormalizationException;
import io.trading.feed.canonical.model.Symbol;
import io.trading.feed.canonical.model.Venue;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns venue-native symbol text into a canonical {@link Symbol}.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>trim and uppercase;</li>
 *   <li>Deribit perpetual and index names ({@code BTC-PERPETUAL}, {@code btc_usd}) resolve
 *       to their currency against {@code USD}, or against the settlement currency for linear
 *       instruments ({@code ETH_USDC}). Dated futures ({@code BTC-29MAR24}) and options
 *       ({@code BTC-29MAR24-60000-C}) are rejected: their prices are not prices of the pair;</li>
 *   <li>a single {@code -}, {@code _} or {@code /} separator splits base and quote;</li>
 *   <li>otherwise the venue's quote table is matched longest first.</li>
 * </ol>
 * Canonical input maps to itself, so normalization is idempotent.
 */
public final class SymbolNormalizer {

    private static final String DERIBIT_DEFAULT_QUOTE = "USD";
    private static final String DERIBIT_PERPETUAL = "PERPETUAL";

    private final Map<Venue, QuoteTable> quoteTables;

    public SymbolNormalizer(Map<Venue, QuoteTable> quoteTables) {
        this.quoteTables = new EnumMap<>(Venue.class);
        this.quoteTables.putAll(defaultTables());
        this.quoteTables.putAll(quoteTables);
    }

    public static SymbolNormalizer defaults() {
        return new SymbolNormalizer(Map.of());
    }

    /**
     * Default tables with the Binance quote list replaced.
     */
    public static SymbolNormalizer withBinanceQuotes(QuoteTable binanceQuotes) {
        return new SymbolNormalizer(Map.of(Venue.BINANCE, binanceQuotes));
    }

    private static Map<Venue, QuoteTable> defaultTables() {
        Map<Venue, QuoteTable> tables = new EnumMap<>(Venue.class);
        tables.put(Venue.BINANCE, QuoteTable.BINANCE_DEFAULT);
        tables.put(Venue.COINBASE, QuoteTable.COINBASE_DEFAULT);
        tables.put(Venue.DERIBIT, QuoteTable.DERIBIT_DEFAULT);
        tables.put(Venue.ONCHAIN, QuoteTable.ONCHAIN_DEFAULT);
        return tables;
    }

    /**
     * Normalizes a venue-native symbol.
     *
     * @throws NormalizationException with reason {@code UNKNOWN_SYMBOL_FORMAT}
     */
    public Symbol normalize(Venue venue, String raw) throws NormalizationException {
        if (raw == null) {
            throw NormalizationException.unknownSymbol(venue, null);
        }
        String text = raw.trim().toUpperCase(Locale.ROOT);
        if (text.isEmpty()) {
            throw NormalizationException.unknownSymbol(venue, raw);
        }
        String[] parts = venue == Venue.DERIBIT ? deribitParts(text) : splitParts(venue, text);
        if (parts == null || !isAlphanumeric(parts[0]) || !isAlphanumeric(parts[1])) {
            throw NormalizationException.unknownSymbol(venue, raw);
        }
        return new Symbol(parts[0], parts[1]);
    }

    private String[] splitParts(Venue venue, String text) {
        String[] separated = text.split("[-_/]", -1);
        if (separated.length == 2) {
            return separated;
        }
        if (separated.length > 2) {
            return null;
        }
        return quoteTables.get(venue).split(text).orElse(null);
    }

    private String[] deribitParts(String text) {
        String[] segments = text.split("-", -1);
        if (segments.length == 2 && quoteTables.get(Venue.DERIBIT).contains(segments[1])) {
            return segments;
        }
        if (segments.length > 2 || (segments.length == 2 && !DERIBIT_PERPETUAL.equals(segments[1]))) {
            return null;
        }
        String head = segments[0];
        int underscore = head.indexOf('_');
        if (underscore >= 0) {
            // linear instruments and index names: ETH_USDC, BTC_USDC-PERPETUAL, btc_usd
            return new String[] {head.substring(0, underscore), head.substring(underscore + 1)};
        }
        if (segments.length == 1) {
            return quoteTables.get(Venue.DERIBIT).split(head).orElse(null);
        }
        return new String[] {head, DERIBIT_DEFAULT_QUOTE};
    }

    private static boolean isAlphanumeric(String part) {
        if (part.isEmpty()) {
            return false;
        }
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (!((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {
                return false;
            }
        }
        return true;
    }
}
