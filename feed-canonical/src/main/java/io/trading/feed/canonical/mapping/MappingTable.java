package io.trading.feed.canonical.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.PriceLevel;
import io.trading.feed.canonical.model.Venue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static io.trading.feed.canonical.mapping.FieldRules.bool;
import static io.trading.feed.canonical.mapping.FieldRules.decimal;
import static io.trading.feed.canonical.mapping.FieldRules.firstOf;
import static io.trading.feed.canonical.mapping.FieldRules.integer;
import static io.trading.feed.canonical.mapping.FieldRules.levels;
import static io.trading.feed.canonical.mapping.FieldRules.text;
import static io.trading.feed.canonical.mapping.FieldRules.textMapped;
import static io.trading.feed.canonical.mapping.FieldRules.timestamp;

/**
 * Static table of {@link KindMapping}s keyed by venue and kind.
 *
 * <p>Payloads arrive here one event per {@code RawEvent}: agents split batched frames
 * (a Deribit notification with many trades, a Deribit ticker feeding several kinds)
 * before canonicalization.
 */
public final class MappingTable {

    private final Map<Venue, Map<EventKind, KindMapping>> mappings;

    private MappingTable(Map<Venue, Map<EventKind, KindMapping>> mappings) {
        this.mappings = mappings;
    }

    public Optional<KindMapping> lookup(Venue venue, EventKind kind) {
        Map<EventKind, KindMapping> byKind = mappings.get(venue);
        return byKind == null ? Optional.empty() : Optional.ofNullable(byKind.get(kind));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mappings for every supported venue payload.
     */
    public static MappingTable defaults() {
        Builder builder = builder();
        binance(builder);
        coinbase(builder);
        deribit(builder);
        onchain(builder);
        for (Venue venue : Venue.values()) {
            shared(builder, venue);
        }
        return builder.build();
    }

    private static void binance(Builder b) {
        Venue v = Venue.BINANCE;
        b.map(v, EventKind.TRADE, KindMapping.builder(text("/s"), firstOf(timestamp("/T"), timestamp("/E")))
            .field("p", decimal("/p"))
            .field("q", decimal("/q"))
            .field("t", integer("/t"))
            .field("side", binanceTakerSide())
            .build());
        b.map(v, EventKind.L2_DIFF, KindMapping.builder(text("/s"), timestamp("/E"))
            .field("bids", levels("/b"))
            .field("asks", levels("/a"))
            .field("u", integer("/u"))
            .build());
        b.map(v, EventKind.BOOK_TICKER, KindMapping.builder(text("/s"), timestamp("/E"))
            .field("bp", decimal("/b"))
            .field("bq", decimal("/B"))
            .field("ap", decimal("/a"))
            .field("aq", decimal("/A"))
            .receiptFallback()
            .build());
        b.map(v, EventKind.TICKER_24H, KindMapping.builder(text("/s"), timestamp("/E"))
            .field("c", decimal("/c"))
            .field("o", decimal("/o"))
            .field("h", decimal("/h"))
            .field("l", decimal("/l"))
            .field("v", decimal("/v"))
            .build());
        b.map(v, EventKind.OHLCV, KindMapping.builder(text("/s"), timestamp("/E"))
            .field("o", decimal("/k/o"))
            .field("h", decimal("/k/h"))
            .field("l", decimal("/k/l"))
            .field("c", decimal("/k/c"))
            .field("v", decimal("/k/v"))
            .field("interval", text("/k/i"))
            .field("closed", bool("/k/x"))
            .build());
        b.map(v, EventKind.MARK_PRICE, KindMapping.builder(text("/s"), timestamp("/E"))
            .field("p", decimal("/p"))
            .build());
        b.map(v, EventKind.INDEX_PRICE, KindMapping.builder(text("/s"), timestamp("/E"))
            .field("p", decimal("/i"))
            .build());
        b.map(v, EventKind.FUNDING_RATE, KindMapping.builder(text("/s"), timestamp("/E"))
            .field("r", decimal("/r"))
            .field("next_ts", integer("/T"))
            .build());
    }

    private static void coinbase(Builder b) {
        Venue v = Venue.COINBASE;
        b.map(v, EventKind.TRADE, KindMapping.builder(text("/product_id"), timestamp("/time"))
            .field("p", decimal("/price"))
            .field("q", decimal("/size"))
            .field("t", integer("/trade_id"))
            .field("side", textMapped("/side", MappingTable::oppositeSide))
            .build());
        b.map(v, EventKind.TICKER_24H, KindMapping.builder(text("/product_id"), timestamp("/time"))
            .field("c", decimal("/price"))
            .field("o", decimal("/open_24h"))
            .field("h", decimal("/high_24h"))
            .field("l", decimal("/low_24h"))
            .field("v", decimal("/volume_24h"))
            .receiptFallback()
            .build());
        b.map(v, EventKind.L2_SNAPSHOT, KindMapping.builder(text("/product_id"), timestamp("/time"))
            .field("bids", levels("/bids"))
            .field("asks", levels("/asks"))
            .receiptFallback()
            .build());
        b.map(v, EventKind.L2_DIFF, KindMapping.builder(text("/product_id"), timestamp("/time"))
            .field("bids", coinbaseChanges("buy"))
            .field("asks", coinbaseChanges("sell"))
            .build());
    }

    private static void deribit(Builder b) {
        Venue v = Venue.DERIBIT;
        FieldRule instrument = text("/instrument_name");
        FieldRule ts = timestamp("/timestamp");
        b.map(v, EventKind.TRADE, KindMapping.builder(instrument, ts)
            .field("p", decimal("/price"))
            .field("q", decimal("/amount"))
            .field("t", integer("/trade_seq"))
            .field("side", text("/direction"))
            .build());
        b.map(v, EventKind.TICKER_24H, KindMapping.builder(instrument, ts)
            .field("c", decimal("/last_price"))
            .field("h", decimal("/stats/high"))
            .field("l", decimal("/stats/low"))
            .field("v", decimal("/stats/volume"))
            .build());
        b.map(v, EventKind.MARK_PRICE, KindMapping.builder(instrument, ts)
            .field("p", decimal("/mark_price"))
            .build());
        b.map(v, EventKind.INDEX_PRICE, KindMapping.builder(text("/index_name"), ts)
            .field("p", decimal("/price"))
            .build());
        b.map(v, EventKind.FUNDING_RATE, KindMapping.builder(instrument, ts)
            .field("r", firstOf(decimal("/current_funding"), decimal("/funding_8h")))
            .build());
        b.map(v, EventKind.OPEN_INTEREST, KindMapping.builder(instrument, ts)
            .field("oi", decimal("/open_interest"))
            .build());
        // An option is keyed by its underlying, BTC-29MAR24-60000-C -> BTC-USD
        FieldRule underlying = textMapped("/instrument_name", name -> optionPart(name, 0) + "-USD");
        b.map(v, EventKind.OPTIONS_CHAIN, KindMapping.builder(underlying, ts)
            .field("strike", textMapped("/instrument_name", name -> new BigDecimal(optionPart(name, 2).replace('d', '.'))))
            .field("expiry", textMapped("/instrument_name", name -> optionPart(name, 1)))
            .field("option_type", textMapped("/instrument_name", MappingTable::optionType))
            .field("p", decimal("/mark_price"))
            .field("iv", decimal("/mark_iv"))
            .build());
    }

    private static void onchain(Builder b) {
        Venue v = Venue.ONCHAIN;
        FieldRule symbol = text("/s");
        FieldRule ts = timestamp("/ts");
        b.map(v, EventKind.ONCHAIN_TRANSFER, KindMapping.builder(symbol, ts)
            .field("hash", text("/hash"))
            .field("from", text("/from"))
            .field("to", text("/to"))
            .field("amount", decimal("/amount"))
            .field("block", integer("/block"))
            .receiptFallback()
            .build());
        b.map(v, EventKind.ONCHAIN_BALANCE, KindMapping.builder(symbol, ts)
            .field("address", text("/address"))
            .field("balance", decimal("/balance"))
            .receiptFallback()
            .build());
        b.map(v, EventKind.TOP_DEX_POOL, KindMapping.builder(symbol, ts)
            .field("pool", text("/pool"))
            .field("dex", text("/dex"))
            .field("liquidity", decimal("/liquidity"))
            .field("volume_24h", decimal("/volume_24h"))
            .receiptFallback()
            .build());
        b.map(v, EventKind.MEMPOOL, KindMapping.builder(symbol, ts)
            .field("hash", text("/hash"))
            .field("value", decimal("/value"))
            .receiptFallback()
            .build());
        b.map(v, EventKind.BRIDGE_FLOW, KindMapping.builder(symbol, ts)
            .field("amount", decimal("/amount"))
            .field("from_chain", text("/from_chain"))
            .field("to_chain", text("/to_chain"))
            .receiptFallback()
            .build());
        b.map(v, EventKind.MEV_SIGNAL, KindMapping.builder(symbol, ts)
            .field("strategy", text("/strategy"))
            .field("profit", decimal("/profit"))
            .receiptFallback()
            .build());
    }

    // Payloads produced inside the gateway (telemetry) or pushed by external fetchers (news).
    private static void shared(Builder b, Venue v) {
        b.map(v, EventKind.TELEMETRY, KindMapping.builder(text("/s"), timestamp("/ts"))
            .field("latency_ms", integer("/latency_ms"))
            .field("messages", integer("/messages"))
            .receiptFallback()
            .build());
        b.map(v, EventKind.NEWS_HEADLINE, KindMapping.builder(text("/s"), timestamp("/ts"))
            .field("title", text("/title"))
            .field("source", text("/source"))
            .field("url", text("/url"))
            .receiptFallback()
            .build());
    }

    // "m": true means the buyer was the maker, so the aggressor sold.
    private static FieldRule binanceTakerSide() {
        FieldRule maker = bool("/m");
        return payload -> {
            Object buyerIsMaker = maker.read(payload);
            if (buyerIsMaker == null) {
                return null;
            }
            return (Boolean) buyerIsMaker ? "sell" : "buy";
        };
    }

    private static Object oppositeSide(String makerSide) {
        return switch (makerSide.toLowerCase(Locale.ROOT)) {
            case "buy" -> "sell";
            case "sell" -> "buy";
            default -> throw new IllegalArgumentException("unknown side: " + makerSide);
        };
    }

    private static FieldRule coinbaseChanges(String side) {
        return payload -> {
            JsonNode changes = payload.get("changes");
            if (changes == null || changes.isNull()) {
                return null;
            }
            if (!changes.isArray()) {
                throw new IllegalArgumentException("changes must be an array");
            }
            List<PriceLevel> levels = new ArrayList<>();
            for (JsonNode change : changes) {
                if (!change.isArray() || change.size() < 3) {
                    throw new IllegalArgumentException("malformed change: " + change);
                }
                if (side.equalsIgnoreCase(change.get(0).asText())) {
                    levels.add(new PriceLevel(FieldRules.toDecimal(change.get(1)), FieldRules.toDecimal(change.get(2))));
                }
            }
            return levels;
        };
    }

    // BTC-29MAR24-60000-C
    private static String optionPart(String instrument, int index) {
        String[] parts = instrument.split("-");
        if (parts.length != 4) {
            throw new IllegalArgumentException("not an option instrument: " + instrument);
        }
        return parts[index];
    }

    private static Object optionType(String instrument) {
        return switch (optionPart(instrument, 3)) {
            case "C" -> "call";
            case "P" -> "put";
            default -> throw new IllegalArgumentException("unknown option type: " + instrument);
        };
    }

    public static final class Builder {
        private final Map<Venue, Map<EventKind, KindMapping>> mappings = new EnumMap<>(Venue.class);

        private Builder() {
        }

        public Builder map(Venue venue, EventKind kind, KindMapping mapping) {
            mappings.computeIfAbsent(venue, k -> new EnumMap<>(EventKind.class)).put(kind, mapping);
            return this;
        }

        public MappingTable build() {
            Map<Venue, Map<EventKind, KindMapping>> copy = new EnumMap<>(Venue.class);
            mappings.forEach((venue, byKind) -> copy.put(venue, new EnumMap<>(byKind)));
            return new MappingTable(copy);
        }
    }
}
