package io.trading.feed.canonical.model;

import java.util.List;
import java.util.Locale;

import static io.trading.feed.canonical.model.FieldSpec.optional;
import static io.trading.feed.canonical.model.FieldSpec.required;
import static io.trading.feed.canonical.model.FieldType.BOOLEAN;
import static io.trading.feed.canonical.model.FieldType.DECIMAL;
import static io.trading.feed.canonical.model.FieldType.INTEGER;
import static io.trading.feed.canonical.model.FieldType.LEVELS;
import static io.trading.feed.canonical.model.FieldType.TEXT;

/**
 * Closed set of canonical event kinds.
 *
 * <p>Each kind owns its field schema. Every event additionally carries the venue
 * ({@code agent}), the canonical symbol ({@code s}) and the event timestamp ({@code ts}),
 * which are not listed here.
 *
 * <p>Auxiliary kinds are best-effort: the dispatcher never blocks on them. Experimental
 * kinds are only accepted when their environment toggle is on.
 */
public enum EventKind {
    TRADE("trade", false, false, List.of(
        required("p", DECIMAL),
        required("q", DECIMAL),
        optional("t", INTEGER),
        optional("side", TEXT))),
    L2_DIFF("l2_diff", false, false, List.of(
        required("bids", LEVELS),
        required("asks", LEVELS),
        optional("u", INTEGER))),
    L2_SNAPSHOT("l2_snapshot", false, false, List.of(
        required("bids", LEVELS),
        required("asks", LEVELS))),
    BOOK_TICKER("book_ticker", false, false, List.of(
        required("bp", DECIMAL),
        required("bq", DECIMAL),
        required("ap", DECIMAL),
        required("aq", DECIMAL))),
    TICKER_24H("ticker_24h", false, false, List.of(
        required("c", DECIMAL),
        optional("o", DECIMAL),
        optional("h", DECIMAL),
        optional("l", DECIMAL),
        optional("v", DECIMAL))),
    OHLCV("ohlcv", false, false, List.of(
        required("o", DECIMAL),
        required("h", DECIMAL),
        required("l", DECIMAL),
        required("c", DECIMAL),
        required("v", DECIMAL),
        optional("interval", TEXT),
        optional("closed", BOOLEAN))),
    INDEX_PRICE("index_price", false, false, List.of(
        required("p", DECIMAL))),
    MARK_PRICE("mark_price", false, false, List.of(
        required("p", DECIMAL))),
    FUNDING_RATE("funding_rate", false, false, List.of(
        required("r", DECIMAL),
        optional("next_ts", INTEGER))),
    OPEN_INTEREST("open_interest", false, false, List.of(
        required("oi", DECIMAL))),
    ONCHAIN_TRANSFER("onchain_transfer", false, false, List.of(
        required("hash", TEXT),
        required("from", TEXT),
        required("to", TEXT),
        required("amount", DECIMAL),
        optional("block", INTEGER))),
    ONCHAIN_BALANCE("onchain_balance", false, false, List.of(
        required("address", TEXT),
        required("balance", DECIMAL))),
    TOP_DEX_POOL("top_dex_pool", true, false, List.of(
        required("pool", TEXT),
        required("dex", TEXT),
        required("liquidity", DECIMAL),
        optional("volume_24h", DECIMAL))),
    NEWS_HEADLINE("news_headline", true, false, List.of(
        required("title", TEXT),
        required("source", TEXT),
        optional("url", TEXT))),
    TELEMETRY("telemetry", true, false, List.of(
        required("latency_ms", INTEGER),
        required("messages", INTEGER))),
    OPTIONS_CHAIN("options_chain", false, true, List.of(
        required("strike", DECIMAL),
        required("expiry", TEXT),
        required("option_type", TEXT),
        required("p", DECIMAL),
        optional("iv", DECIMAL))),
    MEMPOOL("mempool", true, true, List.of(
        required("hash", TEXT),
        required("value", DECIMAL))),
    BRIDGE_FLOW("bridge_flow", false, true, List.of(
        required("amount", DECIMAL),
        required("from_chain", TEXT),
        required("to_chain", TEXT))),
    MEV_SIGNAL("mev_signal", true, true, List.of(
        required("strategy", TEXT),
        required("profit", DECIMAL)));

    private final String wireName;
    private final boolean auxiliary;
    private final boolean experimental;
    private final List<FieldSpec> fields;

    EventKind(String wireName, boolean auxiliary, boolean experimental, List<FieldSpec> fields) {
        this.wireName = wireName;
        this.auxiliary = auxiliary;
        this.experimental = experimental;
        this.fields = fields;
    }

    /**
     * Value of the {@code type} field on the wire.
     */
    public String wireName() {
        return wireName;
    }

    public boolean isAuxiliary() {
        return auxiliary;
    }

    public boolean isExperimental() {
        return experimental;
    }

    /**
     * Kind-specific fields in wire order.
     */
    public List<FieldSpec> fields() {
        return fields;
    }

    public static EventKind fromWireName(String value) {
        String lower = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (EventKind kind : values()) {
            if (kind.wireName.equals(lower)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
