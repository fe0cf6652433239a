package io.trading.feed.gateway.analytics;

import io.trading.feed.canonical.model.CanonicalEvent;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.PriceLevel;
import io.trading.feed.canonical.model.SpreadEvent;
import io.trading.feed.canonical.model.Symbol;
import io.trading.feed.canonical.model.Venue;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BookStoreTest {

    private static final Symbol BTC_USDT = Symbol.parse("BTC-USDT");

    private final BookStore store = new BookStore();

    private static PriceLevel level(String price, String quantity) {
        return new PriceLevel(new BigDecimal(price), new BigDecimal(quantity));
    }

    private static CanonicalEvent book(Venue venue, EventKind kind, List<PriceLevel> bids, List<PriceLevel> asks, long ts) {
        return new CanonicalEvent(venue, kind, BTC_USDT, ts, ts, Map.of("bids", bids, "asks", asks));
    }

    private static CanonicalEvent ticker(Venue venue, String bp, String bq, String ap, String aq, long ts) {
        return new CanonicalEvent(venue, EventKind.BOOK_TICKER, BTC_USDT, ts, ts, Map.of(
            "bp", new BigDecimal(bp), "bq", new BigDecimal(bq),
            "ap", new BigDecimal(ap), "aq", new BigDecimal(aq)));
    }

    @Test
    void testSnapshotSetsBestBidAndAsk() {
        store.apply(book(Venue.BINANCE, EventKind.L2_SNAPSHOT,
            List.of(level("99", "1"), level("100", "2"), level("98", "3")),
            List.of(level("102", "1"), level("101", "4")), 1));

        assertEquals(level("100", "2"), store.bestBid(Venue.BINANCE, BTC_USDT).orElseThrow());
        assertEquals(level("101", "4"), store.bestAsk(Venue.BINANCE, BTC_USDT).orElseThrow());

        OrderBook orderBook = store.book(Venue.BINANCE, BTC_USDT).orElseThrow();
        assertEquals(List.of(level("100", "2"), level("99", "1"), level("98", "3")), orderBook.bids());
        assertEquals(List.of(level("101", "4"), level("102", "1")), orderBook.asks());
        assertEquals(1, orderBook.lastUpdate());
    }

    @Test
    void testSnapshotReplacesBook() {
        store.apply(book(Venue.BINANCE, EventKind.L2_SNAPSHOT,
            List.of(level("100", "1"), level("99", "1")), List.of(level("101", "1")), 1));
        store.apply(book(Venue.BINANCE, EventKind.L2_SNAPSHOT,
            List.of(level("95", "5")), List.of(level("96", "5")), 2));

        OrderBook orderBook = store.book(Venue.BINANCE, BTC_USDT).orElseThrow();
        assertEquals(List.of(level("95", "5")), orderBook.bids());
        assertEquals(List.of(level("96", "5")), orderBook.asks());
    }

    @Test
    void testDiffUpdatesAndAddsLevels() {
        store.apply(book(Venue.BINANCE, EventKind.L2_SNAPSHOT,
            List.of(level("100", "1")), List.of(level("101", "1")), 1));
        store.apply(book(Venue.BINANCE, EventKind.L2_DIFF,
            List.of(level("100", "7"), level("100.5", "2")), List.of(level("103", "1")), 2));

        OrderBook orderBook = store.book(Venue.BINANCE, BTC_USDT).orElseThrow();
        assertEquals(List.of(level("100.5", "2"), level("100", "7")), orderBook.bids());
        assertEquals(List.of(level("101", "1"), level("103", "1")), orderBook.asks());
        assertEquals(2, orderBook.lastUpdate());
    }

    @Test
    void testZeroQuantityDeletesLevel() {
        store.apply(book(Venue.BINANCE, EventKind.L2_SNAPSHOT,
            List.of(level("100", "1"), level("99", "1")), List.of(level("101", "1"), level("102", "1")), 1));
        // scale differs from the snapshot level
        store.apply(book(Venue.BINANCE, EventKind.L2_DIFF,
            List.of(level("100.00", "0")), List.of(level("101", "0.000")), 2));

        assertEquals(level("99", "1"), store.bestBid(Venue.BINANCE, BTC_USDT).orElseThrow());
        assertEquals(level("102", "1"), store.bestAsk(Venue.BINANCE, BTC_USDT).orElseThrow());
    }

    @Test
    void testDeletingLastLevelEmptiesSide() {
        store.apply(book(Venue.BINANCE, EventKind.L2_SNAPSHOT,
            List.of(level("100", "1")), List.of(level("101", "1")), 1));
        store.apply(book(Venue.BINANCE, EventKind.L2_DIFF, List.of(level("100", "0")), List.of(), 2));

        assertTrue(store.bestBid(Venue.BINANCE, BTC_USDT).isEmpty());
        assertTrue(store.bestAsk(Venue.BINANCE, BTC_USDT).isPresent());
    }

    @Test
    void testDiffBeforeSnapshotBuildsBook() {
        store.apply(book(Venue.DERIBIT, EventKind.L2_DIFF, List.of(level("50", "1")), List.of(level("51", "2")), 1));

        assertEquals(level("50", "1"), store.bestBid(Venue.DERIBIT, BTC_USDT).orElseThrow());
        assertEquals(level("51", "2"), store.bestAsk(Venue.DERIBIT, BTC_USDT).orElseThrow());
    }

    @Test
    void testBookTickerUpdatesTopOfBook() {
        store.apply(ticker(Venue.BINANCE, "100", "1", "101", "2", 1));
        store.apply(ticker(Venue.BINANCE, "100.5", "3", "101", "0", 2));

        OrderBook orderBook = store.book(Venue.BINANCE, BTC_USDT).orElseThrow();
        assertEquals(List.of(level("100.5", "3"), level("100", "1")), orderBook.bids());
        assertTrue(orderBook.asks().isEmpty());
    }

    @Test
    void testBooksAreSeparatedByVenue() {
        store.apply(book(Venue.BINANCE, EventKind.L2_SNAPSHOT, List.of(level("100", "1")), List.of(), 1));
        store.apply(book(Venue.COINBASE, EventKind.L2_SNAPSHOT, List.of(level("200", "1")), List.of(), 1));

        assertEquals(level("100", "1"), store.bestBid(Venue.BINANCE, BTC_USDT).orElseThrow());
        assertEquals(level("200", "1"), store.bestBid(Venue.COINBASE, BTC_USDT).orElseThrow());
        assertTrue(store.book(Venue.DERIBIT, BTC_USDT).isEmpty());
    }

    @Test
    void testAcceptsOnlyBookKinds() {
        assertTrue(store.accepts(book(Venue.BINANCE, EventKind.L2_DIFF, List.of(), List.of(), 1)));
        assertTrue(store.accepts(ticker(Venue.BINANCE, "1", "1", "2", "1", 1)));
        assertFalse(store.accepts(new CanonicalEvent(Venue.BINANCE, EventKind.TRADE, BTC_USDT, 1, 1,
            Map.of("p", BigDecimal.ONE, "q", BigDecimal.ONE))));
        assertFalse(store.accepts(new SpreadEvent(BTC_USDT, Venue.BINANCE, Venue.COINBASE,
            List.of(Venue.BINANCE, Venue.COINBASE), new BigDecimal("100"), new BigDecimal("101"), new BigDecimal("1"), 1)));
    }

    @Test
    void testNonBookEventIsRejected() {
        CanonicalEvent trade = new CanonicalEvent(Venue.BINANCE, EventKind.TRADE, BTC_USDT, 1, 1,
            Map.of("p", BigDecimal.ONE, "q", BigDecimal.ONE));

        assertThrows(IllegalArgumentException.class, () -> store.apply(trade));
        assertTrue(store.book(Venue.BINANCE, BTC_USDT).isEmpty());
    }
}
