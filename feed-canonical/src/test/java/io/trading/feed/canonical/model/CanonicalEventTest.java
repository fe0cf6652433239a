package io.trading.feed.canonical.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalEventTest {

    private static final Symbol BTC_USDT = new Symbol("BTC", "USDT");

    @Test
    void testFieldsFollowSchemaOrder() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("side", "buy");
        fields.put("q", new BigDecimal("0.5"));
        fields.put("p", new BigDecimal("100.00"));

        CanonicalEvent event = new CanonicalEvent(Venue.BINANCE, EventKind.TRADE, BTC_USDT, 1L, 2L, fields);

        assertEquals(List.of("p", "q", "side"), List.copyOf(event.fields().keySet()));
        assertEquals("100.00", event.price().toPlainString());
        assertEquals("trade", event.typeName());
        assertFalse(event.isAuxiliary());
    }

    @Test
    void testMissingRequiredFieldIsRejected() {
        Map<String, Object> fields = Map.of("p", new BigDecimal("1"));

        assertThrows(IllegalArgumentException.class,
            () -> new CanonicalEvent(Venue.BINANCE, EventKind.TRADE, BTC_USDT, 1L, 1L, fields));
    }

    @Test
    void testWrongTypeIsRejected() {
        Map<String, Object> fields = Map.of("p", "100", "q", new BigDecimal("1"));

        assertThrows(IllegalArgumentException.class,
            () -> new CanonicalEvent(Venue.BINANCE, EventKind.TRADE, BTC_USDT, 1L, 1L, fields));
    }

    @Test
    void testUndeclaredFieldIsRejected() {
        Map<String, Object> fields = Map.of("p", new BigDecimal("1"), "extra", "x");

        assertThrows(IllegalArgumentException.class,
            () -> new CanonicalEvent(Venue.BINANCE, EventKind.MARK_PRICE, BTC_USDT, 1L, 1L, fields));
    }

    @Test
    void testFieldsAreImmutable() {
        CanonicalEvent event = new CanonicalEvent(Venue.DERIBIT, EventKind.TELEMETRY, BTC_USDT, 1L, 1L,
            Map.of("latency_ms", 12L, "messages", 40L));

        assertTrue(event.isAuxiliary());
        assertThrows(UnsupportedOperationException.class, () -> event.fields().put("messages", 1L));
    }

    @Test
    void testKindFlags() {
        assertTrue(EventKind.MEMPOOL.isAuxiliary());
        assertTrue(EventKind.MEMPOOL.isExperimental());
        assertTrue(EventKind.OPTIONS_CHAIN.isExperimental());
        assertFalse(EventKind.OPTIONS_CHAIN.isAuxiliary());
        assertTrue(EventKind.NEWS_HEADLINE.isAuxiliary());
        assertFalse(EventKind.TRADE.isExperimental());
        assertEquals(EventKind.BOOK_TICKER, EventKind.fromWireName("BOOK_TICKER"));
        assertThrows(IllegalArgumentException.class, () -> EventKind.fromWireName("candles"));
    }
}
