package io.trading.feed.canonical.symbol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuoteTableTest {

    @Test
    void testQuotesAreOrderedLongestFirst() {
        QuoteTable table = QuoteTable.fromString("usd,usdt,btc,fdusd");

        assertEquals(List.of("FDUSD", "USDT", "USD", "BTC"), table.quotes());
    }

    @Test
    void testSplitRequiresNonEmptyBase() {
        QuoteTable table = QuoteTable.of("USDT");

        assertTrue(table.split("USDT").isEmpty());
        assertArrayEquals(new String[] {"BTC", "USDT"}, table.split("BTCUSDT").orElseThrow());
    }

    @Test
    void testInvalidQuoteListIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> QuoteTable.fromString(" "));
        assertThrows(IllegalArgumentException.class, () -> QuoteTable.fromString("usd-t"));
    }
}
