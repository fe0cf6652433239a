package io.trading.feed.gateway.agent.binance;

import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.RawEvent;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.agent.ProtocolException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Classification of real Binance stream frames.
 */
class BinanceFrameDecoderTest {

    private final BinanceFrameDecoder decoder = new BinanceFrameDecoder(EnumSet.allOf(EventKind.class));

    @Test
    void testTrade() throws Exception {
        String message = """
            {
                "e": "trade",
                "E": 1704067200000,
                "s": "BTCUSDT",
                "t": 123456789,
                "p": "43250.50",
                "q": "0.125",
                "T": 1704067199999,
                "m": true
            }
            """;

        List<RawEvent> events = decoder.decode(message, 1704067200010L);

        assertEquals(1, events.size());
        RawEvent event = events.get(0);
        assertEquals(Venue.BINANCE, event.venue());
        assertEquals(EventKind.TRADE, event.kind());
        assertEquals(1704067200010L, event.receivedAt());
        assertEquals("43250.50", event.payload().get("p").asText());
    }

    @Test
    void testCombinedStreamIsUnwrapped() throws Exception {
        String message = """
            {"stream":"ethusdt@depth@100ms","data":{"e":"depthUpdate","E":1704067200000,"s":"ETHUSDT",
             "U":1,"u":2,"b":[["2250.10","1.5"]],"a":[["2250.20","0.7"]]}}
            """;

        List<RawEvent> events = decoder.decode(message, 1L);

        assertEquals(1, events.size());
        assertEquals(EventKind.L2_DIFF, events.get(0).kind());
        assertEquals("ETHUSDT", events.get(0).payload().get("s").asText());
    }

    @Test
    void testBookTickerHasNoEventTag() throws Exception {
        String message = """
            {"u":400900217,"s":"BNBUSDT","b":"25.35190000","B":"31.21000000","a":"25.36520000","A":"40.66000000"}
            """;

        List<RawEvent> events = decoder.decode(message, 1L);

        assertEquals(1, events.size());
        assertEquals(EventKind.BOOK_TICKER, events.get(0).kind());
    }

    @Test
    void testMarkPriceUpdateFeedsThreeKinds() throws Exception {
        String message = """
            {"e":"markPriceUpdate","E":1562305380000,"s":"BTCUSDT","p":"11794.15000000",
             "i":"11784.62659091","P":"11784.25641265","r":"0.00038167","T":1562306400000}
            """;

        List<RawEvent> events = decoder.decode(message, 1L);

        assertEquals(List.of(EventKind.MARK_PRICE, EventKind.INDEX_PRICE, EventKind.FUNDING_RATE),
            events.stream().map(RawEvent::kind).toList());
    }

    @Test
    void testDisabledKindsAreSkipped() throws Exception {
        BinanceFrameDecoder markOnly = new BinanceFrameDecoder(Set.of(EventKind.MARK_PRICE));
        String message = """
            {"e":"markPriceUpdate","E":1562305380000,"s":"BTCUSDT","p":"11794.15","i":"11784.62","r":"0.0003"}
            """;

        List<RawEvent> events = markOnly.decode(message, 1L);

        assertEquals(1, events.size());
        assertEquals(EventKind.MARK_PRICE, events.get(0).kind());
        assertTrue(markOnly.decode("{\"e\":\"trade\",\"s\":\"BTCUSDT\",\"p\":\"1\",\"q\":\"1\"}", 1L).isEmpty());
    }

    @Test
    void testSubscriptionAckIsIgnored() throws Exception {
        assertTrue(decoder.decode("{\"result\":null,\"id\":1}", 1L).isEmpty());
    }

    @Test
    void testErrorResponseIsProtocolError() {
        String message = "{\"error\":{\"code\":2,\"msg\":\"Invalid request\"},\"id\":1}";
        assertThrows(ProtocolException.class, () -> decoder.decode(message, 1L));
    }

    @Test
    void testMalformedFrameIsProtocolError() {
        assertThrows(ProtocolException.class, () -> decoder.decode("{\"e\":\"trade\",", 1L));
        assertThrows(ProtocolException.class, () -> decoder.decode("[1,2,3]", 1L));
    }

    @Test
    void testUnknownEventIsIgnored() throws Exception {
        assertTrue(decoder.decode("{\"e\":\"aggTrade\",\"s\":\"BTCUSDT\"}", 1L).isEmpty());
    }
}
