package io.trading.feed.gateway.agent.coinbase;

import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.RawEvent;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.agent.ProtocolException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoinbaseFrameDecoderTest {

    private final CoinbaseFrameDecoder decoder = new CoinbaseFrameDecoder(
        EnumSet.of(EventKind.TRADE, EventKind.TICKER_24H, EventKind.L2_DIFF, EventKind.L2_SNAPSHOT));

    @Test
    void testMatchIsTrade() throws Exception {
        String message = """
            {
                "type": "match",
                "trade_id": 10,
                "sequence": 50,
                "maker_order_id": "ac928c66-ca53-498f-9c13-a110027a60e8",
                "taker_order_id": "132fb6ae-456b-4654-b4e0-d681ac05cea1",
                "time": "2014-11-07T08:19:27.028459Z",
                "product_id": "BTC-USD",
                "size": "5.23512",
                "price": "400.23",
                "side": "sell"
            }
            """;

        List<RawEvent> events = decoder.decode(message, 5L);

        assertEquals(1, events.size());
        assertEquals(Venue.COINBASE, events.get(0).venue());
        assertEquals(EventKind.TRADE, events.get(0).kind());
    }

    @Test
    void testLastMatchIsTrade() throws Exception {
        String message = """
            {"type":"last_match","trade_id":9,"product_id":"ETH-USD","size":"1","price":"2000.00",
             "side":"buy","time":"2024-01-01T00:00:00Z"}
            """;

        assertEquals(EventKind.TRADE, decoder.decode(message, 1L).get(0).kind());
    }

    @Test
    void testBookMessages() throws Exception {
        String snapshot = """
            {"type":"snapshot","product_id":"BTC-USD","bids":[["10101.10","0.45054140"]],"asks":[["10102.55","0.57753524"]]}
            """;
        String update = """
            {"type":"l2update","product_id":"BTC-USD","time":"2019-08-14T20:42:27.265Z","changes":[["buy","10101.80","0.162567"]]}
            """;

        assertEquals(EventKind.L2_SNAPSHOT, decoder.decode(snapshot, 1L).get(0).kind());
        assertEquals(EventKind.L2_DIFF, decoder.decode(update, 1L).get(0).kind());
    }

    @Test
    void testControlFramesAreIgnored() throws Exception {
        assertTrue(decoder.decode("{\"type\":\"subscriptions\",\"channels\":[]}", 1L).isEmpty());
        assertTrue(decoder.decode("{\"type\":\"heartbeat\",\"sequence\":90}", 1L).isEmpty());
    }

    @Test
    void testDisabledKindIsSkipped() throws Exception {
        CoinbaseFrameDecoder tradesOnly = new CoinbaseFrameDecoder(EnumSet.of(EventKind.TRADE));
        String ticker = "{\"type\":\"ticker\",\"product_id\":\"BTC-USD\",\"price\":\"400.00\"}";

        assertTrue(tradesOnly.decode(ticker, 1L).isEmpty());
    }

    @Test
    void testErrorIsProtocolError() {
        String message = "{\"type\":\"error\",\"message\":\"Failed to subscribe\",\"reason\":\"FOO-BAR is not a valid product\"}";

        ProtocolException e = assertThrows(ProtocolException.class, () -> decoder.decode(message, 1L));
        assertTrue(e.getMessage().contains("Failed to subscribe"));
    }
}
