package io.trading.feed.gateway.agent.deribit;

import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.RawEvent;
import io.trading.feed.gateway.agent.ProtocolException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeribitFrameDecoderTest {

    private final DeribitFrameDecoder decoder = new DeribitFrameDecoder(EnumSet.allOf(EventKind.class));

    @Test
    void testTradesNotificationCarriesManyTrades() throws Exception {
        String message = """
            {
              "jsonrpc": "2.0",
              "method": "subscription",
              "params": {
                "channel": "trades.BTC-PERPETUAL.100ms",
                "data": [
                  {"trade_seq":30289432,"trade_id":"48079254","timestamp":1590484156350,"price":8950.0,
                   "instrument_name":"BTC-PERPETUAL","direction":"sell","amount":10.0},
                  {"trade_seq":30289433,"trade_id":"48079255","timestamp":1590484156350,"price":8950.0,
                   "instrument_name":"BTC-PERPETUAL","direction":"sell","amount":100.0}
                ]
              }
            }
            """;

        List<RawEvent> events = decoder.decode(message, 1L);

        assertEquals(2, events.size());
        assertTrue(events.stream().allMatch(e -> e.kind() == EventKind.TRADE));
        assertEquals("8950.0", events.get(0).payload().get("price").toString());
    }

    @Test
    void testPerpetualTicker() throws Exception {
        String message = """
            {"jsonrpc":"2.0","method":"subscription","params":{"channel":"ticker.BTC-PERPETUAL.100ms",
             "data":{"timestamp":1623060194301,"instrument_name":"BTC-PERPETUAL","mark_price":36214.37,
                     "index_price":36202.51,"last_price":36219.5,"current_funding":0.0001,"funding_8h":0.00003,
                     "open_interest":502097590,"stats":{"volume":7870.5,"high":37030.0,"low":35300.0}}}}
            """;

        List<RawEvent> events = decoder.decode(message, 1L);

        assertEquals(
            List.of(EventKind.MARK_PRICE, EventKind.FUNDING_RATE, EventKind.OPEN_INTEREST, EventKind.TICKER_24H),
            events.stream().map(RawEvent::kind).toList()
        );
    }

    @Test
    void testOptionTickerFeedsOptionsChainOnly() throws Exception {
        String message = """
            {"jsonrpc":"2.0","method":"subscription","params":{"channel":"ticker.BTC-29MAR24-60000-C.100ms",
             "data":{"timestamp":1700000000000,"instrument_name":"BTC-29MAR24-60000-C","mark_price":0.0123,
                     "mark_iv":55.2,"open_interest":12.5,"last_price":0.012}}}
            """;

        List<RawEvent> events = decoder.decode(message, 1L);

        assertEquals(1, events.size());
        assertEquals(EventKind.OPTIONS_CHAIN, events.get(0).kind());
    }

    @Test
    void testOptionAndFutureTradesAreSkipped() throws Exception {
        String message = """
            {"jsonrpc":"2.0","method":"subscription","params":{"channel":"trades.option.BTC.100ms",
             "data":[
               {"trade_seq":1,"timestamp":1700000000000,"price":0.0425,
                "instrument_name":"BTC-29MAR24-60000-C","direction":"buy","amount":1.0},
               {"trade_seq":2,"timestamp":1700000000001,"price":61250.5,
                "instrument_name":"BTC-29MAR24","direction":"sell","amount":20.0},
               {"trade_seq":3,"timestamp":1700000000002,"price":60010.0,
                "instrument_name":"BTC-PERPETUAL","direction":"buy","amount":10.0}
             ]}}
            """;

        List<RawEvent> events = decoder.decode(message, 1L);

        assertEquals(1, events.size());
        assertEquals("BTC-PERPETUAL", events.get(0).payload().get("instrument_name").asText());
    }

    @Test
    void testDatedFutureTickerIsSkipped() throws Exception {
        String message = """
            {"jsonrpc":"2.0","method":"subscription","params":{"channel":"ticker.BTC-29MAR24.100ms",
             "data":{"timestamp":1700000000000,"instrument_name":"BTC-29MAR24","mark_price":61250.5,
                     "open_interest":1200.0,"last_price":61251.0}}}
            """;

        assertTrue(decoder.decode(message, 1L).isEmpty());
    }

    @Test
    void testPriceIndex() throws Exception {
        String message = """
            {"jsonrpc":"2.0","method":"subscription","params":{"channel":"deribit_price_index.btc_usd",
             "data":{"timestamp":1550588002899,"price":3937.89,"index_name":"btc_usd"}}}
            """;

        assertEquals(EventKind.INDEX_PRICE, decoder.decode(message, 1L).get(0).kind());
    }

    @Test
    void testRpcResultsAreIgnored() throws Exception {
        String message = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":[\"trades.BTC-PERPETUAL.100ms\"]}";
        assertTrue(decoder.decode(message, 1L).isEmpty());
    }

    @Test
    void testRpcErrorIsProtocolError() {
        String message = "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":10001,\"message\":\"error\"}}";
        assertThrows(ProtocolException.class, () -> decoder.decode(message, 1L));
    }

    @Test
    void testTradesWithoutArrayIsProtocolError() {
        String message = """
            {"jsonrpc":"2.0","method":"subscription","params":{"channel":"trades.BTC-PERPETUAL.100ms","data":{}}}
            """;
        assertThrows(ProtocolException.class, () -> decoder.decode(message, 1L));
    }

    @Test
    void testIsOption() {
        assertTrue(DeribitFrameDecoder.isOption("BTC-29MAR24-60000-C"));
        assertTrue(DeribitFrameDecoder.isOption("ETH-29MAR24-3000-P"));
        assertFalse(DeribitFrameDecoder.isOption("BTC-PERPETUAL"));
        assertFalse(DeribitFrameDecoder.isOption("BTC-29MAR24"));
    }

    @Test
    void testIsExpiring() {
        assertTrue(DeribitFrameDecoder.isExpiring("BTC-29MAR24-60000-C"));
        assertTrue(DeribitFrameDecoder.isExpiring("ETH-29MAR24"));
        assertFalse(DeribitFrameDecoder.isExpiring("BTC-PERPETUAL"));
        assertFalse(DeribitFrameDecoder.isExpiring("SOL_USDC-PERPETUAL"));
        assertFalse(DeribitFrameDecoder.isExpiring("ETH_USDC"));
    }
}
