package io.trading.feed.canonical.encoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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

class JsonLineEncoderTest {

    private final JsonLineEncoder encoder = JsonLineEncoder.getInstance();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testTradeLine() {
        CanonicalEvent trade = new CanonicalEvent(Venue.BINANCE, EventKind.TRADE, new Symbol("BTC", "USDT"),
            1704067200000L, 1704067200005L,
            Map.of("p", new BigDecimal("43250.50"), "q", new BigDecimal("0.010"), "t", 42L, "side", "buy"));

        String line = encoder.encode(trade);

        assertEquals("{\"agent\":\"binance\",\"type\":\"trade\",\"s\":\"BTC-USDT\",\"p\":\"43250.50\","
            + "\"q\":\"0.010\",\"t\":42,\"side\":\"buy\",\"ts\":1704067200000}", line);
        assertFalse(line.contains("\n"));
    }

    @Test
    void testLevelsAreStringPairs() throws Exception {
        CanonicalEvent diff = new CanonicalEvent(Venue.COINBASE, EventKind.L2_DIFF, new Symbol("ETH", "USD"), 1L, 1L,
            Map.of("bids", List.of(new PriceLevel(new BigDecimal("2000.10"), new BigDecimal("1.5"))),
                "asks", List.of()));

        JsonNode json = mapper.readTree(encoder.encode(diff));

        assertEquals("2000.10", json.get("bids").get(0).get(0).asText());
        assertEquals("1.5", json.get("bids").get(0).get(1).asText());
        assertEquals(0, json.get("asks").size());
    }

    @Test
    void testSpreadLine() throws Exception {
        SpreadEvent spread = new SpreadEvent(new Symbol("BTC", "USDT"), Venue.BINANCE, Venue.COINBASE,
            List.of(Venue.BINANCE, Venue.COINBASE), new BigDecimal("100"), new BigDecimal("107"),
            new BigDecimal("0.07"), 1000L);

        JsonNode json = mapper.readTree(encoder.encode(spread));

        assertEquals("spread", json.get("type").asText());
        assertEquals("BTC-USDT", json.get("s").asText());
        assertEquals("binance", json.get("buy").asText());
        assertEquals("coinbase", json.get("sell").asText());
        assertEquals(2, json.get("venues").size());
        assertEquals("0.07", json.get("spread").asText());
        assertEquals("107", json.get("sell_p").asText());
        assertEquals(1000L, json.get("ts").asLong());
    }

    @Test
    void testLargeDecimalUsesPlainNotation() {
        CanonicalEvent mark = new CanonicalEvent(Venue.DERIBIT, EventKind.MARK_PRICE, new Symbol("BTC", "USD"), 1L, 1L,
            Map.of("p", new BigDecimal("6E+4")));

        assertTrue(encoder.encode(mark).contains("\"p\":\"60000\""));
    }
}
