package io.trading.feed.gateway.agent.coinbase;

import io.trading.feed.canonical.model.EventKind;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoinbaseAgentTest {

    private static final URI URL = URI.create("wss://ws-feed.exchange.coinbase.com");

    @Test
    void testSubscribeMessage() {
        CoinbaseAgent agent = new CoinbaseAgent(URL, List.of("btc-usd", "ETH-USD"),
            EnumSet.of(EventKind.TRADE, EventKind.L2_SNAPSHOT, EventKind.L2_DIFF), Duration.ofSeconds(1), Clock.systemUTC());

        assertEquals(List.of("BTC-USD", "ETH-USD"), agent.symbols());
        assertEquals(List.of("matches", "level2_batch"), agent.channels());
        assertEquals(
            List.of("{\"type\":\"subscribe\",\"product_ids\":[\"BTC-USD\",\"ETH-USD\"],\"channels\":[\"matches\",\"level2_batch\"]}"),
            agent.subscriptionMessages()
        );
    }

    @Test
    void testNothingToSubscribe() {
        CoinbaseAgent agent = new CoinbaseAgent(URL, List.of("BTC-USD"),
            EnumSet.of(EventKind.MARK_PRICE), Duration.ofSeconds(1), Clock.systemUTC());

        assertTrue(agent.subscriptionMessages().isEmpty());
    }
}
