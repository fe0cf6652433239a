package io.trading.feed.gateway.agent.binance;

import io.trading.feed.canonical.model.EventKind;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BinanceAgentTest {

    private static final URI URL = URI.create("wss://stream.binance.com:9443/ws");

    private static BinanceAgent agent(List<String> symbols, Set<EventKind> kinds) {
        return new BinanceAgent(URL, symbols, kinds, Duration.ofSeconds(1), Clock.systemUTC());
    }

    @Test
    void testStreamsFollowEnabledKinds() {
        BinanceAgent agent = agent(List.of("BTCUSDT"), EnumSet.of(EventKind.TRADE, EventKind.BOOK_TICKER, EventKind.FUNDING_RATE));

        assertEquals(List.of("btcusdt@trade", "btcusdt@bookTicker", "btcusdt@markPrice"), agent.streams());
    }

    @Test
    void testSubscribeMessage() {
        BinanceAgent agent = agent(List.of("btcusdt", "ethusdt"), EnumSet.of(EventKind.TRADE));

        assertEquals(
            List.of("{\"method\":\"SUBSCRIBE\",\"params\":[\"btcusdt@trade\",\"ethusdt@trade\"],\"id\":1}"),
            agent.subscriptionMessages()
        );
    }

    @Test
    void testLargeSubscriptionsAreBatched() {
        List<String> symbols = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            symbols.add("coin" + i + "usdt");
        }
        BinanceAgent agent = agent(symbols, EnumSet.of(EventKind.TRADE, EventKind.TICKER_24H));

        List<String> messages = agent.subscriptionMessages();

        assertEquals(2, messages.size());
        assertTrue(messages.get(1).endsWith("\"id\":2}"));
    }

    @Test
    void testRequiresSymbols() {
        assertThrows(IllegalArgumentException.class, () -> agent(List.of(), EnumSet.of(EventKind.TRADE)));
    }
}
