package io.trading.feed.gateway.agent.onchain;

import io.trading.feed.canonical.model.EventKind;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OnchainAgentTest {

    @Test
    void testSubscribeMessage() {
        OnchainAgent agent = new OnchainAgent(URI.create("ws://127.0.0.1:8546/relay"), List.of("ETH-USD"),
            EnumSet.of(EventKind.TRADE, EventKind.ONCHAIN_BALANCE, EventKind.ONCHAIN_TRANSFER, EventKind.MEMPOOL),
            Duration.ofSeconds(1), Clock.systemUTC());

        assertEquals(List.of("balance", "pending_tx", "transfer"), agent.types());
        assertEquals(
            List.of("{\"op\":\"subscribe\",\"symbols\":[\"ETH-USD\"],\"types\":[\"balance\",\"pending_tx\",\"transfer\"]}"),
            agent.subscriptionMessages()
        );
    }
}
