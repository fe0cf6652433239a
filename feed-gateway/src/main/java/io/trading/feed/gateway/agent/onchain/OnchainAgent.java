package io.trading.feed.gateway.agent.onchain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.agent.WebSocketFeedAgent;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Agent for the on-chain relay, a WebSocket service that watches the chain and pushes
 * transfers, balances, DEX pools, pending transactions, bridge flows and MEV signals.
 */
public class OnchainAgent extends WebSocketFeedAgent {

    public static final List<String> DEFAULT_SYMBOLS = List.of("ETH-USD", "USDC-USD");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public OnchainAgent(URI uri, List<String> symbols, Set<EventKind> kinds, Duration connectTimeout, Clock clock) {
        super(Venue.ONCHAIN, uri, symbols, kinds, connectTimeout, new OnchainFrameDecoder(kinds), clock);
    }

    @Override
    protected boolean enableCompression() {
        return false;
    }

    @Override
    protected List<String> subscriptionMessages() {
        List<String> types = types();
        if (types.isEmpty()) {
            return List.of();
        }
        ObjectNode request = MAPPER.createObjectNode();
        request.put("op", "subscribe");
        ArrayNode symbolArray = request.putArray("symbols");
        symbols().forEach(symbolArray::add);
        ArrayNode typeArray = request.putArray("types");
        types.forEach(typeArray::add);
        return List.of(request.toString());
    }

    List<String> types() {
        return OnchainFrameDecoder.TYPES.entrySet().stream()
            .filter(entry -> wants(entry.getValue()))
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }
}
