package io.trading.feed.gateway.agent.coinbase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.agent.WebSocketFeedAgent;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Coinbase Exchange WebSocket agent.
 * Connects to wss://ws-feed.exchange.coinbase.com; one subscribe message carries every
 * product and channel.
 */
public class CoinbaseAgent extends WebSocketFeedAgent {

    public static final List<String> DEFAULT_SYMBOLS = List.of("BTC-USD", "ETH-USD");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public CoinbaseAgent(URI uri, List<String> symbols, Set<EventKind> kinds, Duration connectTimeout, Clock clock) {
        super(Venue.COINBASE, uri, upper(symbols), kinds, connectTimeout, new CoinbaseFrameDecoder(kinds), clock);
    }

    private static List<String> upper(List<String> symbols) {
        return symbols.stream().map(s -> s.toUpperCase(Locale.ROOT)).toList();
    }

    @Override
    protected List<String> subscriptionMessages() {
        List<String> channels = channels();
        if (channels.isEmpty()) {
            return List.of();
        }
        ObjectNode message = MAPPER.createObjectNode();
        message.put("type", "subscribe");
        ArrayNode products = message.putArray("product_ids");
        symbols().forEach(products::add);
        ArrayNode channelArray = message.putArray("channels");
        channels.forEach(channelArray::add);
        return List.of(message.toString());
    }

    List<String> channels() {
        List<String> channels = new ArrayList<>();
        if (wants(EventKind.TRADE)) {
            channels.add("matches");
        }
        if (wants(EventKind.TICKER_24H)) {
            channels.add("ticker");
        }
        if (wants(EventKind.L2_DIFF) || wants(EventKind.L2_SNAPSHOT)) {
            channels.add("level2_batch");
        }
        return channels;
    }
}
