package io.trading.feed.gateway.agent.deribit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.agent.WebSocketFeedAgent;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deribit JSON-RPC WebSocket agent.
 * Connects to wss://www.deribit.com/ws/api/v2 and subscribes with public/subscribe.
 */
public class DeribitAgent extends WebSocketFeedAgent {

    public static final List<String> DEFAULT_SYMBOLS = List.of("BTC-PERPETUAL", "ETH-PERPETUAL");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Set<EventKind> TICKER_KINDS = Set.of(
        EventKind.MARK_PRICE,
        EventKind.FUNDING_RATE,
        EventKind.OPEN_INTEREST,
        EventKind.TICKER_24H,
        EventKind.OPTIONS_CHAIN
    );

    public DeribitAgent(URI uri, List<String> symbols, Set<EventKind> kinds, Duration connectTimeout, Clock clock) {
        super(Venue.DERIBIT, uri, upper(symbols), kinds, connectTimeout, new DeribitFrameDecoder(kinds), clock);
    }

    private static List<String> upper(List<String> symbols) {
        return symbols.stream().map(s -> s.toUpperCase(Locale.ROOT)).toList();
    }

    @Override
    protected List<String> subscriptionMessages() {
        Set<String> channels = channels();
        if (channels.isEmpty()) {
            return List.of();
        }
        ObjectNode request = MAPPER.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", 1);
        request.put("method", "public/subscribe");
        ArrayNode array = request.putObject("params").putArray("channels");
        channels.forEach(array::add);
        return List.of(request.toString());
    }

    Set<String> channels() {
        boolean ticker = kinds().stream().anyMatch(TICKER_KINDS::contains);
        Set<String> channels = new LinkedHashSet<>();
        for (String instrument : symbols()) {
            if (wants(EventKind.TRADE)) {
                channels.add("trades." + instrument + ".100ms");
            }
            if (ticker) {
                channels.add("ticker." + instrument + ".100ms");
            }
            if (wants(EventKind.INDEX_PRICE)) {
                channels.add("deribit_price_index." + indexName(instrument));
            }
        }
        return channels;
    }

    // BTC-PERPETUAL -> btc_usd, ETH_USDC-PERPETUAL -> eth_usdc
    static String indexName(String instrument) {
        String head = instrument.split("-")[0].toLowerCase(Locale.ROOT);
        return head.contains("_") ? head : head + "_usd";
    }
}
