package io.trading.feed.gateway.agent.binance;

import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.agent.WebSocketFeedAgent;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Binance WebSocket agent.
 * Connects to wss://stream.binance.com:9443/ws and subscribes with a SUBSCRIBE request.
 */
public class BinanceAgent extends WebSocketFeedAgent {

    public static final List<String> DEFAULT_SYMBOLS = List.of("btcusdt", "ethusdt");

    // Binance rejects SUBSCRIBE requests with more than this many streams
    private static final int MAX_STREAMS_PER_REQUEST = 200;

    public BinanceAgent(URI uri, List<String> symbols, Set<EventKind> kinds, Duration connectTimeout, Clock clock) {
        super(Venue.BINANCE, uri, symbols, kinds, connectTimeout, new BinanceFrameDecoder(kinds), clock);
    }

    @Override
    protected List<String> subscriptionMessages() {
        List<String> streams = streams();
        List<String> messages = new ArrayList<>();
        int id = 1;
        for (int from = 0; from < streams.size(); from += MAX_STREAMS_PER_REQUEST) {
            List<String> batch = streams.subList(from, Math.min(streams.size(), from + MAX_STREAMS_PER_REQUEST));
            messages.add(String.format(
                "{\"method\":\"SUBSCRIBE\",\"params\":[\"%s\"],\"id\":%d}",
                String.join("\",\"", batch),
                id++
            ));
        }
        return messages;
    }

    List<String> streams() {
        Set<String> suffixes = new LinkedHashSet<>();
        if (wants(EventKind.TRADE)) {
            suffixes.add("@trade");
        }
        if (wants(EventKind.L2_DIFF)) {
            suffixes.add("@depth@100ms");
        }
        if (wants(EventKind.BOOK_TICKER)) {
            suffixes.add("@bookTicker");
        }
        if (wants(EventKind.TICKER_24H)) {
            suffixes.add("@ticker");
        }
        if (wants(EventKind.OHLCV)) {
            suffixes.add("@kline_1m");
        }
        if (wants(EventKind.MARK_PRICE) || wants(EventKind.FUNDING_RATE) || wants(EventKind.INDEX_PRICE)) {
            suffixes.add("@markPrice");
        }

        List<String> streams = new ArrayList<>();
        for (String symbol : symbols()) {
            String lower = symbol.toLowerCase(Locale.ROOT);
            for (String suffix : suffixes) {
                streams.add(lower + suffix);
            }
        }
        return streams;
    }
}
