package io.trading.feed.gateway.agent.binance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.feed.canonical.encoder.PayloadMapper;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.RawEvent;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.agent.FrameDecoder;
import io.trading.feed.gateway.agent.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Classifies Binance stream frames by their {@code e} tag.
 *
 * <p>Handles raw ({@code /ws}) and combined ({@code /stream}) payloads. A mark price update
 * feeds up to three kinds: mark price, index price and funding rate.
 */
public class BinanceFrameDecoder implements FrameDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(BinanceFrameDecoder.class);

    private static final ObjectMapper MAPPER = PayloadMapper.create();

    private final Set<EventKind> kinds;

    public BinanceFrameDecoder(Set<EventKind> kinds) {
        this.kinds = Set.copyOf(kinds);
    }

    @Override
    public List<RawEvent> decode(String frame, long receivedAt) throws ProtocolException {
        JsonNode root;
        try {
            root = MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("[binance] unreadable frame: " + abbreviate(frame), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("[binance] expected a JSON object: " + abbreviate(frame));
        }

        // Subscription acks: {"result":null,"id":1} or {"error":{...},"id":1}
        if (root.has("error")) {
            throw new ProtocolException("[binance] error response: " + root.get("error"));
        }
        if (root.has("result") && root.has("id")) {
            return List.of();
        }

        JsonNode payload = root.has("stream") && root.has("data") ? root.get("data") : root;
        String eventType = payload.path("e").asText("");

        List<RawEvent> events = new ArrayList<>(3);
        switch (eventType) {
            case "trade" -> add(events, EventKind.TRADE, payload, receivedAt);
            case "depthUpdate" -> add(events, EventKind.L2_DIFF, payload, receivedAt);
            case "24hrTicker" -> add(events, EventKind.TICKER_24H, payload, receivedAt);
            case "kline" -> add(events, EventKind.OHLCV, payload, receivedAt);
            case "markPriceUpdate" -> {
                add(events, EventKind.MARK_PRICE, payload, receivedAt);
                if (payload.hasNonNull("i")) {
                    add(events, EventKind.INDEX_PRICE, payload, receivedAt);
                }
                if (payload.hasNonNull("r") && !payload.get("r").asText().isEmpty()) {
                    add(events, EventKind.FUNDING_RATE, payload, receivedAt);
                }
            }
            case "" -> {
                if (payload.has("u") && payload.has("s") && payload.has("b") && payload.has("a")) {
                    add(events, EventKind.BOOK_TICKER, payload, receivedAt);
                } else {
                    LOGGER.debug("[binance] ignoring untagged frame: {}", abbreviate(frame));
                }
            }
            default -> LOGGER.debug("[binance] ignoring event type {}", eventType);
        }
        return events;
    }

    private void add(List<RawEvent> events, EventKind kind, JsonNode payload, long receivedAt) {
        if (kinds.contains(kind)) {
            events.add(new RawEvent(Venue.BINANCE, kind, payload, receivedAt));
        }
    }

    static String abbreviate(String frame) {
        return frame.length() <= 200 ? frame : frame.substring(0, 200) + "...";
    }
}
