package io.trading.feed.gateway.agent.deribit;

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
 * Splits Deribit JSON-RPC subscription notifications into raw events.
 *
 * <p>A {@code trades.*} notification carries an array of trades. A {@code ticker.*}
 * notification for a perpetual feeds mark price, funding rate, open interest and the 24h
 * ticker; for an option it feeds the options chain only. Trades of options and dated
 * futures, and tickers of dated futures, are skipped: they have no canonical spot symbol.
 */
public class DeribitFrameDecoder implements FrameDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeribitFrameDecoder.class);

    private static final ObjectMapper MAPPER = PayloadMapper.create();

    private final Set<EventKind> kinds;

    public DeribitFrameDecoder(Set<EventKind> kinds) {
        this.kinds = Set.copyOf(kinds);
    }

    @Override
    public List<RawEvent> decode(String frame, long receivedAt) throws ProtocolException {
        JsonNode root;
        try {
            root = MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("[deribit] unreadable frame", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("[deribit] expected a JSON object");
        }
        if (root.has("error")) {
            JsonNode error = root.get("error");
            throw new ProtocolException("[deribit] error " + error.path("code").asText() + ": " + error.path("message").asText());
        }
        if (!"subscription".equals(root.path("method").asText())) {
            // subscribe results, heartbeats and test requests
            return List.of();
        }

        JsonNode params = root.path("params");
        String channel = params.path("channel").asText("");
        JsonNode data = params.path("data");
        List<RawEvent> events = new ArrayList<>();

        if (channel.startsWith("trades.")) {
            if (!data.isArray()) {
                throw new ProtocolException("[deribit] trades notification without an array: " + channel);
            }
            for (JsonNode trade : data) {
                if (isExpiring(trade.path("instrument_name").asText(""))) {
                    LOGGER.debug("[deribit] skipping trade on {}", trade.path("instrument_name").asText());
                    continue;
                }
                add(events, EventKind.TRADE, trade, receivedAt);
            }
        } else if (channel.startsWith("ticker.")) {
            decodeTicker(events, data, receivedAt);
        } else if (channel.startsWith("deribit_price_index.")) {
            add(events, EventKind.INDEX_PRICE, data, receivedAt);
        } else {
            LOGGER.debug("[deribit] ignoring channel {}", channel);
        }
        return events;
    }

    private void decodeTicker(List<RawEvent> events, JsonNode data, long receivedAt) {
        String instrument = data.path("instrument_name").asText("");
        if (isOption(instrument)) {
            add(events, EventKind.OPTIONS_CHAIN, data, receivedAt);
            return;
        }
        if (isExpiring(instrument)) {
            LOGGER.debug("[deribit] skipping ticker of {}", instrument);
            return;
        }
        if (data.hasNonNull("mark_price")) {
            add(events, EventKind.MARK_PRICE, data, receivedAt);
        }
        if (data.hasNonNull("current_funding") || data.hasNonNull("funding_8h")) {
            add(events, EventKind.FUNDING_RATE, data, receivedAt);
        }
        if (data.hasNonNull("open_interest")) {
            add(events, EventKind.OPEN_INTEREST, data, receivedAt);
        }
        if (data.hasNonNull("last_price")) {
            add(events, EventKind.TICKER_24H, data, receivedAt);
        }
    }

    // BTC-29MAR24-60000-C
    static boolean isOption(String instrument) {
        String[] parts = instrument.split("-");
        return parts.length == 4 && ("C".equals(parts[3]) || "P".equals(parts[3]));
    }

    // Options and dated futures: BTC-29MAR24-60000-C, BTC-29MAR24
    static boolean isExpiring(String instrument) {
        String[] parts = instrument.split("-");
        return parts.length >= 2 && !"PERPETUAL".equals(parts[1]);
    }

    private void add(List<RawEvent> events, EventKind kind, JsonNode payload, long receivedAt) {
        if (kinds.contains(kind)) {
            events.add(new RawEvent(Venue.DERIBIT, kind, payload, receivedAt));
        }
    }
}
