package io.trading.feed.gateway.agent.coinbase;

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

import java.util.List;
import java.util.Set;

/**
 * Classifies Coinbase Exchange feed frames by their {@code type} field.
 */
public class CoinbaseFrameDecoder implements FrameDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CoinbaseFrameDecoder.class);

    private static final ObjectMapper MAPPER = PayloadMapper.create();

    private final Set<EventKind> kinds;

    public CoinbaseFrameDecoder(Set<EventKind> kinds) {
        this.kinds = Set.copyOf(kinds);
    }

    @Override
    public List<RawEvent> decode(String frame, long receivedAt) throws ProtocolException {
        JsonNode root;
        try {
            root = MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("[coinbase] unreadable frame", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("[coinbase] expected a JSON object");
        }

        String type = root.path("type").asText("");
        EventKind kind = switch (type) {
            case "match", "last_match" -> EventKind.TRADE;
            case "ticker" -> EventKind.TICKER_24H;
            case "snapshot" -> EventKind.L2_SNAPSHOT;
            case "l2update" -> EventKind.L2_DIFF;
            case "error" -> throw new ProtocolException("[coinbase] error: "
                + root.path("message").asText() + " " + root.path("reason").asText(""));
            default -> null;
        };
        if (kind == null) {
            if (!"subscriptions".equals(type) && !"heartbeat".equals(type)) {
                LOGGER.debug("[coinbase] ignoring message type '{}'", type);
            }
            return List.of();
        }
        if (!kinds.contains(kind)) {
            return List.of();
        }
        return List.of(new RawEvent(Venue.COINBASE, kind, root, receivedAt));
    }
}
