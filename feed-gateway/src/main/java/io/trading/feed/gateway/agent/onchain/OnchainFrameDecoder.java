package io.trading.feed.gateway.agent.onchain;

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
import java.util.Map;
import java.util.Set;

/**
 * Decodes frames from the on-chain relay. The relay already shapes each frame as one
 * event with a {@code type} tag, an {@code s} pair and an optional {@code ts}.
 */
public class OnchainFrameDecoder implements FrameDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(OnchainFrameDecoder.class);

    private static final ObjectMapper MAPPER = PayloadMapper.create();

    static final Map<String, EventKind> TYPES = Map.of(
        "transfer", EventKind.ONCHAIN_TRANSFER,
        "balance", EventKind.ONCHAIN_BALANCE,
        "dex_pool", EventKind.TOP_DEX_POOL,
        "pending_tx", EventKind.MEMPOOL,
        "bridge", EventKind.BRIDGE_FLOW,
        "mev", EventKind.MEV_SIGNAL
    );

    private final Set<EventKind> kinds;

    public OnchainFrameDecoder(Set<EventKind> kinds) {
        this.kinds = Set.copyOf(kinds);
    }

    @Override
    public List<RawEvent> decode(String frame, long receivedAt) throws ProtocolException {
        JsonNode root;
        try {
            root = MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("[onchain] unreadable frame", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("[onchain] expected a JSON object");
        }

        String type = root.path("type").asText("");
        if ("error".equals(type)) {
            throw new ProtocolException("[onchain] relay error: " + root.path("message").asText());
        }
        EventKind kind = TYPES.get(type);
        if (kind == null) {
            LOGGER.debug("[onchain] ignoring frame type '{}'", type);
            return List.of();
        }
        if (!kinds.contains(kind)) {
            return List.of();
        }
        return List.of(new RawEvent(Venue.ONCHAIN, kind, root, receivedAt));
    }
}
