package io.trading.feed.gateway.agent;

import io.trading.feed.canonical.model.RawEvent;

import java.util.List;

/**
 * Splits one venue text frame into raw events.
 *
 * <p>Control frames (acks, heartbeats, subscription confirmations) decode to an empty
 * list. Decoders are stateless.
 */
@FunctionalInterface
public interface FrameDecoder {

    /**
     * @param frame      Text frame as received
     * @param receivedAt Receipt time in epoch milliseconds
     * @throws ProtocolException if the frame is not JSON or is an error frame
     */
    List<RawEvent> decode(String frame, long receivedAt) throws ProtocolException;
}
