package io.trading.feed.canonical.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Venue-native payload as handed over by an agent, before canonicalization.
 *
 * @param venue      Originating venue
 * @param kind       Kind the agent classified the payload as
 * @param payload    Parsed vendor JSON, opaque to everything but the mapping table
 * @param receivedAt Local receipt time in epoch milliseconds
 */
public record RawEvent(
    Venue venue,
    EventKind kind,
    JsonNode payload,
    long receivedAt
) {
    public RawEvent {
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }
}
