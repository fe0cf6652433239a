package io.trading.feed.canonical.mapping;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads one canonical value out of a venue payload.
 *
 * <p>Returns {@code null} when the source is absent. Throws
 * {@link IllegalArgumentException} when the source is present but cannot be read as the
 * target type.
 */
@FunctionalInterface
public interface FieldRule {

    Object read(JsonNode payload);
}
