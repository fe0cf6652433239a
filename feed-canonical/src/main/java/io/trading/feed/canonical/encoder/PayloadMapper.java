package io.trading.feed.canonical.encoder;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Builds the {@link ObjectMapper} used to read venue payloads into trees.
 *
 * <p>Floating point numbers are kept as {@link java.math.BigDecimal} with their source
 * scale, so a venue sending {@code 8950.0} is reported as {@code "8950.0"}.
 */
public final class PayloadMapper {

    private PayloadMapper() {
    }

    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        return mapper;
    }
}
