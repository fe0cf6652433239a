package io.trading.feed.canonical.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.feed.canonical.encoder.PayloadMapper;
import io.trading.feed.canonical.model.PriceLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldRulesTest {

    private static final ObjectMapper MAPPER = PayloadMapper.create();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    void testDecimalKeepsScale() throws Exception {
        JsonNode payload = json("{\"a\":\"100.00\",\"b\":8950.0,\"c\":\"\",\"d\":\"x\"}");

        assertEquals("100.00", ((BigDecimal) FieldRules.decimal("/a").read(payload)).toPlainString());
        assertEquals("8950.0", ((BigDecimal) FieldRules.decimal("/b").read(payload)).toPlainString());
        assertNull(FieldRules.decimal("/missing").read(payload));
        assertThrows(IllegalArgumentException.class, () -> FieldRules.decimal("/c").read(payload));
        assertThrows(IllegalArgumentException.class, () -> FieldRules.decimal("/d").read(payload));
    }

    @Test
    void testTimestampFormats() throws Exception {
        JsonNode payload = json("""
            {"n":1704067200000,"s":"1704067200000","iso":"2014-11-07T08:19:27.028459Z","bad":"yesterday"}
            """);

        assertEquals(1704067200000L, FieldRules.timestamp("/n").read(payload));
        assertEquals(1704067200000L, FieldRules.timestamp("/s").read(payload));
        assertEquals(1415348367028L, FieldRules.timestamp("/iso").read(payload));
        assertThrows(IllegalArgumentException.class, () -> FieldRules.timestamp("/bad").read(payload));
    }

    @Test
    void testTimestampBeyondEpochMillisRange() throws Exception {
        JsonNode payload = json("{\"far\":\"+1000000000-01-01T00:00:00Z\"}");

        assertThrows(IllegalArgumentException.class, () -> FieldRules.timestamp("/far").read(payload));
    }

    @Test
    void testLevels() throws Exception {
        JsonNode payload = json("{\"b\":[[\"0.0024\",\"10\",\"extra\"]],\"bad\":[[\"1\"]]}");

        assertEquals(List.of(new PriceLevel(new BigDecimal("0.0024"), new BigDecimal("10"))),
            FieldRules.levels("/b").read(payload));
        assertThrows(IllegalArgumentException.class, () -> FieldRules.levels("/bad").read(payload));
    }

    @Test
    void testNestedPointerAndNull() throws Exception {
        JsonNode payload = json("{\"k\":{\"i\":\"1m\",\"x\":true},\"n\":null}");

        assertEquals("1m", FieldRules.text("/k/i").read(payload));
        assertEquals(Boolean.TRUE, FieldRules.bool("/k/x").read(payload));
        assertNull(FieldRules.text("/n").read(payload));
    }

    @Test
    void testFirstOfAndTextMapped() throws Exception {
        JsonNode payload = json("{\"E\":2,\"side\":\"buy\"}");

        assertEquals(2L, FieldRules.firstOf(FieldRules.timestamp("/T"), FieldRules.timestamp("/E")).read(payload));
        assertEquals("BUY", FieldRules.textMapped("/side", s -> s.toUpperCase()).read(payload));
        assertEquals("x", FieldRules.constant("x").read(payload));
    }

    @Test
    void testInteger() throws Exception {
        JsonNode payload = json("{\"a\":12,\"b\":\"34\",\"c\":1.5}");

        assertEquals(12L, FieldRules.integer("/a").read(payload));
        assertEquals(34L, FieldRules.integer("/b").read(payload));
        assertThrows(IllegalArgumentException.class, () -> FieldRules.integer("/c").read(payload));
    }
}
