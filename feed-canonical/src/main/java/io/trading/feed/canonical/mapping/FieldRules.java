package io.trading.feed.canonical.mapping;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import io.trading.feed.canonical.model.PriceLevel;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Factory methods for the common {@link FieldRule} shapes: a JSON pointer plus a
 * target type.
 */
public final class FieldRules {

    private FieldRules() {
    }

    /**
     * Exact decimal from a JSON string or number. The source text is kept, so
     * {@code "100.00"} stays {@code 100.00}.
     */
    public static FieldRule decimal(String pointer) {
        JsonPointer path = JsonPointer.compile(pointer);
        return payload -> toDecimal(node(payload, path));
    }

    public static FieldRule text(String pointer) {
        JsonPointer path = JsonPointer.compile(pointer);
        return payload -> {
            JsonNode node = node(payload, path);
            if (node == null) {
                return null;
            }
            if (!node.isValueNode()) {
                throw new IllegalArgumentException("expected text but was " + node.getNodeType());
            }
            return node.asText();
        };
    }

    public static FieldRule integer(String pointer) {
        JsonPointer path = JsonPointer.compile(pointer);
        return payload -> toLong(node(payload, path));
    }

    public static FieldRule bool(String pointer) {
        JsonPointer path = JsonPointer.compile(pointer);
        return payload -> {
            JsonNode node = node(payload, path);
            if (node == null) {
                return null;
            }
            if (node.isBoolean()) {
                return node.booleanValue();
            }
            if (node.isTextual() && ("true".equalsIgnoreCase(node.textValue()) || "false".equalsIgnoreCase(node.textValue()))) {
                return Boolean.parseBoolean(node.textValue());
            }
            throw new IllegalArgumentException("expected boolean but was " + node);
        };
    }

    /**
     * Array of {@code [price, quantity, ...]} arrays. Extra trailing elements are ignored.
     */
    public static FieldRule levels(String pointer) {
        JsonPointer path = JsonPointer.compile(pointer);
        return payload -> {
            JsonNode node = node(payload, path);
            if (node == null) {
                return null;
            }
            if (!node.isArray()) {
                throw new IllegalArgumentException("expected level array but was " + node.getNodeType());
            }
            List<PriceLevel> levels = new ArrayList<>(node.size());
            for (JsonNode level : node) {
                if (!level.isArray() || level.size() < 2) {
                    throw new IllegalArgumentException("malformed level: " + level);
                }
                levels.add(new PriceLevel(toDecimal(level.get(0)), toDecimal(level.get(1))));
            }
            return levels;
        };
    }

    /**
     * Epoch milliseconds from a number, a numeric string or an ISO-8601 instant.
     */
    public static FieldRule timestamp(String pointer) {
        JsonPointer path = JsonPointer.compile(pointer);
        return payload -> toEpochMillis(node(payload, path));
    }

    /**
     * First non-null result of the given rules.
     */
    public static FieldRule firstOf(FieldRule... rules) {
        return payload -> {
            for (FieldRule rule : rules) {
                Object value = rule.read(payload);
                if (value != null) {
                    return value;
                }
            }
            return null;
        };
    }

    /**
     * Text at the pointer, mapped through the given function.
     */
    public static FieldRule textMapped(String pointer, Function<String, Object> mapper) {
        FieldRule source = text(pointer);
        return payload -> {
            Object value = source.read(payload);
            return value == null ? null : mapper.apply((String) value);
        };
    }

    public static FieldRule constant(Object value) {
        return payload -> value;
    }

    static JsonNode node(JsonNode payload, JsonPointer path) {
        JsonNode node = payload.at(path);
        return node.isMissingNode() || node.isNull() ? null : node;
    }

    static BigDecimal toDecimal(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            String text = node.textValue().trim();
            if (text.isEmpty()) {
                throw new IllegalArgumentException("empty decimal");
            }
            return new BigDecimal(text);
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        throw new IllegalArgumentException("expected decimal but was " + node.getNodeType());
    }

    static Long toLong(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            return Long.parseLong(node.textValue().trim());
        }
        throw new IllegalArgumentException("expected integer but was " + node);
    }

    static Long toEpochMillis(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            return node.longValue();
        }
        if (node.isTextual()) {
            String text = node.textValue().trim();
            if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                return Long.parseLong(text);
            }
            try {
                return Instant.parse(text).toEpochMilli();
            } catch (DateTimeException | ArithmeticException e) {
                // unparsable, or outside the epoch-millis range
                throw new IllegalArgumentException("unparsable timestamp: " + text, e);
            }
        }
        throw new IllegalArgumentException("expected timestamp but was " + node.getNodeType());
    }
}
