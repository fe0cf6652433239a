package io.trading.feed.canonical.model;

/**
 * Value types a canonical event field can carry.
 */
public enum FieldType {
    /** Exact decimal, serialized as a JSON string. */
    DECIMAL,
    /** Free text. */
    TEXT,
    /** Signed 64-bit integer (ids, epoch millis). */
    INTEGER,
    /** Boolean flag. */
    BOOLEAN,
    /** Ordered list of {@link PriceLevel}. */
    LEVELS;

    /**
     * Returns whether the given value is acceptable for this type.
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case DECIMAL -> value instanceof java.math.BigDecimal;
            case TEXT -> value instanceof String;
            case INTEGER -> value instanceof Long;
            case BOOLEAN -> value instanceof Boolean;
            case LEVELS -> value instanceof java.util.List<?> list
                && list.stream().allMatch(PriceLevel.class::isInstance);
        };
    }
}
