package io.trading.feed.canonical.mapping;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How one venue payload shape maps onto a canonical kind.
 *
 * @param symbol           Reads the venue-native symbol text
 * @param timestamp        Reads the event time; may yield {@code null}
 * @param receiptFallback  Use the receipt time when the payload has no event time
 * @param fields           Rule per canonical field name
 */
public record KindMapping(
    FieldRule symbol,
    FieldRule timestamp,
    boolean receiptFallback,
    Map<String, FieldRule> fields
) {
    public KindMapping {
        if (symbol == null) {
            throw new IllegalArgumentException("symbol rule cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp rule cannot be null");
        }
        fields = Map.copyOf(fields);
    }

    public FieldRule rule(String field) {
        return fields.get(field);
    }

    public static Builder builder(FieldRule symbol, FieldRule timestamp) {
        return new Builder(symbol, timestamp);
    }

    public static final class Builder {
        private final FieldRule symbol;
        private final FieldRule timestamp;
        private final Map<String, FieldRule> fields = new LinkedHashMap<>();
        private boolean receiptFallback;

        private Builder(FieldRule symbol, FieldRule timestamp) {
            this.symbol = symbol;
            this.timestamp = timestamp;
        }

        public Builder field(String name, FieldRule rule) {
            fields.put(name, rule);
            return this;
        }

        /**
         * Falls back to the receipt time for payloads that carry no event time.
         */
        public Builder receiptFallback() {
            this.receiptFallback = true;
            return this;
        }

        public KindMapping build() {
            return new KindMapping(symbol, timestamp, receiptFallback, fields);
        }
    }
}
