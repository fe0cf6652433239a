package io.trading.feed.canonical.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Venue-independent market event.
 *
 * <p>The field map is validated against {@link EventKind#fields()} on construction: every
 * required field is present, every value has its declared type and no undeclared field is
 * carried. Fields are kept in schema order.
 *
 * @param venue      Originating venue
 * @param kind       Event kind
 * @param symbol     Canonical symbol
 * @param timestamp  Event time reported by the venue, epoch milliseconds
 * @param receivedAt Local receipt time, epoch milliseconds
 * @param fields     Kind-specific fields keyed by wire name
 */
public record CanonicalEvent(
    Venue venue,
    EventKind kind,
    Symbol symbol,
    long timestamp,
    long receivedAt,
    Map<String, Object> fields
) implements FeedEvent {

    public CanonicalEvent {
        if (venue == null) {
            throw new IllegalArgumentException("venue cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (symbol == null) {
            throw new IllegalArgumentException("symbol cannot be null");
        }
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        fields = validate(kind, fields);
    }

    private static Map<String, Object> validate(EventKind kind, Map<String, Object> fields) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (FieldSpec spec : kind.fields()) {
            Object value = fields.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    throw new IllegalArgumentException(kind + " requires field " + spec.name());
                }
                continue;
            }
            if (!spec.type().accepts(value)) {
                throw new IllegalArgumentException(
                    kind + "." + spec.name() + " must be " + spec.type() + " but was " + value.getClass().getSimpleName());
            }
            ordered.put(spec.name(), spec.type() == FieldType.LEVELS ? List.copyOf((List<?>) value) : value);
        }
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (entry.getValue() != null && !ordered.containsKey(entry.getKey())) {
                throw new IllegalArgumentException(kind + " does not declare field " + entry.getKey());
            }
        }
        return Collections.unmodifiableMap(ordered);
    }

    @Override
    public String typeName() {
        return kind.wireName();
    }

    @Override
    public boolean isAuxiliary() {
        return kind.isAuxiliary();
    }

    public boolean has(String name) {
        return fields.containsKey(name);
    }

    public BigDecimal decimal(String name) {
        return (BigDecimal) fields.get(name);
    }

    public String text(String name) {
        return (String) fields.get(name);
    }

    public Long integer(String name) {
        return (Long) fields.get(name);
    }

    public Boolean flag(String name) {
        return (Boolean) fields.get(name);
    }

    @SuppressWarnings("unchecked")
    public List<PriceLevel> levels(String name) {
        return (List<PriceLevel>) fields.get(name);
    }

    /**
     * Trade price, or {@code null} for kinds without a {@code p} field.
     */
    public BigDecimal price() {
        return decimal("p");
    }
}
