package io.trading.feed.canonical.model;

/**
 * Declares one field of a canonical event kind.
 *
 * @param name     Wire name of the field
 * @param type     Value type
 * @param required Whether every event of the kind must carry the field
 */
public record FieldSpec(
    String name,
    FieldType type,
    boolean required
) {
    public FieldSpec {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    public static FieldSpec required(String name, FieldType type) {
        return new FieldSpec(name, type, true);
    }

    public static FieldSpec optional(String name, FieldType type) {
        return new FieldSpec(name, type, false);
    }
}
