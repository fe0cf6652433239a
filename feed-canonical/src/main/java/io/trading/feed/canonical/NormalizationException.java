package io.trading.feed.canonical;

import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.Venue;

/**
 * Raised when a raw event cannot be turned into a canonical event.
 *
 * <p>The event is dropped and counted by {@link #reason()}; the stream it came from
 * carries on.
 */
public class NormalizationException extends Exception {

    /**
     * Why canonicalization failed.
     */
    public enum Reason {
        /** Venue symbol text does not resolve to BASE-QUOTE. */
        UNKNOWN_SYMBOL_FORMAT,
        /** A required field is absent from the payload. */
        MISSING_FIELD,
        /** Kind is not in the enabled-kind set. */
        FEATURE_DISABLED,
        /** A field is present but its value cannot be read as the declared type. */
        INVALID_FIELD,
        /** No mapping exists for the venue and kind. */
        UNMAPPED_KIND
    }

    private final Reason reason;
    private final String field;

    public NormalizationException(Reason reason, String field, String message) {
        super(message);
        this.reason = reason;
        this.field = field;
    }

    public NormalizationException(Reason reason, String field, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.field = field;
    }

    public static NormalizationException unknownSymbol(Venue venue, String symbol) {
        return new NormalizationException(Reason.UNKNOWN_SYMBOL_FORMAT, "s",
            "Unrecognized " + venue + " symbol: " + symbol);
    }

    public static NormalizationException missingField(EventKind kind, String field) {
        return new NormalizationException(Reason.MISSING_FIELD, field,
            "Missing required field '" + field + "' for " + kind);
    }

    public static NormalizationException invalidField(EventKind kind, String field, Throwable cause) {
        return new NormalizationException(Reason.INVALID_FIELD, field,
            "Invalid value for field '" + field + "' of " + kind + ": " + cause.getMessage(), cause);
    }

    public static NormalizationException featureDisabled(EventKind kind) {
        return new NormalizationException(Reason.FEATURE_DISABLED, null, "Kind is disabled: " + kind);
    }

    public static NormalizationException unmapped(Venue venue, EventKind kind) {
        return new NormalizationException(Reason.UNMAPPED_KIND, null,
            "No mapping for " + kind + " on " + venue);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * Offending field name, or {@code null} when the failure is not about a field.
     */
    public String field() {
        return field;
    }
}
