package io.trading.feed.canonical;

import io.trading.feed.canonical.mapping.FieldRule;
import io.trading.feed.canonical.mapping.KindMapping;
import io.trading.feed.canonical.mapping.MappingTable;
import io.trading.feed.canonical.model.CanonicalEvent;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.FieldSpec;
import io.trading.feed.canonical.model.RawEvent;
import io.trading.feed.canonical.model.Symbol;
import io.trading.feed.canonical.symbol.SymbolNormalizer;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Converts {@link RawEvent}s into {@link CanonicalEvent}s.
 *
 * <p>Stateless and deterministic: the same raw event always yields the same canonical
 * event or the same failure. Safe to share between threads.
 */
public final class Canonicalizer {

    private final Set<EventKind> enabledKinds;
    private final SymbolNormalizer symbolNormalizer;
    private final MappingTable mappingTable;

    public Canonicalizer(Set<EventKind> enabledKinds, SymbolNormalizer symbolNormalizer, MappingTable mappingTable) {
        if (enabledKinds == null || symbolNormalizer == null || mappingTable == null) {
            throw new IllegalArgumentException("enabledKinds, symbolNormalizer and mappingTable are required");
        }
        this.enabledKinds = enabledKinds.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(enabledKinds));
        this.symbolNormalizer = symbolNormalizer;
        this.mappingTable = mappingTable;
    }

    public Canonicalizer(Set<EventKind> enabledKinds) {
        this(enabledKinds, SymbolNormalizer.defaults(), MappingTable.defaults());
    }

    public Set<EventKind> enabledKinds() {
        return enabledKinds;
    }

    public boolean isEnabled(EventKind kind) {
        return enabledKinds.contains(kind);
    }

    /**
     * Canonicalizes one raw event.
     *
     * @throws NormalizationException when the kind is disabled or unmapped, the symbol does
     *                                not resolve, or a required field is absent or unreadable
     */
    public CanonicalEvent canonicalize(RawEvent raw) throws NormalizationException {
        EventKind kind = raw.kind();
        if (!enabledKinds.contains(kind)) {
            throw NormalizationException.featureDisabled(kind);
        }
        KindMapping mapping = mappingTable.lookup(raw.venue(), kind)
            .orElseThrow(() -> NormalizationException.unmapped(raw.venue(), kind));

        Object symbolText = read(mapping.symbol(), raw, "s");
        if (symbolText == null) {
            throw NormalizationException.missingField(kind, "s");
        }
        Symbol symbol = symbolNormalizer.normalize(raw.venue(), symbolText.toString());

        Object ts = read(mapping.timestamp(), raw, "ts");
        long timestamp;
        if (ts instanceof Long millis) {
            timestamp = millis;
        } else if (ts == null && mapping.receiptFallback()) {
            timestamp = raw.receivedAt();
        } else if (ts == null) {
            throw NormalizationException.missingField(kind, "ts");
        } else {
            throw NormalizationException.invalidField(kind, "ts",
                new IllegalArgumentException("unexpected timestamp value " + ts));
        }

        Map<String, Object> fields = new HashMap<>();
        for (FieldSpec spec : kind.fields()) {
            FieldRule rule = mapping.rule(spec.name());
            Object value = rule == null ? null : read(rule, raw, spec.name());
            if (value == null) {
                if (spec.required()) {
                    throw NormalizationException.missingField(kind, spec.name());
                }
                continue;
            }
            if (!spec.type().accepts(value)) {
                throw NormalizationException.invalidField(kind, spec.name(),
                    new IllegalArgumentException("expected " + spec.type() + " but was " + value.getClass().getSimpleName()));
            }
            fields.put(spec.name(), value);
        }
        return new CanonicalEvent(raw.venue(), kind, symbol, timestamp, raw.receivedAt(), fields);
    }

    private static Object read(FieldRule rule, RawEvent raw, String field) throws NormalizationException {
        try {
            return rule.read(raw.payload());
        } catch (IllegalArgumentException e) {
            throw NormalizationException.invalidField(raw.kind(), field, e);
        }
    }
}
