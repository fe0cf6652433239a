package io.trading.feed.gateway.pipeline;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.feed.canonical.model.CanonicalEvent;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.RawEvent;
import io.trading.feed.canonical.model.Symbol;
import io.trading.feed.canonical.model.Venue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts canonical events per venue and symbol and turns the counts into telemetry raw
 * events once per interval. Confined to the pipeline thread.
 */
public class TelemetryTracker {

    private final long intervalMillis;
    private final Map<Venue, Map<Symbol, Stats>> stats = new EnumMap<>(Venue.class);
    private long lastEmittedAt;

    public TelemetryTracker(Duration interval, long now) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.intervalMillis = interval.toMillis();
        this.lastEmittedAt = now;
    }

    public void record(CanonicalEvent event) {
        if (event.kind() == EventKind.TELEMETRY) {
            return;
        }
        Stats s = stats.computeIfAbsent(event.venue(), v -> new LinkedHashMap<>())
            .computeIfAbsent(event.symbol(), k -> new Stats());
        s.messages++;
        s.latencyMillis = Math.max(0, event.receivedAt() - event.timestamp());
    }

    /**
     * Telemetry payloads for the elapsed interval, or an empty list if the interval has not
     * elapsed yet. Counters restart after each emission.
     */
    public List<RawEvent> drainDue(long now) {
        if (now - lastEmittedAt < intervalMillis) {
            return List.of();
        }
        lastEmittedAt = now;
        List<RawEvent> out = new ArrayList<>();
        stats.forEach((venue, bySymbol) -> bySymbol.forEach((symbol, s) -> {
            ObjectNode payload = JsonNodeFactory.instance.objectNode();
            payload.put("s", symbol.toString());
            payload.put("latency_ms", s.latencyMillis);
            payload.put("messages", s.messages);
            payload.put("ts", now);
            out.add(new RawEvent(venue, EventKind.TELEMETRY, payload, now));
            s.messages = 0;
        }));
        return out;
    }

    private static final class Stats {
        long messages;
        long latencyMillis;
    }
}
