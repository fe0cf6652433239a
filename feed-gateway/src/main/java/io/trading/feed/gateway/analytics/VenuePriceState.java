package io.trading.feed.gateway.analytics;

import io.trading.feed.canonical.model.Symbol;
import io.trading.feed.canonical.model.Venue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest price per venue for one symbol. Written only by the spread detector thread; other
 * threads may read.
 */
public final class VenuePriceState {

    private final Symbol symbol;
    private final Map<Venue, PriceObservation> latest = new ConcurrentHashMap<>();

    VenuePriceState(Symbol symbol) {
        this.symbol = symbol;
    }

    public Symbol symbol() {
        return symbol;
    }

    public Optional<PriceObservation> get(Venue venue) {
        return Optional.ofNullable(latest.get(venue));
    }

    /**
     * Stores the observation unless the venue already has one at the same or a later event
     * time.
     *
     * @return false if the observation was stale or a duplicate
     */
    boolean update(PriceObservation observation) {
        PriceObservation current = latest.get(observation.venue());
        if (current != null && current.eventTimestamp() >= observation.eventTimestamp()) {
            return false;
        }
        latest.put(observation.venue(), observation);
        return true;
    }

    /**
     * Observations received within the staleness window, in venue order.
     */
    List<PriceObservation> fresh(long now, long stalenessMillis) {
        List<PriceObservation> out = new ArrayList<>(latest.size());
        for (PriceObservation observation : latest.values()) {
            if (now - observation.receivedAt() <= stalenessMillis) {
                out.add(observation);
            }
        }
        out.sort(Comparator.comparing(PriceObservation::venue));
        return out;
    }
}
