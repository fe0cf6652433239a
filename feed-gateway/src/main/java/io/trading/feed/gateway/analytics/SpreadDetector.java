package io.trading.feed.gateway.analytics;

import io.trading.feed.canonical.model.CanonicalEvent;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.FeedEvent;
import io.trading.feed.canonical.model.SpreadEvent;
import io.trading.feed.canonical.model.Symbol;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.config.SpreadThreshold;
import io.trading.feed.gateway.dispatch.EventConsumer;
import io.trading.feed.gateway.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Detects cross-venue price dislocations from the trade stream.
 *
 * <p>Runs as a dispatcher consumer, so all state is written from one delivery thread. For
 * every trade it keeps the latest price per venue, compares the venues whose last trade was
 * received within the staleness window, and emits a {@link SpreadEvent} when the relative
 * spread {@code (max - min) / min} exceeds the threshold. Emissions are debounced per symbol.
 */
public class SpreadDetector implements EventConsumer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpreadDetector.class);

    public static final int DEFAULT_SUBSCRIPTION_CAPACITY = 1024;

    private final BigDecimal threshold;
    private final long stalenessMillis;
    private final long debounceMillis;
    private final SpreadPublisher publisher;
    private final FeedMetrics metrics;
    private final Clock clock;

    private final Map<Symbol, VenuePriceState> states = new ConcurrentHashMap<>();
    private final Map<Symbol, Long> lastEmitted = new ConcurrentHashMap<>();
    private final List<SpreadSubscription> subscriptions = new CopyOnWriteArrayList<>();

    public SpreadDetector(
        SpreadThreshold threshold,
        Duration staleness,
        Duration debounce,
        SpreadPublisher publisher,
        FeedMetrics metrics,
        Clock clock
    ) {
        if (threshold == null) {
            throw new IllegalArgumentException("threshold is required");
        }
        if (staleness.isNegative() || debounce.isNegative()) {
            throw new IllegalArgumentException("staleness and debounce must be non-negative");
        }
        this.threshold = threshold.fraction();
        this.stalenessMillis = staleness.toMillis();
        this.debounceMillis = debounce.toMillis();
        this.publisher = publisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public boolean accepts(FeedEvent event) {
        return event instanceof CanonicalEvent canonical && canonical.kind() == EventKind.TRADE;
    }

    @Override
    public void onEvent(FeedEvent event) throws InterruptedException {
        onTrade((CanonicalEvent) event);
    }

    /**
     * Applies one trade.
     *
     * @return the emitted spread event, if any
     */
    public Optional<SpreadEvent> onTrade(CanonicalEvent trade) throws InterruptedException {
        if (trade.kind() != EventKind.TRADE) {
            throw new IllegalArgumentException("not a trade: " + trade.kind());
        }
        Symbol symbol = trade.symbol();
        VenuePriceState state = states.computeIfAbsent(symbol, VenuePriceState::new);
        PriceObservation observation =
            new PriceObservation(trade.venue(), trade.price(), trade.timestamp(), trade.receivedAt());
        if (!state.update(observation)) {
            LOGGER.trace("[{}] stale trade for {} at {}", trade.venue(), symbol, trade.timestamp());
            return Optional.empty();
        }

        long now = clock.millis();
        List<PriceObservation> fresh = state.fresh(now, stalenessMillis);
        if (fresh.size() < 2) {
            return Optional.empty();
        }

        PriceObservation low = fresh.get(0);
        PriceObservation high = fresh.get(0);
        for (PriceObservation candidate : fresh) {
            if (candidate.price().compareTo(low.price()) < 0) {
                low = candidate;
            }
            if (candidate.price().compareTo(high.price()) > 0) {
                high = candidate;
            }
        }
        if (low.price().signum() == 0 || low.venue() == high.venue()) {
            return Optional.empty();
        }

        BigDecimal spread = high.price().subtract(low.price())
            .divide(low.price(), MathContext.DECIMAL64);
        if (spread.compareTo(threshold) <= 0) {
            return Optional.empty();
        }

        Long last = lastEmitted.get(symbol);
        if (last != null && now - last < debounceMillis) {
            return Optional.empty();
        }
        lastEmitted.put(symbol, now);

        List<Venue> venues = new ArrayList<>(fresh.size());
        for (PriceObservation o : fresh) {
            venues.add(o.venue());
        }
        SpreadEvent event = new SpreadEvent(
            symbol, low.venue(), high.venue(), venues, low.price(), high.price(), spread, trade.timestamp());

        LOGGER.info("Spread {}: buy {} @ {} / sell {} @ {} ({})",
            symbol, low.venue(), low.price(), high.venue(), high.price(), spread.toPlainString());
        metrics.recordSpreadEvent(symbol.toString());
        for (SpreadSubscription subscription : subscriptions) {
            if (subscription.isClosed()) {
                subscriptions.remove(subscription);
            } else {
                subscription.offer(event);
            }
        }
        if (publisher != null) {
            publisher.publish(event);
        }
        return Optional.of(event);
    }

    public SpreadSubscription subscribe() {
        return subscribe(DEFAULT_SUBSCRIPTION_CAPACITY);
    }

    public SpreadSubscription subscribe(int capacity) {
        SpreadSubscription subscription = new SpreadSubscription(capacity);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Latest stored trade price for a symbol on a venue, regardless of staleness.
     */
    public Optional<BigDecimal> latestPrice(Symbol symbol, Venue venue) {
        VenuePriceState state = states.get(symbol);
        if (state == null) {
            return Optional.empty();
        }
        return state.get(venue).map(PriceObservation::price);
    }
}
