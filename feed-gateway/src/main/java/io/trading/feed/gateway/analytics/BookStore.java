package io.trading.feed.gateway.analytics;

import io.trading.feed.canonical.model.CanonicalEvent;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.FeedEvent;
import io.trading.feed.canonical.model.PriceLevel;
import io.trading.feed.canonical.model.Symbol;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.dispatch.EventConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maintains one {@link OrderBook} per venue and symbol from snapshot, diff and book ticker
 * events.
 *
 * <p>Runs as a dispatcher consumer. A snapshot replaces the book; diffs and book tickers
 * are applied on top of whatever the book holds, including an empty book.
 */
public class BookStore implements EventConsumer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BookStore.class);

    public static final Set<EventKind> BOOK_KINDS = Set.of(EventKind.L2_SNAPSHOT, EventKind.L2_DIFF, EventKind.BOOK_TICKER);

    private final Map<BookKey, OrderBook> books = new ConcurrentHashMap<>();

    @Override
    public boolean accepts(FeedEvent event) {
        return event instanceof CanonicalEvent canonical && BOOK_KINDS.contains(canonical.kind());
    }

    @Override
    public void onEvent(FeedEvent event) {
        apply((CanonicalEvent) event);
    }

    /**
     * Applies one book event to the book of its venue and symbol.
     */
    public void apply(CanonicalEvent event) {
        if (!BOOK_KINDS.contains(event.kind())) {
            throw new IllegalArgumentException("not a book event: " + event.kind());
        }
        OrderBook book = books.computeIfAbsent(new BookKey(event.venue(), event.symbol()), key -> {
            LOGGER.debug("[{}] new book for {}", key.venue(), key.symbol());
            return new OrderBook();
        });
        switch (event.kind()) {
            case L2_SNAPSHOT -> book.applySnapshot(event.levels("bids"), event.levels("asks"), event.timestamp());
            case L2_DIFF -> book.applyDiff(event.levels("bids"), event.levels("asks"), event.timestamp());
            case BOOK_TICKER -> book.applyTicker(
                new PriceLevel(event.decimal("bp"), event.decimal("bq")),
                new PriceLevel(event.decimal("ap"), event.decimal("aq")),
                event.timestamp());
            default -> throw new IllegalStateException("unhandled book kind " + event.kind());
        }
    }

    @Override
    public void onClose() {
        LOGGER.info("Book store closed with {} book(s)", books.size());
    }

    public Optional<OrderBook> book(Venue venue, Symbol symbol) {
        return Optional.ofNullable(books.get(new BookKey(venue, symbol)));
    }

    public Optional<PriceLevel> bestBid(Venue venue, Symbol symbol) {
        return book(venue, symbol).flatMap(OrderBook::bestBid);
    }

    public Optional<PriceLevel> bestAsk(Venue venue, Symbol symbol) {
        return book(venue, symbol).flatMap(OrderBook::bestAsk);
    }

    private record BookKey(Venue venue, Symbol symbol) {
    }
}
