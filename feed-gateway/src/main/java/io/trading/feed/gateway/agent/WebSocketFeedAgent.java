package io.trading.feed.gateway.agent;

import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.RawEvent;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.netty.WebSocketClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class for agents that stream over a single WebSocket session.
 *
 * <p>The Netty event loop only appends text frames to a bounded inbox; decoding happens on
 * the polling thread. A closed transport, a transport error or an inbox overflow ends the
 * stream with {@link DisconnectedException}.
 */
public abstract class WebSocketFeedAgent implements FeedAgent, RawEventStream {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketFeedAgent.class);

    static final int INBOX_CAPACITY = 65_536;

    private final Venue venue;
    private final URI uri;
    private final List<String> symbols;
    private final Set<EventKind> kinds;
    private final Duration connectTimeout;
    private final FrameDecoder decoder;
    private final Clock clock;

    private final BlockingQueue<Frame> inbox = new ArrayBlockingQueue<>(INBOX_CAPACITY);
    private final Deque<RawEvent> decoded = new ArrayDeque<>();
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile Throwable transportError;
    private long lastFrameAt = Long.MIN_VALUE;
    private WebSocketClient client;

    protected WebSocketFeedAgent(
        Venue venue,
        URI uri,
        List<String> symbols,
        Set<EventKind> kinds,
        Duration connectTimeout,
        FrameDecoder decoder,
        Clock clock
    ) {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException(venue + " agent needs at least one symbol");
        }
        this.venue = venue;
        this.uri = uri;
        this.symbols = List.copyOf(symbols);
        this.kinds = Set.copyOf(kinds);
        this.connectTimeout = connectTimeout;
        this.decoder = decoder;
        this.clock = clock;
    }

    /**
     * Messages sent right after the handshake to subscribe to the configured streams.
     */
    protected abstract List<String> subscriptionMessages();

    /**
     * Whether the WebSocket client should offer permessage-deflate.
     */
    protected boolean enableCompression() {
        return true;
    }

    @Override
    public Venue venue() {
        return venue;
    }

    @Override
    public List<String> symbols() {
        return symbols;
    }

    protected Set<EventKind> kinds() {
        return kinds;
    }

    protected boolean wants(EventKind kind) {
        return kinds.contains(kind);
    }

    @Override
    public void connect() throws ConnectionException {
        client = new WebSocketClient(
            uri,
            venue.id(),
            this::onFrame,
            this::onError,
            this::onDisconnected,
            enableCompression()
        );
        client.connect(connectTimeout);
        for (String message : subscriptionMessages()) {
            LOGGER.debug("[{}] subscribing: {}", venue, message);
            if (!client.send(message)) {
                throw new ConnectionException("[" + venue + "] session closed while subscribing");
            }
        }
        LOGGER.info("[{}] subscribed to {} symbol(s), kinds {}", venue, symbols.size(), kinds);
    }

    @Override
    public RawEventStream stream() {
        return this;
    }

    @Override
    public RawEvent poll(long timeout, TimeUnit unit)
        throws DisconnectedException, ProtocolException, InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            RawEvent next = decoded.poll();
            if (next != null) {
                return next;
            }
            long remaining = deadline - System.nanoTime();
            Frame frame = remaining > 0 ? inbox.poll(remaining, TimeUnit.NANOSECONDS) : inbox.poll();
            if (frame == null) {
                return null;
            }
            if (frame.text() == null) {
                throw new DisconnectedException("[" + venue + "] " + frame.reason(), transportError);
            }
            lastFrameAt = frame.receivedAt();
            decoded.addAll(decoder.decode(frame.text(), frame.receivedAt()));
        }
    }

    @Override
    public long lastFrameAt() {
        return lastFrameAt;
    }

    @Override
    public void close() {
        WebSocketClient current = client;
        client = null;
        if (current != null) {
            current.close();
        }
    }

    private void onFrame(String text) {
        if (terminated.get()) {
            return;
        }
        if (!inbox.offer(new Frame(text, clock.millis(), null))) {
            LOGGER.warn("[{}] inbox full ({} frames), dropping session", venue, INBOX_CAPACITY);
            terminate("inbox overflow");
        }
    }

    private void onError(Throwable error) {
        transportError = error;
    }

    private void onDisconnected() {
        terminate(transportError == null ? "connection closed" : "connection lost: " + transportError.getMessage());
    }

    // The terminal marker must always fit, so it bypasses the capacity check by clearing first.
    private void terminate(String reason) {
        if (terminated.compareAndSet(false, true)) {
            Frame marker = new Frame(null, clock.millis(), reason);
            if (!inbox.offer(marker)) {
                inbox.clear();
                inbox.offer(marker);
            }
        }
    }

    private record Frame(String text, long receivedAt, String reason) {
    }
}
