package io.trading.feed.gateway.dispatch;

import io.trading.feed.canonical.model.FeedEvent;
import io.trading.feed.gateway.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to registered consumers, each with its own bounded queue and delivery
 * thread.
 *
 * <p>Publishing is two-phase: every consumer first gets a non-blocking offer, then the
 * consumers whose {@link BackpressurePolicy#BOUNDED_BLOCK} queue was full are waited on
 * against one shared deadline. A stuck consumer therefore costs at most one offer timeout
 * per event and never delays delivery to the others. Auxiliary events are always delivered
 * {@link BackpressurePolicy#DROP_OLDEST}.
 *
 * <p>Per-consumer order is publish order for a single publishing thread.
 *
 * <p>A consumer may publish back into the dispatcher (the spread detector does). On close,
 * consumers are drained in reverse registration order, so such a consumer must be registered
 * after the consumers it feeds.
 */
public class Dispatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Dispatcher.class);

    private final List<ConsumerChannel> channels = new CopyOnWriteArrayList<>();
    private final Duration offerTimeout;
    private final FeedMetrics metrics;
    private volatile boolean started = false;
    private volatile boolean closed = false;

    public Dispatcher(Duration offerTimeout, FeedMetrics metrics) {
        if (offerTimeout == null || offerTimeout.isNegative()) {
            throw new IllegalArgumentException("offerTimeout must be non-negative");
        }
        this.offerTimeout = offerTimeout;
        this.metrics = metrics;
    }

    /**
     * Registers a consumer. Consumers registered after {@link #start()} start immediately.
     *
     * @throws IllegalArgumentException if the name is already taken or the capacity is not positive
     */
    public synchronized void register(String name, BackpressurePolicy policy, int capacity, EventConsumer consumer) {
        if (closed) {
            throw new IllegalStateException("Dispatcher is closed");
        }
        for (ConsumerChannel channel : channels) {
            if (channel.name().equals(name)) {
                throw new IllegalArgumentException("Consumer already registered: " + name);
            }
        }
        ConsumerChannel channel = new ConsumerChannel(name, policy, capacity, consumer, metrics);
        channels.add(channel);
        if (started) {
            channel.start();
        }
        LOGGER.info("Registered consumer {} (policy={}, capacity={})", name, policy, capacity);
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        channels.forEach(ConsumerChannel::start);
    }

    /**
     * Delivers an event to every consumer that accepts it.
     *
     * @throws InterruptedException if interrupted while waiting on a full queue
     */
    public void publish(FeedEvent event) throws InterruptedException {
        List<ConsumerChannel> blocked = null;
        for (ConsumerChannel channel : channels) {
            if (channel.isStopped() || !channel.accepts(event)) {
                continue;
            }
            if (event.isAuxiliary() || channel.policy() == BackpressurePolicy.DROP_OLDEST) {
                channel.offerDropOldest(event);
            } else if (!channel.tryOffer(event)) {
                if (blocked == null) {
                    blocked = new ArrayList<>(2);
                }
                blocked.add(channel);
            }
        }
        if (blocked == null) {
            return;
        }

        long deadline = System.nanoTime() + offerTimeout.toNanos();
        for (ConsumerChannel channel : blocked) {
            if (!channel.offer(event, deadline - System.nanoTime())) {
                metrics.recordDeliveryFailure(channel.name());
                LOGGER.debug("Consumer {} full, {} {} not delivered", channel.name(), event.typeName(), event.symbol());
            }
        }
    }

    /**
     * Current queue depth of a consumer, or -1 if unknown.
     */
    public int queueDepth(String name) {
        for (ConsumerChannel channel : channels) {
            if (channel.name().equals(name)) {
                return channel.depth();
            }
        }
        return -1;
    }

    /**
     * Stops accepting registrations and drains every consumer queue, last registered first.
     * Consumers still draining keep receiving events published by the ones stopped before.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        List<ConsumerChannel> stopOrder = new ArrayList<>(channels);
        Collections.reverse(stopOrder);
        for (ConsumerChannel channel : stopOrder) {
            try {
                if (!channel.stop(5_000)) {
                    LOGGER.warn("Consumer {} did not drain within 5 s", channel.name());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        LOGGER.info("Dispatcher closed");
    }
}
