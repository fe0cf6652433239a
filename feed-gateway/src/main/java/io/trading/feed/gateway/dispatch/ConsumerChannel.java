package io.trading.feed.gateway.dispatch;

import io.trading.feed.canonical.model.FeedEvent;
import io.trading.feed.gateway.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One registered consumer: a bounded FIFO queue drained by a dedicated delivery thread.
 */
final class ConsumerChannel implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerChannel.class);
    private static final long IDLE_POLL_MS = 100;

    private final String name;
    private final BackpressurePolicy policy;
    private final EventConsumer consumer;
    private final BlockingQueue<FeedEvent> queue;
    private final FeedMetrics metrics;
    private final Thread thread;

    private volatile boolean running = true;

    ConsumerChannel(String name, BackpressurePolicy policy, int capacity, EventConsumer consumer, FeedMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = name;
        this.policy = policy;
        this.consumer = consumer;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.metrics = metrics;
        this.thread = new Thread(this, "dispatch-" + name);
        this.thread.setDaemon(true);
    }

    String name() {
        return name;
    }

    BackpressurePolicy policy() {
        return policy;
    }

    boolean accepts(FeedEvent event) {
        try {
            return consumer.accepts(event);
        } catch (RuntimeException e) {
            LOGGER.warn("Consumer {} filter failed for {}", name, event.typeName(), e);
            metrics.recordDeliveryFailure(name);
            return false;
        }
    }

    boolean isStopped() {
        return !running;
    }

    int depth() {
        return queue.size();
    }

    void start() {
        thread.start();
    }

    /**
     * Non-blocking enqueue.
     */
    boolean tryOffer(FeedEvent event) {
        return queue.offer(event);
    }

    /**
     * Enqueue waiting at most the given time.
     */
    boolean offer(FeedEvent event, long timeoutNanos) throws InterruptedException {
        return queue.offer(event, Math.max(0, timeoutNanos), TimeUnit.NANOSECONDS);
    }

    /**
     * Enqueue, evicting from the head until there is room. Never blocks.
     */
    void offerDropOldest(FeedEvent event) {
        while (!queue.offer(event)) {
            if (queue.poll() != null) {
                metrics.recordDropped(name);
            }
        }
    }

    @Override
    public void run() {
        LOGGER.debug("Delivery thread for {} started", name);
        try {
            while (running || !queue.isEmpty()) {
                FeedEvent event = queue.poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                deliver(event);
                metrics.setQueueDepth(name, queue.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                consumer.onClose();
            } catch (RuntimeException e) {
                LOGGER.warn("Consumer {} failed to close", name, e);
            }
            LOGGER.debug("Delivery thread for {} finished", name);
        }
    }

    private void deliver(FeedEvent event) {
        try {
            consumer.onEvent(event);
            metrics.recordDelivered(name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        } catch (Exception e) {
            metrics.recordDeliveryFailure(name);
            LOGGER.warn("Consumer {} failed on {} {}", name, event.typeName(), event.symbol(), e);
        }
    }

    /**
     * Stops after the queued events are delivered.
     */
    boolean stop(long timeoutMillis) throws InterruptedException {
        running = false;
        thread.join(timeoutMillis);
        if (thread.isAlive()) {
            thread.interrupt();
            return false;
        }
        return true;
    }
}
