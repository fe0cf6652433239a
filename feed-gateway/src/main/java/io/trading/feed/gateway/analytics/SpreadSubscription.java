package io.trading.feed.gateway.analytics;

import io.trading.feed.canonical.model.SpreadEvent;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-subscriber queue of spread events. When full, the oldest event is discarded.
 */
public class SpreadSubscription implements AutoCloseable {

    private final BlockingQueue<SpreadEvent> queue;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed = false;

    SpreadSubscription(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    void offer(SpreadEvent event) {
        while (!queue.offer(event)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
            }
        }
    }

    /**
     * Next spread event, or null if none arrived within the timeout.
     */
    public SpreadEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public long dropped() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
    }
}
