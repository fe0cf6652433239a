package io.trading.feed.gateway.supervisor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot shutdown signal observed by every runner at its polls and backoff sleeps.
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Sleeps for the given delay or until cancelled, whichever comes first.
     *
     * @return true if cancelled
     */
    public boolean await(Duration delay) throws InterruptedException {
        return latch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
