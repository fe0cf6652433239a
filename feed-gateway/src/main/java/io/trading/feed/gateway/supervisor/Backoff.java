package io.trading.feed.gateway.supervisor;

import java.time.Duration;

/**
 * Exponential reconnect delay: initial, initial * m, initial * m^2, ... capped at max.
 * Not thread-safe; each runner owns one.
 */
public final class Backoff {

    private final long initialMillis;
    private final long maxMillis;
    private final double multiplier;

    private long currentMillis;
    private int attempts;

    public Backoff(Duration initial, Duration max, double multiplier) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial delay must be positive");
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max delay must not be below the initial delay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
        this.initialMillis = initial.toMillis();
        this.maxMillis = max.toMillis();
        this.multiplier = multiplier;
        this.currentMillis = initialMillis;
    }

    public static Backoff from(SupervisorSettings settings) {
        return new Backoff(settings.backoffInitial(), settings.backoffMax(), settings.backoffMultiplier());
    }

    /**
     * Returns the delay for the next attempt and grows the following one.
     */
    public Duration next() {
        long delay = currentMillis;
        attempts++;
        currentMillis = Math.min((long) (currentMillis * multiplier), maxMillis);
        return Duration.ofMillis(delay);
    }

    /**
     * Resets the delay after a stable session.
     */
    public void reset() {
        currentMillis = initialMillis;
        attempts = 0;
    }

    public int attempts() {
        return attempts;
    }
}
