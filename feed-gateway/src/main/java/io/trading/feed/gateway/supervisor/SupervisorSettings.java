package io.trading.feed.gateway.supervisor;

import java.time.Duration;

/**
 * Timing and retry policy shared by all agent runners.
 *
 * @param backoffInitial         First reconnect delay
 * @param backoffMax             Upper bound on the reconnect delay
 * @param backoffMultiplier      Growth factor between consecutive delays
 * @param stabilityWindow        Streaming time after which backoff and the failure count reset
 * @param maxConsecutiveFailures Failures after which the agent is marked FAILED
 * @param feedStaleness          Silence after which a session is considered dead
 * @param pollInterval           Upper bound on a single stream poll, and so on shutdown latency
 * @param telemetryInterval      Period of telemetry emission; only used when telemetry is enabled
 * @param ingressOfferTimeout    Wait per attempt when the pipeline ingress is full
 */
public record SupervisorSettings(
    Duration backoffInitial,
    Duration backoffMax,
    double backoffMultiplier,
    Duration stabilityWindow,
    int maxConsecutiveFailures,
    Duration feedStaleness,
    Duration pollInterval,
    Duration telemetryInterval,
    Duration ingressOfferTimeout
) {
    public static final SupervisorSettings DEFAULT = new SupervisorSettings(
        Duration.ofSeconds(1),
        Duration.ofSeconds(60),
        2.0,
        Duration.ofSeconds(30),
        10,
        Duration.ofSeconds(30),
        Duration.ofMillis(250),
        Duration.ofSeconds(10),
        Duration.ofMillis(100)
    );

    public SupervisorSettings {
        requirePositive(backoffInitial, "backoffInitial");
        requirePositive(backoffMax, "backoffMax");
        requirePositive(stabilityWindow, "stabilityWindow");
        requirePositive(feedStaleness, "feedStaleness");
        requirePositive(pollInterval, "pollInterval");
        requirePositive(telemetryInterval, "telemetryInterval");
        requirePositive(ingressOfferTimeout, "ingressOfferTimeout");
        if (backoffMax.compareTo(backoffInitial) < 0) {
            throw new IllegalArgumentException("backoffMax must not be below backoffInitial");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1");
        }
        if (maxConsecutiveFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveFailures must be positive");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
