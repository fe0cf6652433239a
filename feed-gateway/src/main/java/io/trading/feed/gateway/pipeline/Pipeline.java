package io.trading.feed.gateway.pipeline;

import io.trading.feed.canonical.Canonicalizer;
import io.trading.feed.canonical.EventValidator;
import io.trading.feed.canonical.NormalizationException;
import io.trading.feed.canonical.model.CanonicalEvent;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.RawEvent;
import io.trading.feed.gateway.dispatch.Dispatcher;
import io.trading.feed.gateway.metrics.FeedMetrics;
import io.trading.feed.gateway.supervisor.RawEventIngress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Normalization stage between the agents and the dispatcher.
 *
 * <p>Agents offer raw events into one bounded ingress queue. A single stage thread
 * canonicalizes, validates and publishes them in ingress order, which keeps every agent's
 * events FIFO for every consumer. Failed events are counted by reason and dropped.
 */
public class Pipeline implements RawEventIngress, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);
    private static final String INGRESS = "ingress";

    private final Canonicalizer canonicalizer;
    private final EventValidator validator;
    private final Dispatcher dispatcher;
    private final FeedMetrics metrics;
    private final Clock clock;
    private final BlockingQueue<RawEvent> ingress;
    private final TelemetryTracker telemetry;
    private final Thread thread;

    private volatile boolean running = false;

    public Pipeline(
        Canonicalizer canonicalizer,
        EventValidator validator,
        Dispatcher dispatcher,
        FeedMetrics metrics,
        int capacity,
        Duration telemetryInterval,
        Clock clock
    ) {
        this.canonicalizer = canonicalizer;
        this.validator = validator;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
        this.ingress = new ArrayBlockingQueue<>(capacity);
        this.telemetry = canonicalizer.isEnabled(EventKind.TELEMETRY)
            ? new TelemetryTracker(telemetryInterval, clock.millis())
            : null;
        this.thread = new Thread(this::run, "pipeline");
        this.thread.setDaemon(true);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread.start();
        LOGGER.info("Pipeline started (telemetry={})", telemetry != null);
    }

    @Override
    public boolean offer(RawEvent event, long timeout, TimeUnit unit) throws InterruptedException {
        return ingress.offer(event, timeout, unit);
    }

    public int depth() {
        return ingress.size();
    }

    private void run() {
        try {
            while (running || !ingress.isEmpty()) {
                RawEvent raw = ingress.poll(100, TimeUnit.MILLISECONDS);
                if (raw != null) {
                    processSafely(raw);
                }
                if (telemetry != null) {
                    for (RawEvent tick : telemetry.drainDue(clock.millis())) {
                        processSafely(tick);
                    }
                }
                metrics.setQueueDepth(INGRESS, ingress.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Pipeline stopped");
    }

    // One bad event is dropped and counted; the stage thread keeps running.
    private void processSafely(RawEvent raw) throws InterruptedException {
        try {
            process(raw);
        } catch (RuntimeException e) {
            metrics.recordPipelineFailure(raw.venue());
            LOGGER.error("[{}] dropped {} after unexpected error", raw.venue(), raw.kind(), e);
        }
    }

    /**
     * Canonicalizes, validates and publishes one raw event. Visible for tests, which drive
     * the stage without its thread.
     *
     * @return the published event, or empty if the event was rejected
     */
    Optional<CanonicalEvent> process(RawEvent raw) throws InterruptedException {
        CanonicalEvent event;
        try {
            event = canonicalizer.canonicalize(raw);
        } catch (NormalizationException e) {
            metrics.recordNormalizationError(raw.venue(), e.reason());
            LOGGER.debug("[{}] dropped {}: {}", raw.venue(), raw.kind(), e.getMessage());
            return Optional.empty();
        }

        Optional<String> rejection;
        try {
            rejection = validator.validate(event);
        } catch (RuntimeException e) {
            rejection = Optional.of("validator failed: " + e.getMessage());
        }
        if (rejection.isPresent()) {
            metrics.recordValidatorRejection(event.venue(), event.kind());
            LOGGER.warn("[{}] rejected {} {}: {}", event.venue(), event.kind(), event.symbol(), rejection.get());
            return Optional.empty();
        }

        metrics.recordCanonicalEvent(event.venue(), event.kind());
        if (telemetry != null) {
            telemetry.record(event);
        }
        dispatcher.publish(event);
        metrics.recordPipelineLatency(event.venue(), Math.max(0, clock.millis() - raw.receivedAt()) * 1000);
        return Optional.of(event);
    }

    /**
     * Stops after draining the ingress queue.
     */
    @Override
    public void close() {
        running = false;
        try {
            thread.join(5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
