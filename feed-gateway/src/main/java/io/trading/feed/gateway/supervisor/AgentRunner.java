package io.trading.feed.gateway.supervisor;

import io.trading.feed.canonical.model.RawEvent;
import io.trading.feed.gateway.FeedException;
import io.trading.feed.gateway.agent.AgentFactory;
import io.trading.feed.gateway.agent.DisconnectedException;
import io.trading.feed.gateway.agent.FeedAgent;
import io.trading.feed.gateway.agent.ProtocolException;
import io.trading.feed.gateway.agent.RawEventStream;
import io.trading.feed.gateway.config.FeedSpec;
import io.trading.feed.gateway.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Owns one feed for the life of the process: connects, streams, and reconnects with
 * backoff until cancelled or until too many consecutive failures.
 *
 * <p>Every failure is contained here. Nothing a runner does can affect another runner
 * beyond the shared, bounded pipeline ingress.
 */
public class AgentRunner implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentRunner.class);

    private final String name;
    private final FeedSpec feed;
    private final AgentFactory factory;
    private final RawEventIngress ingress;
    private final SupervisorSettings settings;
    private final CancellationSignal cancellation;
    private final FeedMetrics metrics;
    private final Clock clock;
    private final Backoff backoff;

    private volatile AgentState state = AgentState.CONNECTING;
    private volatile long stateSince;
    private volatile int consecutiveFailures;
    private volatile long restarts;
    private volatile long messages;
    private volatile String lastError;

    public AgentRunner(
        String name,
        FeedSpec feed,
        AgentFactory factory,
        RawEventIngress ingress,
        SupervisorSettings settings,
        CancellationSignal cancellation,
        FeedMetrics metrics,
        Clock clock
    ) {
        this.name = name;
        this.feed = feed;
        this.factory = factory;
        this.ingress = ingress;
        this.settings = settings;
        this.cancellation = cancellation;
        this.metrics = metrics;
        this.clock = clock;
        this.backoff = Backoff.from(settings);
        this.stateSince = clock.millis();
    }

    public String name() {
        return name;
    }

    public AgentStatus status() {
        return new AgentStatus(name, feed, state, consecutiveFailures, restarts, messages, lastError, stateSince);
    }

    @Override
    public void run() {
        LOGGER.info("[{}] runner started for {}", name, feed);
        try {
            while (!cancellation.isCancelled()) {
                transition(AgentState.CONNECTING);
                FeedAgent agent = null;
                try {
                    agent = factory.create(feed);
                    agent.connect();
                    transition(AgentState.STREAMING);
                    stream(agent.stream());
                } catch (FeedException e) {
                    recordFailure(e);
                } catch (RuntimeException e) {
                    LOGGER.error("[{}] unexpected agent failure", name, e);
                    recordFailure(e);
                } finally {
                    if (agent != null) {
                        closeQuietly(agent);
                    }
                }

                if (cancellation.isCancelled()) {
                    break;
                }
                if (consecutiveFailures >= settings.maxConsecutiveFailures()) {
                    LOGGER.error("[{}] giving up after {} consecutive failures, last error: {}",
                        name, consecutiveFailures, lastError);
                    transition(AgentState.FAILED);
                    return;
                }

                transition(AgentState.DISCONNECTED);
                Duration delay = backoff.next();
                LOGGER.info("[{}] reconnecting in {} ms (failure {} of {})",
                    name, delay.toMillis(), consecutiveFailures, settings.maxConsecutiveFailures());
                if (cancellation.await(delay)) {
                    break;
                }
                restarts++;
                metrics.recordReconnect(name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("[{}] interrupted", name);
        } finally {
            if (state != AgentState.FAILED) {
                transition(AgentState.STOPPED);
            }
            LOGGER.info("[{}] runner finished in state {}", name, state);
        }
    }

    /**
     * Streams until cancelled (normal return) or until the session fails (exception).
     */
    private void stream(RawEventStream stream) throws FeedException, InterruptedException {
        long pollMillis = settings.pollInterval().toMillis();
        long staleMillis = settings.feedStaleness().toMillis();
        long stableMillis = settings.stabilityWindow().toMillis();
        long streamingSince = clock.millis();
        long lastActivityAt = streamingSince;
        boolean stable = false;

        while (!cancellation.isCancelled()) {
            RawEvent event;
            try {
                event = stream.poll(pollMillis, TimeUnit.MILLISECONDS);
            } catch (ProtocolException e) {
                metrics.recordProtocolError(name);
                throw e;
            }
            long now = clock.millis();
            if (event != null) {
                lastActivityAt = now;
                messages++;
                metrics.recordRawEvent(event.venue(), event.kind());
                if (!handOff(event)) {
                    return;
                }
            } else {
                // acks and heartbeats keep a session alive without producing events
                lastActivityAt = Math.max(lastActivityAt, stream.lastFrameAt());
                if (now - lastActivityAt >= staleMillis) {
                    throw new DisconnectedException("no data for " + (now - lastActivityAt) + " ms");
                }
            }

            if (!stable && now - streamingSince >= stableMillis) {
                stable = true;
                if (consecutiveFailures > 0 || backoff.attempts() > 0) {
                    LOGGER.info("[{}] session stable, resetting backoff", name);
                }
                consecutiveFailures = 0;
                backoff.reset();
            }
        }
    }

    // Blocks while the ingress is full, but never past cancellation.
    private boolean handOff(RawEvent event) throws InterruptedException {
        long timeoutMillis = settings.ingressOfferTimeout().toMillis();
        while (!cancellation.isCancelled()) {
            if (ingress.offer(event, timeoutMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    private void recordFailure(Exception e) {
        consecutiveFailures++;
        lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
        if (!cancellation.isCancelled()) {
            LOGGER.warn("[{}] session ended: {}", name, lastError);
        }
    }

    private void transition(AgentState next) {
        if (state != next) {
            LOGGER.debug("[{}] {} -> {}", name, state, next);
        }
        state = next;
        stateSince = clock.millis();
        metrics.setAgentState(name, next);
    }

    private void closeQuietly(FeedAgent agent) {
        try {
            agent.close();
        } catch (RuntimeException e) {
            LOGGER.warn("[{}] error while closing agent", name, e);
        }
    }
}
