package io.trading.feed.gateway.supervisor;

import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.agent.AgentFactory;
import io.trading.feed.gateway.config.FeedSpec;
import io.trading.feed.gateway.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs one {@link AgentRunner} per configured feed, each on a dedicated thread.
 *
 * <p>Runners share nothing but the cancellation signal and the pipeline ingress, so a
 * failing venue never stalls or stops another.
 */
public class Supervisor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Supervisor.class);

    private final List<AgentRunner> runners = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();
    private final CancellationSignal cancellation = new CancellationSignal();
    private volatile boolean started = false;

    public Supervisor(
        List<FeedSpec> feeds,
        AgentFactory factory,
        RawEventIngress ingress,
        SupervisorSettings settings,
        FeedMetrics metrics,
        Clock clock
    ) {
        Map<Venue, Integer> perVenue = new EnumMap<>(Venue.class);
        for (FeedSpec feed : feeds) {
            int index = perVenue.merge(feed.venue(), 1, Integer::sum) - 1;
            String name = feed.venue().id() + "-" + index;
            runners.add(new AgentRunner(name, feed, factory, ingress, settings, cancellation, metrics, clock));
        }
    }

    /**
     * Starts all runners.
     */
    public synchronized void start() {
        if (started) {
            LOGGER.warn("Supervisor already started");
            return;
        }
        started = true;
        for (AgentRunner runner : runners) {
            Thread thread = new Thread(runner, "agent-" + runner.name());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                LOGGER.error("Runner thread {} died unexpectedly", t.getName(), e));
            threads.add(thread);
            thread.start();
        }
        LOGGER.info("Supervisor started {} agent runner(s)", runners.size());
    }

    /**
     * Immutable snapshot of every agent.
     */
    public List<AgentStatus> status() {
        return runners.stream().map(AgentRunner::status).toList();
    }

    /**
     * Whether every runner has reached a terminal state.
     */
    public boolean allTerminated() {
        return runners.stream().allMatch(r -> r.status().state().isTerminal());
    }

    /**
     * Signals every runner to stop. Returns immediately.
     */
    public void shutdown() {
        cancellation.cancel();
    }

    /**
     * Waits for all runner threads to finish.
     *
     * @return true if every runner finished within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread thread : threads) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remaining <= 0) {
                return threads.stream().noneMatch(Thread::isAlive);
            }
            thread.join(remaining);
        }
        return threads.stream().noneMatch(Thread::isAlive);
    }

    @Override
    public void close() {
        shutdown();
        try {
            if (!awaitTermination(Duration.ofSeconds(5))) {
                LOGGER.warn("Some agent runners did not stop within 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
