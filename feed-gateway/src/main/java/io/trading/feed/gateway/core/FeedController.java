package io.trading.feed.gateway.core;

import io.trading.feed.canonical.Canonicalizer;
import io.trading.feed.canonical.EventValidator;
import io.trading.feed.canonical.mapping.MappingTable;
import io.trading.feed.canonical.symbol.SymbolNormalizer;
import io.trading.feed.gateway.agent.AgentFactory;
import io.trading.feed.gateway.agent.VenueAgentFactory;
import io.trading.feed.gateway.analytics.BookStore;
import io.trading.feed.gateway.analytics.SpreadDetector;
import io.trading.feed.gateway.config.FeedConfig;
import io.trading.feed.gateway.config.FeedSpec;
import io.trading.feed.gateway.dispatch.BackpressurePolicy;
import io.trading.feed.gateway.dispatch.Dispatcher;
import io.trading.feed.gateway.metrics.FeedMetrics;
import io.trading.feed.gateway.metrics.MetricsServer;
import io.trading.feed.gateway.pipeline.Pipeline;
import io.trading.feed.gateway.sink.JsonLineSink;
import io.trading.feed.gateway.sink.Sink;
import io.trading.feed.gateway.sink.SinkConsumer;
import io.trading.feed.gateway.sink.SinkException;
import io.trading.feed.gateway.supervisor.AgentStatus;
import io.trading.feed.gateway.supervisor.Supervisor;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires and owns the running gateway: agents under the supervisor, the normalization
 * pipeline, the dispatcher with its consumers, and the metrics server.
 *
 * <p>Shutdown runs upstream first so queued events are drained into the sinks.
 */
public class FeedController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedController.class);

    private final FeedConfig config;
    private final FeedMetrics metrics;
    private final Dispatcher dispatcher;
    private final Pipeline pipeline;
    private final Supervisor supervisor;
    private final MetricsServer metricsServer;
    private final ShutdownSignalBarrier shutdownBarrier;

    public FeedController(FeedConfig config) throws SinkException {
        this(config, FeedMetrics.createDefault(), Clock.systemUTC(), null, EventValidator.acceptAll());
    }

    /**
     * @param agentFactory agent factory, or {@code null} for the built-in venue agents
     */
    public FeedController(
        FeedConfig config,
        FeedMetrics metrics,
        Clock clock,
        AgentFactory agentFactory,
        EventValidator validator
    ) throws SinkException {
        this.config = config;
        this.metrics = metrics;
        this.dispatcher = new Dispatcher(config.sinkOfferTimeout(), metrics);

        for (Sink sink : createSinks(config)) {
            dispatcher.register(sink.name(), BackpressurePolicy.BOUNDED_BLOCK, config.sinkQueueCapacity(),
                new SinkConsumer(sink, metrics));
        }

        SpreadDetector spreadDetector = new SpreadDetector(
            config.threshold(),
            config.spreadStaleness(),
            config.spreadDebounce(),
            dispatcher::publish,
            metrics,
            clock
        );
        dispatcher.register("spread-detector", BackpressurePolicy.BOUNDED_BLOCK, config.sinkQueueCapacity(),
            spreadDetector);

        if (config.enabledKinds().stream().anyMatch(BookStore.BOOK_KINDS::contains)) {
            dispatcher.register("book-store", BackpressurePolicy.BOUNDED_BLOCK, config.sinkQueueCapacity(),
                new BookStore());
        }

        Canonicalizer canonicalizer = new Canonicalizer(
            config.enabledKinds(),
            SymbolNormalizer.withBinanceQuotes(config.binanceQuotes()),
            MappingTable.defaults()
        );
        this.pipeline = new Pipeline(
            canonicalizer,
            validator,
            dispatcher,
            metrics,
            config.sinkQueueCapacity(),
            config.supervisor().telemetryInterval(),
            clock
        );

        AgentFactory factory = agentFactory != null ? agentFactory : new VenueAgentFactory(config, clock);
        this.supervisor = new Supervisor(config.feeds(), factory, pipeline, config.supervisor(), metrics, clock);
        this.metricsServer = config.metricsPort() > 0
            ? new MetricsServer(config.metricsPort(), metrics, supervisor::status)
            : null;
        this.shutdownBarrier = new ShutdownSignalBarrier();

        LOGGER.info("Feed controller initialized: {} feed(s), kinds={}", config.feeds().size(), config.enabledKinds());
    }

    private static List<Sink> createSinks(FeedConfig config) throws SinkException {
        List<Sink> sinks = new ArrayList<>();
        sinks.add(JsonLineSink.stdout());
        if (config.jsonOut() != null) {
            sinks.add(JsonLineSink.toFile(config.jsonOut()));
        }
        return sinks;
    }

    /**
     * Starts every stage, downstream first.
     */
    public void start() throws IOException {
        LOGGER.info("Starting feed gateway...");
        dispatcher.start();
        pipeline.start();
        if (metricsServer != null) {
            metricsServer.start();
        }
        supervisor.start();
        for (FeedSpec feed : config.feeds()) {
            LOGGER.info("  feed {}", feed);
        }
        LOGGER.info("Spread threshold {}, staleness {} ms, debounce {} ms",
            config.threshold(), config.spreadStaleness().toMillis(), config.spreadDebounce().toMillis());
    }

    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }

    public List<AgentStatus> status() {
        return supervisor.status();
    }

    public FeedMetrics metrics() {
        return metrics;
    }

    /**
     * Blocks until shutdown is signalled.
     */
    public void waitForShutdown() {
        shutdownBarrier.await();
    }

    @Override
    public void close() {
        LOGGER.info("Shutting down feed gateway...");
        supervisor.shutdown();
        try {
            if (!supervisor.awaitTermination(Duration.ofSeconds(5))) {
                LOGGER.warn("Agents still running after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        CloseHelper.closeAll(pipeline, dispatcher, metricsServer);
        for (AgentStatus status : supervisor.status()) {
            LOGGER.info("  {} ended {} after {} message(s), {} restart(s)",
                status.name(), status.state(), status.messages(), status.restarts());
        }
        LOGGER.info("Feed gateway shut down");
    }
}
