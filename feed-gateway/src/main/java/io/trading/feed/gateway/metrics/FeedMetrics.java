package io.trading.feed.gateway.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.feed.canonical.NormalizationException;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.supervisor.AgentState;

/**
 * Prometheus metrics collector for the feed gateway.
 *
 * Tracks:
 * - Raw and canonical event counts per venue and kind
 * - Normalization errors per reason and validator rejections
 * - Deliveries, drops and failures per dispatcher consumer
 * - Sink errors, reconnects, agent state and spread events
 * - Ingress to dispatch latency
 */
public class FeedMetrics {

    private final CollectorRegistry registry;

    private final Counter rawEvents;
    private final Counter canonicalEvents;
    private final Counter normalizationErrors;
    private final Counter validatorRejections;
    private final Counter pipelineFailures;
    private final Counter protocolErrors;
    private final Counter reconnects;
    private final Counter delivered;
    private final Counter dropped;
    private final Counter deliveryFailures;
    private final Counter sinkErrors;
    private final Counter spreadEvents;

    private final Gauge agentState;
    private final Gauge queueDepth;

    private final Summary pipelineLatencyMicros;

    /**
     * Creates metrics on the default registry and registers JVM metrics.
     */
    public static FeedMetrics createDefault() {
        DefaultExports.initialize();
        return new FeedMetrics(CollectorRegistry.defaultRegistry);
    }

    /**
     * Creates metrics on the given registry. Tests pass a fresh registry each time.
     */
    public FeedMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.rawEvents = Counter.build()
            .name("feed_raw_events_total")
            .help("Raw events received from venue agents")
            .labelNames("venue", "kind")
            .register(registry);

        this.canonicalEvents = Counter.build()
            .name("feed_canonical_events_total")
            .help("Events that passed canonicalization and validation")
            .labelNames("venue", "kind")
            .register(registry);

        this.normalizationErrors = Counter.build()
            .name("feed_normalization_errors_total")
            .help("Raw events dropped by the canonicalizer")
            .labelNames("venue", "reason")
            .register(registry);

        this.validatorRejections = Counter.build()
            .name("feed_validator_rejections_total")
            .help("Canonical events rejected by the validator")
            .labelNames("venue", "kind")
            .register(registry);

        this.pipelineFailures = Counter.build()
            .name("feed_pipeline_failures_total")
            .help("Raw events dropped after an unexpected error in the pipeline stage")
            .labelNames("venue")
            .register(registry);

        this.protocolErrors = Counter.build()
            .name("feed_protocol_errors_total")
            .help("Malformed or error frames received from venues")
            .labelNames("agent")
            .register(registry);

        this.reconnects = Counter.build()
            .name("feed_reconnects_total")
            .help("Reconnection attempts per agent")
            .labelNames("agent")
            .register(registry);

        this.delivered = Counter.build()
            .name("feed_delivered_total")
            .help("Events delivered to a dispatcher consumer")
            .labelNames("consumer")
            .register(registry);

        this.dropped = Counter.build()
            .name("feed_dropped_total")
            .help("Events evicted from a drop-oldest consumer queue")
            .labelNames("consumer")
            .register(registry);

        this.deliveryFailures = Counter.build()
            .name("feed_delivery_failures_total")
            .help("Events a consumer could not take in time or failed to handle")
            .labelNames("consumer")
            .register(registry);

        this.sinkErrors = Counter.build()
            .name("feed_sink_errors_total")
            .help("Sink write failures")
            .labelNames("sink")
            .register(registry);

        this.spreadEvents = Counter.build()
            .name("feed_spread_events_total")
            .help("Spread events emitted per symbol")
            .labelNames("symbol")
            .register(registry);

        // 0 = connecting, 1 = streaming, 2 = disconnected, 3 = failed, 4 = stopped
        this.agentState = Gauge.build()
            .name("feed_agent_state")
            .help("Agent state (0 connecting, 1 streaming, 2 disconnected, 3 failed, 4 stopped)")
            .labelNames("agent")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("feed_queue_depth")
            .help("Events waiting in a pipeline or consumer queue")
            .labelNames("queue")
            .register(registry);

        this.pipelineLatencyMicros = Summary.build()
            .name("feed_pipeline_latency_microseconds")
            .help("Receipt to dispatch latency in microseconds")
            .labelNames("venue")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);
    }

    public void recordRawEvent(Venue venue, EventKind kind) {
        rawEvents.labels(venue.id(), kind.wireName()).inc();
    }

    public void recordCanonicalEvent(Venue venue, EventKind kind) {
        canonicalEvents.labels(venue.id(), kind.wireName()).inc();
    }

    public void recordNormalizationError(Venue venue, NormalizationException.Reason reason) {
        normalizationErrors.labels(venue.id(), reason.name()).inc();
    }

    public void recordValidatorRejection(Venue venue, EventKind kind) {
        validatorRejections.labels(venue.id(), kind.wireName()).inc();
    }

    public void recordPipelineFailure(Venue venue) {
        pipelineFailures.labels(venue.id()).inc();
    }

    public void recordProtocolError(String agent) {
        protocolErrors.labels(agent).inc();
    }

    public void recordReconnect(String agent) {
        reconnects.labels(agent).inc();
    }

    public void recordDelivered(String consumer) {
        delivered.labels(consumer).inc();
    }

    public void recordDropped(String consumer) {
        dropped.labels(consumer).inc();
    }

    public void recordDeliveryFailure(String consumer) {
        deliveryFailures.labels(consumer).inc();
    }

    public void recordSinkError(String sink) {
        sinkErrors.labels(sink).inc();
    }

    public void recordSpreadEvent(String symbol) {
        spreadEvents.labels(symbol).inc();
    }

    public void setAgentState(String agent, AgentState state) {
        agentState.labels(agent).set(state.ordinal());
    }

    public void setQueueDepth(String queue, int depth) {
        queueDepth.labels(queue).set(depth);
    }

    public void recordPipelineLatency(Venue venue, long micros) {
        pipelineLatencyMicros.labels(venue.id()).observe(micros);
    }

    public double getDropped(String consumer) {
        return dropped.labels(consumer).get();
    }

    public double getDeliveryFailures(String consumer) {
        return deliveryFailures.labels(consumer).get();
    }

    public double getDelivered(String consumer) {
        return delivered.labels(consumer).get();
    }

    public double getNormalizationErrors(Venue venue, NormalizationException.Reason reason) {
        return normalizationErrors.labels(venue.id(), reason.name()).get();
    }

    public double getValidatorRejections(Venue venue, EventKind kind) {
        return validatorRejections.labels(venue.id(), kind.wireName()).get();
    }

    public double getPipelineFailures(Venue venue) {
        return pipelineFailures.labels(venue.id()).get();
    }

    public double getSinkErrors(String sink) {
        return sinkErrors.labels(sink).get();
    }

    public double getReconnects(String agent) {
        return reconnects.labels(agent).get();
    }

    public double getSpreadEvents(String symbol) {
        return spreadEvents.labels(symbol).get();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
