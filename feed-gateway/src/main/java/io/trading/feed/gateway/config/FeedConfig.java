package io.trading.feed.gateway.config;

import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.canonical.symbol.QuoteTable;
import io.trading.feed.gateway.supervisor.SupervisorSettings;

import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the feed gateway, resolved once at startup.
 *
 * <p>No component reads the environment on its own; everything it needs is carried here.
 *
 * @param feeds             Feeds to stream, one agent each
 * @param enabledKinds      Kinds that pass canonicalization
 * @param jsonOut           File for JSON lines output, {@code null} for stdout
 * @param threshold         Spread emission threshold
 * @param spreadStaleness   Age after which a venue's last trade no longer takes part in a spread
 * @param spreadDebounce    Minimum time between spread events for one symbol
 * @param endpoints         WebSocket endpoint per venue
 * @param binanceQuotes     Quote assets used to split Binance symbols
 * @param connectTimeout    Bound on connect plus handshake
 * @param supervisor        Reconnect, staleness and polling policy
 * @param sinkQueueCapacity Capacity of every consumer queue
 * @param sinkOfferTimeout  Longest wait for a full bounded-block consumer queue
 * @param metricsPort       Port of the metrics HTTP server, 0 to disable it
 */
public record FeedConfig(
    List<FeedSpec> feeds,
    Set<EventKind> enabledKinds,
    Path jsonOut,
    SpreadThreshold threshold,
    Duration spreadStaleness,
    Duration spreadDebounce,
    Map<Venue, URI> endpoints,
    QuoteTable binanceQuotes,
    Duration connectTimeout,
    SupervisorSettings supervisor,
    int sinkQueueCapacity,
    Duration sinkOfferTimeout,
    int metricsPort
) {
    private static final Duration DEFAULT_SPREAD_STALENESS = Duration.ofSeconds(10);
    private static final Duration DEFAULT_SPREAD_DEBOUNCE = Duration.ofSeconds(5);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_SINK_QUEUE_CAPACITY = 10_000;
    private static final Duration DEFAULT_SINK_OFFER_TIMEOUT = Duration.ofMillis(250);
    private static final int DEFAULT_METRICS_PORT = 9090;

    private static final Set<String> TRUTHY = Set.of("1", "true", "yes", "on");

    private static final Map<String, EventKind> KIND_FLAGS = Map.ofEntries(
        Map.entry("--l2-diffs", EventKind.L2_DIFF),
        Map.entry("--l2-snapshots", EventKind.L2_SNAPSHOT),
        Map.entry("--book-ticker", EventKind.BOOK_TICKER),
        Map.entry("--ticker-24h", EventKind.TICKER_24H),
        Map.entry("--ohlcv", EventKind.OHLCV),
        Map.entry("--index-price", EventKind.INDEX_PRICE),
        Map.entry("--mark-price", EventKind.MARK_PRICE),
        Map.entry("--funding-rate", EventKind.FUNDING_RATE),
        Map.entry("--open-interest", EventKind.OPEN_INTEREST),
        Map.entry("--onchain-transfers", EventKind.ONCHAIN_TRANSFER),
        Map.entry("--onchain-balances", EventKind.ONCHAIN_BALANCE),
        Map.entry("--top-dex-pools", EventKind.TOP_DEX_POOL),
        Map.entry("--news", EventKind.NEWS_HEADLINE),
        Map.entry("--telemetry", EventKind.TELEMETRY)
    );

    private static final Map<String, EventKind> EXPERIMENTAL_TOGGLES = Map.of(
        "ENABLE_OPTIONS_CHAIN", EventKind.OPTIONS_CHAIN,
        "ENABLE_MEMPOOL", EventKind.MEMPOOL,
        "ENABLE_BRIDGE_FLOWS", EventKind.BRIDGE_FLOW,
        "ENABLE_MEV_SIGNALS", EventKind.MEV_SIGNAL
    );

    private static final Map<Venue, String> ENDPOINT_VARIABLES = Map.of(
        Venue.BINANCE, "BINANCE_WS_URL",
        Venue.COINBASE, "COINBASE_WS_URL",
        Venue.DERIBIT, "DERIBIT_WS_URL",
        Venue.ONCHAIN, "ONCHAIN_WS_URL"
    );

    public static final Map<Venue, URI> DEFAULT_ENDPOINTS = Map.of(
        Venue.BINANCE, URI.create("wss://stream.binance.com:9443/ws"),
        Venue.COINBASE, URI.create("wss://ws-feed.exchange.coinbase.com"),
        Venue.DERIBIT, URI.create("wss://www.deribit.com/ws/api/v2"),
        Venue.ONCHAIN, URI.create("ws://127.0.0.1:8546/relay")
    );

    public FeedConfig {
        if (feeds == null || feeds.isEmpty()) {
            throw new IllegalArgumentException("at least one feed is required");
        }
        if (enabledKinds == null || enabledKinds.isEmpty()) {
            throw new IllegalArgumentException("at least one event kind must be enabled");
        }
        if (threshold == null) {
            throw new IllegalArgumentException("threshold cannot be null");
        }
        requirePositive(spreadStaleness, "spreadStaleness");
        requirePositive(spreadDebounce, "spreadDebounce");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(sinkOfferTimeout, "sinkOfferTimeout");
        if (endpoints == null) {
            throw new IllegalArgumentException("endpoints cannot be null");
        }
        for (FeedSpec feed : feeds) {
            URI uri = endpoints.get(feed.venue());
            if (uri == null) {
                throw new IllegalArgumentException("no endpoint for " + feed.venue());
            }
            if (!"ws".equals(uri.getScheme()) && !"wss".equals(uri.getScheme())) {
                throw new IllegalArgumentException("endpoint for " + feed.venue() + " must be ws:// or wss://: " + uri);
            }
        }
        if (binanceQuotes == null) {
            throw new IllegalArgumentException("binanceQuotes cannot be null");
        }
        if (supervisor == null) {
            throw new IllegalArgumentException("supervisor settings cannot be null");
        }
        if (sinkQueueCapacity <= 0) {
            throw new IllegalArgumentException("sinkQueueCapacity must be positive");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 0 and 65535");
        }
        feeds = List.copyOf(feeds);
        enabledKinds = Collections.unmodifiableSet(EnumSet.copyOf(enabledKinds));
        endpoints = Collections.unmodifiableMap(new EnumMap<>(endpoints));
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public URI endpoint(Venue venue) {
        return endpoints.get(venue);
    }

    /**
     * Resolves configuration from the process arguments and environment.
     */
    public static FeedConfig fromEnv(String[] args) throws ConfigurationException {
        return resolve(Arrays.asList(args), System.getenv());
    }

    /**
     * Resolves configuration from command line arguments and an environment map.
     *
     * Arguments:
     * - positional "venue:symbols" feed specs (e.g., "binance:btcusdt,ethusdt", "coinbase:all")
     * - kind flags (--l2-diffs, --book-ticker, --telemetry, ...), --no-trades
     * - --json-out=FILE, --threshold=0.005|0.5%, --metrics-port=PORT
     *
     * Environment variables:
     * - ENABLE_OPTIONS_CHAIN, ENABLE_MEMPOOL, ENABLE_BRIDGE_FLOWS, ENABLE_MEV_SIGNALS: experimental kinds
     * - BINANCE_WS_URL, COINBASE_WS_URL, DERIBIT_WS_URL, ONCHAIN_WS_URL: endpoints
     * - BINANCE_QUOTES: quote assets for Binance symbol splitting (e.g., "usdt,usdc,btc")
     * - SPREAD_STALENESS_MS, SPREAD_DEBOUNCE_MS, CONNECT_TIMEOUT_MS, FEED_STALENESS_MS,
     *   MAX_CONSECUTIVE_FAILURES, BACKOFF_INITIAL_MS, BACKOFF_MAX_MS, STABILITY_WINDOW_MS,
     *   SINK_QUEUE_CAPACITY, SINK_OFFER_TIMEOUT_MS, METRICS_PORT: tuning
     *
     * @throws ConfigurationException on unknown flags, malformed values or when no feed is given
     */
    public static FeedConfig resolve(List<String> args, Map<String, String> env) throws ConfigurationException {
        Builder builder = builder();
        builder.metricsPort(parseInt(env, "METRICS_PORT", DEFAULT_METRICS_PORT));

        for (String arg : args) {
            String trimmed = arg.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (!trimmed.startsWith("--")) {
                try {
                    builder.addFeed(FeedSpec.fromString(trimmed));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException("Invalid feed spec '" + trimmed + "': " + e.getMessage(), e);
                }
                continue;
            }
            int eq = trimmed.indexOf('=');
            String flag = eq < 0 ? trimmed : trimmed.substring(0, eq);
            String value = eq < 0 ? null : trimmed.substring(eq + 1);
            switch (flag) {
                case "--no-trades" -> builder.disableKind(EventKind.TRADE);
                case "--json-out" -> {
                    try {
                        builder.jsonOut(Path.of(requireValue(flag, value)));
                    } catch (InvalidPathException e) {
                        throw new ConfigurationException("Invalid --json-out path: " + e.getMessage(), e);
                    }
                }
                case "--threshold" -> {
                    try {
                        builder.threshold(SpreadThreshold.parse(requireValue(flag, value)));
                    } catch (IllegalArgumentException e) {
                        throw new ConfigurationException(e.getMessage(), e);
                    }
                }
                case "--metrics-port" -> builder.metricsPort(parseInt(flag, requireValue(flag, value)));
                default -> {
                    EventKind kind = KIND_FLAGS.get(flag);
                    if (kind == null || value != null) {
                        throw new ConfigurationException("Unknown option: " + trimmed);
                    }
                    builder.enableKind(kind);
                }
            }
        }

        EXPERIMENTAL_TOGGLES.forEach((variable, kind) -> {
            if (isTruthy(env.get(variable))) {
                builder.enableKind(kind);
            }
        });

        for (Map.Entry<Venue, String> entry : ENDPOINT_VARIABLES.entrySet()) {
            String url = env.get(entry.getValue());
            if (url != null && !url.isBlank()) {
                try {
                    builder.endpoint(entry.getKey(), new URI(url.trim()));
                } catch (java.net.URISyntaxException e) {
                    throw new ConfigurationException("Invalid " + entry.getValue() + ": " + url, e);
                }
            }
        }

        String quotes = env.get("BINANCE_QUOTES");
        if (quotes != null && !quotes.isBlank()) {
            try {
                builder.binanceQuotes(QuoteTable.fromString(quotes));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid BINANCE_QUOTES: " + e.getMessage(), e);
            }
        }

        builder.spreadStaleness(parseMillis(env, "SPREAD_STALENESS_MS", DEFAULT_SPREAD_STALENESS));
        builder.spreadDebounce(parseMillis(env, "SPREAD_DEBOUNCE_MS", DEFAULT_SPREAD_DEBOUNCE));
        builder.connectTimeout(parseMillis(env, "CONNECT_TIMEOUT_MS", DEFAULT_CONNECT_TIMEOUT));
        builder.sinkQueueCapacity(parseInt(env, "SINK_QUEUE_CAPACITY", DEFAULT_SINK_QUEUE_CAPACITY));
        builder.sinkOfferTimeout(parseMillis(env, "SINK_OFFER_TIMEOUT_MS", DEFAULT_SINK_OFFER_TIMEOUT));

        SupervisorSettings defaults = SupervisorSettings.DEFAULT;
        try {
            builder.supervisor(new SupervisorSettings(
                parseMillis(env, "BACKOFF_INITIAL_MS", defaults.backoffInitial()),
                parseMillis(env, "BACKOFF_MAX_MS", defaults.backoffMax()),
                defaults.backoffMultiplier(),
                parseMillis(env, "STABILITY_WINDOW_MS", defaults.stabilityWindow()),
                parseInt(env, "MAX_CONSECUTIVE_FAILURES", defaults.maxConsecutiveFailures()),
                parseMillis(env, "FEED_STALENESS_MS", defaults.feedStaleness()),
                defaults.pollInterval(),
                defaults.telemetryInterval(),
                defaults.ingressOfferTimeout()
            ));
            return builder.build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    static boolean isTruthy(String value) {
        return value != null && TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private static String requireValue(String flag, String value) throws ConfigurationException {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(flag + " requires a value (" + flag + "=...)");
        }
        return value.trim();
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) throws ConfigurationException {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return parseInt(key, value);
    }

    private static int parseInt(String key, String value) throws ConfigurationException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + " value: " + value, e);
        }
    }

    private static Duration parseMillis(Map<String, String> env, String key, Duration defaultValue)
        throws ConfigurationException {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + " value: " + value, e);
        }
    }

    /**
     * Creates a new builder for FeedConfig. Only trades are enabled by default.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FeedConfig.
     */
    public static class Builder {
        private final List<FeedSpec> feeds = new ArrayList<>();
        private final Set<EventKind> enabledKinds = EnumSet.of(EventKind.TRADE);
        private final Map<Venue, URI> endpoints = new EnumMap<>(DEFAULT_ENDPOINTS);
        private Path jsonOut;
        private SpreadThreshold threshold = SpreadThreshold.DEFAULT;
        private Duration spreadStaleness = DEFAULT_SPREAD_STALENESS;
        private Duration spreadDebounce = DEFAULT_SPREAD_DEBOUNCE;
        private QuoteTable binanceQuotes = QuoteTable.BINANCE_DEFAULT;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private SupervisorSettings supervisor = SupervisorSettings.DEFAULT;
        private int sinkQueueCapacity = DEFAULT_SINK_QUEUE_CAPACITY;
        private Duration sinkOfferTimeout = DEFAULT_SINK_OFFER_TIMEOUT;
        private int metricsPort = DEFAULT_METRICS_PORT;

        public Builder addFeed(FeedSpec feed) {
            this.feeds.add(feed);
            return this;
        }

        public Builder addFeed(String spec) {
            return addFeed(FeedSpec.fromString(spec));
        }

        public Builder enableKind(EventKind kind) {
            this.enabledKinds.add(kind);
            return this;
        }

        public Builder disableKind(EventKind kind) {
            this.enabledKinds.remove(kind);
            return this;
        }

        public Builder jsonOut(Path jsonOut) {
            this.jsonOut = jsonOut;
            return this;
        }

        public Builder threshold(SpreadThreshold threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder spreadStaleness(Duration spreadStaleness) {
            this.spreadStaleness = spreadStaleness;
            return this;
        }

        public Builder spreadDebounce(Duration spreadDebounce) {
            this.spreadDebounce = spreadDebounce;
            return this;
        }

        public Builder endpoint(Venue venue, URI uri) {
            this.endpoints.put(venue, uri);
            return this;
        }

        public Builder binanceQuotes(QuoteTable binanceQuotes) {
            this.binanceQuotes = binanceQuotes;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder supervisor(SupervisorSettings supervisor) {
            this.supervisor = supervisor;
            return this;
        }

        public Builder sinkQueueCapacity(int sinkQueueCapacity) {
            this.sinkQueueCapacity = sinkQueueCapacity;
            return this;
        }

        public Builder sinkOfferTimeout(Duration sinkOfferTimeout) {
            this.sinkOfferTimeout = sinkOfferTimeout;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public FeedConfig build() {
            if (feeds.isEmpty()) {
                throw new IllegalStateException("At least one feed must be added (e.g., binance:btcusdt)");
            }
            if (enabledKinds.isEmpty()) {
                throw new IllegalStateException("No event kind is enabled");
            }
            return new FeedConfig(
                feeds,
                enabledKinds,
                jsonOut,
                threshold,
                spreadStaleness,
                spreadDebounce,
                endpoints,
                binanceQuotes,
                connectTimeout,
                supervisor,
                sinkQueueCapacity,
                sinkOfferTimeout,
                metricsPort
            );
        }
    }
}
