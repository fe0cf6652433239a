package io.trading.feed.gateway.agent;

import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.gateway.agent.binance.BinanceAgent;
import io.trading.feed.gateway.agent.coinbase.CoinbaseAgent;
import io.trading.feed.gateway.agent.deribit.DeribitAgent;
import io.trading.feed.gateway.agent.onchain.OnchainAgent;
import io.trading.feed.gateway.config.FeedConfig;
import io.trading.feed.gateway.config.FeedSpec;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Registry of the built-in venue agents.
 */
public class VenueAgentFactory implements AgentFactory {

    private final FeedConfig config;
    private final Clock clock;

    public VenueAgentFactory(FeedConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public FeedAgent create(FeedSpec spec) {
        URI uri = config.endpoint(spec.venue());
        Set<EventKind> kinds = config.enabledKinds();
        Duration timeout = config.connectTimeout();
        List<String> symbols = symbols(spec);
        return switch (spec.venue()) {
            case BINANCE -> new BinanceAgent(uri, symbols, kinds, timeout, clock);
            case COINBASE -> new CoinbaseAgent(uri, symbols, kinds, timeout, clock);
            case DERIBIT -> new DeribitAgent(uri, symbols, kinds, timeout, clock);
            case ONCHAIN -> new OnchainAgent(uri, symbols, kinds, timeout, clock);
        };
    }

    /**
     * Symbols configured for the feed, or the venue's default universe for {@code all}.
     */
    public static List<String> symbols(FeedSpec spec) {
        if (!spec.isAll()) {
            return spec.symbols();
        }
        return switch (spec.venue()) {
            case BINANCE -> BinanceAgent.DEFAULT_SYMBOLS;
            case COINBASE -> CoinbaseAgent.DEFAULT_SYMBOLS;
            case DERIBIT -> DeribitAgent.DEFAULT_SYMBOLS;
            case ONCHAIN -> OnchainAgent.DEFAULT_SYMBOLS;
        };
    }
}
