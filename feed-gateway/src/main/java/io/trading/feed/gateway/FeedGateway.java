package io.trading.feed.gateway;

import io.trading.feed.gateway.config.ConfigurationException;
import io.trading.feed.gateway.config.FeedConfig;
import io.trading.feed.gateway.core.FeedController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the arbitrage feed.
 *
 * <p>Usage: {@code feed-gateway [flags] venue:symbols [venue:symbols ...]}
 */
public class FeedGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedGateway.class);

    static final int EXIT_FATAL = 1;
    static final int EXIT_CONFIGURATION = 2;

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Arbitrage Feed Starting...");
        LOGGER.info("========================================");

        FeedConfig config;
        try {
            config = FeedConfig.fromEnv(args);
        } catch (ConfigurationException e) {
            LOGGER.error("Configuration error: {}", e.getMessage());
            LOGGER.error("Usage: feed-gateway [--l2-diffs ...] [--threshold=0.5%] [--json-out=file] venue:symbols ...");
            System.exit(EXIT_CONFIGURATION);
            return;
        }

        LOGGER.info("Configuration loaded:");
        LOGGER.info("  Feeds: {}", config.feeds());
        LOGGER.info("  Kinds: {}", config.enabledKinds());
        LOGGER.info("  Threshold: {}", config.threshold());
        if (config.jsonOut() != null) {
            LOGGER.info("  JSON out: {}", config.jsonOut());
        }

        try {
            FeedController controller = new FeedController(config);
            controller.start();

            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.waitForShutdown();
            controller.close();
        } catch (Exception e) {
            LOGGER.error("Fatal error in feed gateway", e);
            System.exit(EXIT_FATAL);
        }

        LOGGER.info("Arbitrage feed exited");
    }
}
