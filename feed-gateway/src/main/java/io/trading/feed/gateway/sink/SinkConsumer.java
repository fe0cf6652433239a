package io.trading.feed.gateway.sink;

import io.trading.feed.canonical.model.FeedEvent;
import io.trading.feed.gateway.dispatch.EventConsumer;
import io.trading.feed.gateway.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts a {@link Sink} to the dispatcher. Write failures are logged and counted against
 * the sink; the next event is attempted normally.
 */
public class SinkConsumer implements EventConsumer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SinkConsumer.class);

    private final Sink sink;
    private final FeedMetrics metrics;

    public SinkConsumer(Sink sink, FeedMetrics metrics) {
        this.sink = sink;
        this.metrics = metrics;
    }

    @Override
    public void onEvent(FeedEvent event) {
        try {
            sink.write(event);
        } catch (SinkException e) {
            metrics.recordSinkError(sink.name());
            LOGGER.warn("Sink {} rejected {} {}: {}", sink.name(), event.typeName(), event.symbol(), e.getMessage());
        }
    }

    @Override
    public void onClose() {
        try {
            sink.close();
        } catch (SinkException e) {
            metrics.recordSinkError(sink.name());
            LOGGER.warn("Sink {} failed to close", sink.name(), e);
        }
    }
}
