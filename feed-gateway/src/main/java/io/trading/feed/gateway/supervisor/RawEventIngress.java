package io.trading.feed.gateway.supervisor;

import io.trading.feed.canonical.model.RawEvent;

import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off from agent runners to the pipeline stage.
 */
@FunctionalInterface
public interface RawEventIngress {

    /**
     * @return false if the ingress stayed full for the whole timeout
     */
    boolean offer(RawEvent event, long timeout, TimeUnit unit) throws InterruptedException;
}
