package io.trading.feed.gateway.agent;

import io.trading.feed.canonical.model.RawEvent;

import java.util.concurrent.TimeUnit;

/**
 * Pull side of an agent session.
 */
public interface RawEventStream {

    /**
     * Waits up to the timeout for the next raw event.
     *
     * @return the next event, or {@code null} if none arrived in time
     * @throws DisconnectedException if the transport closed; the stream is finished
     * @throws ProtocolException     if the venue sent an error or an unreadable frame
     * @throws InterruptedException  if the calling thread was interrupted
     */
    RawEvent poll(long timeout, TimeUnit unit)
        throws DisconnectedException, ProtocolException, InterruptedException;

    /**
     * Receipt time of the latest frame of any sort, acks and heartbeats included, or
     * {@link Long#MIN_VALUE} if the stream cannot tell.
     */
    default long lastFrameAt() {
        return Long.MIN_VALUE;
    }
}
