package io.trading.feed.gateway.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslProvider;
import io.trading.feed.gateway.agent.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Netty-based WebSocket client for venue streaming APIs.
 * Supports both epoll (Linux) and NIO (universal) event loop groups.
 *
 * <p>{@link #connect(Duration)} blocks until the WebSocket handshake has completed, so a
 * returned client is ready to send subscriptions. One client serves one session; create a
 * new one to reconnect.
 */
public class WebSocketClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);

    private static final int MAX_HTTP_CONTENT_LENGTH = 65536;
    private static final int MAX_FRAME_PAYLOAD_LENGTH = 16 * 1024 * 1024;

    private final URI uri;
    private final String name;
    private final Consumer<String> messageHandler;
    private final Consumer<Throwable> errorHandler;
    private final Runnable disconnectHandler;
    private final boolean enableCompression;

    private EventLoopGroup eventLoopGroup;
    private Channel channel;
    private volatile boolean connected = false;

    /**
     * Creates a new WebSocket client.
     *
     * @param uri               The WebSocket URI to connect to
     * @param name              Friendly name for this client (e.g., "binance")
     * @param messageHandler    Callback for received text messages, invoked on the event loop
     * @param errorHandler      Callback for transport errors
     * @param disconnectHandler Callback when the connection is lost
     * @param enableCompression Whether to offer permessage-deflate
     */
    public WebSocketClient(
        URI uri,
        String name,
        Consumer<String> messageHandler,
        Consumer<Throwable> errorHandler,
        Runnable disconnectHandler,
        boolean enableCompression
    ) {
        this.uri = uri;
        this.name = name;
        this.messageHandler = messageHandler;
        this.errorHandler = errorHandler;
        this.disconnectHandler = disconnectHandler;
        this.enableCompression = enableCompression;
    }

    /**
     * Connects and completes the WebSocket handshake within the timeout.
     *
     * @throws ConnectionException if the TCP connect, TLS or handshake fails or times out
     */
    public void connect(Duration timeout) throws ConnectionException {
        if (connected) {
            LOGGER.warn("{}: already connected", name);
            return;
        }

        boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
        long deadline = System.nanoTime() + timeout.toNanos();

        SslContext sslContext = secure ? createSslContext() : null;
        WebSocketClientHandler handler = new WebSocketClientHandler(
            uri,
            name,
            MAX_FRAME_PAYLOAD_LENGTH,
            messageHandler,
            errorHandler,
            () -> {
                boolean wasConnected = connected;
                connected = false;
                if (wasConnected) {
                    LOGGER.warn("{}: disconnected", name);
                }
                if (disconnectHandler != null) {
                    disconnectHandler.run();
                }
            }
        );

        eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, name + "-ws");
        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<>() {
                @Override
                protected void initChannel(Channel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    if (sslContext != null) {
                        pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }
                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT_LENGTH));
                    if (enableCompression) {
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                    }
                    pipeline.addLast(new WebSocketFrameAggregator(MAX_FRAME_PAYLOAD_LENGTH));
                    pipeline.addLast(handler);
                }
            });

        LOGGER.info("{}: connecting to {}:{}", name, host, port);
        try {
            ChannelFuture connectFuture = bootstrap.connect(host, port);
            if (!connectFuture.await(remainingMillis(deadline), TimeUnit.MILLISECONDS)) {
                throw new ConnectionException(name + ": connect to " + uri + " timed out after " + timeout.toMillis() + " ms");
            }
            if (!connectFuture.isSuccess()) {
                throw new ConnectionException(name + ": connect to " + uri + " failed", connectFuture.cause());
            }
            channel = connectFuture.channel();

            ChannelFuture handshake = handler.handshakeFuture();
            if (!handshake.await(remainingMillis(deadline), TimeUnit.MILLISECONDS)) {
                throw new ConnectionException(name + ": handshake with " + uri + " timed out");
            }
            if (!handshake.isSuccess()) {
                throw new ConnectionException(name + ": handshake with " + uri + " failed", handshake.cause());
            }
            connected = true;
            LOGGER.info("{}: connected", name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new ConnectionException(name + ": interrupted while connecting", e);
        } catch (ConnectionException e) {
            close();
            throw e;
        }
    }

    private SslContext createSslContext() throws ConnectionException {
        try {
            return SslContextBuilder.forClient()
                .protocols("TLSv1.2", "TLSv1.3")
                .sslProvider(SslProvider.JDK)
                .build();
        } catch (SSLException e) {
            throw new ConnectionException(name + ": failed to create SSL context", e);
        }
    }

    private static long remainingMillis(long deadlineNanos) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    /**
     * Sends a text message through the WebSocket.
     *
     * @return false if the client is not connected
     */
    public boolean send(String message) {
        Channel current = channel;
        if (!connected || current == null) {
            LOGGER.warn("{}: cannot send message, not connected", name);
            return false;
        }
        current.writeAndFlush(new TextWebSocketFrame(message)).addListener(future -> {
            if (!future.isSuccess()) {
                LOGGER.warn("{}: failed to send message", name, future.cause());
                if (errorHandler != null) {
                    errorHandler.accept(future.cause());
                }
            }
        });
        return true;
    }

    @Override
    public void close() {
        connected = false;

        Channel current = channel;
        channel = null;
        if (current != null && current.isActive()) {
            current.writeAndFlush(new CloseWebSocketFrame());
            current.close().awaitUninterruptibly(1, TimeUnit.SECONDS);
        }

        EventLoopGroup group = eventLoopGroup;
        eventLoopGroup = null;
        if (group != null) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }

        LOGGER.debug("{}: closed", name);
    }
}
