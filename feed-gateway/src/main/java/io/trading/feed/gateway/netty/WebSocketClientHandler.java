package io.trading.feed.gateway.netty;

import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.function.Consumer;

/**
 * Netty handler for WebSocket client connections.
 * Handles handshake, frame processing, and connection lifecycle events.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final String name;
    private final WebSocketClientHandshaker handshaker;
    private final Consumer<String> messageHandler;
    private final Consumer<Throwable> errorHandler;
    private final Runnable disconnectHandler;
    private ChannelPromise handshakeFuture;

    public WebSocketClientHandler(
        URI uri,
        String name,
        int maxFramePayloadLength,
        Consumer<String> messageHandler,
        Consumer<Throwable> errorHandler,
        Runnable disconnectHandler
    ) {
        this.name = name;
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            maxFramePayloadLength
        );
        this.messageHandler = messageHandler;
        this.errorHandler = errorHandler;
        this.disconnectHandler = disconnectHandler;
    }

    /**
     * Completes when the WebSocket upgrade succeeded, fails when it did not.
     */
    public ChannelFuture handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("{}: channel inactive", name);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(new IllegalStateException("channel closed before handshake completed"));
        }
        if (disconnectHandler != null) {
            disconnectHandler.run();
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("{}: handshake complete", name);
                handshakeFuture.trySuccess();
            } catch (Exception e) {
                LOGGER.error("{}: handshake failed", name, e);
                handshakeFuture.tryFailure(e);
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof TextWebSocketFrame textFrame) {
            if (messageHandler != null) {
                messageHandler.accept(textFrame.text());
            }
            return;
        }

        if (frame instanceof CloseWebSocketFrame close) {
            LOGGER.info("{}: received close frame ({} {})", name, close.statusCode(), close.reasonText());
            ctx.close();
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            return;
        }

        LOGGER.warn("{}: unsupported frame type {}", name, frame.getClass().getSimpleName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("{}: WebSocket exception", name, cause);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(cause);
        }
        if (errorHandler != null) {
            errorHandler.accept(cause);
        }
        ctx.close();
    }
}
