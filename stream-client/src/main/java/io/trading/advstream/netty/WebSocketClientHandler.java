package io.trading.advstream.netty;

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
import io.trading.advstream.transport.FrameListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.channels.ClosedChannelException;

/**
 * Netty handler for WebSocket client connections.
 * Completes the handshake, answers pings and forwards every frame to a {@link FrameListener}.
 * At most one terminal event (close or error) is reported per connection.
 */
public class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    private final String name;
    private final WebSocketClientHandshaker handshaker;
    private final FrameListener listener;

    private ChannelPromise handshakeFuture;
    private boolean terminated = false;

    public WebSocketClientHandler(String name, URI uri, int maxFramePayloadLength, FrameListener listener) {
        this.name = name;
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            maxFramePayloadLength
        );
        this.listener = listener;
    }

    /**
     * Completes once the handshake succeeded, or fails with the handshake error.
     */
    public ChannelPromise handshakeFuture() {
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
        LOGGER.debug("{}: WebSocket channel inactive", name);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(new ClosedChannelException());
            return;
        }
        terminate(-1, "connection lost", null);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("{}: WebSocket handshake complete", name);
                handshakeFuture.trySuccess();
            } catch (Exception e) {
                LOGGER.error("{}: WebSocket handshake failed", name, e);
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

        if (frame instanceof TextWebSocketFrame textFrame) {
            listener.onText(textFrame.text());
            return;
        }

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            listener.onPing();
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            listener.onPong();
            return;
        }

        if (frame instanceof CloseWebSocketFrame close) {
            LOGGER.debug("{}: Received close frame {} {}", name, close.statusCode(), close.reasonText());
            terminate(close.statusCode(), close.reasonText(), null);
            ctx.close();
            return;
        }

        LOGGER.warn("{}: Unsupported frame type: {}", name, frame.getClass().getName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (!handshakeFuture.isDone()) {
            handshakeFuture.tryFailure(cause);
        } else {
            LOGGER.error("{}: WebSocket exception", name, cause);
            terminate(0, null, cause);
        }
        ctx.close();
    }

    private void terminate(int statusCode, String reason, Throwable cause) {
        if (terminated) {
            return;
        }
        terminated = true;
        if (cause != null) {
            listener.onError(cause);
        } else {
            listener.onClose(statusCode, reason == null ? "" : reason);
        }
    }
}
