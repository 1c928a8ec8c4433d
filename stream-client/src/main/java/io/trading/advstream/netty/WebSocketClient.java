package io.trading.advstream.netty;

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
import io.trading.advstream.transport.FrameListener;
import io.trading.advstream.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;

/**
 * Netty-based WebSocket session to one endpoint.
 * Supports both epoll (Linux) and NIO (universal) event loop groups, plain and TLS URIs.
 */
public class WebSocketClient implements TransportSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClient.class);

    private static final int CONNECT_TIMEOUT_MS = 10_000;
    private static final long HANDSHAKE_TIMEOUT_MS = 10_000;
    private static final long WRITE_TIMEOUT_MS = 10_000;
    private static final int MAX_HTTP_CONTENT_LENGTH = 8192;
    // Level2 snapshots of busy products run to several megabytes
    private static final int MAX_FRAME_PAYLOAD_LENGTH = 16 * 1024 * 1024;

    private final URI uri;
    private final String name;
    private final EventLoopGroup eventLoopGroup;
    private final FrameListener listener;

    private Channel channel;
    private volatile boolean connected = false;
    private volatile boolean closedLocally = false;

    /**
     * Creates a new WebSocket client.
     *
     * @param uri            The WebSocket URI to connect to
     * @param name           Friendly name for this client (e.g., "Public")
     * @param eventLoopGroup Shared I/O threads
     * @param listener       Receives inbound frames
     */
    public WebSocketClient(URI uri, String name, EventLoopGroup eventLoopGroup, FrameListener listener) {
        this.uri = uri;
        this.name = name;
        this.eventLoopGroup = eventLoopGroup;
        this.listener = new LocalCloseFilter(listener);
    }

    /**
     * Connects to the WebSocket server and waits for the handshake.
     *
     * @throws IOException if the connection or the handshake failed
     */
    public void connect() throws IOException, InterruptedException {
        if (connected) {
            LOGGER.warn("{}: Already connected", name);
            return;
        }

        String scheme = uri.getScheme() == null ? "ws" : uri.getScheme().toLowerCase();
        if (!"ws".equals(scheme) && !"wss".equals(scheme)) {
            throw new IOException("Unsupported scheme: " + scheme);
        }
        boolean secure = "wss".equals(scheme);
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
        SslContext sslContext = secure ? buildSslContext() : null;

        WebSocketClientHandler handler = new WebSocketClientHandler(name, uri, MAX_FRAME_PAYLOAD_LENGTH, listener);

        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<>() {
                @Override
                protected void initChannel(Channel ch) {
                    ChannelPipeline pipeline = ch.pipeline();

                    if (sslContext != null) {
                        pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                    }

                    // HTTP codec
                    pipeline.addLast(new HttpClientCodec());

                    // HTTP object aggregator for handshake
                    pipeline.addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT_LENGTH));

                    // WebSocket compression
                    pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);

                    // Reassemble fragmented messages
                    pipeline.addLast(new WebSocketFrameAggregator(MAX_FRAME_PAYLOAD_LENGTH));

                    // WebSocket handshake and frame handler
                    pipeline.addLast(handler);
                }
            });

        LOGGER.info("{}: Connecting to {}:{}...", name, host, port);
        ChannelFuture connectFuture = bootstrap.connect(host, port);
        if (!connectFuture.await(CONNECT_TIMEOUT_MS + 1000L)) {
            connectFuture.cancel(false);
            throw new IOException(name + ": Connect to " + uri + " timed out");
        }
        if (!connectFuture.isSuccess()) {
            throw new IOException(name + ": Failed to connect to " + uri, connectFuture.cause());
        }
        channel = connectFuture.channel();

        if (!handler.handshakeFuture().await(HANDSHAKE_TIMEOUT_MS)) {
            close();
            throw new IOException(name + ": Handshake with " + uri + " timed out");
        }
        if (!handler.handshakeFuture().isSuccess()) {
            close();
            throw new IOException(name + ": Handshake with " + uri + " failed", handler.handshakeFuture().cause());
        }

        connected = true;
        LOGGER.info("{}: Connected", name);
    }

    /**
     * Sends a text message and waits until it is written to the socket.
     *
     * @param message The message to send
     */
    @Override
    public void send(String message) throws IOException {
        Channel current = channel;
        if (!connected || current == null || !current.isActive()) {
            throw new IOException(name + ": Cannot send message, not connected");
        }

        ChannelFuture writeFuture = current.writeAndFlush(new TextWebSocketFrame(message));
        try {
            if (!writeFuture.await(WRITE_TIMEOUT_MS)) {
                throw new IOException(name + ": Write timed out");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException(name + ": Interrupted while sending");
        }
        if (!writeFuture.isSuccess()) {
            throw new IOException(name + ": Failed to send message", writeFuture.cause());
        }
    }

    /**
     * Returns whether the client is currently connected.
     */
    @Override
    public boolean isOpen() {
        Channel current = channel;
        return connected && current != null && current.isActive();
    }

    @Override
    public void close() {
        closedLocally = true;
        connected = false;

        Channel current = channel;
        channel = null;
        if (current != null && current.isActive()) {
            current.writeAndFlush(new CloseWebSocketFrame());
            current.close();
            LOGGER.info("{}: Closed", name);
        }
    }

    private SslContext buildSslContext() throws IOException {
        try {
            return SslContextBuilder.forClient()
                .protocols("TLSv1.3", "TLSv1.2")
                .build();
        } catch (SSLException e) {
            throw new IOException(name + ": Failed to initialise TLS", e);
        }
    }

    /**
     * Drops terminal events caused by our own {@link #close()}.
     */
    private final class LocalCloseFilter implements FrameListener {

        private final FrameListener delegate;

        private LocalCloseFilter(FrameListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onText(String text) {
            delegate.onText(text);
        }

        @Override
        public void onPing() {
            delegate.onPing();
        }

        @Override
        public void onPong() {
            delegate.onPong();
        }

        @Override
        public void onClose(int statusCode, String reason) {
            connected = false;
            if (closedLocally) {
                return;
            }
            LOGGER.warn("{}: Disconnected ({} {})", name, statusCode, reason);
            delegate.onClose(statusCode, reason);
        }

        @Override
        public void onError(Throwable cause) {
            connected = false;
            if (closedLocally) {
                return;
            }
            delegate.onError(cause);
        }
    }
}
