package io.trading.advstream.client;

import io.prometheus.client.CollectorRegistry;
import io.trading.advstream.candle.CandleAggregator;
import io.trading.advstream.candle.CandleCallback;
import io.trading.advstream.config.StreamConfig;
import io.trading.advstream.metrics.StreamMetrics;
import io.trading.advstream.protocol.api.MessageParser;
import io.trading.advstream.protocol.api.ProtocolException;
import io.trading.advstream.protocol.encoder.ControlMessageEncoder;
import io.trading.advstream.protocol.impl.JacksonMessageParser;
import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.ControlMessage;
import io.trading.advstream.protocol.model.ControlType;
import io.trading.advstream.protocol.model.EndpointKind;
import io.trading.advstream.protocol.model.Message;
import io.trading.advstream.ratelimit.TimeSource;
import io.trading.advstream.ratelimit.TokenBucket;
import io.trading.advstream.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Long-lived WebSocket client for the public and user endpoints.
 *
 * <p>Each enabled endpoint owns a connection, a token bucket and a reconnect handler. Subscribe
 * and unsubscribe requests are validated, rate limited and sent on the endpoint their channel
 * belongs to; successful requests are recorded in a {@link SubscriptionRegistry}. When a
 * connection drops, {@link #listen(EndpointStream, MessageCallback)} hands the endpoint to a
 * background reconnect cycle that reopens it with exponential backoff and replays the recorded
 * subscriptions. The other endpoint and its frames are not held up.
 *
 * <p>Typical use:
 * <pre>{@code
 * StreamingClient client = StreamingClient.builder()
 *     .config(StreamConfig.builder().enable(EndpointKind.PUBLIC).build())
 *     .transport(new NettyTransport())
 *     .build();
 * EndpointStream stream = client.connect();
 * client.subscribe(Channel.CANDLES, List.of("BTC-USD"));
 * client.listen(stream, callback);
 * }</pre>
 */
public class StreamingClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingClient.class);

    private final StreamConfig config;
    private final SigningProvider signingProvider;
    private final Clock clock;
    private final StreamMetrics metrics;
    private final MessageParser parser;
    private final ControlMessageEncoder encoder = ControlMessageEncoder.getInstance();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    private final Map<EndpointKind, EndpointConnection> connections = new EnumMap<>(EndpointKind.class);
    private final Map<EndpointKind, ReconnectHandler> reconnectHandlers = new EnumMap<>(EndpointKind.class);
    // Stream currently fed by each endpoint; guarded by this
    private final Map<EndpointKind, EndpointStream> streams = new EnumMap<>(EndpointKind.class);
    private final List<EndpointStream> openedStreams = new CopyOnWriteArrayList<>();
    private final ExecutorService listenerExecutor;

    private volatile boolean closed = false;

    private StreamingClient(Builder builder) {
        this.config = builder.config;
        this.signingProvider = builder.signingProvider;
        this.clock = builder.clock;
        this.metrics = builder.metrics != null ? builder.metrics : new StreamMetrics(new CollectorRegistry());
        this.parser = builder.parser != null ? builder.parser : new JacksonMessageParser();

        for (EndpointKind kind : EndpointKind.values()) {
            if (!config.isEnabled(kind)) {
                continue;
            }
            TokenBucket limiter = new TokenBucket(
                kind.getDisplayName(),
                config.rateLimitTokens(),
                config.rateLimitRefill(),
                builder.timeSource
            );
            connections.put(kind, new EndpointConnection(
                kind, config.urlFor(kind), builder.transport, limiter, metrics));
            reconnectHandlers.put(kind, new ReconnectHandler(
                kind, config.maxRetries(), config.backoffMode(), builder.timeSource));
            metrics.setConnectionStatus(kind, false);
        }

        AtomicInteger threadCount = new AtomicInteger();
        this.listenerExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "stream-listener-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Opens every enabled endpoint.
     *
     * @return one stream merging the inbound frames of all enabled endpoints
     * @throws ConnectionException if an endpoint could not be opened
     */
    public EndpointStream connect() throws InterruptedException {
        return open(connections.keySet());
    }

    /**
     * Opens a single endpoint.
     *
     * @throws CallerException if the endpoint is not enabled
     * @throws ConnectionException if the endpoint could not be opened
     */
    public EndpointStream connect(EndpointKind kind) throws InterruptedException {
        if (!connections.containsKey(kind)) {
            throw CallerException.endpointDisabled(kind, null);
        }
        return open(EnumSet.of(kind));
    }

    private EndpointStream open(Set<EndpointKind> kinds) throws InterruptedException {
        ensureOpen();
        EndpointStream stream = new EndpointStream(kinds);
        openedStreams.add(stream);
        for (EndpointKind kind : kinds) {
            InboundStream inbound = connections.get(kind).open(ConnectionState.CONNECTED);
            reconnectHandlers.get(kind).reset();
            synchronized (this) {
                streams.put(kind, stream);
            }
            stream.attach(inbound);
        }
        return stream;
    }

    /**
     * Subscribes to a channel on the endpoint that serves it.
     *
     * @param channel    Channel to subscribe
     * @param productIds Products to subscribe, may be empty for channels without products
     * @throws CallerException if the endpoint is disabled or not connected
     * @throws AuthenticationException if a user request could not be signed
     * @throws ConnectionException if the request could not be written
     */
    public void subscribe(Channel channel, List<String> productIds) throws InterruptedException {
        sendControl(ControlType.SUBSCRIBE, channel, productIds, registry::add);
    }

    /**
     * Unsubscribes products from a channel. The registry entry is kept even when it becomes empty.
     */
    public void unsubscribe(Channel channel, List<String> productIds) throws InterruptedException {
        sendControl(ControlType.UNSUBSCRIBE, channel, productIds, registry::remove);
    }

    /**
     * Sends one control message. The registry is updated inside the endpoint's send section,
     * so concurrent requests on one channel leave it in the order the server received them.
     */
    private void sendControl(ControlType type, Channel channel, List<String> productIds, RegistryUpdate update)
        throws InterruptedException {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        List<String> products = productIds == null ? List.of() : List.copyOf(productIds);
        EndpointKind kind = channel.endpoint();

        EndpointConnection connection = connections.get(kind);
        if (connection == null) {
            throw CallerException.endpointDisabled(kind, channel);
        }
        if (closed || !connection.hasSession()) {
            throw CallerException.notConnected(kind);
        }

        String payload = encoder.encode(buildControlMessage(type, channel, products));
        connection.send(payload, () -> {
            update.apply(kind, channel, products);
            metrics.setActiveSubscriptions(kind, registry.size(kind));
        });
        metrics.recordControlMessageSent(kind, type);
        LOGGER.info("{}: Sent {} for {} {}", kind, type, channel, products);
    }

    private ControlMessage buildControlMessage(ControlType type, Channel channel, List<String> productIds)
        throws InterruptedException {
        if (channel.endpoint() != EndpointKind.USER) {
            return ControlMessage.unsigned(type, channel, productIds, clock.instant().getEpochSecond());
        }
        if (signingProvider == null) {
            throw new AuthenticationException("No signing provider configured for the User endpoint");
        }
        String jwt;
        try {
            jwt = signingProvider.sign(null);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new AuthenticationException("Failed to sign " + type + " request for " + channel, e);
        }
        if (jwt == null || jwt.isEmpty()) {
            throw new AuthenticationException("Signing provider returned an empty token");
        }
        return ControlMessage.signed(type, channel, productIds, jwt);
    }

    /**
     * Processes frames until the stream is closed.
     *
     * <p>Text frames are parsed and passed to the callback; unreadable frames are reported through
     * {@link MessageCallback#onError(ProtocolException)}. Close and error frames of a current
     * connection start a background reconnect of that endpoint; frames of other endpoints are
     * delivered while it runs.
     *
     * @throws ConnectionException if reconnection is disabled or exhausted
     * @throws StreamException if replaying the subscriptions after a reconnect failed otherwise
     * @throws InterruptedException if the listening thread is interrupted
     */
    public void listen(EndpointStream stream, MessageCallback callback) throws InterruptedException {
        while (true) {
            InboundFrame frame = stream.next();
            if (frame == null) {
                LOGGER.debug("Stream closed, listen loop ending");
                return;
            }
            switch (frame.type()) {
                case TEXT -> handleText(frame, callback);
                case PING, PONG -> LOGGER.trace("{}: {}", frame.endpoint(), frame.type());
                case CLOSE, ERROR -> handleDisconnect(frame);
                case RECONNECT_FAILED -> throw (RuntimeException) frame.cause();
            }
        }
    }

    private void handleText(InboundFrame frame, MessageCallback callback) {
        Message message;
        try {
            message = parser.parse(frame.text());
        } catch (ProtocolException e) {
            metrics.recordProtocolError(frame.endpoint());
            LOGGER.warn("{}: Protocol error: {}", frame.endpoint(), e.getMessage());
            callback.onError(e);
            return;
        }
        metrics.recordMessageReceived(frame.endpoint(), message.channel());
        callback.onMessage(message);
    }

    /**
     * Starts reconnecting the endpoint of a terminal frame. The cycle runs on a listener thread,
     * so frames of the other endpoint keep flowing through the listen loop meanwhile.
     */
    private void handleDisconnect(InboundFrame frame) {
        EndpointKind kind = frame.endpoint();
        EndpointConnection connection = connections.get(kind);
        if (closed || connection == null || !connection.isCurrent(frame.generation())) {
            LOGGER.debug("{}: Ignoring {} of superseded connection {}", kind, frame.describe(), frame.generation());
            return;
        }

        LOGGER.warn("{}: Connection {}", kind, frame.describe());
        metrics.recordConnectionError(kind);

        if (!config.autoReconnect() || config.maxRetries() == 0) {
            connection.markDisconnected(ConnectionState.DISCONNECTED);
            throw new ConnectionException(kind, "Connection " + frame.describe() + ", reconnect disabled", frame.cause());
        }

        if (!connection.beginReconnect()) {
            LOGGER.debug("{}: Reconnect already in progress, ignoring {}", kind, frame.describe());
            return;
        }
        try {
            listenerExecutor.execute(() -> reconnect(kind, connection));
        } catch (RejectedExecutionException e) {
            connection.markDisconnected(ConnectionState.DISCONNECTED);
            LOGGER.info("{}: Client closed before reconnect could start", kind);
        }
    }

    private void reconnect(EndpointKind kind, EndpointConnection connection) {
        InboundStream inbound;
        try {
            inbound = reconnectHandlers.get(kind).reconnect(attempt -> {
                metrics.recordReconnectAttempt(kind);
                InboundStream fresh = connection.open(ConnectionState.RECONNECTING);
                replay(kind);
                return fresh;
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failReconnect(kind, connection, new ConnectionException(kind, "Reconnect interrupted", e));
            return;
        } catch (RuntimeException e) {
            failReconnect(kind, connection, e);
            return;
        }

        if (closed) {
            connection.close();
            return;
        }
        connection.setState(ConnectionState.CONNECTED);
        EndpointStream target = streamOf(kind);
        if (target != null) {
            target.attach(inbound);
        }
    }

    /**
     * Marks the endpoint disconnected and ends the listen loop of its stream with {@code cause}.
     */
    private void failReconnect(EndpointKind kind, EndpointConnection connection, RuntimeException cause) {
        connection.markDisconnected(ConnectionState.DISCONNECTED);
        if (closed) {
            LOGGER.info("{}: Client closed during reconnect", kind);
            return;
        }
        LOGGER.error("{}: Giving up on endpoint: {}", kind, cause.getMessage());
        EndpointStream target = streamOf(kind);
        if (target != null) {
            target.offer(InboundFrame.reconnectFailed(kind, cause));
        }
    }

    private synchronized EndpointStream streamOf(EndpointKind kind) {
        return streams.get(kind);
    }

    /**
     * Re-sends the recorded subscriptions of an endpoint through the normal subscribe path.
     */
    private void replay(EndpointKind kind) throws InterruptedException {
        Map<Channel, List<String>> snapshot = registry.snapshot(kind);
        LOGGER.info("{}: Replaying {} subscription(s)", kind, snapshot.size());
        for (Map.Entry<Channel, List<String>> entry : snapshot.entrySet()) {
            if (entry.getValue().isEmpty() && entry.getKey().requiresProductIds()) {
                continue;
            }
            subscribe(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Watches completed candles of the given products on the public endpoint.
     *
     * <p>Connects the public endpoint, subscribes heartbeats (to keep the connection alive) and
     * candles, then listens on a background thread.
     *
     * @return a future that completes when the client is closed, or exceptionally with the
     *         error that ended the listen loop
     */
    public CompletableFuture<Void> watchCandles(List<String> productIds, CandleCallback callback)
        throws InterruptedException {
        EndpointStream stream = connect(EndpointKind.PUBLIC);
        subscribe(Channel.HEARTBEATS, List.of());
        subscribe(Channel.CANDLES, productIds);

        CandleAggregator aggregator = new CandleAggregator((now, productId, candle) -> {
            metrics.recordCandleCompleted(productId);
            callback.onCandle(now, productId, candle);
        }, clock, CandleAggregator.GRANULARITY_SECONDS);

        CompletableFuture<Void> done = new CompletableFuture<>();
        listenerExecutor.execute(() -> {
            try {
                listen(stream, aggregator);
                done.complete(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (closed) {
                    done.complete(null);
                } else {
                    done.completeExceptionally(e);
                }
            } catch (RuntimeException e) {
                LOGGER.error("Candle watcher stopped", e);
                done.completeExceptionally(e);
            }
        });
        return done;
    }

    /**
     * Current state of every enabled endpoint.
     */
    public Map<EndpointKind, ConnectionState> connectionStates() {
        Map<EndpointKind, ConnectionState> states = new EnumMap<>(EndpointKind.class);
        connections.forEach((kind, connection) -> states.put(kind, connection.state()));
        return Collections.unmodifiableMap(states);
    }

    /**
     * Recorded subscriptions of an endpoint.
     */
    public Map<Channel, List<String>> subscriptions(EndpointKind kind) {
        return registry.snapshot(kind);
    }

    public Set<EndpointKind> enabledEndpoints() {
        return Collections.unmodifiableSet(connections.keySet());
    }

    public boolean isEnabled(EndpointKind kind) {
        return connections.containsKey(kind);
    }

    /**
     * Rate limiter of an endpoint, or null if the endpoint is disabled.
     */
    public TokenBucket rateLimiter(EndpointKind kind) {
        EndpointConnection connection = connections.get(kind);
        return connection == null ? null : connection.limiter();
    }

    public StreamMetrics getMetrics() {
        return metrics;
    }

    private void ensureOpen() {
        if (closed) {
            throw new CallerException("Client is closed");
        }
    }

    /**
     * Ends every listen loop and closes all connections. The transport is left to its owner.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (EndpointStream stream : new ArrayList<>(openedStreams)) {
            stream.close();
        }
        connections.values().forEach(EndpointConnection::close);
        listenerExecutor.shutdownNow();
        LOGGER.info("Streaming client closed");
    }

    @FunctionalInterface
    private interface RegistryUpdate {
        void apply(EndpointKind kind, Channel channel, List<String> productIds);
    }

    /**
     * Creates a new builder for StreamingClient.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for StreamingClient.
     */
    public static class Builder {
        private StreamConfig config;
        private WebSocketTransport transport;
        private SigningProvider signingProvider;
        private TimeSource timeSource = TimeSource.SYSTEM;
        private Clock clock = Clock.systemUTC();
        private StreamMetrics metrics;
        private MessageParser parser;

        public Builder config(StreamConfig config) {
            this.config = config;
            return this;
        }

        public Builder transport(WebSocketTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder signingProvider(SigningProvider signingProvider) {
            this.signingProvider = signingProvider;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(StreamMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder parser(MessageParser parser) {
            this.parser = parser;
            return this;
        }

        public StreamingClient build() {
            if (config == null) {
                throw new IllegalStateException("config must be set");
            }
            if (transport == null) {
                throw new IllegalStateException("transport must be set");
            }
            if (timeSource == null || clock == null) {
                throw new IllegalStateException("timeSource and clock must be set");
            }
            return new StreamingClient(this);
        }
    }
}
