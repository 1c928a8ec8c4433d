package io.trading.advstream.client;

import io.trading.advstream.metrics.StreamMetrics;
import io.trading.advstream.protocol.model.EndpointKind;
import io.trading.advstream.ratelimit.TokenBucket;
import io.trading.advstream.transport.TransportSession;
import io.trading.advstream.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Connection state of one endpoint: the outbound session, its rate limiter and the
 * current connection generation.
 *
 * The session is guarded by a fair lock. Senders hold it across token acquisition and the
 * write, so messages reach the transport in the order their tokens were granted.
 */
class EndpointConnection implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EndpointConnection.class);

    private final EndpointKind kind;
    private final URI uri;
    private final WebSocketTransport transport;
    private final TokenBucket limiter;
    private final StreamMetrics metrics;

    private final ReentrantLock sinkLock = new ReentrantLock(true);
    private final AtomicLong generation = new AtomicLong();

    // Written under sinkLock, except plain state updates through setState
    private volatile TransportSession session;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    EndpointConnection(
        EndpointKind kind,
        URI uri,
        WebSocketTransport transport,
        TokenBucket limiter,
        StreamMetrics metrics
    ) {
        this.kind = kind;
        this.uri = uri;
        this.transport = transport;
        this.limiter = limiter;
        this.metrics = metrics;
    }

    EndpointKind kind() {
        return kind;
    }

    TokenBucket limiter() {
        return limiter;
    }

    /**
     * Opens a new session, replacing and closing any previous one.
     *
     * @param next State once the session is open; a reconnect stays {@code RECONNECTING}
     *             until its subscriptions are replayed
     * @return the inbound side of the new session, not yet attached to a stream
     * @throws ConnectionException if the transport could not connect
     */
    InboundStream open(ConnectionState next) throws InterruptedException {
        long gen = generation.incrementAndGet();
        InboundStream inbound = new InboundStream(kind, gen);

        TransportSession fresh;
        try {
            fresh = transport.open(uri, inbound);
        } catch (IOException e) {
            metrics.recordConnectionError(kind);
            throw new ConnectionException(kind, "Failed to connect to " + uri, e);
        }

        TransportSession previous;
        sinkLock.lock();
        try {
            previous = session;
            session = fresh;
        } finally {
            sinkLock.unlock();
        }
        if (previous != null) {
            previous.close();
        }

        setState(next);
        LOGGER.info("{}: Connected to {} (generation {})", kind, uri, gen);
        return inbound;
    }

    /**
     * Takes one rate-limiter token and sends the payload. {@code onSent} runs after a
     * successful write while the sink is still held, so its effects follow wire order.
     *
     * @throws CallerException if there is no open session
     * @throws ConnectionException if the write failed
     */
    void send(String payload, Runnable onSent) throws InterruptedException {
        sinkLock.lockInterruptibly();
        try {
            TransportSession current = session;
            if (current == null) {
                throw CallerException.notConnected(kind);
            }
            limiter.consume();
            try {
                current.send(payload);
            } catch (IOException e) {
                metrics.recordConnectionError(kind);
                throw new ConnectionException(kind, "Failed to send control message", e);
            }
            onSent.run();
        } finally {
            sinkLock.unlock();
        }
    }

    /**
     * Whether an outbound session is available.
     */
    boolean hasSession() {
        return session != null;
    }

    boolean isCurrent(long gen) {
        return generation.get() == gen;
    }

    /**
     * Drops the current session and moves to {@code next}.
     */
    void markDisconnected(ConnectionState next) {
        TransportSession previous;
        sinkLock.lock();
        try {
            previous = session;
            session = null;
            state = next;
        } finally {
            sinkLock.unlock();
        }
        if (previous != null) {
            previous.close();
        }
        metrics.setConnectionStatus(kind, false);
    }

    /**
     * Drops the current session and moves to {@code RECONNECTING}, unless a reconnect is
     * already running.
     *
     * @return false if the endpoint was already reconnecting
     */
    boolean beginReconnect() {
        TransportSession previous;
        sinkLock.lock();
        try {
            if (state == ConnectionState.RECONNECTING) {
                return false;
            }
            previous = session;
            session = null;
            state = ConnectionState.RECONNECTING;
        } finally {
            sinkLock.unlock();
        }
        if (previous != null) {
            previous.close();
        }
        metrics.setConnectionStatus(kind, false);
        return true;
    }

    void setState(ConnectionState next) {
        state = next;
        metrics.setConnectionStatus(kind, next == ConnectionState.CONNECTED);
    }

    ConnectionState state() {
        return state;
    }

    @Override
    public void close() {
        // Invalidate in-flight frames of the closed session
        generation.incrementAndGet();
        markDisconnected(ConnectionState.DISCONNECTED);
    }
}
