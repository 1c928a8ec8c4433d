package io.trading.advstream.client;

import io.trading.advstream.protocol.model.EndpointKind;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Merged inbound frames of one or more endpoints, in arrival order.
 * Returned by {@link StreamingClient#connect()} and consumed by
 * {@link StreamingClient#listen(EndpointStream, MessageCallback)}.
 */
public class EndpointStream implements AutoCloseable {

    private static final InboundFrame END_OF_STREAM =
        InboundFrame.control(EndpointKind.PUBLIC, -1, InboundFrame.FrameType.CLOSE);

    private final Set<EndpointKind> endpoints;
    private final BlockingQueue<InboundFrame> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed = false;

    EndpointStream(Set<EndpointKind> endpoints) {
        this.endpoints = Collections.unmodifiableSet(EnumSet.copyOf(endpoints));
    }

    /**
     * Endpoints feeding this stream.
     */
    public Set<EndpointKind> endpoints() {
        return endpoints;
    }

    void attach(InboundStream inbound) {
        inbound.redirectTo(this);
    }

    void offer(InboundFrame frame) {
        if (!closed) {
            queue.offer(frame);
        }
    }

    /**
     * Waits for the next frame.
     *
     * @return the next frame, or null once the stream is closed
     * @throws InterruptedException if interrupted while waiting
     */
    public InboundFrame next() throws InterruptedException {
        if (closed) {
            return null;
        }
        InboundFrame frame = queue.take();
        if (frame == END_OF_STREAM) {
            queue.offer(END_OF_STREAM);
            return null;
        }
        return frame;
    }

    /**
     * Waits up to {@code timeout} for the next frame.
     *
     * @return the next frame, or null on timeout or once the stream is closed
     */
    public InboundFrame poll(Duration timeout) throws InterruptedException {
        if (closed) {
            return null;
        }
        InboundFrame frame = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (frame == END_OF_STREAM) {
            queue.offer(END_OF_STREAM);
            return null;
        }
        return frame;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Ends the stream. Pending frames are dropped and waiting readers return null.
     */
    @Override
    public void close() {
        closed = true;
        queue.clear();
        queue.offer(END_OF_STREAM);
    }
}
