package io.trading.advstream.client;

import io.trading.advstream.protocol.model.EndpointKind;
import io.trading.advstream.transport.FrameListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Inbound side of one connection generation.
 *
 * Frames are buffered until the stream is attached to an {@link EndpointStream}; from then on
 * they are forwarded directly. Attaching drains the buffer first, so frame order is kept.
 */
class InboundStream implements FrameListener {

    private final EndpointKind endpoint;
    private final long generation;

    private final List<InboundFrame> pending = new ArrayList<>();
    private EndpointStream target;

    InboundStream(EndpointKind endpoint, long generation) {
        this.endpoint = endpoint;
        this.generation = generation;
    }

    EndpointKind endpoint() {
        return endpoint;
    }

    long generation() {
        return generation;
    }

    /**
     * Forwards buffered and future frames to the given stream.
     */
    synchronized void redirectTo(EndpointStream stream) {
        for (InboundFrame frame : pending) {
            stream.offer(frame);
        }
        pending.clear();
        target = stream;
    }

    synchronized void push(InboundFrame frame) {
        if (target != null) {
            target.offer(frame);
        } else {
            pending.add(frame);
        }
    }

    @Override
    public void onText(String text) {
        push(InboundFrame.text(endpoint, generation, text));
    }

    @Override
    public void onPing() {
        push(InboundFrame.control(endpoint, generation, InboundFrame.FrameType.PING));
    }

    @Override
    public void onPong() {
        push(InboundFrame.control(endpoint, generation, InboundFrame.FrameType.PONG));
    }

    @Override
    public void onClose(int statusCode, String reason) {
        push(InboundFrame.close(endpoint, generation, statusCode, reason));
    }

    @Override
    public void onError(Throwable cause) {
        push(InboundFrame.error(endpoint, generation, cause));
    }
}
