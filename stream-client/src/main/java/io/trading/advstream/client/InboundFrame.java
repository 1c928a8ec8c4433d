package io.trading.advstream.client;

import io.trading.advstream.protocol.model.EndpointKind;

/**
 * One frame received on an endpoint connection, tagged with the connection it came from.
 *
 * @param endpoint   Endpoint the frame arrived on
 * @param generation Connection generation; bumped each time the endpoint is (re)opened
 * @param type       Frame classification
 * @param text       Payload of text frames, close reason of close frames, otherwise null
 * @param statusCode Close status of close frames, otherwise 0
 * @param cause      Failure of error and reconnect-failed frames, otherwise null
 */
public record InboundFrame(
    EndpointKind endpoint,
    long generation,
    FrameType type,
    String text,
    int statusCode,
    Throwable cause
) {

    public enum FrameType {
        TEXT,
        PING,
        PONG,
        CLOSE,
        ERROR,
        /** Posted by the client when reconnecting the endpoint failed for good. */
        RECONNECT_FAILED
    }

    public static InboundFrame text(EndpointKind endpoint, long generation, String text) {
        return new InboundFrame(endpoint, generation, FrameType.TEXT, text, 0, null);
    }

    public static InboundFrame control(EndpointKind endpoint, long generation, FrameType type) {
        return new InboundFrame(endpoint, generation, type, null, 0, null);
    }

    public static InboundFrame close(EndpointKind endpoint, long generation, int statusCode, String reason) {
        return new InboundFrame(endpoint, generation, FrameType.CLOSE, reason, statusCode, null);
    }

    public static InboundFrame error(EndpointKind endpoint, long generation, Throwable cause) {
        return new InboundFrame(endpoint, generation, FrameType.ERROR, null, 0, cause);
    }

    static InboundFrame reconnectFailed(EndpointKind endpoint, RuntimeException cause) {
        return new InboundFrame(endpoint, -1, FrameType.RECONNECT_FAILED, null, 0, cause);
    }

    /**
     * Whether this frame ends its connection.
     */
    public boolean isTerminal() {
        return type == FrameType.CLOSE || type == FrameType.ERROR || type == FrameType.RECONNECT_FAILED;
    }

    /**
     * Human-readable reason for a terminal frame.
     */
    public String describe() {
        return switch (type) {
            case CLOSE -> "closed (" + statusCode + (text == null || text.isEmpty() ? "" : " " + text) + ")";
            case ERROR -> "error (" + (cause == null ? "unknown" : cause.getMessage()) + ")";
            case RECONNECT_FAILED -> "reconnect failed (" + cause.getMessage() + ")";
            default -> type.name().toLowerCase();
        };
    }
}
