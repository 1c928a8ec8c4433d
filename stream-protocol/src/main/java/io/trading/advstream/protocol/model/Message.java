package io.trading.advstream.protocol.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Message received from the WebSocket containing event updates.
 *
 * @param channel     The channel the message belongs to
 * @param clientId    Client identifier assigned by the server
 * @param timestamp   Server timestamp (RFC 3339)
 * @param sequenceNum Per-connection sequence number
 * @param events      Channel-specific events
 */
public record Message(
    Channel channel,
    String clientId,
    String timestamp,
    long sequenceNum,
    List<Event> events
) {
    public Message {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        events = events == null ? List.of() : List.copyOf(events);
    }

    /**
     * Flattens every candle update carried by this message, in wire order.
     */
    public List<CandleUpdate> candleUpdates() {
        List<CandleUpdate> updates = new ArrayList<>();
        for (Event event : events) {
            if (event instanceof CandlesEvent candles) {
                updates.addAll(candles.candles());
            }
        }
        return updates;
    }
}
