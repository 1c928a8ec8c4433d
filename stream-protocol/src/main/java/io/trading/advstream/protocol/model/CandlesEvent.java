package io.trading.advstream.protocol.model;

import java.util.List;

/**
 * The candles event containing updates to the open candle of each product.
 *
 * @param type    Snapshot or update
 * @param candles Candle updates, possibly several per product and out of order
 */
public record CandlesEvent(
    EventType type,
    List<CandleUpdate> candles
) implements Event {
    public CandlesEvent {
        candles = candles == null ? List.of() : List.copyOf(candles);
    }
}
