package io.trading.advstream.protocol.model;

/**
 * Candle snapshot for one product, as carried by the candles channel.
 *
 * @param productId Product identifier (e.g., "BTC-USD")
 * @param candle    Current state of the product's candle
 */
public record CandleUpdate(
    String productId,
    Candle candle
) {
    public CandleUpdate {
        if (productId == null || productId.isEmpty()) {
            throw new IllegalArgumentException("productId cannot be null or empty");
        }
        if (candle == null) {
            throw new IllegalArgumentException("candle cannot be null");
        }
    }
}
