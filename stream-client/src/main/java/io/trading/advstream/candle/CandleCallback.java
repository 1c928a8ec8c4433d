package io.trading.advstream.candle;

import io.trading.advstream.protocol.model.Candle;

/**
 * Receives completed candles.
 */
@FunctionalInterface
public interface CandleCallback {

    /**
     * @param now       Wall-clock time in UNIX seconds, rounded down to a multiple of twice the granularity
     * @param productId Product the candle belongs to
     * @param candle    The candle that just completed
     */
    void onCandle(long now, String productId, Candle candle);
}
