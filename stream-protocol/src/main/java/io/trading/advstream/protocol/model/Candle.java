package io.trading.advstream.protocol.model;

import java.math.BigDecimal;

/**
 * OHLCV summary of one time bucket.
 *
 * @param start  Bucket start time in UNIX seconds
 * @param open   Opening price (first trade) in the bucket
 * @param high   Highest price during the bucket
 * @param low    Lowest price during the bucket
 * @param close  Closing price (last trade) in the bucket
 * @param volume Volume traded during the bucket
 */
public record Candle(
    long start,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume
) {
    public Candle {
        if (open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("prices cannot be null");
        }
        if (volume == null) {
            throw new IllegalArgumentException("volume cannot be null");
        }
    }
}
