package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A market trade as reported by the market_trades channel.
 */
public record MarketTrade(
    @JsonProperty("trade_id") String tradeId,
    @JsonProperty("product_id") String productId,
    @JsonProperty("price") BigDecimal price,
    @JsonProperty("size") BigDecimal size,
    @JsonProperty("side") Side side,
    @JsonProperty("time") String time
) {
}
