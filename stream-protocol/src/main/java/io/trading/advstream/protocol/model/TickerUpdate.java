package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Ticker state of one product.
 */
public record TickerUpdate(
    @JsonProperty("type") String type,
    @JsonProperty("product_id") String productId,
    @JsonProperty("price") BigDecimal price,
    @JsonProperty("volume_24_h") BigDecimal volume24h,
    @JsonProperty("low_24_h") BigDecimal low24h,
    @JsonProperty("high_24_h") BigDecimal high24h,
    @JsonProperty("low_52_w") BigDecimal low52w,
    @JsonProperty("high_52_w") BigDecimal high52w,
    @JsonProperty("price_percent_chg_24_h") BigDecimal pricePercentChange24h
) {
}
