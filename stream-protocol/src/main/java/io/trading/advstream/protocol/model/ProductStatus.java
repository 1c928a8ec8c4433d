package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Product description pushed by the status channel.
 */
public record ProductStatus(
    @JsonProperty("product_type") String productType,
    @JsonProperty("id") String id,
    @JsonProperty("base_currency") String baseCurrency,
    @JsonProperty("quote_currency") String quoteCurrency,
    @JsonProperty("base_increment") BigDecimal baseIncrement,
    @JsonProperty("quote_increment") BigDecimal quoteIncrement,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("status") String status,
    @JsonProperty("status_message") String statusMessage,
    @JsonProperty("min_market_funds") BigDecimal minMarketFunds
) {
}
