package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A single price level change in the order book.
 */
public record Level2Update(
    @JsonProperty("side") Level2Side side,
    @JsonProperty("event_time") String eventTime,
    @JsonProperty("price_level") BigDecimal priceLevel,
    @JsonProperty("new_quantity") BigDecimal newQuantity
) {
}
