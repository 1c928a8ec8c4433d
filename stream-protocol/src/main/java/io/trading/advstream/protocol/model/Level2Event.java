package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The level2 event containing order book changes for one product.
 */
public record Level2Event(
    @JsonProperty("type") EventType type,
    @JsonProperty("product_id") String productId,
    @JsonProperty("updates") List<Level2Update> updates
) implements Event {
}
