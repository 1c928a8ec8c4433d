package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The status event containing product updates.
 */
public record StatusEvent(
    @JsonProperty("type") EventType type,
    @JsonProperty("products") List<ProductStatus> products
) implements Event {
}
