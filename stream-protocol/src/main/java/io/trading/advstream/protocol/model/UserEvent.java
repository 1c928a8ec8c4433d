package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The user event containing order updates.
 */
public record UserEvent(
    @JsonProperty("type") EventType type,
    @JsonProperty("orders") List<OrderUpdate> orders
) implements Event {
}
