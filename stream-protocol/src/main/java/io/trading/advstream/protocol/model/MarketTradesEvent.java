package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The market trades event.
 */
public record MarketTradesEvent(
    @JsonProperty("type") EventType type,
    @JsonProperty("trades") List<MarketTrade> trades
) implements Event {
}
