package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The ticker event, shared by the ticker and ticker_batch channels.
 */
public record TickerEvent(
    @JsonProperty("type") EventType type,
    @JsonProperty("tickers") List<TickerUpdate> tickers
) implements Event {
}
