package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Futures balance summary of the authenticated user. Fields are kept as the raw JSON map.
 */
public record FuturesBalanceSummaryEvent(
    @JsonProperty("type") EventType type,
    @JsonProperty("fcm_balance_summary") Map<String, Object> balanceSummary
) implements Event {
}
