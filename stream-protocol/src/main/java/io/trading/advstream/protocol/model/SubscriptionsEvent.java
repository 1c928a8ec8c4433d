package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Server confirmation of the active subscriptions, keyed by channel wire name.
 */
public record SubscriptionsEvent(
    @JsonProperty("subscriptions") Map<String, List<String>> subscriptions
) implements Event {
}
