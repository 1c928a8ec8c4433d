package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The heartbeats event containing the server time and a heartbeat counter.
 */
public record HeartbeatsEvent(
    @JsonProperty("current_time") String currentTime,
    @JsonProperty("heartbeat_counter") long heartbeatCounter
) implements Event {
}
