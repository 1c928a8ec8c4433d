package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Subscribe or unsubscribe request sent to an endpoint.
 * Public requests carry a {@code timestamp}, user requests a {@code jwt}; exactly one is set.
 *
 * @param type       Subscribing or unsubscribing
 * @param productIds Product ids to (un)subscribe, may be empty
 * @param channel    Channel to (un)subscribe
 * @param timestamp  UNIX seconds, public requests only
 * @param jwt        Bearer token, user requests only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "product_ids", "channel", "timestamp", "jwt"})
public record ControlMessage(
    @JsonProperty("type") ControlType type,
    @JsonProperty("product_ids") List<String> productIds,
    @JsonProperty("channel") Channel channel,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("jwt") String jwt
) {
    public ControlMessage {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if ((timestamp == null) == (jwt == null)) {
            throw new IllegalArgumentException("exactly one of timestamp or jwt must be set");
        }
        productIds = productIds == null ? List.of() : List.copyOf(productIds);
    }

    /**
     * Creates a request for the public endpoint.
     */
    public static ControlMessage unsigned(ControlType type, Channel channel, List<String> productIds, long epochSeconds) {
        return new ControlMessage(type, productIds, channel, Long.toString(epochSeconds), null);
    }

    /**
     * Creates a request for the user endpoint.
     */
    public static ControlMessage signed(ControlType type, Channel channel, List<String> productIds, String jwt) {
        return new ControlMessage(type, productIds, channel, null, jwt);
    }
}
