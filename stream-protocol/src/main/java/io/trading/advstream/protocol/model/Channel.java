package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * WebSocket channels that can be subscribed to.
 * Each channel belongs to exactly one {@link EndpointKind} and carries one event shape.
 */
public enum Channel {
    /** Sends all products and currencies on a preset interval. */
    STATUS("status", EndpointKind.PUBLIC, false, StatusEvent.class),
    /** Updates every second, grouped into five minute buckets. */
    CANDLES("candles", EndpointKind.PUBLIC, true, CandlesEvent.class),
    /** Real-time price updates every time a match happens. */
    TICKER("ticker", EndpointKind.PUBLIC, true, TickerEvent.class),
    /** Price updates batched every 5000 milliseconds. */
    TICKER_BATCH("ticker_batch", EndpointKind.PUBLIC, true, TickerEvent.class),
    /** All order book updates. */
    LEVEL2("level2", EndpointKind.PUBLIC, true, Level2Event.class),
    /** Real-time updates every time a market trade happens. */
    MARKET_TRADES("market_trades", EndpointKind.PUBLIC, true, MarketTradesEvent.class),
    /** Server pings that keep idle connections open. */
    HEARTBEATS("heartbeats", EndpointKind.PUBLIC, false, HeartbeatsEvent.class),
    /** Order updates for the authenticated user. */
    USER("user", EndpointKind.USER, false, UserEvent.class),
    /** Futures balance changes for the authenticated user. */
    FUTURES_BALANCE_SUMMARY("futures_balance_summary", EndpointKind.USER, false, FuturesBalanceSummaryEvent.class),
    /** Confirmation of the currently active subscriptions. */
    SUBSCRIPTIONS("subscriptions", EndpointKind.PUBLIC, false, SubscriptionsEvent.class);

    private static final Map<String, Channel> BY_WIRE_NAME = new HashMap<>();

    static {
        for (Channel channel : values()) {
            BY_WIRE_NAME.put(channel.wireName, channel);
        }
        // Level2 updates arrive tagged with their data channel name
        BY_WIRE_NAME.put("l2_data", LEVEL2);
    }

    private final String wireName;
    private final EndpointKind endpoint;
    private final boolean requiresProductIds;
    private final Class<? extends Event> eventType;

    Channel(String wireName, EndpointKind endpoint, boolean requiresProductIds, Class<? extends Event> eventType) {
        this.wireName = wireName;
        this.endpoint = endpoint;
        this.requiresProductIds = requiresProductIds;
        this.eventType = eventType;
    }

    /**
     * Serialized form used in control messages and inbound envelopes.
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * The endpoint this channel is served on.
     */
    public EndpointKind endpoint() {
        return endpoint;
    }

    /**
     * Whether a subscription to this channel is meaningless without product ids.
     */
    public boolean requiresProductIds() {
        return requiresProductIds;
    }

    /**
     * Event record type carried in the {@code events} array of this channel.
     */
    public Class<? extends Event> eventType() {
        return eventType;
    }

    /**
     * Resolves a channel from its serialized name, accepting inbound aliases.
     */
    public static Optional<Channel> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(value));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
