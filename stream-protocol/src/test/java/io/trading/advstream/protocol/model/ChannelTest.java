package io.trading.advstream.protocol.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChannelTest {

    @Test
    void testEveryChannelMapsToOneEndpoint() {
        for (Channel channel : Channel.values()) {
            EndpointKind expected = EnumSet.of(Channel.USER, Channel.FUTURES_BALANCE_SUMMARY).contains(channel)
                ? EndpointKind.USER
                : EndpointKind.PUBLIC;
            assertEquals(expected, channel.endpoint(), channel.name());
        }
    }

    @Test
    void testProductScopedChannels() {
        EnumSet<Channel> scoped = EnumSet.of(
            Channel.CANDLES, Channel.TICKER, Channel.TICKER_BATCH, Channel.LEVEL2, Channel.MARKET_TRADES);
        for (Channel channel : Channel.values()) {
            assertEquals(scoped.contains(channel), channel.requiresProductIds(), channel.name());
        }
    }

    @Test
    void testFromWireName() {
        for (Channel channel : Channel.values()) {
            assertEquals(Optional.of(channel), Channel.fromWireName(channel.wireName()));
        }
        assertEquals(Optional.of(Channel.LEVEL2), Channel.fromWireName("l2_data"));
        assertTrue(Channel.fromWireName("unknown").isEmpty());
        assertTrue(Channel.fromWireName(null).isEmpty());
    }
}
