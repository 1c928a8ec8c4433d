package io.trading.advstream.protocol.encoder;

import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.ControlMessage;
import io.trading.advstream.protocol.model.ControlType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlMessageEncoderTest {

    private final ControlMessageEncoder encoder = ControlMessageEncoder.getInstance();

    @Test
    void testEncodePublicSubscribe() {
        ControlMessage message = ControlMessage.unsigned(
            ControlType.SUBSCRIBE, Channel.CANDLES, List.of("BTC-USD", "ETH-USD"), 1700000000L);

        assertEquals(
            "{\"type\":\"subscribe\",\"product_ids\":[\"BTC-USD\",\"ETH-USD\"],\"channel\":\"candles\",\"timestamp\":\"1700000000\"}",
            encoder.encode(message)
        );
    }

    @Test
    void testEncodeUserUnsubscribeWithJwt() {
        ControlMessage message = ControlMessage.signed(ControlType.UNSUBSCRIBE, Channel.USER, List.of(), "token-1");

        assertEquals(
            "{\"type\":\"unsubscribe\",\"product_ids\":[],\"channel\":\"user\",\"jwt\":\"token-1\"}",
            encoder.encode(message)
        );
    }

    @Test
    void testTimestampAndJwtAreExclusive() {
        assertThrows(IllegalArgumentException.class,
            () -> new ControlMessage(ControlType.SUBSCRIBE, List.of(), Channel.STATUS, "1", "jwt"));
        assertThrows(IllegalArgumentException.class,
            () -> new ControlMessage(ControlType.SUBSCRIBE, List.of(), Channel.STATUS, null, null));
    }
}
