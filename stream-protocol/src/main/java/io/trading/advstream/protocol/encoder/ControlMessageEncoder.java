package io.trading.advstream.protocol.encoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.advstream.protocol.api.ProtocolException;
import io.trading.advstream.protocol.model.ControlMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON encoder for outbound subscribe/unsubscribe requests.
 * Thread-safe and reusable.
 */
public class ControlMessageEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ControlMessageEncoder.class);

    private static final ControlMessageEncoder INSTANCE = new ControlMessageEncoder();

    private final ObjectMapper objectMapper;

    private ControlMessageEncoder() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Gets the singleton instance.
     */
    public static ControlMessageEncoder getInstance() {
        return INSTANCE;
    }

    /**
     * Serializes a control message to its JSON text frame.
     */
    public String encode(ControlMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to encode {} request for {}: {}", message.type(), message.channel(), e.getMessage(), e);
            throw new ProtocolException("Failed to encode control message", e);
        }
    }
}
