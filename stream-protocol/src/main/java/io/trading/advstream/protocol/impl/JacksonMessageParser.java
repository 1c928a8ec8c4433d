package io.trading.advstream.protocol.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.advstream.protocol.api.MessageParser;
import io.trading.advstream.protocol.api.ProtocolException;
import io.trading.advstream.protocol.model.Candle;
import io.trading.advstream.protocol.model.CandleUpdate;
import io.trading.advstream.protocol.model.CandlesEvent;
import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.Event;
import io.trading.advstream.protocol.model.EventType;
import io.trading.advstream.protocol.model.Message;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Jackson tree-model parser for inbound frames.
 *
 * The envelope is read first; {@code channel} selects the event record type, so each
 * frame is resolved to exactly one event shape. Candle entries are mapped by hand because
 * the candle fields are flattened next to {@code product_id} and numbers arrive as strings.
 */
public class JacksonMessageParser implements MessageParser {

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_MESSAGE = "message";
    private static final String FIELD_CHANNEL = "channel";
    private static final String FIELD_CLIENT_ID = "client_id";
    private static final String FIELD_TIMESTAMP = "timestamp";
    private static final String FIELD_SEQUENCE_NUM = "sequence_num";
    private static final String FIELD_EVENTS = "events";
    private static final String FIELD_CANDLES = "candles";
    private static final String FIELD_PRODUCT_ID = "product_id";
    private static final String FIELD_START = "start";
    private static final String FIELD_OPEN = "open";
    private static final String FIELD_HIGH = "high";
    private static final String FIELD_LOW = "low";
    private static final String FIELD_CLOSE = "close";
    private static final String FIELD_VOLUME = "volume";

    private static final String TYPE_ERROR = "error";

    private final ObjectMapper objectMapper;

    public JacksonMessageParser() {
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
    }

    @Override
    public Message parse(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new ProtocolException("Empty frame");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON frame: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Frame is not a JSON object");
        }

        if (TYPE_ERROR.equals(root.path(FIELD_TYPE).asText())) {
            throw ProtocolException.serverError(root.path(FIELD_MESSAGE).asText("unknown"));
        }

        String channelName = root.path(FIELD_CHANNEL).asText(null);
        if (channelName == null) {
            throw new ProtocolException("Frame has no channel");
        }
        Channel channel = Channel.fromWireName(channelName)
            .orElseThrow(() -> new ProtocolException("Unknown channel: " + channelName));

        JsonNode eventsNode = root.get(FIELD_EVENTS);
        if (eventsNode == null || !eventsNode.isArray()) {
            throw new ProtocolException("Frame on channel " + channelName + " has no events array");
        }

        List<Event> events = new ArrayList<>(eventsNode.size());
        for (JsonNode eventNode : eventsNode) {
            events.add(parseEvent(channel, eventNode));
        }

        return new Message(
            channel,
            root.path(FIELD_CLIENT_ID).asText(""),
            root.path(FIELD_TIMESTAMP).asText(""),
            root.path(FIELD_SEQUENCE_NUM).asLong(0),
            events
        );
    }

    private Event parseEvent(Channel channel, JsonNode eventNode) {
        if (channel == Channel.CANDLES) {
            return parseCandlesEvent(eventNode);
        }
        try {
            return objectMapper.treeToValue(eventNode, channel.eventType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ProtocolException("Invalid " + channel + " event: " + e.getMessage(), e);
        }
    }

    private CandlesEvent parseCandlesEvent(JsonNode eventNode) {
        JsonNode candlesNode = eventNode.get(FIELD_CANDLES);
        if (candlesNode == null || !candlesNode.isArray()) {
            throw new ProtocolException("Candles event has no candles array");
        }

        List<CandleUpdate> updates = new ArrayList<>(candlesNode.size());
        for (JsonNode candleNode : candlesNode) {
            Candle candle = new Candle(
                requireLong(candleNode, FIELD_START),
                requireDecimal(candleNode, FIELD_OPEN),
                requireDecimal(candleNode, FIELD_HIGH),
                requireDecimal(candleNode, FIELD_LOW),
                requireDecimal(candleNode, FIELD_CLOSE),
                requireDecimal(candleNode, FIELD_VOLUME)
            );
            updates.add(new CandleUpdate(requireText(candleNode, FIELD_PRODUCT_ID), candle));
        }
        return new CandlesEvent(EventType.fromString(eventNode.path(FIELD_TYPE).asText(null)), updates);
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new ProtocolException("Candle field '" + field + "' is missing");
        }
        return value.asText();
    }

    private static long requireLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value != null && value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value != null && value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ProtocolException("Candle field '" + field + "' is not an integer: " + value.asText(), e);
            }
        }
        throw new ProtocolException("Candle field '" + field + "' is missing");
    }

    private static BigDecimal requireDecimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value != null && value.isNumber()) {
            return value.decimalValue();
        }
        if (value != null && value.isTextual()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ProtocolException("Candle field '" + field + "' is not a number: " + value.asText(), e);
            }
        }
        throw new ProtocolException("Candle field '" + field + "' is missing");
    }
}
