package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Trade or order side (buy or sell).
 */
public enum Side {
    BUY,
    SELL,
    UNKNOWN;

    @JsonCreator
    public static Side fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase()) {
            case "buy" -> BUY;
            case "sell" -> SELL;
            default -> UNKNOWN;
        };
    }
}
