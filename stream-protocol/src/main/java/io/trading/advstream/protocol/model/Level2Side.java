package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Order book side of a level2 update.
 */
public enum Level2Side {
    BID,
    OFFER,
    UNKNOWN;

    @JsonCreator
    public static Level2Side fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase()) {
            case "bid" -> BID;
            case "offer", "ask" -> OFFER;
            default -> UNKNOWN;
        };
    }
}
