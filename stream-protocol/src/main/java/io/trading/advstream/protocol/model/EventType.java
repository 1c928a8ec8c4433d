package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Whether an event carries a full snapshot or an incremental update.
 */
public enum EventType {
    SNAPSHOT,
    UPDATE,
    UNKNOWN;

    @JsonCreator
    public static EventType fromString(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase()) {
            case "snapshot" -> SNAPSHOT;
            case "update" -> UPDATE;
            default -> UNKNOWN;
        };
    }
}
