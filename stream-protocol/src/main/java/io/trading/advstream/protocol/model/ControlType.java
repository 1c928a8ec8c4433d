package io.trading.advstream.protocol.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of outbound control message.
 */
public enum ControlType {
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe");

    private final String wireName;

    ControlType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
