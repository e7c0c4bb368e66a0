package com.chatrelay.server.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of envelope understood by the relay. Wire values are lower case.
 */
public enum EnvelopeType {
    JOIN("join"),
    LEAVE("leave"),
    MSG("msg"),
    PM("pm"),
    TYPING("typing"),
    STOP_TYPING("stop_typing"),
    SYS("sys");

    private final String wireName;

    EnvelopeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Resolves a wire value. Only the exact lower-case names match; ordinals,
     * digit strings and anything else resolve to {@code null}.
     */
    @JsonCreator
    public static EnvelopeType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (EnvelopeType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
