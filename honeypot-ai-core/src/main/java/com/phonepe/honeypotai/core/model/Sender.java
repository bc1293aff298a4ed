package com.phonepe.honeypotai.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * Who wrote a message. COUNTERPART is the suspected fraud actor, AGENT is us.
 */
@Getter
@AllArgsConstructor
public enum Sender {
    COUNTERPART("scammer"),
    AGENT("user"),
    ;

    @JsonValue
    private final String wireName;

    @JsonCreator
    public static Sender fromValue(final String value) {
        if (null == value) {
            throw new IllegalArgumentException("Sender is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "scammer", "counterpart" -> COUNTERPART;
            case "user", "agent" -> AGENT;
            default -> throw new IllegalArgumentException("Unknown sender: " + value);
        };
    }
}
