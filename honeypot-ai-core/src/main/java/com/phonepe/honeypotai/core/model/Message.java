package com.phonepe.honeypotai.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.phonepe.honeypotai.core.utils.LenientInstantDeserializer;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * A single turn of a conversation
 */
@Value
public class Message {
    Sender sender;
    String text;
    Instant timestamp;

    @Builder
    @JsonCreator
    public Message(@JsonProperty("sender") Sender sender,
                   @JsonProperty("text") String text,
                   @JsonProperty("timestamp")
                   @JsonDeserialize(using = LenientInstantDeserializer.class) Instant timestamp) {
        this.sender = sender;
        this.text = text;
        this.timestamp = Objects.requireNonNullElseGet(timestamp, Instant::now);
    }

    public static Message fromCounterpart(final String text) {
        return new Message(Sender.COUNTERPART, text, Instant.now());
    }

    public static Message fromAgent(final String text) {
        return new Message(Sender.AGENT, text, Instant.now());
    }
}
