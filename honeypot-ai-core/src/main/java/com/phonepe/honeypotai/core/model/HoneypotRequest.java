package com.phonepe.honeypotai.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * An inbound message for a session along with the history known to the caller
 */
@Value
public class HoneypotRequest {
    String sessionId;
    Message message;
    List<Message> conversationHistory;
    RequestMetadata metadata;

    @Builder
    @JsonCreator
    public HoneypotRequest(@JsonProperty("sessionId") String sessionId,
                           @JsonProperty("message") Message message,
                           @JsonProperty("conversationHistory") List<Message> conversationHistory,
                           @JsonProperty("metadata") RequestMetadata metadata) {
        this.sessionId = sessionId;
        this.message = message;
        this.conversationHistory = Objects.requireNonNullElse(conversationHistory, List.of());
        this.metadata = metadata;
    }
}
