package com.phonepe.honeypotai.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Everything a reply generator is allowed to see for one turn
 */
@Value
@Builder
public class ReplyContext {
    @NonNull
    String sessionId;
    @NonNull
    ConversationGoal goal;
    @NonNull
    Message message;
    @NonNull
    @Builder.Default
    List<Message> recentHistory = List.of();
    @NonNull
    @Builder.Default
    ExtractedIntelligence intelligence = ExtractedIntelligence.empty();
}
