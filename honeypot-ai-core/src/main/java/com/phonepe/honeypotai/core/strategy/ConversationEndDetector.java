package com.phonepe.honeypotai.core.strategy;

import com.phonepe.honeypotai.core.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether the counterpart is closing the conversation
 */
public interface ConversationEndDetector {
    String name();

    /**
     * @return the decision, or empty if this detector could not decide
     */
    Optional<Boolean> isConversationOver(final String text, final List<Message> history);
}
