package com.phonepe.honeypotai.core.model;

import lombok.Value;

/**
 * Per-turn engagement decision
 */
@Value
public class StrategyDecision {
    boolean shouldEngage;
    ConversationGoal goal;
    String reasoning;

    public static StrategyDecision engage(ConversationGoal goal, String reasoning) {
        return new StrategyDecision(true, goal, reasoning);
    }

    public static StrategyDecision disengage(String reasoning) {
        return new StrategyDecision(false, ConversationGoal.WRAP_UP, reasoning);
    }
}
