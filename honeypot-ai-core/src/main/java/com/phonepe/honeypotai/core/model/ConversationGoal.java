package com.phonepe.honeypotai.core.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What the next reply should try to achieve. The hint is handed to the persona when generating a reply.
 */
@Getter
@AllArgsConstructor
public enum ConversationGoal {
    CLARIFY("Ask clarifying questions. Act confused about what they want and ask them to explain it step by step."),
    DELAY("Stall politely. Say you are busy or need a few minutes, but stay interested and keep them talking."),
    ESCALATE("Sound worried about the consequences they describe and ask exactly what you need to do to fix it."),
    CONTINUE("Keep the conversation going naturally and ask for a few more details."),
    WRAP_UP("Politely end the conversation, for example by saying you will check with your bank directly."),
    ;

    private final String behaviourHint;
}
