package com.phonepe.honeypotai.core.strategy;

import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.model.ConversationGoal;
import com.phonepe.honeypotai.core.model.StrategyDecision;
import com.phonepe.honeypotai.core.session.Session;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Picks the goal of the next reply and decides when to stop engaging
 */
@Slf4j
public class StrategyPlanner {
    /** Requests and threats that mean the counterpart is still pushing, whatever else they say */
    public static final List<String> ACTIVE_ASK_KEYWORDS = List.of(
            "verify", "verify immediately", "blocked", "suspended", "share", "send", "provide", "click", "link",
            "upi", "account", "urgent", "immediately", "now", "asap", "required", "must", "need to");

    private final HoneypotConfig config;
    private final ConversationEndDetector llmEndDetector;
    private final ConversationEndDetector keywordEndDetector;

    public StrategyPlanner(HoneypotConfig config, ConversationEndDetector llmEndDetector) {
        this(config, llmEndDetector, new KeywordEndDetector(config.getConversationEndKeywords()));
    }

    public StrategyPlanner(HoneypotConfig config,
                           ConversationEndDetector llmEndDetector,
                           ConversationEndDetector keywordEndDetector) {
        this.config = Objects.requireNonNull(config);
        this.llmEndDetector = config.isLlmEndDetectionEnabled() ? llmEndDetector : null;
        this.keywordEndDetector = Objects.requireNonNull(keywordEndDetector);
    }

    public StrategyDecision decide(final Session session, final String currentText) {
        final var text = Objects.requireNonNullElse(currentText, "").toLowerCase(Locale.ROOT);
        final var exchanged = session.getMessagesExchanged();
        if (exchanged >= config.getMaxMessagesPerSession()) {
            return logged(session, StrategyDecision.disengage("Maximum messages per session reached"));
        }
        if (!session.isScamDetected()) {
            return logged(session, StrategyDecision.disengage("No scam detected"));
        }
        final var goal = selectGoal(session, text);
        if (goal == ConversationGoal.WRAP_UP && exchanged > 1) {
            final var ending = conversationEnding(session, currentText);
            if (null != ending) {
                return logged(session, StrategyDecision.disengage(ending));
            }
        }
        return logged(session, StrategyDecision.engage(goal, reasoning(goal, text)));
    }

    private ConversationGoal selectGoal(Session session, String text) {
        final var exchanged = session.getMessagesExchanged();
        final var hasIntelligence = session.getIntelligence().hasAny();
        if (!hasIntelligence || exchanged < config.getMinMessagesForReport()) {
            if (text.contains("upi")) {
                return ConversationGoal.CLARIFY;
            }
            if (text.contains("link") || text.contains("click") || text.contains("verify")) {
                return ConversationGoal.CLARIFY;
            }
            if (text.contains("urgent") || text.contains("immediately")) {
                return ConversationGoal.DELAY;
            }
            return ConversationGoal.CONTINUE;
        }
        if (exchanged >= 2 && (text.contains("upi") || text.contains("send"))) {
            return ConversationGoal.ESCALATE;
        }
        if (exchanged < config.getMinMessagesForReport()) {
            return text.contains("upi") || text.contains("account")
                   ? ConversationGoal.ESCALATE
                   : ConversationGoal.CONTINUE;
        }
        return ConversationGoal.WRAP_UP;
    }

    /**
     * @return reason for ending, or null if the conversation should go on
     */
    private String conversationEnding(Session session, String currentText) {
        if (hasActiveAsk(currentText)) {
            log.debug("Session {}: counterpart is still asking for something, not ending", session.getId());
            return null;
        }
        final var history = session.getHistory();
        if (null != llmEndDetector) {
            final var llmDecision = llmEndDetector.isConversationOver(currentText, history);
            if (llmDecision.isPresent()) {
                return llmDecision.get() ? "LLM detected conversation should end" : null;
            }
            log.warn("Session {}: model end detection unavailable, using keywords", session.getId());
        }
        return keywordEndDetector.isConversationOver(currentText, history).orElse(false)
               ? "Static keywords detected conversation should end"
               : null;
    }

    public static boolean hasActiveAsk(final String text) {
        if (null == text) {
            return false;
        }
        final var lower = text.toLowerCase(Locale.ROOT);
        return ACTIVE_ASK_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private static String reasoning(ConversationGoal goal, String text) {
        return switch (goal) {
            case CLARIFY -> {
                if (text.contains("upi")) {
                    yield "Need to extract UPI ID - asking clarifying questions to delay";
                }
                if (text.contains("link") || text.contains("click")) {
                    yield "Phishing link detected - asking for more information";
                }
                yield "Need more intelligence - asking clarifying questions";
            }
            case DELAY -> "Creating delay to extract more intelligence while maintaining engagement";
            case ESCALATE -> "Showing increased concern to draw out payment details";
            case CONTINUE -> "Continuing normal engagement to extract intelligence";
            case WRAP_UP -> "Sufficient intelligence gathered or conversation should end";
        };
    }

    private static StrategyDecision logged(Session session, StrategyDecision decision) {
        log.info("Session {}: engage={}, goal={}, reason={}",
                 session.getId(), decision.isShouldEngage(), decision.getGoal(), decision.getReasoning());
        return decision;
    }
}
