package com.phonepe.honeypotai.core.strategy;

import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.llm.LlmCalls;
import com.phonepe.honeypotai.core.llm.LlmClient;
import com.phonepe.honeypotai.core.llm.LlmRequest;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.prompts.HoneypotPrompts;
import com.phonepe.honeypotai.core.prompts.Transcripts;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Asks the model for a YES/NO on whether the conversation is over. Undecided on failure or an unclear answer.
 */
@Slf4j
public class LlmEndDetector implements ConversationEndDetector {
    private static final int HISTORY_WINDOW = 4;

    private final LlmClient llmClient;
    private final HoneypotConfig config;
    private final HoneypotPrompts prompts;

    public LlmEndDetector(LlmClient llmClient, HoneypotConfig config, HoneypotPrompts prompts) {
        this.llmClient = Objects.requireNonNull(llmClient);
        this.config = Objects.requireNonNull(config);
        this.prompts = Objects.requireNonNullElse(prompts, HoneypotPrompts.DEFAULT);
    }

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public Optional<Boolean> isConversationOver(String text, List<Message> history) {
        final var response = LlmCalls.call(
                llmClient,
                LlmRequest.builder()
                        .purpose("end-detection")
                        .prompt(HoneypotPrompts.render(
                                prompts.getEndDetectionPrompt(),
                                Map.of("message", Objects.requireNonNullElse(text, ""),
                                       "history", Transcripts.history(HoneypotUtils.lastN(history,
                                                                                           HISTORY_WINDOW)))))
                        .temperature(0.1)
                        .topP(0.5)
                        .maxTokens(10)
                        .build(),
                config.getLlmTimeout());
        if (!response.isSuccess() || null == response.getContent()) {
            return Optional.empty();
        }
        final var answer = response.getContent().trim().toUpperCase(Locale.ROOT);
        if (answer.startsWith("YES")) {
            return Optional.of(true);
        }
        if (answer.startsWith("NO")) {
            return Optional.of(false);
        }
        log.warn("Unclear end detection answer from model: {}", response.getContent());
        return Optional.empty();
    }
}
