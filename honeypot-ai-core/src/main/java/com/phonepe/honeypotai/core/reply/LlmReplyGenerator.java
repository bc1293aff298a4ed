package com.phonepe.honeypotai.core.reply;

import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.llm.LlmCalls;
import com.phonepe.honeypotai.core.llm.LlmClient;
import com.phonepe.honeypotai.core.llm.LlmRequest;
import com.phonepe.honeypotai.core.model.ReplyContext;
import com.phonepe.honeypotai.core.prompts.HoneypotPrompts;
import com.phonepe.honeypotai.core.prompts.Transcripts;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Persona replies written by the model. Falls back to the delegate on failure or empty output.
 */
@Slf4j
public class LlmReplyGenerator implements ReplyGenerator {
    public static final int HISTORY_WINDOW = 8;
    private static final Pattern SPEAKER_PREFIX = Pattern.compile(
            "^(?:reply|response|you|me|user|victim|answer)\\s*:\\s*", Pattern.CASE_INSENSITIVE);

    private final LlmClient llmClient;
    private final HoneypotConfig config;
    private final HoneypotPrompts prompts;
    private final ReplyGenerator fallback;

    public LlmReplyGenerator(LlmClient llmClient,
                             HoneypotConfig config,
                             HoneypotPrompts prompts,
                             ReplyGenerator fallback) {
        this.llmClient = Objects.requireNonNull(llmClient);
        this.config = Objects.requireNonNull(config);
        this.prompts = Objects.requireNonNullElse(prompts, HoneypotPrompts.DEFAULT);
        this.fallback = Objects.requireNonNullElseGet(fallback, TemplateReplyGenerator::new);
    }

    @Override
    public String generate(ReplyContext context) {
        final var response = LlmCalls.call(
                llmClient,
                LlmRequest.builder()
                        .purpose("persona-reply")
                        .systemPrompt(prompts.getPersonaSystemPrompt())
                        .prompt(HoneypotPrompts.render(
                                prompts.getPersonaPrompt(),
                                Map.of("goalHint", context.getGoal().getBehaviourHint(),
                                       "history", Transcripts.history(
                                               HoneypotUtils.lastN(context.getRecentHistory(), HISTORY_WINDOW)),
                                       "message", Objects.requireNonNullElse(context.getMessage().getText(), ""))))
                        .temperature(0.7)
                        .topP(0.9)
                        .maxTokens(100)
                        .build(),
                config.getLlmTimeout());
        final var reply = response.isSuccess() ? clean(response.getContent()) : "";
        if (reply.isEmpty()) {
            log.warn("Session {}: no usable reply from model ({}), using fallback",
                     context.getSessionId(), response.getError().getMessage());
            return fallback.generate(context);
        }
        return reply;
    }

    static String clean(final String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        var text = raw.trim();
        text = SPEAKER_PREFIX.matcher(text).replaceFirst("");
        text = StringUtils.strip(text, "\"'`");
        return text.trim();
    }
}
