package com.phonepe.honeypotai.core.detection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.errors.ErrorType;
import com.phonepe.honeypotai.core.errors.HoneypotError;
import com.phonepe.honeypotai.core.extraction.IntelligenceExtractor;
import com.phonepe.honeypotai.core.llm.LlmCalls;
import com.phonepe.honeypotai.core.llm.LlmClient;
import com.phonepe.honeypotai.core.llm.LlmRequest;
import com.phonepe.honeypotai.core.model.DetectionMethod;
import com.phonepe.honeypotai.core.model.DetectionVerdict;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.prompts.HoneypotPrompts;
import com.phonepe.honeypotai.core.prompts.Transcripts;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import com.phonepe.honeypotai.core.utils.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Asks the model to classify a message. Any malformed output or failed call is reported as an error so that the
 * caller can fall back to rules.
 */
@Slf4j
public class LlmClassifier implements ScamClassifier {
    public static final int HISTORY_WINDOW = 3;
    public static final int MAX_REASON_LENGTH = 200;
    private static final JsonNode OUTPUT_SCHEMA = JsonUtils.schema(ClassificationOutput.class);

    private final LlmClient llmClient;
    private final HoneypotConfig config;
    private final HoneypotPrompts prompts;
    private final IntelligenceExtractor extractor;
    private final ObjectMapper mapper;

    public LlmClassifier(LlmClient llmClient,
                         HoneypotConfig config,
                         HoneypotPrompts prompts,
                         IntelligenceExtractor extractor,
                         ObjectMapper mapper) {
        this.llmClient = Objects.requireNonNull(llmClient);
        this.config = Objects.requireNonNull(config);
        this.prompts = Objects.requireNonNullElse(prompts, HoneypotPrompts.DEFAULT);
        this.extractor = Objects.requireNonNull(extractor);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public ClassificationResult classify(String text, List<Message> history) {
        final var prompt = HoneypotPrompts.render(
                prompts.getClassificationPrompt(),
                Map.of("message", Objects.requireNonNullElse(text, ""),
                       "history", Transcripts.history(HoneypotUtils.lastN(history, HISTORY_WINDOW)),
                       "artifacts", Transcripts.artifacts(extractor.extractFromText(text))));
        final var response = LlmCalls.call(llmClient,
                                           LlmRequest.builder()
                                                   .purpose("classification")
                                                   .systemPrompt(prompts.getClassificationSystemPrompt())
                                                   .prompt(prompt)
                                                   .temperature(0.2)
                                                   .topP(0.7)
                                                   .maxTokens(200)
                                                   .outputSchema(OUTPUT_SCHEMA)
                                                   .build(),
                                           config.getLlmTimeout());
        if (!response.isSuccess()) {
            return ClassificationResult.failure(response.getError());
        }
        return parse(response.getContent());
    }

    ClassificationResult parse(final String content) {
        final var json = jsonObjectIn(content);
        if (null == json) {
            return ClassificationResult.failure(
                    HoneypotError.error(ErrorType.JSON_ERROR, "No JSON object found in model output"));
        }
        final JsonNode node;
        try {
            node = mapper.readTree(json);
        }
        catch (JsonProcessingException e) {
            return ClassificationResult.failure(HoneypotError.error(ErrorType.JSON_ERROR, e));
        }
        final var errors = new ArrayList<String>();
        final var isScam = node.get("is_scam");
        if (null == isScam || !isScam.isBoolean()) {
            errors.add("is_scam must be a boolean");
        }
        final var confidenceNode = node.get("confidence");
        if (null == confidenceNode || !confidenceNode.isNumber()) {
            errors.add("confidence must be a number");
        }
        if (!errors.isEmpty()) {
            return ClassificationResult.failure(
                    HoneypotError.error(ErrorType.DATA_VALIDATION_FAILURE, String.join(", ", errors)));
        }
        final var confidence = Math.max(0.0, Math.min(1.0, confidenceNode.asDouble()));
        final var reasonNode = node.get("reason");
        final var reason = StringUtils.abbreviate(
                null == reasonNode || reasonNode.isNull() ? "" : reasonNode.asText(), MAX_REASON_LENGTH);
        final var malicious = confidence >= config.getDecisionThreshold();
        log.info("Model classification: is_scam={}, confidence={}, malicious={}",
                 isScam.asBoolean(), confidence, malicious);
        return ClassificationResult.success(
                DetectionVerdict.builder()
                        .malicious(malicious)
                        .confidence(confidence)
                        .method(DetectionMethod.LLM)
                        .evidence(reason.isEmpty() ? List.of() : List.of(reason))
                        .reason(String.format(Locale.ROOT, "LLM detection (confidence=%.2f): %s", confidence, reason))
                        .build());
    }

    /**
     * Outermost JSON object in the text. Tolerates code fences and surrounding prose.
     */
    static String jsonObjectIn(final String content) {
        if (StringUtils.isBlank(content)) {
            return null;
        }
        final var start = content.indexOf('{');
        final var end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return content.substring(start, end + 1);
    }
}
