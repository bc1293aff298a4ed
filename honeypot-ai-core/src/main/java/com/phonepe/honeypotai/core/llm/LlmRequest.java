package com.phonepe.honeypotai.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single prompt sent to the model
 */
@Value
@Builder
public class LlmRequest {
    /**
     * Short name of the call site, used for logging
     */
    @NonNull
    String purpose;

    String systemPrompt;

    @NonNull
    String prompt;

    Double temperature;

    Double topP;

    Integer maxTokens;

    /**
     * When set, the client should ask for structured output matching this schema
     */
    JsonNode outputSchema;
}
