/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.honeypotai.models;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Provider specific switches for {@link SimpleOpenAILlmClient}
 */
@Value
public class SimpleOpenAILlmClientOptions {
    public static final SimpleOpenAILlmClientOptions DEFAULT = SimpleOpenAILlmClientOptions.builder().build();

    /**
     * Send a json_schema response format when the request carries an output schema. Some OpenAI compatible
     * providers reject it, in which case the model is steered by the prompt alone.
     */
    boolean structuredOutput;

    /**
     * Send the token limit as max_completion_tokens. When false the older max_tokens field is used.
     */
    boolean useMaxCompletionTokens;

    @Builder
    public SimpleOpenAILlmClientOptions(Boolean structuredOutput, Boolean useMaxCompletionTokens) {
        this.structuredOutput = Objects.requireNonNullElse(structuredOutput, true);
        this.useMaxCompletionTokens = Objects.requireNonNullElse(useMaxCompletionTokens, true);
    }
}
