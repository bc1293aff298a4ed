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

import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.phonepe.honeypotai.core.errors.ErrorType;
import com.phonepe.honeypotai.core.errors.HoneypotError;
import com.phonepe.honeypotai.core.llm.LlmClient;
import com.phonepe.honeypotai.core.llm.LlmRequest;
import com.phonepe.honeypotai.core.llm.LlmResponse;
import com.phonepe.honeypotai.core.utils.EnvLoader;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import com.phonepe.honeypotai.core.utils.JsonUtils;
import io.github.sashirestela.cleverclient.client.OkHttpClientAdapter;
import io.github.sashirestela.cleverclient.support.CleverClientException;
import io.github.sashirestela.openai.SimpleOpenAI;
import io.github.sashirestela.openai.common.ResponseFormat;
import io.github.sashirestela.openai.domain.chat.Chat;
import io.github.sashirestela.openai.domain.chat.ChatMessage;
import io.github.sashirestela.openai.domain.chat.ChatRequest;
import io.github.sashirestela.openai.service.ChatCompletionServices;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.ClassUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link LlmClient} over any OpenAI compatible chat completions endpoint (OpenAI, Azure OpenAI, Groq and the
 * like) using simple-openai
 */
@Slf4j
public class SimpleOpenAILlmClient implements LlmClient {
    private final String modelName;
    private final ChatCompletionServices openAIProvider;
    private final SimpleOpenAILlmClientOptions options;

    public SimpleOpenAILlmClient(@NonNull String modelName, @NonNull ChatCompletionServices openAIProvider) {
        this(modelName, openAIProvider, null);
    }

    public SimpleOpenAILlmClient(
            @NonNull String modelName,
            @NonNull ChatCompletionServices openAIProvider,
            SimpleOpenAILlmClientOptions options) {
        this.modelName = modelName;
        this.openAIProvider = openAIProvider;
        this.options = Objects.requireNonNullElse(options, SimpleOpenAILlmClientOptions.DEFAULT);
    }

    /**
     * Client for an OpenAI compatible endpoint configured through HONEYPOT_LLM_BASE_URL, HONEYPOT_LLM_API_KEY and
     * HONEYPOT_LLM_MODEL
     */
    public static SimpleOpenAILlmClient fromEnvironment() {
        final var provider = SimpleOpenAI.builder()
                .baseUrl(EnvLoader.readEnv("HONEYPOT_LLM_BASE_URL", "https://api.openai.com"))
                .apiKey(EnvLoader.readEnv("HONEYPOT_LLM_API_KEY"))
                .objectMapper(JsonUtils.createMapper())
                .clientAdapter(new OkHttpClientAdapter(new OkHttpClient.Builder().build()))
                .build();
        return new SimpleOpenAILlmClient(EnvLoader.readEnv("HONEYPOT_LLM_MODEL", "gpt-4o-mini"), provider);
    }

    @Override
    public CompletableFuture<LlmResponse> complete(LlmRequest request) {
        final var stopwatch = Stopwatch.createStarted();
        try {
            return openAIProvider.chatCompletions()
                    .create(toChatRequest(request))
                    .thenApply(chat -> {
                        log.debug("Model {} responded for {} in {} ms",
                                  modelName, request.getPurpose(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
                        return toResponse(chat);
                    })
                    .exceptionally(SimpleOpenAILlmClient::errorResponse);
        }
        catch (RuntimeException e) {
            return CompletableFuture.completedFuture(errorResponse(e));
        }
    }

    private ChatRequest toChatRequest(LlmRequest request) {
        final var messages = new ArrayList<ChatMessage>();
        if (!Strings.isNullOrEmpty(request.getSystemPrompt())) {
            messages.add(ChatMessage.SystemMessage.of(request.getSystemPrompt()));
        }
        messages.add(ChatMessage.UserMessage.of(request.getPrompt()));
        final var builder = ChatRequest.builder()
                .messages(messages)
                .model(modelName)
                .n(1);
        if (null != request.getTemperature()) {
            builder.temperature(request.getTemperature());
        }
        if (null != request.getTopP()) {
            builder.topP(request.getTopP());
        }
        if (null != request.getMaxTokens()) {
            if (options.isUseMaxCompletionTokens()) {
                builder.maxCompletionTokens(request.getMaxTokens());
            }
            else {
                builder.maxTokens(request.getMaxTokens());
            }
        }
        if (options.isStructuredOutput() && null != request.getOutputSchema()) {
            builder.responseFormat(ResponseFormat.jsonSchema(ResponseFormat.JsonSchema.builder()
                                                                     .name(request.getPurpose()
                                                                                   .replace('-', '_'))
                                                                     .schema(request.getOutputSchema())
                                                                     .strict(true)
                                                                     .build()));
        }
        return builder.build();
    }

    private static LlmResponse toResponse(Chat chat) {
        if (null == chat || null == chat.getChoices()) {
            return LlmResponse.error(ErrorType.NO_RESPONSE);
        }
        final var choice = chat.getChoices()
                .stream()
                .findFirst()
                .orElse(null);
        if (null == choice || null == choice.getMessage() || Strings.isNullOrEmpty(choice.getMessage().getContent())) {
            return LlmResponse.error(ErrorType.NO_RESPONSE);
        }
        return LlmResponse.success(choice.getMessage().getContent());
    }

    private static LlmResponse errorResponse(Throwable error) {
        final var rootCause = HoneypotUtils.rootCause(error);
        log.error("Error calling model: {} -> {}", rootCause.getClass().getSimpleName(), rootCause.getMessage());
        // OkHttp reports network issues as a variety of IOExceptions
        if (ClassUtils.isAssignable(rootCause.getClass(), IOException.class)) {
            return LlmResponse.error(ErrorType.MODEL_CALL_COMMUNICATION_ERROR, rootCause.getMessage());
        }
        if (rootCause instanceof CleverClientException cleverClientException) {
            return cleverClientException.responseInfo()
                    .map(responseInfo -> {
                        final var message = Objects.requireNonNullElse(responseInfo.getData(),
                                                                       cleverClientException.getMessage());
                        return switch (responseInfo.getStatusCode()) {
                            case 429 -> LlmResponse.error(ErrorType.MODEL_CALL_RATE_LIMIT_EXCEEDED, message);
                            default -> LlmResponse.error(ErrorType.MODEL_CALL_HTTP_FAILURE,
                                                         "Received HTTP error: [%d] %s".formatted(
                                                                 responseInfo.getStatusCode(), message));
                        };
                    })
                    .orElseGet(() -> LlmResponse.error(ErrorType.GENERIC_MODEL_CALL_FAILURE,
                                                       cleverClientException.getMessage()));
        }
        return LlmResponse.error(HoneypotError.error(ErrorType.GENERIC_MODEL_CALL_FAILURE, rootCause));
    }
}
