package com.phonepe.honeypotai.core.llm;

import java.util.concurrent.CompletableFuture;

/**
 * Abstraction over a chat completion model. Implementations report failures through
 * {@link LlmResponse#getError()} and should not complete the future exceptionally.
 */
@FunctionalInterface
public interface LlmClient {
    CompletableFuture<LlmResponse> complete(final LlmRequest request);
}
