package com.phonepe.honeypotai.core.llm;

import com.google.common.base.Stopwatch;
import com.phonepe.honeypotai.core.errors.ErrorType;
import com.phonepe.honeypotai.core.errors.HoneypotError;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a model call with a hard deadline and turns every failure into an error value
 */
@Slf4j
@UtilityClass
public class LlmCalls {

    public static LlmResponse call(final LlmClient client, final LlmRequest request, final Duration timeout) {
        if (null == client) {
            return LlmResponse.error(ErrorType.LLM_NOT_CONFIGURED);
        }
        final var stopwatch = Stopwatch.createStarted();
        log.debug("Calling model for {}. Prompt: {}", request.getPurpose(), request.getPrompt());
        try {
            final var response = client.complete(request)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .get();
            if (null == response) {
                return LlmResponse.error(ErrorType.NO_RESPONSE);
            }
            log.debug("Model call for {} completed in {} ms. Output: {}",
                      request.getPurpose(), stopwatch.elapsed(TimeUnit.MILLISECONDS), response.getContent());
            return response;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(HoneypotError.error(ErrorType.GENERIC_MODEL_CALL_FAILURE, e));
        }
        catch (ExecutionException | CompletionException e) {
            final var rootCause = HoneypotUtils.rootCause(e);
            if (rootCause instanceof TimeoutException) {
                log.warn("Model call for {} timed out after {} ms", request.getPurpose(), timeout.toMillis());
                return LlmResponse.error(ErrorType.MODEL_CALL_TIMEOUT, timeout.toMillis());
            }
            log.warn("Model call for {} failed: {}", request.getPurpose(), rootCause.getMessage());
            return LlmResponse.error(HoneypotError.error(ErrorType.GENERIC_MODEL_CALL_FAILURE, rootCause));
        }
        catch (RuntimeException e) {
            log.warn("Model call for {} failed: {}", request.getPurpose(), HoneypotUtils.rootCause(e).getMessage());
            return LlmResponse.error(HoneypotError.error(ErrorType.GENERIC_MODEL_CALL_FAILURE, e));
        }
    }
}
