package com.phonepe.honeypotai.core.llm;

import com.phonepe.honeypotai.core.TestUtils;
import com.phonepe.honeypotai.core.errors.ErrorType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link LlmCalls}
 */
class LlmCallsTest {
    private static final LlmRequest REQUEST = LlmRequest.builder()
            .purpose("test")
            .prompt("Say hi")
            .build();

    @Test
    void testSuccess() {
        final var response = LlmCalls.call(TestUtils.respondingWith("hi"), REQUEST, Duration.ofSeconds(1));
        assertTrue(response.isSuccess());
        assertEquals("hi", response.getContent());
    }

    @Test
    void testNotConfigured() {
        assertEquals(ErrorType.LLM_NOT_CONFIGURED,
                     LlmCalls.call(null, REQUEST, Duration.ofSeconds(1)).getError().getErrorType());
    }

    @Test
    void testTimeout() {
        final var response = LlmCalls.call(request -> new CompletableFuture<>(), REQUEST, Duration.ofMillis(100));
        assertEquals(ErrorType.MODEL_CALL_TIMEOUT, response.getError().getErrorType());
        assertTrue(response.getError().getMessage().contains("100"));
    }

    @Test
    void testFailedFuture() {
        final var response = LlmCalls.call(
                request -> CompletableFuture.failedFuture(new IOException("connection refused")),
                REQUEST, Duration.ofSeconds(1));
        assertEquals(ErrorType.GENERIC_MODEL_CALL_FAILURE, response.getError().getErrorType());
        assertTrue(response.getError().getMessage().contains("connection refused"));
    }

    @Test
    void testClientThrows() {
        final var response = LlmCalls.call(
                request -> {
                    throw new IllegalStateException("bad client");
                },
                REQUEST, Duration.ofSeconds(1));
        assertEquals(ErrorType.GENERIC_MODEL_CALL_FAILURE, response.getError().getErrorType());
    }

    @Test
    void testNullResponse() {
        assertEquals(ErrorType.NO_RESPONSE,
                     LlmCalls.call(request -> CompletableFuture.completedFuture(null), REQUEST, Duration.ofSeconds(1))
                             .getError().getErrorType());
    }
}
