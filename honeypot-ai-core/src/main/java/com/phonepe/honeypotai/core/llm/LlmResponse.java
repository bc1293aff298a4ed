package com.phonepe.honeypotai.core.llm;

import com.phonepe.honeypotai.core.errors.ErrorType;
import com.phonepe.honeypotai.core.errors.HoneypotError;
import lombok.Value;

/**
 * Raw text returned by the model, or the error that prevented it
 */
@Value
public class LlmResponse {
    String content;
    HoneypotError error;

    public static LlmResponse success(final String content) {
        return new LlmResponse(content, HoneypotError.success());
    }

    public static LlmResponse error(final HoneypotError error) {
        return new LlmResponse(null, error);
    }

    public static LlmResponse error(final ErrorType errorType, final Object... args) {
        return error(HoneypotError.error(errorType, args));
    }

    public boolean isSuccess() {
        return error.isSuccess();
    }
}
