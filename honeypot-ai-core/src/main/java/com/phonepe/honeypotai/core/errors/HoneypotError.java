package com.phonepe.honeypotai.core.errors;

import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import lombok.Value;

/**
 * Error raised by a pipeline component. Carried as a value, never thrown.
 */
@Value
public class HoneypotError {
    ErrorType errorType;
    String message;

    public static HoneypotError success() {
        return new HoneypotError(ErrorType.SUCCESS, ErrorType.SUCCESS.getMessage());
    }

    public static HoneypotError error(ErrorType errorType, Object... args) {
        return new HoneypotError(errorType, String.format(errorType.getMessage(), args));
    }

    public static HoneypotError error(ErrorType errorType, Throwable throwable) {
        return HoneypotError.error(errorType, HoneypotUtils.rootCause(throwable).getMessage());
    }

    public boolean isSuccess() {
        return errorType == ErrorType.SUCCESS;
    }
}
