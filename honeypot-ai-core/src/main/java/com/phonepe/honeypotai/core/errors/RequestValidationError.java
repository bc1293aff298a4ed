package com.phonepe.honeypotai.core.errors;

import lombok.Getter;

import java.util.List;

/**
 * Validation failures in an inbound request
 */
@Getter
public class RequestValidationError extends RuntimeException {
    private final transient List<String> failures;

    public RequestValidationError(final List<String> failures) {
        super(String.join(", ", failures));
        this.failures = List.copyOf(failures);
    }
}
