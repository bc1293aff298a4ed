package com.phonepe.honeypotai.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error categories that travel as values across the model and report seams
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success", false),
    NO_RESPONSE("No response", true),
    LLM_NOT_CONFIGURED("No model client configured", false),
    JSON_ERROR("Error parsing JSON. Error: %s", true),
    SERIALIZATION_ERROR("Error serializing object to JSON. Error: %s", false),
    DATA_VALIDATION_FAILURE("Model data validation failed. Errors: %s", true),
    MODEL_CALL_TIMEOUT("Model call timed out after %d ms", true),
    MODEL_CALL_COMMUNICATION_ERROR("Network error: %s", true),
    MODEL_CALL_RATE_LIMIT_EXCEEDED("Rate limit exceeded: %s", true),
    MODEL_CALL_HTTP_FAILURE("Error making HTTP Call: %s", true),
    GENERIC_MODEL_CALL_FAILURE("Model call failed with error: %s", true),
    REPORT_DISABLED("Report dispatch is disabled as no collector url is configured", false),
    REPORT_NOT_ELIGIBLE("Session %s is not eligible for reporting: %s", false),
    REPORT_HTTP_FAILURE("Collector responded with HTTP %d: %s", true),
    REPORT_COMMUNICATION_ERROR("Error sending report: %s", true),
    INVALID_REQUEST("Invalid request: %s", false),
    INTERNAL_ERROR("Internal error: %s", false),
    ;

    private final String message;
    private final boolean retryable;
}
