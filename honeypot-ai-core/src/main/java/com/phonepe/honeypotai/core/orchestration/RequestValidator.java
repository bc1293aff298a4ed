package com.phonepe.honeypotai.core.orchestration;

import com.google.common.base.Strings;
import com.phonepe.honeypotai.core.errors.RequestValidationError;
import com.phonepe.honeypotai.core.model.HoneypotRequest;
import com.phonepe.honeypotai.core.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on an inbound request
 */
public class RequestValidator {
    public static final int MAX_SESSION_ID_LENGTH = 256;

    public void validate(final HoneypotRequest request) {
        final var failures = new ArrayList<String>();
        if (null == request) {
            throw new RequestValidationError(List.of("request is required"));
        }
        final var sessionId = request.getSessionId();
        if (Strings.isNullOrEmpty(sessionId) || sessionId.isBlank()) {
            failures.add("sessionId is required");
        }
        else if (sessionId.length() > MAX_SESSION_ID_LENGTH) {
            failures.add("sessionId must be at most %d characters".formatted(MAX_SESSION_ID_LENGTH));
        }
        validateMessage("message", request.getMessage(), failures);
        final var history = request.getConversationHistory();
        for (int i = 0; i < history.size(); i++) {
            validateMessage("conversationHistory[%d]".formatted(i), history.get(i), failures);
        }
        if (!failures.isEmpty()) {
            throw new RequestValidationError(failures);
        }
    }

    private static void validateMessage(String path, Message message, List<String> failures) {
        if (null == message) {
            failures.add(path + " is required");
            return;
        }
        if (null == message.getSender()) {
            failures.add(path + ".sender is required");
        }
        if (Strings.isNullOrEmpty(message.getText()) || message.getText().isBlank()) {
            failures.add(path + ".text is required");
        }
    }
}
