package com.phonepe.honeypotai.core.detection;

import com.phonepe.honeypotai.core.errors.ErrorType;
import com.phonepe.honeypotai.core.errors.HoneypotError;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Runs the primary classifier and switches to the fallback whenever the primary fails to produce a verdict
 */
@Slf4j
public class FallbackClassifier implements ScamClassifier {
    private final ScamClassifier primary;
    private final ScamClassifier fallback;

    public FallbackClassifier(ScamClassifier primary, ScamClassifier fallback) {
        this.primary = Objects.requireNonNull(primary);
        this.fallback = Objects.requireNonNull(fallback);
    }

    @Override
    public String name() {
        return primary.name() + "->" + fallback.name();
    }

    @Override
    public ClassificationResult classify(String text, List<Message> history) {
        ClassificationResult result;
        try {
            result = primary.classify(text, history);
        }
        catch (RuntimeException e) {
            result = ClassificationResult.failure(
                    HoneypotError.error(ErrorType.INTERNAL_ERROR, HoneypotUtils.rootCause(e).getMessage()));
        }
        if (result.isSuccess()) {
            return result;
        }
        log.warn("Classifier {} failed ({}: {}). Falling back to {}",
                 primary.name(), result.getError().getErrorType(), result.getError().getMessage(), fallback.name());
        return fallback.classify(text, history);
    }
}
