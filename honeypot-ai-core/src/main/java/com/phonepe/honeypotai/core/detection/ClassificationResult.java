package com.phonepe.honeypotai.core.detection;

import com.phonepe.honeypotai.core.errors.HoneypotError;
import com.phonepe.honeypotai.core.model.DetectionVerdict;
import lombok.Value;

/**
 * Verdict from a classifier, or the error that kept it from producing one
 */
@Value
public class ClassificationResult {
    DetectionVerdict verdict;
    HoneypotError error;

    public static ClassificationResult success(final DetectionVerdict verdict) {
        return new ClassificationResult(verdict, HoneypotError.success());
    }

    public static ClassificationResult failure(final HoneypotError error) {
        return new ClassificationResult(null, error);
    }

    public boolean isSuccess() {
        return null != verdict && error.isSuccess();
    }
}
