package com.phonepe.honeypotai.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of classifying a single message
 */
@Value
public class DetectionVerdict {
    boolean malicious;
    double confidence;
    DetectionMethod method;
    List<String> evidence;
    String reason;

    @Builder
    public DetectionVerdict(boolean malicious,
                            double confidence,
                            DetectionMethod method,
                            List<String> evidence,
                            String reason) {
        this.malicious = malicious;
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
        this.method = Objects.requireNonNull(method, "Detection method is required");
        this.evidence = List.copyOf(Objects.requireNonNullElse(evidence, List.of()));
        this.reason = Objects.requireNonNullElse(reason, "");
    }
}
