package com.phonepe.honeypotai.core.detection;

import com.phonepe.honeypotai.core.model.DetectionVerdict;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for classification. Always returns a verdict: when the configured chain cannot produce one, the
 * deterministic rule scorer decides.
 */
@Slf4j
public class DetectionEngine {
    private final ScamClassifier classifier;
    private final RuleClassifier rules;

    public DetectionEngine(ScamClassifier classifier, RuleClassifier rules) {
        this.rules = Objects.requireNonNull(rules);
        this.classifier = Objects.requireNonNullElse(classifier, rules);
    }

    /**
     * Model first, rules as fallback
     */
    public static DetectionEngine withFallback(LlmClassifier llmClassifier, RuleClassifier rules) {
        if (null == llmClassifier) {
            return new DetectionEngine(rules, rules);
        }
        return new DetectionEngine(new FallbackClassifier(llmClassifier, rules), rules);
    }

    public DetectionVerdict classify(final String text, final List<Message> history) {
        try {
            final var result = classifier.classify(text, history);
            if (result.isSuccess()) {
                return result.getVerdict();
            }
            log.warn("Classifier {} returned no verdict: {}", classifier.name(), result.getError().getMessage());
        }
        catch (RuntimeException e) {
            log.error("Error running classifier {}: {}", classifier.name(), HoneypotUtils.rootCause(e).getMessage(), e);
        }
        return rules.score(text, history);
    }
}
