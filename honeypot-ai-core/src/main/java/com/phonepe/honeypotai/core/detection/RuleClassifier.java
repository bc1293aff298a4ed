package com.phonepe.honeypotai.core.detection;

import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.extraction.IntelligenceExtractor;
import com.phonepe.honeypotai.core.model.DetectionMethod;
import com.phonepe.honeypotai.core.model.DetectionVerdict;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic additive scorer. Each indicator family adds a fixed weight and the total is clamped to [0, 1].
 */
@Slf4j
public class RuleClassifier implements ScamClassifier {
    private final HoneypotConfig config;
    private final IntelligenceExtractor extractor;

    public RuleClassifier(HoneypotConfig config, IntelligenceExtractor extractor) {
        this.config = Objects.requireNonNull(config);
        this.extractor = Objects.requireNonNull(extractor);
    }

    @Override
    public String name() {
        return "rules";
    }

    @Override
    public ClassificationResult classify(String text, List<Message> history) {
        return ClassificationResult.success(score(text, history));
    }

    public DetectionVerdict score(final String rawText, final List<Message> history) {
        final var text = Objects.requireNonNullElse(rawText, "").toLowerCase(Locale.ROOT);
        final var evidence = new ArrayList<String>();
        var score = 0.0;

        final var urgencyHits = ScamKeywords.URGENCY.stream().filter(pattern -> pattern.matcher(text).find()).count();
        if (urgencyHits > 0) {
            score += Math.min(urgencyHits * ScamKeywords.URGENCY_WEIGHT, ScamKeywords.URGENCY_CAP);
            evidence.add("Urgency patterns detected");
        }

        final var phrases = ScamKeywords.SCAM_PHRASES.stream().filter(text::contains).toList();
        if (!phrases.isEmpty()) {
            score += Math.min(phrases.size() * ScamKeywords.SCAM_PHRASE_WEIGHT, ScamKeywords.SCAM_PHRASE_CAP);
            evidence.add("Scam keywords: " + String.join(", ", phrases.subList(0, Math.min(3, phrases.size()))));
        }

        final var reward = ScamKeywords.REWARD.stream().filter(text::contains).findFirst();
        if (reward.isPresent()) {
            score += ScamKeywords.REWARD_WEIGHT;
            evidence.add("Reward scam keyword: '%s'".formatted(reward.get()));
            final var artifacts = extractor.extractFromText(rawText);
            if (!artifacts.getUpiIds().isEmpty() || !artifacts.getPhoneNumbers().isEmpty()) {
                score += ScamKeywords.REWARD_WITH_PAYMENT_TARGET_WEIGHT;
                if (!artifacts.getUpiIds().isEmpty()) {
                    evidence.add("Reward scam with UPI ID: " + artifacts.getUpiIds().first());
                }
                if (!artifacts.getPhoneNumbers().isEmpty()) {
                    evidence.add("Reward scam with phone number: " + artifacts.getPhoneNumbers().first());
                }
            }
        }

        if (anyMatch(ScamKeywords.CONTEXTUAL_BANKING, text)) {
            score += ScamKeywords.CONTEXTUAL_BANKING_WEIGHT;
            evidence.add("Contextual banking terms");
        }
        if (anyMatch(ScamKeywords.PHISHING, text)) {
            score += ScamKeywords.PHISHING_WEIGHT;
            evidence.add("Phishing indicator: URL/link detected");
        }
        if (anyMatch(ScamKeywords.SENSITIVE_REQUEST, text)) {
            score += ScamKeywords.SENSITIVE_REQUEST_WEIGHT;
            evidence.add("Sensitive info request detected");
        }

        final var flaggedHistory = HoneypotUtils.lastN(history, ScamKeywords.HISTORY_WINDOW)
                .stream()
                .map(Message::getText)
                .filter(RuleClassifier::quickCheck)
                .count();
        if (flaggedHistory > 0) {
            score += flaggedHistory * ScamKeywords.HISTORY_WEIGHT;
            evidence.add("Context: %d previous messages had scam indicators".formatted(flaggedHistory));
        }

        final var confidence = round(Math.max(0.0, Math.min(1.0, score)));
        final var malicious = confidence >= config.getDecisionThreshold();
        final var reason = String.format(
                Locale.ROOT,
                "Rule-based fallback (score=%.2f): %s",
                confidence,
                evidence.isEmpty() ? "No indicators" : String.join(", ", evidence.subList(0, Math.min(3, evidence.size()))));
        log.info("Rule classification: malicious={}, score={}, indicators={}", malicious, confidence, evidence.size());
        return DetectionVerdict.builder()
                .malicious(malicious)
                .confidence(confidence)
                .method(DetectionMethod.RULE_FALLBACK)
                .evidence(evidence)
                .reason(reason)
                .build();
    }

    static boolean quickCheck(final String text) {
        if (null == text) {
            return false;
        }
        final var lower = text.toLowerCase(Locale.ROOT);
        return ScamKeywords.HISTORY_INDICATORS.stream().anyMatch(lower::contains);
    }

    private static boolean anyMatch(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
