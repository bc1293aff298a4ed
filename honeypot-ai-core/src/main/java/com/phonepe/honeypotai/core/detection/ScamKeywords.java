package com.phonepe.honeypotai.core.detection;

import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Weighted indicators used by {@link RuleClassifier}
 */
@UtilityClass
public class ScamKeywords {
    public static final double URGENCY_WEIGHT = 0.15;
    public static final double URGENCY_CAP = 0.4;
    public static final double SCAM_PHRASE_WEIGHT = 0.2;
    public static final double SCAM_PHRASE_CAP = 0.4;
    public static final double REWARD_WEIGHT = 0.4;
    public static final double REWARD_WITH_PAYMENT_TARGET_WEIGHT = 0.3;
    public static final double CONTEXTUAL_BANKING_WEIGHT = 0.1;
    public static final double PHISHING_WEIGHT = 0.3;
    public static final double SENSITIVE_REQUEST_WEIGHT = 0.2;
    public static final double HISTORY_WEIGHT = 0.1;
    public static final int HISTORY_WINDOW = 3;

    public static final List<Pattern> URGENCY = patterns(
            "\\b(urgent|immediately|asap|right now|hurry|quickly)\\b",
            "\\b(blocked|suspended|frozen|locked|closed)\\b",
            "\\b(within|today|hours left|final notice)\\b",
            "\\b(will be|going to|about to)\\b");

    public static final List<String> SCAM_PHRASES = List.of(
            "verify immediately", "account blocked", "suspended", "click here", "verify now",
            "urgent action required", "your account", "will be blocked", "avoid suspension", "share your",
            "send otp", "verify your identity", "winning prize", "congratulations", "claim now", "free money",
            "lottery winner", "inheritance", "tax refund", "government benefit");

    public static final List<String> REWARD = List.of(
            "won a prize", "won cash", "cash prize", "you have won", "you won", "lottery", "congratulations",
            "claim your prize", "free money", "cash reward", "reward amount");

    public static final List<Pattern> CONTEXTUAL_BANKING = patterns(
            "\\b(verify|confirm|validate|authenticate)\\b",
            "\\b(account|bank|upi|payment|transaction)\\b");

    public static final List<Pattern> PHISHING = patterns(
            "http[s]?://(?:[a-zA-Z]|[0-9]|[$-_@.&+]|[!*(),]|%[0-9a-fA-F][0-9a-fA-F])+",
            "bit\\.ly|tinyurl|short\\.link",
            "verify.*link|click.*here|visit.*url");

    public static final List<Pattern> SENSITIVE_REQUEST = patterns(
            "\\b(upi id|upi|account number|bank account|card number|pin|otp|cvv)\\b",
            "\\b(share|send|provide|give|tell).*(upi|account|otp|pin)\\b");

    /** Cheap check applied to earlier counterpart messages */
    public static final List<String> HISTORY_INDICATORS = List.of("verify", "blocked", "urgent", "suspended", "upi");

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
