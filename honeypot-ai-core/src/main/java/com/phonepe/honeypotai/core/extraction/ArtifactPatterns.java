package com.phonepe.honeypotai.core.extraction;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Matchers for the artifacts we collect from counterpart messages
 */
@UtilityClass
public class ArtifactPatterns {
    public static final List<String> UPI_HANDLES = List.of(
            "paytm", "gpay", "phonepe", "ybl", "axl", "okicici", "okaxis", "okhdfcbank", "oksbi", "payzapp", "upi");

    public static final Pattern UPI_ID = Pattern.compile(
            "\\b[\\w.-]+@(?:" + String.join("|", UPI_HANDLES) + ")\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    /** 16 digits in groups of four, optionally separated */
    public static final Pattern BANK_ACCOUNT = Pattern.compile("\\b\\d{4}[-.\\s]?\\d{4}[-.\\s]?\\d{4}[-.\\s]?\\d{4}\\b");

    public static final Pattern URL = Pattern.compile("https?://[^\\s<>\"']+", Pattern.CASE_INSENSITIVE);

    /** 10 to 13 digits with an optional leading + and a couple of separators between digits */
    public static final Pattern PHONE_CANDIDATE = Pattern.compile("(?<![\\w+])\\+?\\d(?:[\\s\\-()]{0,2}\\d){9,12}(?!\\d)");

    public static final Pattern NON_DIGIT_SEPARATORS = Pattern.compile("[\\s\\-()]");

    public static final String URL_TRAILING_PUNCTUATION = ".,;:!?)]}";

    public static final List<String> SUSPICIOUS_KEYWORDS = List.of(
            "urgent", "verify", "blocked", "suspended", "immediately", "click here", "verify now", "account",
            "upi", "otp", "share", "send", "provide", "winning", "prize", "free");
}
