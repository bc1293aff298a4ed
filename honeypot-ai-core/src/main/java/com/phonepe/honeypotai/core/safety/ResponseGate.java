package com.phonepe.honeypotai.core.safety;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Last check before a reply leaves the system. Rejects anything that could reveal the agent or cross a line.
 */
@Slf4j
public class ResponseGate {
    public static final int MAX_LENGTH = 500;
    public static final int MIN_LENGTH = 5;

    static final List<String> FORBIDDEN_PHRASES = List.of(
            "I am an AI", "I'm a bot", "I'm an AI", "detection system", "honeypot", "I'm detecting",
            "I'm analyzing", "intelligence", "gathered intelligence", "extracted", "confidence score", "rule-based",
            "scam detection", "I'm a system", "automated", "algorithm");

    static final List<String> META_PHRASES = List.of(
            "we've already", "we have gathered", "we extracted", "our system", "the system", "detection",
            "analysis");

    static final List<String> PROHIBITED_RESPONSES = List.of(
            "I am an AI", "I'm a bot", "detection system", "honeypot", "I'm detecting");

    static final List<String> PROHIBITED_ACTIONS = List.of(
            "impersonate", "pretend to be", "act as", "illegal", "harass", "threaten");

    public GateResult validate(final String reply) {
        if (null == reply) {
            return GateResult.fail("Response too short (min %d characters)".formatted(MIN_LENGTH));
        }
        final var lower = reply.toLowerCase(Locale.ROOT);
        final var violation = firstMatch(lower, FORBIDDEN_PHRASES)
                .map(phrase -> "Response contains forbidden phrase: " + phrase)
                .or(() -> firstMatch(lower, META_PHRASES)
                        .map(phrase -> "Response contains meta phrase: " + phrase))
                .or(() -> firstMatch(lower, PROHIBITED_RESPONSES)
                        .map(phrase -> "Response contains prohibited phrase: " + phrase))
                .or(() -> firstMatch(lower, PROHIBITED_ACTIONS)
                        .map(phrase -> "Response contains prohibited action: " + phrase))
                .or(() -> lengthViolation(reply));
        violation.ifPresent(reason -> log.warn("Reply rejected: {}", reason));
        return violation.map(GateResult::fail).orElseGet(GateResult::pass);
    }

    private static Optional<String> firstMatch(String lowerText, List<String> phrases) {
        return phrases.stream()
                .filter(phrase -> lowerText.contains(phrase.toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    private static Optional<String> lengthViolation(String reply) {
        if (reply.length() > MAX_LENGTH) {
            return Optional.of("Response too long (max %d characters)".formatted(MAX_LENGTH));
        }
        if (reply.trim().length() < MIN_LENGTH) {
            return Optional.of("Response too short (min %d characters)".formatted(MIN_LENGTH));
        }
        return Optional.empty();
    }
}
