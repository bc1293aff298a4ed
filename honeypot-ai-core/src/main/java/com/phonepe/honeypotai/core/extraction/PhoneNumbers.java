package com.phonepe.honeypotai.core.extraction;

import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * Canonicalises Indian mobile numbers to +91XXXXXXXXXX
 */
@UtilityClass
public class PhoneNumbers {
    private static final String COUNTRY_PREFIX = "+91";

    /**
     * Normalises a raw candidate. Returns empty for anything that is not a valid mobile number.
     */
    public static Optional<String> normalize(final String raw) {
        if (null == raw) {
            return Optional.empty();
        }
        var digits = ArtifactPatterns.NON_DIGIT_SEPARATORS.matcher(raw).replaceAll("");
        if (digits.startsWith(COUNTRY_PREFIX)) {
            digits = digits.substring(COUNTRY_PREFIX.length());
        }
        else if (digits.length() == 12 && digits.startsWith("91")) {
            digits = digits.substring(2);
        }
        else if (digits.length() == 11 && digits.startsWith("0")) {
            digits = digits.substring(1);
        }
        if (digits.length() != 10 || !digits.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        final var first = digits.charAt(0);
        if (first < '6' || first > '9') {
            return Optional.empty();
        }
        return Optional.of(COUNTRY_PREFIX + digits);
    }
}
