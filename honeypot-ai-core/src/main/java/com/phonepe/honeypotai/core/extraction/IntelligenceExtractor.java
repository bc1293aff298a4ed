package com.phonepe.honeypotai.core.extraction;

import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pulls bank accounts, UPI ids, links, phone numbers and suspicious keywords out of a message and the recent
 * history. Never fails: on an internal error the result is empty.
 */
@Slf4j
public class IntelligenceExtractor {
    public static final int HISTORY_WINDOW = 5;

    public ExtractedIntelligence extract(final String text, final List<Message> history) {
        try {
            final var texts = new ArrayList<String>();
            if (null != text) {
                texts.add(text);
            }
            HoneypotUtils.lastN(Objects.requireNonNullElse(history, List.<Message>of()), HISTORY_WINDOW)
                    .stream()
                    .map(Message::getText)
                    .filter(Objects::nonNull)
                    .forEach(texts::add);
            return texts.stream()
                    .map(this::extractFromText)
                    .reduce(ExtractedIntelligence.empty(), ExtractedIntelligence::merge);
        }
        catch (RuntimeException e) {
            log.error("Error extracting intelligence: {}", HoneypotUtils.rootCause(e).getMessage(), e);
            return ExtractedIntelligence.empty();
        }
    }

    /**
     * Artifacts in a single piece of text, without looking at history
     */
    public ExtractedIntelligence extractFromText(final String text) {
        if (StringUtils.isBlank(text)) {
            return ExtractedIntelligence.empty();
        }
        return ExtractedIntelligence.builder()
                .bankAccounts(bankAccounts(text))
                .upiIds(upiIds(text))
                .phishingLinks(links(text))
                .phoneNumbers(phoneNumbers(text))
                .suspiciousKeywords(keywords(text))
                .build();
    }

    private static Set<String> bankAccounts(String text) {
        final var found = new TreeSet<String>();
        final var matcher = ArtifactPatterns.BANK_ACCOUNT.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group().replaceAll("[-.\\s]", ""));
        }
        return found;
    }

    private static Set<String> upiIds(String text) {
        final var found = new TreeSet<String>();
        final var matcher = ArtifactPatterns.UPI_ID.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return found;
    }

    private static Set<String> links(String text) {
        final var found = new TreeSet<String>();
        final var matcher = ArtifactPatterns.URL.matcher(text);
        while (matcher.find()) {
            final var url = StringUtils.stripEnd(matcher.group(), ArtifactPatterns.URL_TRAILING_PUNCTUATION);
            if (!url.isEmpty()) {
                found.add(url);
            }
        }
        return found;
    }

    private static Set<String> phoneNumbers(String text) {
        final var found = new TreeSet<String>();
        final var matcher = ArtifactPatterns.PHONE_CANDIDATE.matcher(text);
        while (matcher.find()) {
            PhoneNumbers.normalize(matcher.group()).ifPresent(found::add);
        }
        return found;
    }

    private static Set<String> keywords(String text) {
        final var lower = text.toLowerCase(Locale.ROOT);
        final var found = new TreeSet<String>();
        for (final var keyword : ArtifactPatterns.SUSPICIOUS_KEYWORDS) {
            if (lower.contains(keyword)) {
                found.add(keyword);
            }
        }
        return found;
    }
}
