package com.phonepe.honeypotai.core.strategy;

import com.phonepe.honeypotai.core.model.Message;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches the configured closing phrases as substrings of the lower-cased message
 */
public class KeywordEndDetector implements ConversationEndDetector {
    private final List<String> keywords;

    public KeywordEndDetector(List<String> keywords) {
        this.keywords = List.copyOf(keywords);
    }

    @Override
    public String name() {
        return "keywords";
    }

    @Override
    public Optional<Boolean> isConversationOver(String text, List<Message> history) {
        final var lower = Objects.requireNonNullElse(text, "").toLowerCase(Locale.ROOT);
        return Optional.of(keywords.stream().anyMatch(lower::contains));
    }
}
