package com.phonepe.honeypotai.core.prompts;

import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.model.Sender;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders conversation fragments into prompt text
 */
@UtilityClass
public class Transcripts {
    public static final String NO_HISTORY = "(no previous messages)";
    public static final String NO_ARTIFACTS = "(none)";

    public static String history(final List<Message> messages) {
        if (null == messages || messages.isEmpty()) {
            return NO_HISTORY;
        }
        return messages.stream()
                .map(message -> "%s: %s".formatted(message.getSender() == Sender.COUNTERPART ? "Them" : "You",
                                                   message.getText()))
                .collect(Collectors.joining("\n"));
    }

    public static String artifacts(final ExtractedIntelligence intelligence) {
        if (null == intelligence) {
            return NO_ARTIFACTS;
        }
        final var lines = new ArrayList<String>();
        addLine(lines, "Bank accounts", intelligence.getBankAccounts());
        addLine(lines, "UPI ids", intelligence.getUpiIds());
        addLine(lines, "Links", intelligence.getPhishingLinks());
        addLine(lines, "Phone numbers", intelligence.getPhoneNumbers());
        return lines.isEmpty() ? NO_ARTIFACTS : String.join("\n", lines);
    }

    private static void addLine(List<String> lines, String label, Iterable<String> values) {
        final var joined = String.join(", ", values);
        if (!joined.isEmpty()) {
            lines.add(label + ": " + joined);
        }
    }
}
