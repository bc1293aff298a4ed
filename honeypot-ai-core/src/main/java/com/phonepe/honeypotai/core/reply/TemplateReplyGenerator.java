package com.phonepe.honeypotai.core.reply;

import com.phonepe.honeypotai.core.model.ReplyContext;

import java.util.Locale;
import java.util.Objects;

/**
 * Canned replies per goal, picked by keywords in the counterpart message
 */
public class TemplateReplyGenerator implements ReplyGenerator {

    @Override
    public String generate(ReplyContext context) {
        final var text = Objects.requireNonNullElse(context.getMessage().getText(), "").toLowerCase(Locale.ROOT);
        return switch (context.getGoal()) {
            case CLARIFY -> {
                if (text.contains("upi")) {
                    yield "I'm not comfortable sharing my UPI ID. Is there another way to verify?";
                }
                if (text.contains("link") || text.contains("click")) {
                    yield "I'm not sure about clicking links. Can you tell me more about this?";
                }
                if (text.contains("verify")) {
                    yield "How do I verify? Can you explain the process step by step?";
                }
                yield "I see. Can you provide more details about this?";
            }
            case DELAY -> text.contains("urgent") || text.contains("immediately")
                          ? "I'm at work right now. Can you explain what I need to do? I need a few minutes to understand this."
                          : "I need to check something first. Can you give me more information about this?";
            case ESCALATE -> text.contains("blocked") || text.contains("suspended")
                             ? "This is really worrying. What exactly do I need to do to prevent this? I want to fix this immediately."
                             : "I'm concerned about this. What should I do next?";
            case CONTINUE -> {
                if (text.contains("blocked") || text.contains("suspended")) {
                    yield "Why is my account being blocked? What did I do wrong?";
                }
                if (text.contains("verify")) {
                    yield "How do I verify? Can you explain the process?";
                }
                yield "I see. Can you provide more details about this?";
            }
            case WRAP_UP -> "I'll check with my bank directly. Thanks for letting me know.";
        };
    }
}
