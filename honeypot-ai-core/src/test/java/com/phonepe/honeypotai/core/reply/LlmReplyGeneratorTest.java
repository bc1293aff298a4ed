package com.phonepe.honeypotai.core.reply;

import com.phonepe.honeypotai.core.TestUtils;
import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.errors.ErrorType;
import com.phonepe.honeypotai.core.llm.LlmRequest;
import com.phonepe.honeypotai.core.llm.LlmResponse;
import com.phonepe.honeypotai.core.model.ConversationGoal;
import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.model.ReplyContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link LlmReplyGenerator}
 */
class LlmReplyGeneratorTest {

    @Test
    void testClean() {
        assertEquals("Which bank is this?", LlmReplyGenerator.clean("Reply: Which bank is this?"));
        assertEquals("Which bank is this?", LlmReplyGenerator.clean("\"Which bank is this?\""));
        assertEquals("Which bank is this?", LlmReplyGenerator.clean("  You:   'Which bank is this?'  "));
        assertEquals("Which bank is this?", LlmReplyGenerator.clean("Which bank is this?"));
    }

    @Test
    void testCleanBlank() {
        assertEquals("", LlmReplyGenerator.clean("   "));
        assertEquals("", LlmReplyGenerator.clean(null));
    }

    @Test
    void testUsesModelReply() {
        final var captured = new AtomicReference<LlmRequest>();
        final var generator = new LlmReplyGenerator(request -> {
            captured.set(request);
            return CompletableFuture.completedFuture(LlmResponse.success("Reply: Oh no, what happened?"));
        }, HoneypotConfig.DEFAULT, null, null);
        final var history = new ArrayList<Message>();
        IntStream.range(0, 12).forEach(i -> history.add(i % 2 == 0
                                                         ? Message.fromCounterpart("line " + i)
                                                         : Message.fromAgent("answer " + i)));

        assertEquals("Oh no, what happened?", generator.generate(context(ConversationGoal.DELAY, history)));

        final var request = captured.get();
        assertEquals("persona-reply", request.getPurpose());
        assertTrue(request.getPrompt().contains(ConversationGoal.DELAY.getBehaviourHint()));
        assertTrue(request.getPrompt().contains("You: answer 11"));
        assertTrue(request.getPrompt().contains("Them: line 4"));
        assertFalse(request.getPrompt().contains("Them: line 2"));
    }

    @Test
    void testFallsBackOnFailure() {
        final var generator = new LlmReplyGenerator(
                request -> CompletableFuture.completedFuture(
                        LlmResponse.error(ErrorType.MODEL_CALL_COMMUNICATION_ERROR, "down")),
                HoneypotConfig.DEFAULT, null, new TemplateReplyGenerator());
        assertEquals("I'll check with my bank directly. Thanks for letting me know.",
                     generator.generate(context(ConversationGoal.WRAP_UP, List.of())));
    }

    @Test
    void testFallsBackOnEmptyReply() {
        final var generator = new LlmReplyGenerator(
                TestUtils.respondingWith("\"\""), HoneypotConfig.DEFAULT, null, null);
        assertEquals("I'm concerned about this. What should I do next?",
                     generator.generate(context(ConversationGoal.ESCALATE, List.of())));
    }

    private static ReplyContext context(ConversationGoal goal, List<Message> history) {
        return ReplyContext.builder()
                .sessionId("s1")
                .goal(goal)
                .message(Message.fromCounterpart("Pay the fee today"))
                .recentHistory(history)
                .intelligence(ExtractedIntelligence.empty())
                .build();
    }
}
