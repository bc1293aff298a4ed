package com.phonepe.honeypotai.core.report;

import com.phonepe.honeypotai.core.TestUtils;
import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.errors.ErrorType;
import com.phonepe.honeypotai.core.llm.LlmResponse;
import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.session.InMemorySessionStore;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests {@link StructuredNotesGenerator} and {@link LlmNotesGenerator}
 */
class ReportNotesGeneratorTest {
    private final InMemorySessionStore store = new InMemorySessionStore();

    @Test
    void testStructuredNotes() {
        final var session = TestUtils.prepare(
                store, "s1", true, 6,
                ExtractedIntelligence.builder()
                        .upiIds(List.of("a@ybl", "b@paytm"))
                        .phoneNumbers(List.of("+919876543210"))
                        .build());
        store.withSession("s1", locked -> {
            locked.annotate("Extracted UPI ID: a@ybl");
            return null;
        });
        assertEquals("Detection: Rule-based fallback (score=0.90): test; "
                             + "Artifacts: 2 UPI ids, 1 phone numbers; "
                             + "Extracted UPI ID: a@ybl",
                     new StructuredNotesGenerator().notes(session));
    }

    @Test
    void testNothingToSay() {
        final var session = store.withSession("s1", locked -> locked);
        assertEquals(StructuredNotesGenerator.NO_NOTES, new StructuredNotesGenerator().notes(session));
    }

    @Test
    void testModelNotes() {
        final var session = TestUtils.prepare(store, "s1", true, 6, TestUtils.upi("a@ybl"));
        final var generator = new LlmNotesGenerator(
                TestUtils.respondingWith("  Caller posed as bank staff and pushed for a UPI transfer.  "),
                HoneypotConfig.DEFAULT, null, null);
        assertEquals("Caller posed as bank staff and pushed for a UPI transfer.", generator.notes(session));
    }

    @Test
    void testModelNotesFallBack() {
        final var session = TestUtils.prepare(store, "s1", true, 6, TestUtils.upi("a@ybl"));
        final var generator = new LlmNotesGenerator(
                request -> CompletableFuture.completedFuture(
                        LlmResponse.error(ErrorType.MODEL_CALL_HTTP_FAILURE, "boom")),
                HoneypotConfig.DEFAULT, null, new StructuredNotesGenerator());
        assertEquals("Detection: Rule-based fallback (score=0.90): test; Artifacts: 1 UPI ids",
                     generator.notes(session));
    }
}
