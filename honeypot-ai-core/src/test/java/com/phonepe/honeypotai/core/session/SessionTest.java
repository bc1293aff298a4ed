package com.phonepe.honeypotai.core.session;

import com.phonepe.honeypotai.core.TestUtils;
import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.model.Message;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link Session}
 */
class SessionTest {
    private final InMemorySessionStore store = new InMemorySessionStore();

    @Test
    void testScamDetectionIsSticky() {
        store.withSession("s1", session -> {
            session.recordVerdict(TestUtils.verdict(true));
            session.recordVerdict(TestUtils.verdict(false));
            assertTrue(session.isScamDetected());
            assertFalse(session.getLatestVerdict().isMalicious());
            return null;
        });
    }

    @Test
    void testSeedOnlyIntoEmptyHistory() {
        store.withSession("s1", session -> {
            assertTrue(session.seedHistory(List.of(Message.fromCounterpart("a"), Message.fromAgent("b"))));
            assertEquals(0, session.getMessagesExchanged());
            assertFalse(session.seedHistory(List.of(Message.fromCounterpart("c"))));
            session.append(Message.fromCounterpart("d"));
            assertEquals(3, session.getHistory().size());
            assertEquals(1, session.getMessagesExchanged());
            return null;
        });
    }

    @Test
    void testMergeReturnsOnlyNewEntries() {
        store.withSession("s1", session -> {
            assertEquals(Set.of("a@ybl"), session.mergeIntelligence(TestUtils.upi("a@ybl")).getUpiIds());
            final var added = session.mergeIntelligence(
                    ExtractedIntelligence.builder().upiIds(List.of("a@ybl", "b@ybl")).build());
            assertEquals(Set.of("b@ybl"), added.getUpiIds());
            assertEquals(Set.of("a@ybl", "b@ybl"), session.getIntelligence().getUpiIds());
            assertTrue(session.mergeIntelligence(TestUtils.upi("b@ybl")).isEmpty());
            return null;
        });
    }

    @Test
    void testReportStateMovesOnce() {
        store.withSession("s1", session -> {
            assertEquals(ReportState.NOT_SENT, session.getReportState());
            assertTrue(session.markReportSent());
            assertFalse(session.markReportSent());
            assertEquals(ReportState.SENT, session.getReportState());
            return null;
        });
    }

    @Test
    void testMutationRequiresLock() {
        final var session = new Session("loose", Clock.systemUTC());
        assertThrows(IllegalStateException.class, () -> session.append(Message.fromCounterpart("hi")));
    }
}
