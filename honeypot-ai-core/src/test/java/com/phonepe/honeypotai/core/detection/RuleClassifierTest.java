package com.phonepe.honeypotai.core.detection;

import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.extraction.IntelligenceExtractor;
import com.phonepe.honeypotai.core.model.DetectionMethod;
import com.phonepe.honeypotai.core.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link RuleClassifier}
 */
class RuleClassifierTest {
    private final RuleClassifier classifier = new RuleClassifier(HoneypotConfig.DEFAULT, new IntelligenceExtractor());

    @Test
    void testBlockedAccountScoresFull() {
        final var verdict = classifier.score("Your bank account will be blocked today. Verify immediately.",
                                             List.of());
        assertEquals(1.0, verdict.getConfidence());
        assertTrue(verdict.isMalicious());
        assertEquals(DetectionMethod.RULE_FALLBACK, verdict.getMethod());
        assertEquals(List.of("Urgency patterns detected",
                             "Scam keywords: verify immediately, will be blocked",
                             "Contextual banking terms",
                             "Sensitive info request detected"),
                     verdict.getEvidence());
        assertEquals("Rule-based fallback (score=1.00): Urgency patterns detected, "
                             + "Scam keywords: verify immediately, will be blocked, Contextual banking terms",
                     verdict.getReason());
    }

    @Test
    void testUpiRequestAloneStaysBelowThreshold() {
        final var verdict = classifier.score("Share your UPI ID to avoid account suspension.", List.of());
        assertEquals(0.5, verdict.getConfidence());
        assertFalse(verdict.isMalicious());
    }

    @Test
    void testGreetingScoresZero() {
        final var verdict = classifier.score("Hello, how are you?", List.of());
        assertEquals(0.0, verdict.getConfidence());
        assertFalse(verdict.isMalicious());
        assertEquals("Rule-based fallback (score=0.00): No indicators", verdict.getReason());
    }

    @Test
    void testRewardWithPaymentTarget() {
        final var verdict = classifier.score("Congratulations! You won a cash prize. Pay the fee to claim@paytm",
                                             List.of());
        assertTrue(verdict.isMalicious());
        assertTrue(verdict.getEvidence().contains("Reward scam keyword: 'cash prize'"));
        assertTrue(verdict.getEvidence().contains("Reward scam with UPI ID: claim@paytm"));
    }

    @Test
    void testHistoryRaisesScore() {
        final var text = "Please do it fast";
        final var alone = classifier.score(text, List.of());
        final var withHistory = classifier.score(text,
                                                 List.of(Message.fromCounterpart("Your account is blocked"),
                                                         Message.fromCounterpart("Share UPI to verify"),
                                                         Message.fromCounterpart("This is urgent")));
        assertEquals(0.0, alone.getConfidence());
        assertEquals(0.3, withHistory.getConfidence());
        assertTrue(withHistory.getEvidence().contains("Context: 3 previous messages had scam indicators"));
    }

    @Test
    void testAddingIndicatorsNeverLowersScore() {
        final var texts = List.of(
                "hello",
                "hello, verify",
                "hello, verify your account",
                "hello, verify your account urgently today",
                "hello, verify your account today, click here http://bit.ly/abc",
                "hello, verify your account today, click here http://bit.ly/abc and share your otp",
                "congratulations you won a lottery, verify your account today, click here http://bit.ly/abc "
                        + "and share your otp with 9876543210");
        var previous = -1.0;
        for (final var text : texts) {
            final var score = classifier.score(text, List.of()).getConfidence();
            assertTrue(score >= previous, "Score dropped for: " + text);
            assertTrue(score >= 0.0 && score <= 1.0);
            previous = score;
        }
        assertEquals(1.0, previous);
    }

    @Test
    void testThresholdIsConfigurable() {
        final var lenient = new RuleClassifier(HoneypotConfig.builder().decisionThreshold(0.5).build(),
                                               new IntelligenceExtractor());
        assertTrue(lenient.score("Share your UPI ID to avoid account suspension.", List.of()).isMalicious());
    }
}
