package com.phonepe.honeypotai.core;

import com.phonepe.honeypotai.core.llm.LlmClient;
import com.phonepe.honeypotai.core.llm.LlmResponse;
import com.phonepe.honeypotai.core.model.DetectionMethod;
import com.phonepe.honeypotai.core.model.DetectionVerdict;
import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.session.Session;
import com.phonepe.honeypotai.core.session.SessionStore;
import lombok.experimental.UtilityClass;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fixtures shared by tests
 */
@UtilityClass
public class TestUtils {

    public static DetectionVerdict verdict(boolean malicious) {
        return DetectionVerdict.builder()
                .malicious(malicious)
                .confidence(malicious ? 0.9 : 0.1)
                .method(DetectionMethod.RULE_FALLBACK)
                .evidence(List.of())
                .reason(malicious ? "Rule-based fallback (score=0.90): test" : "Rule-based fallback (score=0.10): test")
                .build();
    }

    public static ExtractedIntelligence upi(String upiId) {
        return ExtractedIntelligence.builder().upiIds(List.of(upiId)).build();
    }

    /**
     * Prepares a session that has exchanged the given number of messages
     */
    public static Session prepare(SessionStore store,
                                  String sessionId,
                                  boolean malicious,
                                  int messages,
                                  ExtractedIntelligence intelligence) {
        return store.withSession(sessionId, session -> {
            session.recordVerdict(verdict(malicious));
            for (int i = 0; i < messages; i++) {
                session.append(i % 2 == 0
                               ? Message.fromCounterpart("Message " + i)
                               : Message.fromAgent("Reply " + i));
            }
            session.mergeIntelligence(intelligence);
            return session;
        });
    }

    public static LlmClient respondingWith(String content) {
        return request -> CompletableFuture.completedFuture(LlmResponse.success(content));
    }

    /**
     * Clock that only moves when told to
     */
    public static class MutableClock extends Clock {
        private volatile Instant now;

        public MutableClock(Instant now) {
            this.now = now;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
