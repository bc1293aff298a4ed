package com.phonepe.honeypotai.core.orchestration;

import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.detection.DetectionEngine;
import com.phonepe.honeypotai.core.detection.LlmClassifier;
import com.phonepe.honeypotai.core.detection.RuleClassifier;
import com.phonepe.honeypotai.core.errors.RequestValidationError;
import com.phonepe.honeypotai.core.extraction.IntelligenceExtractor;
import com.phonepe.honeypotai.core.llm.LlmClient;
import com.phonepe.honeypotai.core.model.ConversationGoal;
import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.model.HoneypotReply;
import com.phonepe.honeypotai.core.model.HoneypotRequest;
import com.phonepe.honeypotai.core.model.Message;
import com.phonepe.honeypotai.core.model.ReplyContext;
import com.phonepe.honeypotai.core.prompts.HoneypotPrompts;
import com.phonepe.honeypotai.core.reply.LlmReplyGenerator;
import com.phonepe.honeypotai.core.reply.ReplyGenerator;
import com.phonepe.honeypotai.core.reply.TemplateReplyGenerator;
import com.phonepe.honeypotai.core.report.LlmNotesGenerator;
import com.phonepe.honeypotai.core.report.ReportDispatcher;
import com.phonepe.honeypotai.core.report.StructuredNotesGenerator;
import com.phonepe.honeypotai.core.safety.ResponseGate;
import com.phonepe.honeypotai.core.session.InMemorySessionStore;
import com.phonepe.honeypotai.core.session.Session;
import com.phonepe.honeypotai.core.session.SessionReaper;
import com.phonepe.honeypotai.core.session.SessionStore;
import com.phonepe.honeypotai.core.strategy.LlmEndDetector;
import com.phonepe.honeypotai.core.strategy.StrategyPlanner;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import com.phonepe.honeypotai.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Runs one conversational turn end to end: classify, extract, plan, reply, gate and report. Each turn runs under
 * the lock of its session.
 * <p>
 * Components left out of the builder are created from the config. When no {@link LlmClient} is given the
 * pipeline runs on rules, keyword end detection, canned replies and structured report notes.
 * <p>
 * When a reap interval is given, sessions idle for longer than {@link HoneypotConfig#getSessionIdleTimeout()} are
 * evicted in the background until {@link #close()} is called.
 */
@Slf4j
public class Orchestrator implements AutoCloseable {
    @Getter
    private final HoneypotConfig config;
    @Getter
    private final SessionStore sessionStore;
    private final RequestValidator requestValidator;
    private final IntelligenceExtractor extractor;
    private final DetectionEngine detectionEngine;
    private final StrategyPlanner strategyPlanner;
    private final ReplyGenerator replyGenerator;
    private final ResponseGate responseGate;
    private final ReportDispatcher reportDispatcher;
    private final SessionReaper sessionReaper;

    @Builder
    public Orchestrator(
            HoneypotConfig config,
            LlmClient llmClient,
            HoneypotPrompts prompts,
            SessionStore sessionStore,
            IntelligenceExtractor extractor,
            DetectionEngine detectionEngine,
            StrategyPlanner strategyPlanner,
            ReplyGenerator replyGenerator,
            ResponseGate responseGate,
            ReportDispatcher reportDispatcher,
            Duration sessionReapInterval) {
        this.config = Objects.requireNonNullElse(config, HoneypotConfig.DEFAULT);
        final var effectivePrompts = Objects.requireNonNullElse(prompts, HoneypotPrompts.DEFAULT);
        this.sessionStore = Objects.requireNonNullElseGet(sessionStore, InMemorySessionStore::new);
        this.requestValidator = new RequestValidator();
        this.extractor = Objects.requireNonNullElseGet(extractor, IntelligenceExtractor::new);
        this.detectionEngine = Objects.requireNonNullElseGet(
                detectionEngine,
                () -> DetectionEngine.withFallback(
                        null == llmClient
                        ? null
                        : new LlmClassifier(llmClient, this.config, effectivePrompts, this.extractor,
                                            JsonUtils.createMapper()),
                        new RuleClassifier(this.config, this.extractor)));
        this.strategyPlanner = Objects.requireNonNullElseGet(
                strategyPlanner,
                () -> new StrategyPlanner(this.config,
                                          null == llmClient ? null : new LlmEndDetector(llmClient,
                                                                                         this.config,
                                                                                         effectivePrompts)));
        this.replyGenerator = Objects.requireNonNullElseGet(
                replyGenerator,
                () -> null == llmClient
                      ? new TemplateReplyGenerator()
                      : new LlmReplyGenerator(llmClient, this.config, effectivePrompts, new TemplateReplyGenerator()));
        this.responseGate = Objects.requireNonNullElseGet(responseGate, ResponseGate::new);
        this.reportDispatcher = Objects.requireNonNullElseGet(
                reportDispatcher,
                () -> new ReportDispatcher(this.config,
                                           null == llmClient
                                           ? new StructuredNotesGenerator()
                                           : new LlmNotesGenerator(llmClient, this.config, effectivePrompts,
                                                                   new StructuredNotesGenerator())));
        this.sessionReaper = null == sessionReapInterval
                             ? null
                             : new SessionReaper(this.sessionStore,
                                                 this.config.getSessionIdleTimeout(),
                                                 sessionReapInterval);
    }

    public HoneypotReply handle(final HoneypotRequest request) {
        try {
            requestValidator.validate(request);
        }
        catch (RequestValidationError e) {
            log.warn("Rejecting invalid request: {}", e.getMessage());
            return HoneypotReply.error("Invalid request: " + e.getMessage());
        }
        try {
            return sessionStore.withSession(request.getSessionId(), session -> handleTurn(session, request));
        }
        catch (RuntimeException e) {
            final var rootCause = HoneypotUtils.rootCause(e);
            log.error("Error handling message for session {}: {}", request.getSessionId(), rootCause.getMessage(), e);
            return HoneypotReply.error("Internal error: " + rootCause.getMessage());
        }
    }

    @Override
    public void close() {
        if (null != sessionReaper) {
            sessionReaper.close();
        }
    }

    private HoneypotReply handleTurn(Session session, HoneypotRequest request) {
        if (session.seedHistory(request.getConversationHistory())) {
            log.debug("Session {}: seeded {} history messages", session.getId(),
                      request.getConversationHistory().size());
        }
        final var message = request.getMessage();
        if (session.isEnded()) {
            session.append(message);
            log.info("Session {} has already ended, not replying", session.getId());
            reportDispatcher.maybeSend(session);
            return HoneypotReply.silent();
        }

        final var history = session.getHistory();
        final var verdict = detectionEngine.classify(message.getText(), history);
        session.recordVerdict(verdict);
        session.append(message);
        log.info("Session {}: malicious={}, confidence={}, method={}, scamDetected={}",
                 session.getId(), verdict.isMalicious(), verdict.getConfidence(), verdict.getMethod(),
                 session.isScamDetected());
        if (!session.isScamDetected()) {
            return HoneypotReply.silent();
        }

        final var added = session.mergeIntelligence(extract(session, message.getText(), history));
        annotateArtifacts(session, added);

        final var decision = strategyPlanner.decide(session, message.getText());
        if (!decision.isShouldEngage()) {
            session.markEnded();
            reportDispatcher.maybeSend(session);
            return HoneypotReply.silent();
        }

        var reply = generateReply(ReplyContext.builder()
                                          .sessionId(session.getId())
                                          .goal(decision.getGoal())
                                          .message(message)
                                          .recentHistory(history)
                                          .intelligence(session.getIntelligence())
                                          .build());
        final var gateResult = responseGate.validate(reply);
        if (!gateResult.isOk()) {
            log.warn("Session {}: reply replaced. {}", session.getId(), gateResult.getViolation());
            session.annotate("Safety guard triggered: " + gateResult.getViolation());
            reply = config.getFallbackReply();
        }
        session.append(Message.fromAgent(reply));
        if (decision.getGoal() == ConversationGoal.WRAP_UP) {
            session.markEnded();
            reportDispatcher.maybeSend(session);
        }
        return HoneypotReply.success(reply);
    }

    private ExtractedIntelligence extract(Session session, String text, List<Message> history) {
        try {
            return extractor.extract(text, history);
        }
        catch (RuntimeException e) {
            log.error("Session {}: extraction failed, continuing without new intelligence: {}",
                      session.getId(), HoneypotUtils.rootCause(e).getMessage(), e);
            return ExtractedIntelligence.empty();
        }
    }

    private String generateReply(ReplyContext context) {
        try {
            final var reply = replyGenerator.generate(context);
            if (StringUtils.isNotBlank(reply)) {
                return reply;
            }
            log.warn("Session {}: reply generator returned nothing", context.getSessionId());
        }
        catch (RuntimeException e) {
            log.error("Session {}: reply generation failed: {}",
                      context.getSessionId(), HoneypotUtils.rootCause(e).getMessage(), e);
        }
        return config.getFallbackReply();
    }

    private static void annotateArtifacts(Session session, ExtractedIntelligence added) {
        added.getPhishingLinks().forEach(link -> session.annotate("Extracted phishing link: " + link));
        added.getUpiIds().forEach(upiId -> session.annotate("Extracted UPI ID: " + upiId));
        added.getPhoneNumbers().forEach(phone -> session.annotate("Extracted phone number: " + phone));
        added.getBankAccounts().forEach(account -> session.annotate("Extracted bank account: " + account));
    }
}
