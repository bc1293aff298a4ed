package com.phonepe.honeypotai.core.config;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.phonepe.honeypotai.core.utils.EnvLoader;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Tunables for the engagement pipeline. Missing values fall back to the defaults below.
 */
@Value
@With
public class HoneypotConfig {
    public static final double DEFAULT_DECISION_THRESHOLD = 0.7;
    public static final int DEFAULT_MIN_MESSAGES_FOR_REPORT = 5;
    public static final int DEFAULT_MAX_MESSAGES_PER_SESSION = 50;
    public static final List<String> DEFAULT_CONVERSATION_END_KEYWORDS
            = List.of("bye", "goodbye", "thank you", "thanks", "done", "finished");
    public static final Duration DEFAULT_LLM_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REPORT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SESSION_IDLE_TIMEOUT = Duration.ofHours(24);
    public static final String DEFAULT_FALLBACK_REPLY = "I'm not sure how to respond to that. Can you clarify?";

    public static final HoneypotConfig DEFAULT = HoneypotConfig.builder().build();

    /**
     * Score at or above which a message is considered malicious. Used by both the model and rule tiers.
     */
    double decisionThreshold;

    /**
     * Messages a session must exchange before it becomes eligible for reporting
     */
    int minMessagesForReport;

    /**
     * Hard cap on messages in a session after which we stop engaging
     */
    int maxMessagesPerSession;

    /**
     * Lower-cased phrases that signal the counterpart is closing the conversation
     */
    List<String> conversationEndKeywords;

    boolean llmEndDetectionEnabled;

    Duration llmTimeout;

    /**
     * Collector endpoint for the final report. Dispatch is disabled when absent.
     */
    String reportUrl;

    Duration reportTimeout;

    Duration sessionIdleTimeout;

    /**
     * Neutral reply used when a generated reply is rejected by the safety gate
     */
    String fallbackReply;

    @Builder
    public HoneypotConfig(
            Double decisionThreshold,
            int minMessagesForReport,
            int maxMessagesPerSession,
            List<String> conversationEndKeywords,
            Boolean llmEndDetectionEnabled,
            Duration llmTimeout,
            String reportUrl,
            Duration reportTimeout,
            Duration sessionIdleTimeout,
            String fallbackReply) {
        this.decisionThreshold = Objects.requireNonNullElse(decisionThreshold, DEFAULT_DECISION_THRESHOLD);
        Preconditions.checkArgument(this.decisionThreshold >= 0 && this.decisionThreshold <= 1,
                                    "Decision threshold must be in [0, 1]");
        this.minMessagesForReport = minMessagesForReport <= 0
                                    ? DEFAULT_MIN_MESSAGES_FOR_REPORT
                                    : minMessagesForReport;
        this.maxMessagesPerSession = maxMessagesPerSession <= 0
                                     ? DEFAULT_MAX_MESSAGES_PER_SESSION
                                     : maxMessagesPerSession;
        this.conversationEndKeywords = Objects.requireNonNullElse(conversationEndKeywords,
                                                                  DEFAULT_CONVERSATION_END_KEYWORDS)
                .stream()
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .filter(keyword -> !keyword.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        this.llmEndDetectionEnabled = Objects.requireNonNullElse(llmEndDetectionEnabled, true);
        this.llmTimeout = Objects.requireNonNullElse(llmTimeout, DEFAULT_LLM_TIMEOUT);
        this.reportUrl = Strings.emptyToNull(reportUrl);
        this.reportTimeout = Objects.requireNonNullElse(reportTimeout, DEFAULT_REPORT_TIMEOUT);
        this.sessionIdleTimeout = Objects.requireNonNullElse(sessionIdleTimeout, DEFAULT_SESSION_IDLE_TIMEOUT);
        this.fallbackReply = Objects.requireNonNullElse(Strings.emptyToNull(fallbackReply), DEFAULT_FALLBACK_REPLY);
    }

    public boolean isReportingEnabled() {
        return reportUrl != null;
    }

    /**
     * Builds a config from HONEYPOT_* environment variables
     */
    public static HoneypotConfig fromEnvironment() {
        final var endKeywords = EnvLoader.readEnv("HONEYPOT_CONVERSATION_END_KEYWORDS", null);
        return HoneypotConfig.builder()
                .decisionThreshold(Double.valueOf(EnvLoader.readEnv("HONEYPOT_DECISION_THRESHOLD",
                                                                    String.valueOf(DEFAULT_DECISION_THRESHOLD))))
                .minMessagesForReport(Integer.parseInt(
                        EnvLoader.readEnv("HONEYPOT_MIN_MESSAGES_FOR_REPORT",
                                          String.valueOf(DEFAULT_MIN_MESSAGES_FOR_REPORT))))
                .maxMessagesPerSession(Integer.parseInt(
                        EnvLoader.readEnv("HONEYPOT_MAX_MESSAGES_PER_SESSION",
                                          String.valueOf(DEFAULT_MAX_MESSAGES_PER_SESSION))))
                .conversationEndKeywords(null == endKeywords
                                         ? null
                                         : Splitter.on(',').trimResults().omitEmptyStrings()
                                                 .splitToList(endKeywords))
                .llmEndDetectionEnabled(Boolean.valueOf(EnvLoader.readEnv("HONEYPOT_LLM_END_DETECTION", "true")))
                .llmTimeout(Duration.ofMillis(Long.parseLong(
                        EnvLoader.readEnv("HONEYPOT_LLM_TIMEOUT_MS",
                                          String.valueOf(DEFAULT_LLM_TIMEOUT.toMillis())))))
                .reportUrl(EnvLoader.readEnv("HONEYPOT_REPORT_URL", null))
                .reportTimeout(Duration.ofMillis(Long.parseLong(
                        EnvLoader.readEnv("HONEYPOT_REPORT_TIMEOUT_MS",
                                          String.valueOf(DEFAULT_REPORT_TIMEOUT.toMillis())))))
                .sessionIdleTimeout(Duration.ofMinutes(Long.parseLong(
                        EnvLoader.readEnv("HONEYPOT_SESSION_IDLE_TIMEOUT_MINUTES",
                                          String.valueOf(DEFAULT_SESSION_IDLE_TIMEOUT.toMinutes())))))
                .build();
    }
}
