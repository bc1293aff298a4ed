/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.honeypotai.core.report;

import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.llm.LlmCalls;
import com.phonepe.honeypotai.core.llm.LlmClient;
import com.phonepe.honeypotai.core.llm.LlmRequest;
import com.phonepe.honeypotai.core.prompts.HoneypotPrompts;
import com.phonepe.honeypotai.core.prompts.Transcripts;
import com.phonepe.honeypotai.core.session.Session;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;
import java.util.Objects;

/**
 * Short narrative written by the model, with the structured notes as fallback
 */
@Slf4j
public class LlmNotesGenerator implements ReportNotesGenerator {
    public static final int MAX_NOTES_LENGTH = 1000;

    private final LlmClient llmClient;
    private final HoneypotConfig config;
    private final HoneypotPrompts prompts;
    private final ReportNotesGenerator fallback;

    public LlmNotesGenerator(LlmClient llmClient,
                             HoneypotConfig config,
                             HoneypotPrompts prompts,
                             ReportNotesGenerator fallback) {
        this.llmClient = Objects.requireNonNull(llmClient);
        this.config = Objects.requireNonNull(config);
        this.prompts = Objects.requireNonNullElse(prompts, HoneypotPrompts.DEFAULT);
        this.fallback = Objects.requireNonNullElseGet(fallback, StructuredNotesGenerator::new);
    }

    @Override
    public String notes(Session session) {
        final var response = LlmCalls.call(
                llmClient,
                LlmRequest.builder()
                        .purpose("report-notes")
                        .prompt(HoneypotPrompts.render(
                                prompts.getReportNotesPrompt(),
                                Map.of("history", Transcripts.history(session.getHistory()),
                                       "artifacts", Transcripts.artifacts(session.getIntelligence()))))
                        .temperature(0.3)
                        .maxTokens(200)
                        .build(),
                config.getLlmTimeout());
        if (!response.isSuccess() || StringUtils.isBlank(response.getContent())) {
            log.warn("Session {}: could not generate notes with model ({}), using structured notes",
                     session.getId(), response.getError().getMessage());
            return fallback.notes(session);
        }
        return StringUtils.abbreviate(response.getContent().trim(), MAX_NOTES_LENGTH);
    }
}
