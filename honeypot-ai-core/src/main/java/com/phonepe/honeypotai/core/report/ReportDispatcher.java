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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.honeypotai.core.config.HoneypotConfig;
import com.phonepe.honeypotai.core.errors.ErrorType;
import com.phonepe.honeypotai.core.errors.HoneypotError;
import com.phonepe.honeypotai.core.session.Session;
import com.phonepe.honeypotai.core.utils.HoneypotUtils;
import com.phonepe.honeypotai.core.utils.JsonUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.util.Objects;
import java.util.Set;

/**
 * Posts the final report of a session to the collector, at most once per session. Failures are logged and
 * returned, never retried.
 */
@Slf4j
public class ReportDispatcher {
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final Set<Integer> SUCCESS_CODES = Set.of(200, 201);

    private final HoneypotConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final ReportNotesGenerator notesGenerator;

    public ReportDispatcher(HoneypotConfig config, ReportNotesGenerator notesGenerator) {
        this(config, null, null, notesGenerator);
    }

    public ReportDispatcher(HoneypotConfig config,
                            OkHttpClient httpClient,
                            ObjectMapper mapper,
                            ReportNotesGenerator notesGenerator) {
        this.config = Objects.requireNonNull(config);
        this.httpClient = Objects.requireNonNullElseGet(httpClient,
                                                        () -> new OkHttpClient.Builder()
                                                                .callTimeout(config.getReportTimeout())
                                                                .build());
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.notesGenerator = Objects.requireNonNullElseGet(notesGenerator, StructuredNotesGenerator::new);
    }

    public DispatchResult maybeSend(final Session session) {
        session.getLock().lock();
        try {
            if (session.isReportSent()) {
                log.debug("Report for session {} already sent", session.getId());
                return DispatchResult.alreadySent();
            }
            final var ineligibility = ineligibility(session);
            if (null != ineligibility) {
                log.debug("Session {} not eligible for report: {}", session.getId(), ineligibility);
                return DispatchResult.notEligible(session.getId(), ineligibility);
            }
            if (!config.isReportingEnabled()) {
                log.warn("Session {} is ready for reporting but no collector url is configured", session.getId());
                return DispatchResult.disabled();
            }
            return post(session, buildPayload(session));
        }
        finally {
            session.getLock().unlock();
        }
    }

    public ReportPayload buildPayload(final Session session) {
        return ReportPayload.builder()
                .sessionId(session.getId())
                .scamDetected(session.isScamDetected())
                .totalMessagesExchanged(session.getMessagesExchanged())
                .extractedIntelligence(session.getIntelligence())
                .agentNotes(notesGenerator.notes(session))
                .build();
    }

    private String ineligibility(Session session) {
        if (!session.isEnded()) {
            return "conversation has not ended";
        }
        if (!session.isScamDetected()) {
            return "no scam detected";
        }
        if (session.getMessagesExchanged() < config.getMinMessagesForReport()) {
            return "only %d of %d required messages exchanged".formatted(session.getMessagesExchanged(),
                                                                          config.getMinMessagesForReport());
        }
        if (session.getIntelligence().isEmpty()) {
            return "no intelligence extracted";
        }
        return null;
    }

    private DispatchResult post(Session session, ReportPayload payload) {
        final byte[] body;
        try {
            body = mapper.writeValueAsBytes(payload);
        }
        catch (JsonProcessingException e) {
            log.error("Error serializing report for session {}: {}", session.getId(), e.getMessage(), e);
            return DispatchResult.failed(HoneypotError.error(ErrorType.SERIALIZATION_ERROR, e));
        }
        final Request request;
        try {
            request = new Request.Builder()
                    .url(config.getReportUrl())
                    .post(RequestBody.create(body, JSON))
                    .build();
        }
        catch (IllegalArgumentException e) {
            log.error("Invalid collector url {}: {}", config.getReportUrl(), e.getMessage());
            return DispatchResult.failed(HoneypotError.error(ErrorType.REPORT_COMMUNICATION_ERROR, e));
        }
        try (final var response = httpClient.newCall(request).execute()) {
            if (SUCCESS_CODES.contains(response.code())) {
                session.markReportSent();
                log.info("Report for session {} sent. Status: {}", session.getId(), response.code());
                return DispatchResult.sent();
            }
            final var responseBody = responseBody(response);
            log.error("Collector rejected report for session {}. Status: {}, body: {}",
                      session.getId(), response.code(), responseBody);
            return DispatchResult.failed(HoneypotError.error(ErrorType.REPORT_HTTP_FAILURE,
                                                             response.code(),
                                                             responseBody));
        }
        catch (IOException e) {
            final var rootCause = HoneypotUtils.rootCause(e);
            log.error("Error sending report for session {}: {}", session.getId(), rootCause.getMessage());
            return DispatchResult.failed(HoneypotError.error(ErrorType.REPORT_COMMUNICATION_ERROR, rootCause));
        }
    }

    private static String responseBody(Response response) throws IOException {
        final var body = response.body();
        return null == body ? "" : StringUtils.abbreviate(body.string().trim(), 200);
    }
}
