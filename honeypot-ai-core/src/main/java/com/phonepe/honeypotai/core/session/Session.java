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

package com.phonepe.honeypotai.core.session;

import com.google.common.base.Preconditions;
import com.phonepe.honeypotai.core.model.DetectionVerdict;
import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.model.Message;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one conversation. Mutators must be called while holding {@link #getLock()}, which
 * {@link SessionStore#withSession} takes care of.
 */
public class Session {
    @Getter
    private final String id;
    @Getter
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final List<Message> history = new ArrayList<>();
    private final List<String> annotations = new ArrayList<>();
    @Getter
    private final Instant createdAt;

    @Getter
    private volatile ExtractedIntelligence intelligence = ExtractedIntelligence.empty();
    @Getter
    private volatile DetectionVerdict latestVerdict;
    @Getter
    private volatile boolean scamDetected;
    @Getter
    private volatile int messagesExchanged;
    @Getter
    private volatile boolean ended;
    @Getter
    private volatile ReportState reportState = ReportState.NOT_SENT;
    @Getter
    private volatile Instant updatedAt;

    public Session(String id, Clock clock) {
        this.id = Objects.requireNonNull(id);
        this.clock = Objects.requireNonNull(clock);
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    public List<Message> getHistory() {
        return List.copyOf(history);
    }

    public List<String> getAnnotations() {
        return List.copyOf(annotations);
    }

    /**
     * Loads history known to the caller. Only applies to a session that has no history yet and does not count
     * towards exchanged messages.
     */
    public boolean seedHistory(final List<Message> messages) {
        checkLocked();
        if (!history.isEmpty() || null == messages || messages.isEmpty()) {
            return false;
        }
        history.addAll(messages);
        touch();
        return true;
    }

    public void append(final Message message) {
        checkLocked();
        history.add(Objects.requireNonNull(message));
        messagesExchanged++;
        touch();
    }

    /**
     * Stores the verdict for audit. A session once classified malicious stays malicious.
     */
    public void recordVerdict(final DetectionVerdict verdict) {
        checkLocked();
        latestVerdict = Objects.requireNonNull(verdict);
        if (verdict.isMalicious()) {
            scamDetected = true;
        }
        touch();
    }

    /**
     * Merges newly extracted intelligence
     * @return entries that were not known before
     */
    public ExtractedIntelligence mergeIntelligence(final ExtractedIntelligence extracted) {
        checkLocked();
        final var current = intelligence;
        final var added = extracted.minus(current);
        if (added.hasAny()) {
            intelligence = current.merge(added);
            touch();
        }
        return added;
    }

    public void annotate(final String note) {
        checkLocked();
        annotations.add(note);
        touch();
    }

    public void markEnded() {
        checkLocked();
        ended = true;
        touch();
    }

    /**
     * Moves the report state to SENT
     * @return false if it was already sent
     */
    public boolean markReportSent() {
        checkLocked();
        if (reportState == ReportState.SENT) {
            return false;
        }
        reportState = ReportState.SENT;
        touch();
        return true;
    }

    public boolean isReportSent() {
        return reportState == ReportState.SENT;
    }

    private void touch() {
        updatedAt = clock.instant();
    }

    private void checkLocked() {
        Preconditions.checkState(lock.isHeldByCurrentThread(), "Session %s mutated without holding its lock", id);
    }
}
