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

package com.phonepe.honeypotai.core.prompts;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.apache.commons.text.StringSubstitutor;

import java.util.Map;

/**
 * Prompt templates used for model calls. Placeholders use the ${name} syntax.
 */
@Value
@Builder
@With
@AllArgsConstructor(access = AccessLevel.PUBLIC)
public class HoneypotPrompts {
    public static final String DEFAULT_CLASSIFICATION_SYSTEM_PROMPT = """
            You are a fraud analyst reviewing chat and SMS messages received by Indian bank and UPI customers.
            Decide whether the message is part of a scam. Typical scams impersonate banks or government offices,
            threaten account blocking or suspension, create urgency, ask for UPI ids, OTPs, PINs or card details,
            push the reader to click links, or promise prizes, lotteries, refunds or rewards.
            Respond only with a JSON object of the form {"is_scam": true|false, "confidence": 0.0-1.0, "reason": "..."}.""";

    public static final String DEFAULT_CLASSIFICATION_PROMPT = """
            Message to classify:
            ${message}

            Recent conversation (oldest first):
            ${history}

            Artifacts found in the message:
            ${artifacts}

            Return the JSON object only.""";

    public static final String DEFAULT_END_DETECTION_PROMPT = """
            Below is the latest message from the other party in a chat conversation, followed by the recent turns.
            Is the other party clearly trying to end the conversation (saying goodbye, thanking and leaving,
            stating they are done)? Asking for something, threatening or giving instructions is not ending.

            Latest message:
            ${message}

            Recent conversation (oldest first):
            ${history}

            Answer with a single word: YES or NO.""";

    public static final String DEFAULT_PERSONA_SYSTEM_PROMPT = """
            You are playing an ordinary, slightly anxious bank customer chatting on your phone. You are polite, not
            very technical and you take time to understand instructions. Never reveal or hint that you are an
            automated assistant and never talk about detecting, analysing or collecting anything. Never share real
            personal details, OTPs, PINs or passwords. Keep replies short: one or two sentences, plain text only.""";

    public static final String DEFAULT_PERSONA_PROMPT = """
            What you want to achieve with this reply:
            ${goalHint}

            Conversation so far (oldest first):
            ${history}

            Their latest message:
            ${message}

            Write only your reply.""";

    public static final String DEFAULT_REPORT_NOTES_PROMPT = """
            Summarise the following conversation with a suspected fraudster for an investigator in at most three
            sentences. Mention the tactics used (urgency, impersonation, reward bait, payment or credential
            requests) and the artifacts they shared.

            Conversation (oldest first):
            ${history}

            Artifacts collected:
            ${artifacts}

            Write plain text only.""";

    public static final HoneypotPrompts DEFAULT = HoneypotPrompts.builder().build();

    @Builder.Default
    String classificationSystemPrompt = DEFAULT_CLASSIFICATION_SYSTEM_PROMPT;
    @Builder.Default
    String classificationPrompt = DEFAULT_CLASSIFICATION_PROMPT;
    @Builder.Default
    String endDetectionPrompt = DEFAULT_END_DETECTION_PROMPT;
    @Builder.Default
    String personaSystemPrompt = DEFAULT_PERSONA_SYSTEM_PROMPT;
    @Builder.Default
    String personaPrompt = DEFAULT_PERSONA_PROMPT;
    @Builder.Default
    String reportNotesPrompt = DEFAULT_REPORT_NOTES_PROMPT;

    public static String render(final String template, final Map<String, Object> values) {
        return StringSubstitutor.replace(template, values);
    }
}
