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

import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.session.Session;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic notes built from the verdict, artifact counts and session annotations
 */
public class StructuredNotesGenerator implements ReportNotesGenerator {
    public static final String NO_NOTES = "No specific notes";

    @Override
    public String notes(Session session) {
        final var parts = new ArrayList<String>();
        final var verdict = session.getLatestVerdict();
        if (null != verdict && !verdict.getReason().isEmpty()) {
            parts.add("Detection: " + verdict.getReason());
        }
        final var counts = artifactCounts(session.getIntelligence());
        if (!counts.isEmpty()) {
            parts.add("Artifacts: " + String.join(", ", counts));
        }
        parts.addAll(session.getAnnotations());
        return parts.isEmpty() ? NO_NOTES : String.join("; ", parts);
    }

    private static List<String> artifactCounts(ExtractedIntelligence intelligence) {
        final var counts = new ArrayList<String>();
        addCount(counts, intelligence.getUpiIds().size(), "UPI ids");
        addCount(counts, intelligence.getPhoneNumbers().size(), "phone numbers");
        addCount(counts, intelligence.getPhishingLinks().size(), "links");
        addCount(counts, intelligence.getBankAccounts().size(), "bank accounts");
        return counts;
    }

    private static void addCount(List<String> counts, int count, String label) {
        if (count > 0) {
            counts.add(count + " " + label);
        }
    }
}
