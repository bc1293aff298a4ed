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

import com.phonepe.honeypotai.core.errors.ErrorType;
import com.phonepe.honeypotai.core.errors.HoneypotError;
import lombok.Value;

/**
 * Outcome of a report dispatch attempt
 */
@Value
public class DispatchResult {
    public enum Outcome {
        SENT,
        ALREADY_SENT,
        NOT_ELIGIBLE,
        DISABLED,
        FAILED,
    }

    Outcome outcome;
    HoneypotError error;

    public static DispatchResult sent() {
        return new DispatchResult(Outcome.SENT, HoneypotError.success());
    }

    public static DispatchResult alreadySent() {
        return new DispatchResult(Outcome.ALREADY_SENT, HoneypotError.success());
    }

    public static DispatchResult notEligible(final String sessionId, final String reason) {
        return new DispatchResult(Outcome.NOT_ELIGIBLE,
                                  HoneypotError.error(ErrorType.REPORT_NOT_ELIGIBLE, sessionId, reason));
    }

    public static DispatchResult disabled() {
        return new DispatchResult(Outcome.DISABLED, HoneypotError.error(ErrorType.REPORT_DISABLED));
    }

    public static DispatchResult failed(final HoneypotError error) {
        return new DispatchResult(Outcome.FAILED, error);
    }

    /**
     * True once the report is known to be with the collector
     */
    public boolean isSuccess() {
        return outcome == Outcome.SENT || outcome == Outcome.ALREADY_SENT;
    }
}
