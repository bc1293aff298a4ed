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

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Keyed store of live sessions with per-session mutual exclusion
 */
public interface SessionStore {
    /**
     * Runs the action while holding the lock of the session with the given id, creating the session if needed.
     * Actions on different ids never block each other.
     */
    <T> T withSession(final String sessionId, final Function<Session, T> action);

    Optional<Session> find(final String sessionId);

    boolean delete(final String sessionId);

    /**
     * Removes sessions that have not been updated within {@code maxIdle} and are not in use
     * @return number of sessions removed
     */
    int evictIdle(final Duration maxIdle);

    int size();
}
