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

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically drops idle sessions from a store
 */
@Slf4j
public class SessionReaper implements AutoCloseable {
    private final ScheduledExecutorService executorService;

    public SessionReaper(SessionStore store, Duration maxIdle, Duration interval) {
        Objects.requireNonNull(store);
        Objects.requireNonNull(maxIdle);
        this.executorService = Executors.newSingleThreadScheduledExecutor(runnable -> {
            final var thread = new Thread(runnable, "honeypot-session-reaper");
            thread.setDaemon(true);
            return thread;
        });
        executorService.scheduleWithFixedDelay(() -> {
            try {
                store.evictIdle(maxIdle);
            }
            catch (RuntimeException e) {
                log.error("Error evicting idle sessions: {}", e.getMessage(), e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Session reaper started. Max idle: {}, interval: {}", maxIdle, interval);
    }

    @Override
    public void close() {
        executorService.shutdownNow();
        log.info("Session reaper stopped");
    }
}
