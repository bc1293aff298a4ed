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
import com.google.common.base.Strings;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process local session store. State does not survive restarts.
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore() {
        this(Clock.systemUTC());
    }

    public InMemorySessionStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public <T> T withSession(String sessionId, Function<Session, T> action) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(sessionId), "Session id is required");
        while (true) {
            final var session = sessions.computeIfAbsent(sessionId, id -> {
                log.debug("Creating session {}", id);
                return new Session(id, clock);
            });
            session.getLock().lock();
            try {
                //Evicted between lookup and lock, pick up the fresh one
                if (sessions.get(sessionId) != session) {
                    continue;
                }
                return action.apply(session);
            }
            finally {
                session.getLock().unlock();
            }
        }
    }

    @Override
    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public boolean delete(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    @Override
    public int evictIdle(Duration maxIdle) {
        final var cutoff = clock.instant().minus(maxIdle);
        var evicted = 0;
        for (final var session : sessions.values()) {
            if (!session.getLock().tryLock()) {
                continue;
            }
            try {
                if (session.getUpdatedAt().isBefore(cutoff) && sessions.remove(session.getId(), session)) {
                    evicted++;
                }
            }
            finally {
                session.getLock().unlock();
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle sessions", evicted);
        }
        return evicted;
    }

    @Override
    public int size() {
        return sessions.size();
    }
}
