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

import com.phonepe.honeypotai.core.TestUtils;
import com.phonepe.honeypotai.core.model.ExtractedIntelligence;
import com.phonepe.honeypotai.core.model.Message;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests {@link InMemorySessionStore}
 */
class InMemorySessionStoreTest {

    @Test
    @SneakyThrows
    void testConcurrentTurnsOnSameSessionAreSerialized() {
        final var store = new InMemorySessionStore();
        final var executor = Executors.newFixedThreadPool(8);
        try {
            final var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < 8; t++) {
                final var thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        final var index = i;
                        store.withSession("shared", session -> {
                            session.append(Message.fromCounterpart("m" + thread + "-" + index));
                            session.mergeIntelligence(TestUtils.upi("u" + (index % 10) + "@ybl"));
                            return null;
                        });
                    }
                }));
            }
            for (final var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        }
        finally {
            executor.shutdownNow();
        }
        final var session = store.find("shared").orElseThrow();
        assertEquals(800, session.getMessagesExchanged());
        assertEquals(800, session.getHistory().size());
        assertEquals(10, session.getIntelligence().getUpiIds().size());
    }

    @Test
    @SneakyThrows
    void testDifferentSessionsDoNotBlockEachOther() {
        final var store = new InMemorySessionStore();
        final var holding = new CountDownLatch(1);
        final var release = new CountDownLatch(1);
        final var blocker = CompletableFuture.runAsync(() -> store.withSession("a", session -> {
            holding.countDown();
            try {
                return release.await(10, TimeUnit.SECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }));
        assertTrue(holding.await(5, TimeUnit.SECONDS));
        final var other = CompletableFuture.supplyAsync(
                () -> store.withSession("b", session -> session.getId()));
        assertEquals("b", other.get(2, TimeUnit.SECONDS));
        release.countDown();
        blocker.get(5, TimeUnit.SECONDS);
    }

    @Test
    void testSessionCreatedOnceAndFound() {
        final var store = new InMemorySessionStore();
        final var first = store.withSession("s1", session -> session);
        final var second = store.withSession("s1", session -> session);
        assertSame(first, second);
        assertTrue(store.find("s1").isPresent());
        assertFalse(store.find("s2").isPresent());
        assertTrue(store.delete("s1"));
        assertEquals(0, store.size());
    }

    @Test
    void testEvictIdle() {
        final var clock = new TestUtils.MutableClock(Instant.parse("2026-01-21T10:00:00Z"));
        final var store = new InMemorySessionStore(clock);
        TestUtils.prepare(store, "old", true, 2, ExtractedIntelligence.empty());
        clock.advance(Duration.ofHours(2));
        TestUtils.prepare(store, "fresh", true, 2, ExtractedIntelligence.empty());
        clock.advance(Duration.ofMinutes(30));

        assertEquals(1, store.evictIdle(Duration.ofHours(1)));
        assertEquals(List.of("fresh"), store.find("fresh").map(Session::getId).stream().toList());
        assertFalse(store.find("old").isPresent());
    }

    @Test
    @SneakyThrows
    void testEvictSkipsSessionsInUse() {
        final var clock = new TestUtils.MutableClock(Instant.parse("2026-01-21T10:00:00Z"));
        final var store = new InMemorySessionStore(clock);
        TestUtils.prepare(store, "busy", true, 1, ExtractedIntelligence.empty());
        clock.advance(Duration.ofHours(2));
        final var holding = new CountDownLatch(1);
        final var release = new CountDownLatch(1);
        final var user = CompletableFuture.runAsync(() -> store.withSession("busy", session -> {
            holding.countDown();
            try {
                return release.await(10, TimeUnit.SECONDS);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }));
        assertTrue(holding.await(5, TimeUnit.SECONDS));
        assertEquals(0, store.evictIdle(Duration.ofHours(1)));
        release.countDown();
        user.get(5, TimeUnit.SECONDS);
        assertTrue(store.find("busy").isPresent());
    }
}
