package me.golemcore.monitor.history;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-user conversation history bounded by message count and by age.
 *
 * <p>
 * Each user owns an {@link ExchangeBuffer} of capacity {@code maxMessages}.
 * Exchanges older than {@code expiryWindow} are discarded on every read and
 * write for that user; a user whose buffer becomes empty is removed from the
 * map. There is no background thread: {@link #cleanupAll()} is the hook for
 * callers that want to prune users who are not currently active.
 *
 * <p>
 * Every operation on a user runs inside {@link ConcurrentHashMap#compute}
 * for that user id. Calls for the same user are therefore serialized and each
 * one is applied as a whole, while calls for different users proceed
 * independently.
 *
 * @since 1.0
 */
@Slf4j
public class SessionHistory {

    private final int maxMessages;
    private final Duration expiryWindow;
    private final Clock clock;
    private final Map<Long, ExchangeBuffer> sessions = new ConcurrentHashMap<>();

    public SessionHistory(int maxMessages, Duration expiryWindow, Clock clock) {
        Objects.requireNonNull(expiryWindow, "expiryWindow");
        Objects.requireNonNull(clock, "clock");
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("History max messages must be positive, got " + maxMessages);
        }
        if (expiryWindow.isZero() || expiryWindow.isNegative()) {
            throw new IllegalArgumentException("History expiry window must be positive, got " + expiryWindow);
        }
        this.maxMessages = maxMessages;
        this.expiryWindow = expiryWindow;
        this.clock = clock;
    }

    /**
     * Record a query and its response for a user, pruning expired exchanges first
     * and dropping the oldest one when the buffer is full.
     */
    public void addMessage(long userId, String query, String response) {
        sessions.compute(userId, (id, buffer) -> {
            Instant now = clock.instant();
            ExchangeBuffer target = buffer;
            if (target != null) {
                prune(id, target, now);
            }
            if (target == null) {
                target = new ExchangeBuffer(maxMessages);
            }
            target.append(new Exchange(query, response, now));
            return target;
        });
    }

    /**
     * Get the user's unexpired exchanges, oldest first. The returned list is an
     * immutable snapshot.
     */
    public List<Exchange> getHistory(long userId) {
        AtomicReference<List<Exchange>> snapshot = new AtomicReference<>(List.of());
        sessions.computeIfPresent(userId, (id, buffer) -> {
            prune(id, buffer, clock.instant());
            if (buffer.isEmpty()) {
                return null;
            }
            snapshot.set(buffer.snapshot());
            return buffer;
        });
        return snapshot.get();
    }

    /**
     * Forget everything recorded for the user.
     */
    public void clearHistory(long userId) {
        if (sessions.remove(userId) != null) {
            log.debug("Cleared history for user {}", userId);
        }
    }

    /**
     * Prune every known user and drop users left without exchanges.
     */
    public void cleanupAll() {
        Instant now = clock.instant();
        AtomicInteger removedUsers = new AtomicInteger();
        for (Long userId : sessions.keySet()) {
            sessions.computeIfPresent(userId, (id, buffer) -> {
                prune(id, buffer, now);
                if (buffer.isEmpty()) {
                    removedUsers.incrementAndGet();
                    return null;
                }
                return buffer;
            });
        }
        if (removedUsers.get() > 0) {
            log.debug("History cleanup removed {} idle users", removedUsers);
        }
    }

    /**
     * Number of users currently holding history, expired or not.
     */
    public int userCount() {
        return sessions.size();
    }

    public int getMaxMessages() {
        return maxMessages;
    }

    public Duration getExpiryWindow() {
        return expiryWindow;
    }

    private void prune(long userId, ExchangeBuffer buffer, Instant now) {
        int removed = buffer.removeOlderThan(now.minus(expiryWindow));
        if (removed > 0) {
            log.trace("Pruned {} expired exchanges for user {}", removed, userId);
        }
    }
}
