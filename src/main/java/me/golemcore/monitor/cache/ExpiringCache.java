package me.golemcore.monitor.cache;

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

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory cache where every entry expires a fixed time-to-live
 * after it was stored.
 *
 * <p>
 * Expiry is enforced lazily:
 * <ul>
 * <li>{@link #get(String)} treats an entry as present while
 * {@code now <= expiresAt}</li>
 * <li>an expired entry found by {@code get} is removed in the same atomic
 * step</li>
 * <li>there is no background sweeper; stale entries that are never read again
 * stay until {@link #clear()}</li>
 * </ul>
 *
 * <p>
 * The check-and-evict in {@code get} runs inside
 * {@link ConcurrentHashMap#computeIfPresent}, so a concurrent {@code set} for
 * the same key is either fully applied before the check or after the eviction,
 * never in between.
 *
 * <p>
 * Values are stored as given. Callers that cache collections should store
 * immutable copies.
 *
 * @param <V>
 *            cached value type
 * @since 1.0
 */
public class ExpiringCache<V> {

    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    public ExpiringCache(Duration ttl, Clock clock) {
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(clock, "clock");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got " + ttl);
        }
        try {
            clock.instant().plus(ttl);
        } catch (DateTimeException | ArithmeticException e) {
            throw new IllegalArgumentException("Cache TTL is too large, got " + ttl, e);
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Store a value, replacing any previous entry for the key.
     *
     * @throws NullPointerException
     *             if {@code key} or {@code value} is null; a cached null could not
     *             be told apart from a miss by {@link #get(String)}
     */
    public void set(String key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, new CacheEntry<>(value, clock.instant().plus(ttl)));
    }

    /**
     * Get a value if it exists and has not expired. Expired entries are removed.
     * A null key is a miss.
     */
    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        CacheEntry<V> entry = entries.computeIfPresent(key,
                (entryKey, existing) -> existing.isExpired(now) ? null : existing);
        return entry != null ? Optional.of(entry.value()) : Optional.empty();
    }

    /**
     * Remove all entries.
     */
    public void clear() {
        entries.clear();
    }

    /**
     * Number of physically retained entries, including expired ones that have not
     * been looked up since they expired.
     */
    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }
}
