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

import java.time.Instant;

/**
 * Cached value together with its absolute expiry time.
 *
 * <p>
 * The entry is present while {@code now <= expiresAt}. Past that point it is
 * logically absent even if the owning cache has not removed it yet.
 */
record CacheEntry<V>(V value, Instant expiresAt) {

    boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
