package me.golemcore.monitor.infrastructure.config;

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

import me.golemcore.monitor.cache.ExpiringCache;
import me.golemcore.monitor.domain.model.TrackerIssue;
import me.golemcore.monitor.domain.model.WebsiteStatus;
import me.golemcore.monitor.history.SessionHistory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Builds the in-memory state shared by all request handlers: one expiring
 * cache per upstream payload shape and the per-user conversation history.
 *
 * <p>
 * Invalid bounds (non-positive TTL, capacity or window) fail here, once, at
 * startup.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class StateConfiguration {

    private static final long SECONDS_PER_HOUR = 3600;

    private final BotProperties properties;

    @Bean
    public ExpiringCache<List<WebsiteStatus>> websiteStatusCache(Clock clock) {
        return new ExpiringCache<>(cacheTtl(), clock);
    }

    @Bean
    public ExpiringCache<List<TrackerIssue>> issueCache(Clock clock) {
        return new ExpiringCache<>(cacheTtl(), clock);
    }

    @Bean
    public SessionHistory sessionHistory(Clock clock) {
        BotProperties.HistoryProperties history = properties.getHistory();
        Duration window = expiryWindow(history.getExpiryHours());
        log.info("Session history: max {} messages, expiry window {}", history.getMaxMessages(), window);
        return new SessionHistory(history.getMaxMessages(), window, clock);
    }

    private Duration cacheTtl() {
        return Duration.ofMinutes(properties.getCache().getTtlMinutes());
    }

    static Duration expiryWindow(double hours) {
        return Duration.ofMillis(Math.round(hours * SECONDS_PER_HOUR * 1000));
    }
}
