package me.golemcore.monitor.security;

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

import me.golemcore.monitor.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates users against the Telegram allowlist.
 *
 * <p>
 * Only user ids listed in {@code bot.telegram.allow-from} may talk to the bot.
 * An empty list denies everyone (fail-closed), since the bot exposes internal
 * project status.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AllowlistValidator {

    private final BotProperties properties;

    /**
     * Check if a user is allowed to use the bot.
     */
    public boolean isAllowed(String userId) {
        log.trace("[Security] Allowlist check: user={}", userId);

        List<String> allowedUsers = properties.getTelegram().getAllowFrom();
        if (allowedUsers == null || allowedUsers.isEmpty()) {
            log.warn("[Security] Unauthorized: user={} (allowlist is empty)", userId);
            return false;
        }

        boolean allowed = allowedUsers.stream()
                .map(String::trim)
                .anyMatch(allowedId -> allowedId.equals(userId));
        if (!allowed) {
            log.warn("[Security] Unauthorized: user={}", userId);
        }
        return allowed;
    }
}
