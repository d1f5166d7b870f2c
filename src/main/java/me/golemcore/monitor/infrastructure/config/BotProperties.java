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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link CacheProperties} - status cache time-to-live</li>
 * <li>{@link HistoryProperties} - per-user conversation history bounds</li>
 * <li>{@link TelegramProperties} - Telegram channel and allowed users</li>
 * <li>{@link SentryProperties} - Sentry organization and projects</li>
 * <li>{@link LlmProperties} - Anthropic model settings</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * </ul>
 *
 * <p>
 * Values are read once when the state and adapter beans are built; changing
 * them requires a restart.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private CacheProperties cache = new CacheProperties();
    private HistoryProperties history = new HistoryProperties();
    private TelegramProperties telegram = new TelegramProperties();
    private SentryProperties sentry = new SentryProperties();
    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private List<String> websites = new ArrayList<>();

    // ==================== STATE ====================

    @Data
    public static class CacheProperties {
        private long ttlMinutes = 5;
    }

    @Data
    public static class HistoryProperties {
        private int maxMessages = 5;
        /** Fractional values are allowed, e.g. 0.5 for thirty minutes. */
        private double expiryHours = 1.0;
    }

    // ==================== CHANNELS ====================

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
        private List<String> allowFrom = new ArrayList<>();
    }

    // ==================== UPSTREAMS ====================

    @Data
    public static class SentryProperties {
        private String token;
        private String org;
        private String domain = "sentry.io";
        private List<String> projects = new ArrayList<>();
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String model = "claude-3-sonnet-20240229";
        private int maxTokens = 1024;
        private long timeoutMs = 60000;
        private String systemPrompt = "You are a helpful assistant specializing in monitoring project status and issues. "
                + "Analyze the provided website status and Sentry issues to give concise, relevant answers. "
                + "Format the answer so it renders with Telegram Markdown and use appropriate emojis. "
                + "Consider the conversation history when providing responses to maintain context. "
                + "Make the culprit or reason obvious, for example a 500 response in a specific module.";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private long probeTimeout = 10000;
    }
}
