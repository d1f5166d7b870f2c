package me.golemcore.monitor.adapter.outbound.llm;

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

import me.golemcore.monitor.domain.model.LlmRequest;
import me.golemcore.monitor.domain.model.LlmResponse;
import me.golemcore.monitor.infrastructure.config.BotProperties;
import me.golemcore.monitor.port.outbound.LlmPort;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Anthropic (Claude) adapter built on langchain4j.
 *
 * <p>
 * The chat model is created lazily on first use from {@code bot.llm.*}. When
 * no API key is configured the adapter reports itself unavailable and every
 * call fails, which the conversation pipeline turns into a retry-later reply.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnthropicLlmAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    static final String EMPTY_RESPONSE = "No response generated";

    private final BotProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    /**
     * Package-private setter for tests to inject a mock ChatModel.
     */
    void setChatModel(ChatModel chatModel) {
        this.chatModel = chatModel;
        this.initialized = true;
    }

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        BotProperties.LlmProperties config = properties.getLlm();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("Anthropic API key not configured, LLM adapter unavailable");
            return;
        }
        this.chatModel = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxTokens(config.getMaxTokens())
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .build();
        initialized = true;
        log.info("Anthropic adapter initialized with model: {}", config.getModel());
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ANTHROPIC;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Anthropic adapter not available");
            }

            List<ChatMessage> messages = new ArrayList<>();
            if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
                messages.add(SystemMessage.from(request.getSystemPrompt()));
            }
            messages.add(UserMessage.from(request.getUserMessage()));

            log.debug("Sending request to Anthropic ({} chars)", request.getUserMessage().length());
            ChatResponse response = chatModel.chat(messages);
            return toResponse(response);
        });
    }

    private LlmResponse toResponse(ChatResponse response) {
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        return LlmResponse.builder()
                .content(text != null && !text.isBlank() ? text : EMPTY_RESPONSE)
                .model(getCurrentModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                .build();
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }
}
