package me.golemcore.monitor.adapter.inbound.telegram;

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

import me.golemcore.monitor.domain.service.MonitorConversationService;
import me.golemcore.monitor.infrastructure.config.BotProperties;
import me.golemcore.monitor.infrastructure.i18n.MessageService;
import me.golemcore.monitor.port.inbound.ChannelPort;
import me.golemcore.monitor.security.AllowlistValidator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.ActionType;
import org.telegram.telegrambots.meta.api.methods.send.SendChatAction;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Long polling for incoming messages via Telegram Bot API
 * <li>User authorization via {@link AllowlistValidator}
 * <li>Commands: {@code /start}, {@code /clear}, {@code /refresh}
 * <li>Free text handed to {@link MonitorConversationService} on the request
 * executor, so users are served concurrently
 * <li>Replies in Telegram Markdown, falling back to plain text
 * <li>Message splitting for Telegram's 4096 character limit
 * </ul>
 *
 * <p>
 * The adapter is always available as a Spring bean but only starts polling if
 * {@code bot.telegram.enabled=true} and a token is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String COMMAND_START = "start";
    private static final String COMMAND_CLEAR = "clear";
    private static final String COMMAND_REFRESH = "refresh";
    private static final String PARSE_MODE_MARKDOWN = "Markdown";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;

    private final BotProperties properties;
    private final AllowlistValidator allowlistValidator;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final MonitorConversationService conversationService;
    private final MessageService messageService;
    private final ExecutorService requestExecutor;

    private TelegramClient telegramClient;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for tests to inject a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private boolean isEnabled() {
        return properties.getTelegram().isEnabled();
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled())
            return;

        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.warn("Telegram token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("Telegram channel disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("Telegram client not initialized, cannot start");
                return;
            }

            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                log.error("Failed to start Telegram adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) {
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAuthorized(String senderId) {
        return allowlistValidator.isAllowed(senderId);
    }

    @Override
    public void consume(Update update) {
        if (!update.hasMessage() || !update.getMessage().hasText()) {
            return;
        }

        org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage = update.getMessage();
        String chatId = telegramMessage.getChatId().toString();
        long userId = telegramMessage.getFrom().getId();
        String text = telegramMessage.getText();
        log.info("Received message from user {} in chat {}", userId, chatId);

        if (!isAuthorized(String.valueOf(userId))) {
            log.warn("Unauthorized access attempt by user {}", userId);
            sendMessage(chatId, messageService.getMessage("security.unauthorized"));
            return;
        }

        if (text.startsWith("/")) {
            String cmd = text.split("\\s+", 2)[0].substring(1).split("@")[0]; // strip / and @botname
            if (handleCommand(cmd, chatId, userId)) {
                return;
            }
        }

        try {
            requestExecutor.execute(() -> answer(chatId, userId, text));
        } catch (RejectedExecutionException e) {
            log.error("Request executor rejected message from user {}", userId, e);
            sendMessage(chatId, messageService.getMessage("error.generic"));
        }
    }

    private boolean handleCommand(String cmd, String chatId, long userId) {
        switch (cmd) {
        case COMMAND_START -> sendMessage(chatId, messageService.getMessage("telegram.welcome"));
        case COMMAND_CLEAR -> {
            conversationService.clearHistory(userId);
            sendMessage(chatId, messageService.getMessage("command.clear.done"));
        }
        case COMMAND_REFRESH -> {
            conversationService.refreshStatus();
            sendMessage(chatId, messageService.getMessage("command.refresh.done"));
        }
        default -> {
            return false;
        }
        }
        return true;
    }

    private void answer(String chatId, long userId, String text) {
        showTyping(chatId);
        String response = conversationService.handle(userId, text);
        sendMessage(chatId, response);
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        return CompletableFuture.runAsync(() -> {
            try {
                for (String chunk : splitAtNewlines(content, TELEGRAM_MAX_MESSAGE_LENGTH)) {
                    SendMessage markdown = SendMessage.builder()
                            .chatId(chatId)
                            .text(chunk)
                            .parseMode(PARSE_MODE_MARKDOWN)
                            .build();
                    try {
                        telegramClient.execute(markdown);
                    } catch (TelegramApiException markdownEx) {
                        // Fallback: retry without formatting if Markdown parsing fails
                        log.debug("Markdown parse failed, retrying as plain text: {}", markdownEx.getMessage());
                        telegramClient.execute(SendMessage.builder()
                                .chatId(chatId)
                                .text(chunk)
                                .build());
                    }
                }
            } catch (TelegramApiException e) {
                log.error("Failed to send message to chat: {}", chatId, e);
                throw new IllegalStateException("Failed to send message", e);
            }
        });
    }

    @Override
    public void showTyping(String chatId) {
        try {
            telegramClient.execute(SendChatAction.builder()
                    .chatId(chatId)
                    .action(ActionType.TYPING.toString())
                    .build());
        } catch (TelegramApiException e) {
            log.debug("Failed to send typing indicator: {}", e.getMessage());
        }
    }

    /**
     * Split text at paragraph (\n\n) or line (\n) boundaries to keep chunks under
     * maxLength, so Markdown markers are not cut in half.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);
            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt <= 0) {
                splitAt = segment.lastIndexOf('\n');
            }
            if (splitAt <= 0) {
                splitAt = maxLength;
            }

            chunks.add(text.substring(start, start + splitAt));
            start += splitAt;
            while (start < text.length() && text.charAt(start) == '\n') {
                start++;
            }
        }
        return chunks;
    }
}
