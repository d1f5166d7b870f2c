package me.golemcore.monitor.port.inbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for chat channels the bot listens on (Telegram). Implementations manage
 * connection lifecycle, authorization, and message formatting.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "telegram").
     */
    String getChannelType();

    /**
     * Starts listening for incoming messages from the channel.
     */
    void start();

    /**
     * Stops listening for messages and disconnects from the channel.
     */
    void stop();

    /**
     * Checks if the channel is currently active and listening.
     */
    boolean isRunning();

    /**
     * Sends a text message to the specified chat.
     */
    CompletableFuture<Void> sendMessage(String chatId, String content);

    /**
     * Checks if a user is authorized to interact with the bot.
     */
    boolean isAuthorized(String senderId);

    /**
     * Displays a typing indicator to the user while processing. Default
     * implementation does nothing.
     */
    default void showTyping(String chatId) {
        // Default no-op implementation
    }
}
