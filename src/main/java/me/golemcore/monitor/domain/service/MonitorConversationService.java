package me.golemcore.monitor.domain.service;

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
import me.golemcore.monitor.domain.model.TrackerIssue;
import me.golemcore.monitor.domain.model.WebsiteStatus;
import me.golemcore.monitor.history.Exchange;
import me.golemcore.monitor.history.SessionHistory;
import me.golemcore.monitor.infrastructure.config.BotProperties;
import me.golemcore.monitor.infrastructure.i18n.MessageService;
import me.golemcore.monitor.port.outbound.LlmPort;
import me.golemcore.monitor.port.outbound.UpstreamFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Request pipeline for a single user question.
 *
 * <p>
 * For every message the pipeline:
 * <ol>
 * <li>prunes expired history for all users</li>
 * <li>collects website statuses and tracker issues through
 * {@link StatusService}</li>
 * <li>builds the prompt from the status and the user's recent exchanges</li>
 * <li>asks the language model and records the exchange</li>
 * </ol>
 *
 * <p>
 * Any upstream or model failure is logged and answered with a generic
 * retry-later message. History is only appended after a successful model
 * call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitorConversationService {

    private final SessionHistory sessionHistory;
    private final StatusService statusService;
    private final PromptBuilder promptBuilder;
    private final LlmPort llmPort;
    private final MessageService messageService;
    private final BotProperties properties;

    public String handle(long userId, String text) {
        sessionHistory.cleanupAll();
        log.info("Processing message from user {}", userId);

        try {
            log.debug("Checking website status...");
            List<WebsiteStatus> websites = statusService.getWebsiteStatuses();
            log.debug("Fetching Sentry issues...");
            List<TrackerIssue> issues = statusService.getIssues();

            List<Exchange> history = sessionHistory.getHistory(userId);
            log.debug("User {} history: {} exchanges", userId, history.size());

            String prompt = promptBuilder.build(text, websites, issues, statusService.getMonitoredProjects(),
                    history);
            LlmRequest request = LlmRequest.builder()
                    .systemPrompt(properties.getLlm().getSystemPrompt())
                    .userMessage(prompt)
                    .build();

            log.debug("Sending request to {}", llmPort.getProviderId());
            LlmResponse response = llmPort.chat(request).join();
            String answer = response.getContent();
            log.info("Received response for user {}", userId);

            sessionHistory.addMessage(userId, text, answer);
            return answer;
        } catch (UpstreamFetchException e) {
            log.warn("Upstream fetch failed for user {}: {}", userId, e.getMessage());
            return messageService.getMessage("error.generic");
        } catch (RuntimeException e) {
            log.error("Error generating response for user {}", userId, e);
            return messageService.getMessage("error.generic");
        }
    }

    public void clearHistory(long userId) {
        sessionHistory.clearHistory(userId);
        log.info("History cleared for user {}", userId);
    }

    public void refreshStatus() {
        statusService.refresh();
    }
}
