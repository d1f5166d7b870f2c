package me.golemcore.monitor.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the language model that answers user questions.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "anthropic").
     */
    String getProviderId();

    /**
     * Executes a chat completion request. The future completes exceptionally when
     * the provider call fails.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Returns the model identifier used when a request does not name one.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
