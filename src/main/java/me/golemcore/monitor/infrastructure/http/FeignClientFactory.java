package me.golemcore.monitor.infrastructure.http;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.RequestInterceptor;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds Feign clients for upstream status APIs on the shared OkHttp client,
 * with Jackson JSON and no retries. A failed call surfaces once; the next user
 * question is the retry.
 *
 * <p>
 * Upstreams are configured by host (as in {@code bot.sentry.domain}) and a
 * bearer token:
 *
 * <pre>{@code
 * SentryApi client = factory.createBearerClient(SentryApi.class, "sentry.io", token);
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private static final String HTTPS = "https://";

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a client for an upstream that authenticates with a bearer token.
     * Every request carries {@code Authorization: Bearer <token>} and accepts
     * JSON.
     *
     * @param host
     *            bare host such as {@code sentry.io}, or a full base URL
     */
    public <T> T createBearerClient(Class<T> apiType, String host, String bearerToken) {
        RequestInterceptor auth = template -> template
                .header("Authorization", "Bearer " + bearerToken)
                .header("Accept", "application/json");
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .requestInterceptor(auth)
                .retryer(Retryer.NEVER_RETRY)
                .target(apiType, baseUrl(host));
    }

    static String baseUrl(String host) {
        String trimmed = host.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.startsWith("http://") || trimmed.startsWith(HTTPS)) {
            return trimmed;
        }
        return HTTPS + trimmed;
    }
}
