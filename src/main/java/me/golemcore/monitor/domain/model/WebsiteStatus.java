package me.golemcore.monitor.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Result of probing one monitored website.
 *
 * <p>
 * {@code status} is the HTTP status code, or {@code null} when the request
 * failed before a response arrived; {@code error} then carries the failure
 * message. A site is {@code accessible} only when it answered with 200.
 */
@Value
@Builder
public class WebsiteStatus {

    String url;
    Integer status;
    boolean accessible;
    String error;

    public static WebsiteStatus responded(String url, int status) {
        return WebsiteStatus.builder()
                .url(url)
                .status(status)
                .accessible(status == 200)
                .build();
    }

    public static WebsiteStatus failed(String url, String error) {
        return WebsiteStatus.builder()
                .url(url)
                .accessible(false)
                .error(error)
                .build();
    }

    public boolean hasResponse() {
        return status != null;
    }
}
