package me.golemcore.monitor.adapter.outbound.website;

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

import me.golemcore.monitor.domain.model.WebsiteStatus;
import me.golemcore.monitor.infrastructure.http.OkHttpConfig;
import me.golemcore.monitor.port.outbound.WebsiteProbePort;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Website reachability probe backed by OkHttp.
 *
 * <p>
 * Issues a single GET per URL on the probe client, which has a hard call
 * timeout. Any transport failure, including an invalid URL, is reported as an
 * inaccessible status with the error message rather than thrown.
 */
@Component
@Slf4j
public class OkHttpWebsiteProbeAdapter implements WebsiteProbePort {

    private final OkHttpClient probeClient;

    public OkHttpWebsiteProbeAdapter(@Qualifier(OkHttpConfig.PROBE_CLIENT) OkHttpClient probeClient) {
        this.probeClient = probeClient;
    }

    @Override
    public WebsiteStatus probe(String url) {
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            log.warn("[Probe] Invalid website URL: {}", url);
            return WebsiteStatus.failed(url, e.getMessage());
        }

        try (Response response = probeClient.newCall(request).execute()) {
            log.debug("[Probe] {} -> {}", url, response.code());
            return WebsiteStatus.responded(url, response.code());
        } catch (IOException e) {
            log.warn("[Probe] {} unreachable: {}", url, e.getMessage());
            return WebsiteStatus.failed(url, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
