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

import me.golemcore.monitor.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.TimeUnit;

/**
 * OkHttp clients for upstream calls.
 *
 * <p>
 * The primary client carries the {@code bot.http.*} timeouts and connection
 * pool and backs the Sentry Feign client. The probe client shares its pool and
 * adds a hard call timeout ({@code bot.http.probe-timeout}) per website probe.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    public static final String PROBE_CLIENT = "probeHttpClient";

    private final BotProperties properties;

    @Bean
    @Primary
    public OkHttpClient okHttpClient() {
        BotProperties.HttpProperties http = properties.getHttp();
        ConnectionPool pool = new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(),
                TimeUnit.MILLISECONDS);

        return new OkHttpClient.Builder()
                .connectionPool(pool)
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(true)
                .build();
    }

    @Bean(PROBE_CLIENT)
    public OkHttpClient probeHttpClient(OkHttpClient okHttpClient) {
        return withProbeTimeout(okHttpClient, properties.getHttp().getProbeTimeout());
    }

    static OkHttpClient withProbeTimeout(OkHttpClient base, long probeTimeoutMs) {
        return base.newBuilder()
                .callTimeout(probeTimeoutMs, TimeUnit.MILLISECONDS)
                .followRedirects(true)
                .build();
    }
}
