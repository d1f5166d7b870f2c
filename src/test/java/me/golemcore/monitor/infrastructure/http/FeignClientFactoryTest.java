package me.golemcore.monitor.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Param;
import feign.RequestLine;
import me.golemcore.monitor.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeignClientFactoryTest {

    interface StatusApi {
        @RequestLine("GET /api/{name}")
        Map<String, Object> get(@Param("name") String name);
    }

    private OkHttpMockEngine engine;
    private FeignClientFactory factory;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        OkHttpClient okHttpClient = new OkHttpClient.Builder().addInterceptor(engine).build();
        factory = new FeignClientFactory(okHttpClient, new ObjectMapper());
    }

    @Test
    void shouldSendBearerTokenToHttpsHost() {
        engine.enqueueJson(200, "{\"ok\":true}");
        StatusApi api = factory.createBearerClient(StatusApi.class, "sentry.io", "secret");

        assertEquals(Boolean.TRUE, api.get("health").get("ok"));

        Request request = engine.takeRequest();
        assertEquals("https://sentry.io/api/health", request.url().toString());
        assertEquals("Bearer secret", request.header("Authorization"));
        assertEquals("application/json", request.header("Accept"));
    }

    @Test
    void shouldNotRetryFailedCalls() {
        engine.enqueueFailure(new IOException("connection reset"));
        StatusApi api = factory.createBearerClient(StatusApi.class, "sentry.io", "secret");

        assertThrows(FeignException.class, () -> api.get("health"));
        assertEquals(1, engine.getRequestCount());
    }

    @Test
    void shouldNormalizeConfiguredHost() {
        assertEquals("https://sentry.io", FeignClientFactory.baseUrl(" sentry.io/ "));
        assertEquals("https://sentry.acme.internal", FeignClientFactory.baseUrl("https://sentry.acme.internal/"));
        assertEquals("http://localhost:9000", FeignClientFactory.baseUrl("http://localhost:9000"));
    }
}
