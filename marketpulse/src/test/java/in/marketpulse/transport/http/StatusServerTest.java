package in.marketpulse.transport.http;

import in.marketpulse.config.RateLimitConfig;
import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.metrics.PrometheusFeedMetrics;
import in.marketpulse.infrastructure.metrics.PrometheusMetricsHandler;
import in.marketpulse.infrastructure.ratelimit.RateLimiterRegistry;
import in.marketpulse.testing.MutableClock;
import in.marketpulse.testing.RecordingSleeper;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the status endpoints.
 *
 * Tests:
 * - /health answers 200 while healthy and 503 once a component fails over
 * - /status lists rate limiter stats
 * - /metrics serves Prometheus text format
 * - Unknown paths answer 404
 */
class StatusServerTest {

    private static final int TEST_PORT = 19191;

    private HealthRegistry health;
    private PrometheusFeedMetrics metrics;
    private StatusServer server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        health = new HealthRegistry(clock);
        health.setFailureThreshold(2);
        health.register("binance_websocket");

        RateLimiterRegistry limiters = new RateLimiterRegistry(clock, new RecordingSleeper());
        limiters.get("binance_rest", RateLimitConfig.defaults(5));

        metrics = new PrometheusFeedMetrics(new CollectorRegistry());
        server = new StatusServer(TEST_PORT,
            new StatusHandlers(health, limiters, List.of(), clock),
            new PrometheusMetricsHandler(metrics.getRegistry()));
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testHealthReflectsFailover() throws Exception {
        HttpResponse<String> ok = get("/health");
        assertEquals(200, ok.statusCode());
        assertTrue(ok.body().contains("\"status\":\"ok\""), ok.body());
        assertTrue(ok.body().contains("binance_websocket"), ok.body());

        health.handleFailure("binance_websocket", new RuntimeException("refused"));
        health.handleFailure("binance_websocket", new RuntimeException("refused"));

        HttpResponse<String> failed = get("/health");
        assertEquals(503, failed.statusCode(), "Failed-over component makes the service unavailable");
        assertTrue(failed.body().contains("\"status\":\"failed_over\""), failed.body());
    }

    @Test
    void testStatusListsLimiters() throws Exception {
        HttpResponse<String> response = get("/status");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("\"rateLimiters\""), response.body());
        assertTrue(response.body().contains("binance_rest"), response.body());
        assertTrue(response.body().contains("\"collectors\":[]"), response.body());
    }

    @Test
    void testMetricsEndpoint() throws Exception {
        metrics.recordTrades("binance", "stream", 7);

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("feed_trades_total{venue=\"binance\",source=\"stream\",} 7.0"),
            "Counter exported in text format");
    }

    @Test
    void testUnknownPath() throws Exception {
        assertEquals(404, get("/nope").statusCode());
    }
}
