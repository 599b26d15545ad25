package in.marketpulse.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.marketpulse.domain.health.ComponentHealth;
import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.ratelimit.RateLimiterRegistry;
import in.marketpulse.service.collector.Collector;
import in.marketpulse.service.collector.CollectorStatus;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only status endpoints.
 *
 * GET /health - 200 while no component is failed over, 503 otherwise; body lists every component
 * GET /status - per-venue collector status plus rate limiter stats
 */
public final class StatusHandlers {
    private static final Logger log = LoggerFactory.getLogger(StatusHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final HealthRegistry health;
    private final RateLimiterRegistry limiters;
    private final List<Collector> collectors;
    private final Clock clock;

    public StatusHandlers(HealthRegistry health, RateLimiterRegistry limiters, List<Collector> collectors, Clock clock) {
        this.health = health;
        this.limiters = limiters;
        this.collectors = List.copyOf(collectors);
        this.clock = clock;
    }

    public void health(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");

        try {
            Map<String, ComponentHealth> components = health.statusAll();
            boolean failedOver = components.values().stream().anyMatch(ComponentHealth::isFailedOver);
            boolean degraded = components.values().stream().anyMatch(ComponentHealth::isDegraded);

            ObjectNode body = MAPPER.createObjectNode();
            body.put("status", failedOver ? "failed_over" : degraded ? "degraded" : "ok");
            body.put("ts", clock.instant().toString());
            body.set("components", MAPPER.valueToTree(components));

            exchange.setStatusCode(failedOver ? StatusCodes.SERVICE_UNAVAILABLE : StatusCodes.OK);
            exchange.getResponseSender().send(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("Health check error", e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send(
                    "{\"status\":\"error\",\"ts\":\"" + clock.instant() + "\"}",
                    StandardCharsets.UTF_8);
        }
    }

    public void status(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");

        try {
            List<CollectorStatus> statuses = new ArrayList<>();
            for (Collector collector : collectors) {
                statuses.add(collector.getStatus());
            }
            ObjectNode body = MAPPER.createObjectNode();
            body.put("ts", clock.instant().toString());
            body.set("collectors", MAPPER.valueToTree(statuses));
            body.set("rateLimiters", MAPPER.valueToTree(limiters.statsAll()));

            exchange.getResponseSender().send(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("Status error", e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("{\"error\":\"status unavailable\"}", StandardCharsets.UTF_8);
        }
    }
}
