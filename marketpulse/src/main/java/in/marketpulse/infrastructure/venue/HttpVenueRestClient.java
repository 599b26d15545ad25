package in.marketpulse.infrastructure.venue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.data.BackfillFetchException;
import in.marketpulse.infrastructure.venue.data.RateLimitExceededException;
import in.marketpulse.infrastructure.venue.data.VenueAuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Shared HTTP plumbing for venue REST clients: GET with JSON body, status mapping, and
 * rate limiting of follow-up pages.
 *
 * The first request of a call is expected to be covered by the caller's own
 * {@code limiter.acquire()}; every further page acquires here.
 */
public abstract class HttpVenueRestClient implements VenueRestClient {
    private static final Logger log = LoggerFactory.getLogger(HttpVenueRestClient.class);

    protected static final Duration TIMEOUT = Duration.ofSeconds(15);

    protected final HttpClient httpClient;
    protected final ObjectMapper mapper;
    protected final AdaptiveRateLimiter limiter;

    protected HttpVenueRestClient(HttpClient httpClient, ObjectMapper mapper, AdaptiveRateLimiter limiter) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.limiter = limiter;
    }

    /**
     * Wait for the limiter before a follow-up page.
     */
    protected void acquirePage() throws InterruptedException {
        limiter.acquire();
    }

    protected JsonNode getJson(String symbol, String baseUrl, String path, Map<String, String> params)
            throws InterruptedException {
        URI uri = URI.create(baseUrl + path + query(params));
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(TIMEOUT)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BackfillFetchException(venue(), symbol, "GET " + path + " failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        if (status == 429 || status == 418) {
            throw new RateLimitExceededException(venue(), status, path + " " + abbreviate(response.body()));
        }
        if (status == 401 || status == 403) {
            throw new VenueAuthenticationException(venue(), "rest", "GET " + path + " rejected with HTTP " + status);
        }
        if (status < 200 || status >= 300) {
            throw new BackfillFetchException(venue(), symbol,
                "GET " + path + " returned HTTP " + status + ": " + abbreviate(response.body()));
        }

        try {
            JsonNode body = mapper.readTree(response.body());
            log.trace("[{}] GET {} -> {} bytes", venue(), uri, response.body().length());
            return body;
        } catch (JsonProcessingException e) {
            throw new BackfillFetchException(venue(), symbol, "Invalid JSON from " + path, e);
        }
    }

    protected static String query(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        params.forEach((k, v) -> joiner.add(k + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    protected static double number(JsonNode node, String venue, String symbol, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new BackfillFetchException(venue, symbol, "Missing field " + field);
        }
        try {
            return node.isNumber() ? node.asDouble() : Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            throw new BackfillFetchException(venue, symbol, "Invalid number in " + field + ": " + node.asText(), e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
