package in.marketpulse.infrastructure.ratelimit;

import in.marketpulse.config.RateLimitConfig;
import in.marketpulse.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Hands out one shared {@link AdaptiveRateLimiter} per scope name.
 *
 * Constructed once at startup and passed to every collector; callers in the same scope
 * share the limiter and its budget.
 */
public class RateLimiterRegistry {
    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    private final Map<String, AdaptiveRateLimiter> limiters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Sleeper sleeper;

    public RateLimiterRegistry() {
        this(Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public RateLimiterRegistry(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Limiter for a scope, created with {@code config} on first use. Later calls return the
     * existing limiter and ignore the config argument.
     */
    public AdaptiveRateLimiter get(String scope, RateLimitConfig config) {
        return limiters.computeIfAbsent(scope, create(config));
    }

    public AdaptiveRateLimiter get(String scope) {
        AdaptiveRateLimiter limiter = limiters.get(scope);
        if (limiter == null) {
            throw new IllegalStateException("No rate limiter registered for scope: " + scope);
        }
        return limiter;
    }

    public Map<String, RateLimiterStats> statsAll() {
        Map<String, RateLimiterStats> result = new TreeMap<>();
        limiters.forEach((scope, limiter) -> result.put(scope, limiter.stats()));
        return result;
    }

    private Function<String, AdaptiveRateLimiter> create(RateLimitConfig config) {
        return scope -> {
            log.info("[RateLimiterRegistry] Created scope {} at {} rps (burst {}, window cap {})",
                scope, config.baseRps(), config.burst(), config.maxRequestsPerWindow());
            return new AdaptiveRateLimiter(scope, config, clock, sleeper);
        };
    }
}
