package in.marketpulse.infrastructure.ratelimit;

import in.marketpulse.config.RateLimitConfig;
import in.marketpulse.infrastructure.venue.data.ErrorKind;
import in.marketpulse.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Adaptive rate limiter for one scope (e.g. "binance_rest", "bitget_ws").
 *
 * Features:
 * - Token bucket refilling at the current rate, capacity = burst
 * - Optional hard ceiling of requests per rolling window
 * - Throttle signals halve the current rate (never below the floor)
 * - Long error streaks slow down by 25%
 * - Success streaks step the rate back up towards base
 *
 * All state is guarded by this object's monitor. Callers sleep outside of it.
 *
 * Usage:
 * <pre>
 * limiter.acquire();
 * try {
 *     callVenue();
 *     limiter.reportSuccess();
 * } catch (RuntimeException e) {
 *     limiter.reportError(e);
 * }
 * </pre>
 */
public class AdaptiveRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveRateLimiter.class);

    private static final double THROTTLE_FACTOR = 0.5;
    private static final double ERROR_STREAK_FACTOR = 0.75;
    private static final double THROTTLE_MULTIPLIER_STEP = 2.0;
    private static final double MAX_THROTTLE_MULTIPLIER = 4.0;
    private static final double ERROR_MULTIPLIER_STEP = 1.5;
    private static final double MAX_ERROR_MULTIPLIER = 2.0;
    private static final double MULTIPLIER_DECAY = 0.9;

    private final String scope;
    private final RateLimitConfig config;
    private final Clock clock;
    private final Sleeper sleeper;

    // ════════════════════════════════════════════════════════════════════════
    // STATE (guarded by this)
    // ════════════════════════════════════════════════════════════════════════
    private double baseRps;
    private double currentRps;
    private double tokens;
    private long lastRefillMillis;
    private final Deque<Long> windowStamps = new ArrayDeque<>();
    private double backoffMultiplier = 1.0;
    private int consecutiveErrors = 0;
    private int consecutiveSuccesses = 0;
    private long errors = 0;
    private long successes = 0;
    private long throttledWaits = 0;

    public AdaptiveRateLimiter(String scope, RateLimitConfig config) {
        this(scope, config, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public AdaptiveRateLimiter(String scope, RateLimitConfig config, Clock clock, Sleeper sleeper) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid rate limit config for " + scope + ": " + config);
        }
        this.scope = scope;
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.baseRps = config.baseRps();
        this.currentRps = config.baseRps();
        this.tokens = config.burst();
        this.lastRefillMillis = clock.millis();
    }

    /**
     * Block until a request may be issued under the current rate and window ceiling.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitMillis;
            synchronized (this) {
                long now = clock.millis();
                refill(now);
                pruneWindow(now);

                boolean tokenAvailable = tokens >= 1.0;
                boolean windowAvailable = config.maxRequestsPerWindow() <= 0
                    || windowStamps.size() < config.maxRequestsPerWindow();

                if (tokenAvailable && windowAvailable) {
                    tokens -= 1.0;
                    windowStamps.addLast(now);
                    return;
                }

                long tokenWait = 0;
                if (!tokenAvailable) {
                    tokenWait = (long) Math.ceil(((1.0 - tokens) / currentRps) * 1000.0 * backoffMultiplier);
                }
                long windowWait = 0;
                if (!windowAvailable) {
                    long oldest = windowStamps.peekFirst();
                    windowWait = oldest + config.window().toMillis() - now;
                }
                waitMillis = Math.max(1, Math.max(tokenWait, windowWait));
                waitMillis = Math.min(waitMillis, config.maxWait().toMillis());
                throttledWaits++;
            }
            log.trace("[RateLimiter:{}] waiting {} ms", scope, waitMillis);
            sleeper.sleep(Duration.ofMillis(waitMillis));
        }
    }

    public synchronized void reportSuccess() {
        successes++;
        consecutiveErrors = 0;
        consecutiveSuccesses++;

        if (consecutiveSuccesses >= config.recoveryStreak()) {
            consecutiveSuccesses = 0;
            double before = currentRps;
            currentRps = Math.min(baseRps, currentRps + config.recoveryStep());
            backoffMultiplier = Math.max(1.0, backoffMultiplier * MULTIPLIER_DECAY);
            if (currentRps > before) {
                log.info("[RateLimiter:{}] recovering: {} -> {} rps", scope, fmt(before), fmt(currentRps));
            }
        }
    }

    public synchronized void reportError(Throwable error) {
        errors++;
        consecutiveSuccesses = 0;
        consecutiveErrors++;

        double before = currentRps;
        if (ErrorKind.isThrottleSignal(error)) {
            currentRps = Math.max(config.floorRps(), currentRps * THROTTLE_FACTOR);
            backoffMultiplier = Math.min(MAX_THROTTLE_MULTIPLIER, backoffMultiplier * THROTTLE_MULTIPLIER_STEP);
            // Drain the bucket so the next caller waits at the reduced rate
            tokens = Math.min(tokens, 0.0);
            log.warn("[RateLimiter:{}] throttled by venue: {} -> {} rps (multiplier {})",
                scope, fmt(before), fmt(currentRps), fmt(backoffMultiplier));
        } else if (consecutiveErrors > config.errorStreakThreshold()) {
            currentRps = Math.max(config.floorRps(), currentRps * ERROR_STREAK_FACTOR);
            backoffMultiplier = Math.min(MAX_ERROR_MULTIPLIER, Math.max(backoffMultiplier,
                backoffMultiplier * ERROR_MULTIPLIER_STEP));
            log.warn("[RateLimiter:{}] {} consecutive errors: {} -> {} rps",
                scope, consecutiveErrors, fmt(before), fmt(currentRps));
        }
    }

    /**
     * Change the target rate. The current rate is clamped to the new base.
     */
    public synchronized void updateBaseRps(double newBaseRps) {
        if (newBaseRps <= 0) {
            throw new IllegalArgumentException("Base rps must be positive: " + newBaseRps);
        }
        double old = baseRps;
        baseRps = newBaseRps;
        currentRps = Math.max(Math.min(currentRps, baseRps), Math.min(config.floorRps(), baseRps));
        log.info("[RateLimiter:{}] base rate updated: {} -> {} rps", scope, fmt(old), fmt(newBaseRps));
    }

    public synchronized RateLimiterStats stats() {
        pruneWindow(clock.millis());
        return new RateLimiterStats(
            scope,
            baseRps,
            currentRps,
            config.floorRps(),
            windowStamps.size(),
            errors,
            successes,
            throttledWaits,
            backoffMultiplier
        );
    }

    public String scope() {
        return scope;
    }

    private void refill(long now) {
        long elapsed = now - lastRefillMillis;
        if (elapsed > 0) {
            tokens = Math.min(config.burst(), tokens + (elapsed / 1000.0) * currentRps);
            lastRefillMillis = now;
        }
    }

    private void pruneWindow(long now) {
        long cutoff = now - config.window().toMillis();
        while (!windowStamps.isEmpty() && windowStamps.peekFirst() <= cutoff) {
            windowStamps.pollFirst();
        }
    }

    private static String fmt(double value) {
        return String.format("%.2f", value);
    }
}
