package in.marketpulse.config;

import java.time.Duration;

/**
 * Configuration for one adaptive rate limiter scope.
 *
 * Token bucket at {@code baseRps} with {@code burst} capacity, plus an optional hard ceiling
 * of requests per rolling window (0 disables the ceiling).
 */
public record RateLimitConfig(
    double baseRps,                 // Target requests per second when healthy
    int burst,                      // Token bucket capacity
    double floorRps,                // current rate never drops below this
    int maxRequestsPerWindow,       // Hard cap per rolling window, 0 = none (e.g. 1200/min)
    Duration window,                // Rolling window length
    int recoveryStreak,             // Consecutive successes per recovery step
    double recoveryStep,            // Additive rps increase per recovery step
    int errorStreakThreshold,       // Consecutive non-throttle errors tolerated before slowing down
    Duration maxWait                // Longest single wait inside acquire() before re-evaluating
) {
    public static final double MIN_RECOVERY_STEP = 0.1;

    /**
     * Defaults: burst 10, floor 10% of base, 60 s window without a ceiling, recover every
     * 20 successes by 10% of base, tolerate 5 consecutive errors, wait at most 5 s at a time.
     */
    public static RateLimitConfig defaults(double baseRps) {
        return new RateLimitConfig(
            baseRps,
            10,
            Math.max(0.1, baseRps * 0.1),
            0,
            Duration.ofSeconds(60),
            20,
            Math.max(MIN_RECOVERY_STEP, baseRps * 0.1),
            5,
            Duration.ofSeconds(5)
        );
    }

    public RateLimitConfig withMaxRequestsPerWindow(int max) {
        return new RateLimitConfig(baseRps, burst, floorRps, max, window, recoveryStreak,
            recoveryStep, errorStreakThreshold, maxWait);
    }

    public RateLimitConfig withFloorRps(double floor) {
        return new RateLimitConfig(baseRps, burst, floor, maxRequestsPerWindow, window, recoveryStreak,
            recoveryStep, errorStreakThreshold, maxWait);
    }

    public RateLimitConfig withBurst(int newBurst) {
        return new RateLimitConfig(baseRps, newBurst, floorRps, maxRequestsPerWindow, window, recoveryStreak,
            recoveryStep, errorStreakThreshold, maxWait);
    }

    public RateLimitConfig withRecoveryStreak(int streak) {
        return new RateLimitConfig(baseRps, burst, floorRps, maxRequestsPerWindow, window, streak,
            recoveryStep, errorStreakThreshold, maxWait);
    }

    public boolean isValid() {
        return baseRps > 0
            && burst >= 1
            && floorRps > 0 && floorRps <= baseRps
            && maxRequestsPerWindow >= 0
            && window != null && !window.isNegative() && !window.isZero()
            && recoveryStreak >= 1
            && recoveryStep > 0
            && errorStreakThreshold >= 0
            && maxWait != null && !maxWait.isNegative() && !maxWait.isZero();
    }
}
