package in.marketpulse.infrastructure.ratelimit;

/**
 * Snapshot of a rate limiter scope.
 */
public record RateLimiterStats(
    String scope,
    double baseRps,
    double currentRps,
    double floorRps,
    int windowCount,
    long errors,
    long successes,
    long throttledWaits,
    double backoffMultiplier
) {}
