package in.marketpulse.domain.health;

import java.time.Instant;

/**
 * Point-in-time health snapshot of a component.
 */
public record ComponentHealth(
    String component,
    HealthState state,
    int consecutiveFailures,
    int failuresInWindow,
    Instant lastFailureTime,
    String lastFailureReason,
    Instant cooldownUntil,
    Instant stateChangedAt
) {
    public boolean isHealthy() {
        return state == HealthState.HEALTHY;
    }

    public boolean isDegraded() {
        return state == HealthState.DEGRADED;
    }

    public boolean isFailedOver() {
        return state == HealthState.FAILED_OVER;
    }
}
