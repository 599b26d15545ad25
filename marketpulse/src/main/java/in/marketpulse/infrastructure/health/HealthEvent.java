package in.marketpulse.infrastructure.health;

import in.marketpulse.domain.health.HealthState;

import java.time.Instant;

/**
 * State transition of a registered component.
 */
public record HealthEvent(
    String component,
    HealthEventType eventType,
    HealthState previousState,
    HealthState newState,
    String reason,
    Instant timestamp
) {
    public enum HealthEventType {
        FAILED_OVER,
        RECOVERED
    }
}
