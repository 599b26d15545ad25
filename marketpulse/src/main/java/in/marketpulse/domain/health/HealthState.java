package in.marketpulse.domain.health;

/**
 * Health state of a named pipeline component.
 */
public enum HealthState {
    HEALTHY,      // Operating normally
    DEGRADED,     // Recovering after a failover cooldown, waiting for a fresh success
    FAILED_OVER   // Too many failures in the window; new work is skipped until cooldown ends
}
