package in.marketpulse.service.backfill;

/**
 * Lifecycle of a backfill task.
 */
public enum BackfillStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED
}
