package in.marketpulse.infrastructure.persistence;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable key-value store for backfill cursors and collector snapshots.
 */
public interface StateStore {

    Optional<String> get(String key);

    /**
     * @param ttl expiry, or null to keep the value forever
     */
    void set(String key, String value, Duration ttl);

    default void set(String key, String value) {
        set(key, value, null);
    }

    void delete(String key);
}
