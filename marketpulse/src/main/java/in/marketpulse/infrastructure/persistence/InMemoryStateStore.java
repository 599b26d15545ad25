package in.marketpulse.infrastructure.persistence;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local state store. Used when no database is configured, and in tests.
 */
public class InMemoryStateStore implements StateStore {

    private record Entry(String value, Instant expiresAt) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryStateStore() {
        this(Clock.systemUTC());
    }

    public InMemoryStateStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt() != null && !clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant expiresAt = ttl != null ? clock.instant().plus(ttl) : null;
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    public int size() {
        return entries.size();
    }
}
