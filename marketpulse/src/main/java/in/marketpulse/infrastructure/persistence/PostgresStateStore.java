package in.marketpulse.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * PostgreSQL implementation of StateStore (table {@code feed_state}).
 *
 * Expired rows read as absent; they are removed lazily on the next read of the key.
 */
public final class PostgresStateStore implements StateStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresStateStore.class);

    private final DataSource dataSource;
    private final Clock clock;

    public PostgresStateStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public PostgresStateStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        String sql = "SELECT state_value, expires_at FROM feed_state WHERE state_key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Timestamp expiresAt = rs.getTimestamp("expires_at");
                if (expiresAt != null && !expiresAt.toInstant().isAfter(clock.instant())) {
                    delete(key);
                    return Optional.empty();
                }
                return Optional.of(rs.getString("state_value"));
            }
        } catch (SQLException e) {
            log.error("Failed to read state {}: {}", key, e.getMessage());
            throw new StorageWriteException(key, "state read failed", e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        String sql = """
            INSERT INTO feed_state (state_key, state_value, expires_at, updated_at)
            VALUES (?, ?, ?, NOW())
            ON CONFLICT (state_key) DO UPDATE SET
                state_value = EXCLUDED.state_value,
                expires_at = EXCLUDED.expires_at,
                updated_at = NOW()
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            Instant expiresAt = ttl == null ? null : clock.instant().plus(ttl);
            ps.setTimestamp(3, expiresAt == null ? null : Timestamp.from(expiresAt));
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to write state {}: {}", key, e.getMessage());
            throw new StorageWriteException(key, "state write failed", e);
        }
    }

    @Override
    public void delete(String key) {
        String sql = "DELETE FROM feed_state WHERE state_key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to delete state {}: {}", key, e.getMessage());
            throw new StorageWriteException(key, "state delete failed", e);
        }
    }
}
