package in.marketpulse.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Feed Schema Migration - Creates the storage tables on startup.
 *
 * Tables:
 * - market_trades: raw trades, unique per (venue, market, symbol, venue_trade_id)
 * - market_bars: closed bars, unique per (venue, market, symbol, resolution_seconds, bar_start)
 * - feed_state: key-value state (backfill cursors, collector snapshots) with optional expiry
 */
public final class FeedSchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(FeedSchemaMigration.class);

    private final DataSource dataSource;

    public FeedSchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[SCHEMA MIGRATION] Starting feed tables migration");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "market_trades", """
                CREATE TABLE market_trades (
                    venue VARCHAR(32) NOT NULL,
                    market VARCHAR(16) NOT NULL,
                    symbol VARCHAR(32) NOT NULL,
                    venue_trade_id VARCHAR(64) NOT NULL,
                    price DOUBLE PRECISION NOT NULL,
                    size DOUBLE PRECISION NOT NULL,
                    side VARCHAR(4) NOT NULL,
                    trade_time TIMESTAMPTZ NOT NULL,
                    created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                    PRIMARY KEY (venue, market, symbol, venue_trade_id)
                )
                """);
            createIfMissing(conn, "market_bars", """
                CREATE TABLE market_bars (
                    venue VARCHAR(32) NOT NULL,
                    market VARCHAR(16) NOT NULL,
                    symbol VARCHAR(32) NOT NULL,
                    resolution_seconds INT NOT NULL,
                    bar_start TIMESTAMPTZ NOT NULL,
                    bar_end TIMESTAMPTZ NOT NULL,
                    open DOUBLE PRECISION NOT NULL,
                    high DOUBLE PRECISION NOT NULL,
                    low DOUBLE PRECISION NOT NULL,
                    close DOUBLE PRECISION NOT NULL,
                    volume DOUBLE PRECISION NOT NULL,
                    trade_count BIGINT NOT NULL,
                    last_update TIMESTAMPTZ NOT NULL,
                    PRIMARY KEY (venue, market, symbol, resolution_seconds, bar_start)
                )
                """);
            createIfMissing(conn, "feed_state", """
                CREATE TABLE feed_state (
                    state_key VARCHAR(255) PRIMARY KEY,
                    state_value TEXT NOT NULL,
                    expires_at TIMESTAMPTZ,
                    updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
                )
                """);
            log.info("[SCHEMA MIGRATION] Migration completed successfully");
        } catch (SQLException e) {
            log.error("[SCHEMA MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Feed schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String table, String ddl) throws SQLException {
        if (tableExists(conn, table)) {
            log.info("[SCHEMA MIGRATION] {} already exists", table);
            return;
        }
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
        }
        log.info("[SCHEMA MIGRATION] Created {}", table);
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
