package in.marketpulse.infrastructure.persistence;

import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

/**
 * PostgreSQL implementation of MarketDataSink (tables {@code market_trades}, {@code market_bars}).
 *
 * Writes are idempotent: a repeated trade is ignored, a repeated bar replaces the stored one,
 * so a restart that replays part of a window does not duplicate rows.
 */
public final class PostgresMarketDataSink implements MarketDataSink {
    private static final Logger log = LoggerFactory.getLogger(PostgresMarketDataSink.class);

    private static final String INSERT_TRADE = """
        INSERT INTO market_trades (venue, market, symbol, venue_trade_id, price, size, side, trade_time)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (venue, market, symbol, venue_trade_id) DO NOTHING
        """;

    private static final String UPSERT_BAR = """
        INSERT INTO market_bars (venue, market, symbol, resolution_seconds, bar_start, bar_end,
                                 open, high, low, close, volume, trade_count, last_update)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (venue, market, symbol, resolution_seconds, bar_start) DO UPDATE SET
            bar_end = EXCLUDED.bar_end,
            open = EXCLUDED.open,
            high = EXCLUDED.high,
            low = EXCLUDED.low,
            close = EXCLUDED.close,
            volume = EXCLUDED.volume,
            trade_count = EXCLUDED.trade_count,
            last_update = EXCLUDED.last_update
        """;

    private final DataSource dataSource;

    public PostgresMarketDataSink(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void appendTrade(Trade trade) {
        appendTrades(List.of(trade));
    }

    @Override
    public void appendBar(Bar bar) {
        appendBars(List.of(bar));
    }

    @Override
    public void appendTrades(List<Trade> trades) {
        if (trades.isEmpty()) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_TRADE)) {
            for (Trade trade : trades) {
                int idx = 1;
                ps.setString(idx++, trade.venue());
                ps.setString(idx++, trade.market().code());
                ps.setString(idx++, trade.symbol());
                ps.setString(idx++, tradeId(trade));
                ps.setDouble(idx++, trade.price());
                ps.setDouble(idx++, trade.size());
                ps.setString(idx++, trade.side().name());
                ps.setTimestamp(idx, Timestamp.from(trade.timestamp()));
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            log.error("Failed to insert {} trades: {}", trades.size(), e.getMessage());
            throw new StorageWriteException("market_trades", "insert of " + trades.size() + " trades failed", e);
        }
    }

    @Override
    public void appendBars(List<Bar> bars) {
        if (bars.isEmpty()) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPSERT_BAR)) {
            for (Bar bar : bars) {
                int idx = 1;
                ps.setString(idx++, bar.venue());
                ps.setString(idx++, bar.market().code());
                ps.setString(idx++, bar.symbol());
                ps.setInt(idx++, bar.resolutionSeconds());
                ps.setTimestamp(idx++, Timestamp.from(bar.start()));
                ps.setTimestamp(idx++, Timestamp.from(bar.bucketEnd()));
                ps.setDouble(idx++, bar.open());
                ps.setDouble(idx++, bar.high());
                ps.setDouble(idx++, bar.low());
                ps.setDouble(idx++, bar.close());
                ps.setDouble(idx++, bar.volume());
                ps.setLong(idx++, bar.tradeCount());
                ps.setTimestamp(idx, Timestamp.from(bar.lastUpdate()));
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            log.error("Failed to upsert {} bars: {}", bars.size(), e.getMessage());
            throw new StorageWriteException("market_bars", "upsert of " + bars.size() + " bars failed", e);
        }
    }

    /**
     * Venue id when present, otherwise a key derived from time, price and size.
     */
    static String tradeId(Trade trade) {
        if (trade.venueTradeId() != null && !trade.venueTradeId().isEmpty()) {
            return trade.venueTradeId();
        }
        return trade.timestamp().toEpochMilli() + ":" + trade.price() + ":" + trade.size();
    }
}
