package in.marketpulse.infrastructure.persistence;

import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.Trade;

import java.util.List;

/**
 * Append-only storage for raw trades and closed bars.
 *
 * Implementations throw {@link StorageWriteException} on failure. Pipeline components talk to
 * a {@link HealthReportingSink} wrapper, which never lets those failures escape.
 */
public interface MarketDataSink {

    void appendTrade(Trade trade);

    void appendBar(Bar bar);

    /**
     * Batch variant. The default appends one by one.
     */
    default void appendTrades(List<Trade> trades) {
        for (Trade trade : trades) {
            appendTrade(trade);
        }
    }

    default void appendBars(List<Bar> bars) {
        for (Bar bar : bars) {
            appendBar(bar);
        }
    }
}
