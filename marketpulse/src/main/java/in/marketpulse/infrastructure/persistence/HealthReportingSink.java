package in.marketpulse.infrastructure.persistence;

import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.Trade;
import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Sink wrapper that isolates the pipeline from storage failures.
 *
 * Write failures are logged, counted and reported to the health registry under
 * {@code <venue>_storage}; they are never rethrown. Delivery to storage is at-most-once.
 */
public class HealthReportingSink implements MarketDataSink {
    private static final Logger log = LoggerFactory.getLogger(HealthReportingSink.class);

    private final String venue;
    private final String component;
    private final MarketDataSink delegate;
    private final HealthRegistry health;
    private final FeedMetrics metrics;

    public HealthReportingSink(String venue, MarketDataSink delegate, HealthRegistry health, FeedMetrics metrics) {
        this.venue = venue;
        this.component = venue + "_storage";
        this.delegate = delegate;
        this.health = health;
        this.metrics = metrics;
    }

    @Override
    public void appendTrade(Trade trade) {
        write("appendTrade", 1, () -> delegate.appendTrade(trade));
    }

    @Override
    public void appendBar(Bar bar) {
        write("appendBar", 1, () -> delegate.appendBar(bar));
    }

    @Override
    public void appendTrades(List<Trade> trades) {
        if (trades.isEmpty()) {
            return;
        }
        write("appendTrades", trades.size(), () -> delegate.appendTrades(trades));
    }

    @Override
    public void appendBars(List<Bar> bars) {
        if (bars.isEmpty()) {
            return;
        }
        write("appendBars", bars.size(), () -> delegate.appendBars(bars));
    }

    public MarketDataSink delegate() {
        return delegate;
    }

    private void write(String operation, int count, Runnable action) {
        try {
            action.run();
            health.recordSuccess(component);
        } catch (StorageWriteException e) {
            log.error("[{}] {} failed, {} record(s) dropped: {}", component, operation, count, e.getMessage());
            metrics.recordSinkFailure(venue, operation);
            health.handleFailure(component, e);
        } catch (RuntimeException e) {
            log.error("[{}] {} failed unexpectedly, {} record(s) dropped", component, operation, count, e);
            metrics.recordSinkFailure(venue, operation);
            health.handleFailure(component, new StorageWriteException(component, operation + " failed", e));
        }
    }
}
