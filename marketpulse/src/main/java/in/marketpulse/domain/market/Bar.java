package in.marketpulse.domain.market;

import java.time.Instant;

/**
 * OHLCV bar for one (venue, symbol, market, resolution) bucket.
 *
 * Instances are immutable snapshots. {@code end} is null for a snapshot of a bar
 * that is still open and is {@code start + resolution} once the bar is closed.
 *
 * Bars built by the candle aggregator always carry a {@code tradeCount} of at least 1.
 * Bars taken from a venue's candle endpoint carry 0 when the venue does not report a
 * count (Bitget).
 */
public record Bar(
    String venue,
    String symbol,
    MarketType market,
    int resolutionSeconds,
    Instant start,
    Instant end,
    double open,
    double high,
    double low,
    double close,
    double volume,
    long tradeCount,
    Instant lastUpdate
) {
    public boolean isClosed() {
        return end != null;
    }

    /**
     * End of the bucket regardless of whether the bar has been closed.
     */
    public Instant bucketEnd() {
        return start.plusSeconds(resolutionSeconds);
    }
}
