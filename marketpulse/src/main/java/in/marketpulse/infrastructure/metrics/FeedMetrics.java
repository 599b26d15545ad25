package in.marketpulse.infrastructure.metrics;

import in.marketpulse.domain.health.HealthState;

/**
 * Feed metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Trades ingested and bars emitted
 * - Stream reconnects and malformed messages
 * - Current adaptive rate per limiter scope
 * - Component health and backfill progress
 * - Sink write failures
 */
public interface FeedMetrics {

    /**
     * Record trades accepted from a stream or backfill page.
     *
     * @param venue Venue name
     * @param source "stream" or "backfill"
     * @param count Number of trades
     */
    void recordTrades(String venue, String source, int count);

    /**
     * Record closed bars handed to the sink.
     */
    void recordBars(String venue, int resolutionSeconds, int count);

    void recordReconnect(String venue, String connection);

    void recordMalformedMessage(String venue);

    /**
     * Record a failed write to the sink.
     *
     * @param operation appendTrade, appendBar, appendTrades, appendBars
     */
    void recordSinkFailure(String venue, String operation);

    void updateRateLimit(String scope, double currentRps, double baseRps);

    void updateComponentHealth(String component, HealthState state);

    void updateBackfillProgress(String venue, String symbol, String market, double percent);

    /**
     * Metrics sink that discards everything.
     */
    FeedMetrics NOOP = new FeedMetrics() {
        @Override public void recordTrades(String venue, String source, int count) {}
        @Override public void recordBars(String venue, int resolutionSeconds, int count) {}
        @Override public void recordReconnect(String venue, String connection) {}
        @Override public void recordMalformedMessage(String venue) {}
        @Override public void recordSinkFailure(String venue, String operation) {}
        @Override public void updateRateLimit(String scope, double currentRps, double baseRps) {}
        @Override public void updateComponentHealth(String component, HealthState state) {}
        @Override public void updateBackfillProgress(String venue, String symbol, String market, double percent) {}
    };
}
