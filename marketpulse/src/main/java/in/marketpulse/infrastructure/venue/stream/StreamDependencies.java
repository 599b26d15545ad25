package in.marketpulse.infrastructure.venue.stream;

import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.metrics.FeedMetrics;
import in.marketpulse.infrastructure.persistence.MarketDataSink;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.service.candle.CandleAggregator;
import in.marketpulse.util.Sleeper;

import java.time.Clock;
import java.util.List;

/**
 * Shared collaborators handed to every stream client of a collector.
 *
 * @param limiter limiter for outbound control frames of this venue's streams
 * @param sink sink receiving trades and closed bars (expected to be failure-isolated)
 * @param aggregators one live aggregator per resolution
 */
public record StreamDependencies(
    AdaptiveRateLimiter limiter,
    HealthRegistry health,
    MarketDataSink sink,
    List<CandleAggregator> aggregators,
    FeedMetrics metrics,
    Sleeper sleeper,
    Clock clock
) {}
