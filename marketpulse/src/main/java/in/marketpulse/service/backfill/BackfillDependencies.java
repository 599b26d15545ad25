package in.marketpulse.service.backfill;

import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.metrics.FeedMetrics;
import in.marketpulse.infrastructure.persistence.MarketDataSink;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.VenueRestClient;
import in.marketpulse.util.Sleeper;

import java.time.Clock;

/**
 * Shared collaborators of the backfill tasks of one venue.
 */
public record BackfillDependencies(
    VenueRestClient restClient,
    AdaptiveRateLimiter limiter,
    HealthRegistry health,
    MarketDataSink sink,
    BackfillCursorStore cursors,
    FeedMetrics metrics,
    Sleeper sleeper,
    Clock clock
) {}
