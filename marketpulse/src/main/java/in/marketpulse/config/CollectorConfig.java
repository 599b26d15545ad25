package in.marketpulse.config;

import java.time.Duration;
import java.util.List;

/**
 * Settings for the collector of one venue.
 */
public record CollectorConfig(
    VenueConfig venue,
    List<Integer> resolutions,
    Duration flushInterval,
    Duration stalenessTtl,
    Duration shutdownTimeout,
    int groupSize,
    BackfillConfig backfill
) {
    public CollectorConfig {
        resolutions = List.copyOf(resolutions);
    }

    public static CollectorConfig defaults(VenueConfig venue) {
        return new CollectorConfig(
            venue,
            FeedConfig.DEFAULT_RESOLUTIONS,
            Duration.ofSeconds(10),
            Duration.ofMinutes(15),
            Duration.ofSeconds(30),
            20,
            BackfillConfig.defaults()
        );
    }

    public CollectorConfig withBackfill(BackfillConfig newBackfill) {
        return new CollectorConfig(venue, resolutions, flushInterval, stalenessTtl, shutdownTimeout, groupSize, newBackfill);
    }

    public CollectorConfig withShutdownTimeout(Duration timeout) {
        return new CollectorConfig(venue, resolutions, flushInterval, stalenessTtl, timeout, groupSize, backfill);
    }

    public CollectorConfig withFlushInterval(Duration interval) {
        return new CollectorConfig(venue, resolutions, interval, stalenessTtl, shutdownTimeout, groupSize, backfill);
    }

    public CollectorConfig withResolutions(List<Integer> newResolutions) {
        return new CollectorConfig(venue, newResolutions, flushInterval, stalenessTtl, shutdownTimeout, groupSize, backfill);
    }
}
