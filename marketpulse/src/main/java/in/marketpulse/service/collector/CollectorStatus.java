package in.marketpulse.service.collector;

import in.marketpulse.domain.backfill.BackfillCursor;
import in.marketpulse.infrastructure.venue.stream.ConnectionStats;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of one venue's collector.
 *
 * @param activeBars open bar count keyed by resolution in seconds
 */
public record CollectorStatus(
    String venue,
    boolean running,
    Instant startedAt,
    List<ConnectionStats> connections,
    List<BackfillCursor> backfillCursors,
    Map<Integer, Integer> activeBars
) {}
