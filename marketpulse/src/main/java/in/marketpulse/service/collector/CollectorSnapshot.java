package in.marketpulse.service.collector;

import in.marketpulse.domain.backfill.BackfillCursor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * State written at shutdown under {@code collector:<venue>:state} and logged on the next start.
 *
 * @param reconnectCounts reconnects per connection name over the collector's lifetime
 * @param openBarsDropped bars still open after the final flush
 */
public record CollectorSnapshot(
    String venue,
    Instant startedAt,
    Instant shutdownTime,
    Map<String, Integer> reconnectCounts,
    List<BackfillCursor> cursors,
    int openBarsDropped
) {
    public static String key(String venue) {
        return "collector:" + venue + ":state";
    }
}
