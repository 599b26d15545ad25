package in.marketpulse.domain.backfill;

import in.marketpulse.domain.market.MarketType;

import java.time.Duration;
import java.time.Instant;

/**
 * Persisted progress pointer of a historical backfill.
 *
 * {@code current} walks backward from "now" towards {@code target}. Everything in
 * [current, start-of-backfill) has already been ingested.
 */
public record BackfillCursor(
    String venue,
    String symbol,
    MarketType market,
    Instant current,
    Instant target,
    double progressPercent
) {
    /**
     * Storage key of the cursor: {@code backfill:<venue>:<symbol>:<market>}.
     */
    public String key() {
        return key(venue, symbol, market);
    }

    public static String key(String venue, String symbol, MarketType market) {
        return "backfill:" + venue + ":" + symbol + ":" + market.code();
    }

    public boolean isComplete() {
        return !current.isAfter(target);
    }

    /**
     * Move the cursor to a new position, recomputing progress against {@code origin}
     * (the position the walk started from).
     */
    public BackfillCursor advanceTo(Instant newCurrent, Instant origin) {
        return new BackfillCursor(venue, symbol, market, newCurrent, target,
            progress(origin, newCurrent, target));
    }

    public static double progress(Instant origin, Instant current, Instant target) {
        long total = Duration.between(target, origin).getSeconds();
        if (total <= 0) {
            return 100.0;
        }
        long done = Duration.between(current, origin).getSeconds();
        double pct = (done * 100.0) / total;
        return Math.max(0.0, Math.min(100.0, pct));
    }
}
