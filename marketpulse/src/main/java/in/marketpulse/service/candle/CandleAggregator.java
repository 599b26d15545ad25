package in.marketpulse.service.candle;

import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.domain.market.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Candle Aggregator - Build fixed-resolution OHLCV bars from a trade stream.
 *
 * One aggregator per resolution. It keeps at most one open bar per
 * (venue, symbol, market) key; buckets are aligned to the unix epoch
 * ({@code start = floor(epochSeconds / resolution) * resolution}).
 *
 * Pattern: a trade at or past the open bar's end closes that bar (returned to the caller)
 * and opens a new one. {@link #flushAll()} closes bars whose bucket has ended or that have
 * not seen a trade for longer than the staleness TTL.
 *
 * A trade older than the end of the last bar closed for its key is rejected as late, so a
 * bucket is emitted at most once even when its trades straggle in after a flush.
 *
 * Thread-safety: every mutation of a key happens inside {@link ConcurrentHashMap#compute},
 * both on the trade path and the flush path, so a bar is emitted exactly once.
 */
public final class CandleAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    public static final Duration DEFAULT_STALENESS_TTL = Duration.ofMinutes(15);

    private final int resolutionSeconds;
    private final Duration stalenessTtl;
    private final Clock clock;

    private final ConcurrentHashMap<BarKey, OpenBar> openBars = new ConcurrentHashMap<>();
    // End of the last closed bar per key; written only inside the key's compute section
    private final ConcurrentHashMap<BarKey, Instant> closedThrough = new ConcurrentHashMap<>();
    private final AtomicLong lateTrades = new AtomicLong();

    public CandleAggregator(int resolutionSeconds) {
        this(resolutionSeconds, DEFAULT_STALENESS_TTL, Clock.systemUTC());
    }

    public CandleAggregator(int resolutionSeconds, Duration stalenessTtl, Clock clock) {
        if (resolutionSeconds <= 0) {
            throw new IllegalArgumentException("Resolution must be positive: " + resolutionSeconds);
        }
        if (stalenessTtl == null || stalenessTtl.isNegative() || stalenessTtl.isZero()) {
            throw new IllegalArgumentException("Staleness TTL must be positive");
        }
        this.resolutionSeconds = resolutionSeconds;
        this.stalenessTtl = stalenessTtl;
        this.clock = clock;
    }

    /**
     * Apply a trade.
     *
     * @return the bar that this trade closed, or empty when the trade opened or merged into a bar
     */
    public Optional<Bar> processTrade(Trade trade) {
        BarKey key = BarKey.of(trade);
        Bar[] closed = new Bar[1];

        openBars.compute(key, (k, bar) -> {
            Instant ts = trade.timestamp();
            if (bar == null) {
                Instant through = closedThrough.get(k);
                if (through != null && ts.isBefore(through)) {
                    rejectLate(k, ts, through);
                    return null;
                }
                return OpenBar.from(trade, resolutionSeconds);
            }
            if (ts.isBefore(bar.start)) {
                rejectLate(k, ts, bar.start);
                return bar;
            }
            if (!ts.isBefore(bar.end)) {
                closed[0] = close(k, bar);
                return OpenBar.from(trade, resolutionSeconds);
            }
            bar.merge(trade);
            return bar;
        });

        return Optional.ofNullable(closed[0]);
    }

    /**
     * Close every bar whose bucket has ended or that has gone stale, using the injected clock.
     */
    public List<Bar> flushAll() {
        return flushAll(clock.instant());
    }

    /**
     * Close and remove every bar with {@code now >= end} or {@code now - lastUpdate > stalenessTtl}.
     */
    public List<Bar> flushAll(Instant now) {
        List<Bar> flushed = new ArrayList<>();
        for (BarKey key : openBars.keySet()) {
            openBars.computeIfPresent(key, (k, bar) -> {
                if (!now.isBefore(bar.end) || isStale(bar, now)) {
                    flushed.add(close(k, bar));
                    return null;
                }
                return bar;
            });
        }
        if (!flushed.isEmpty()) {
            log.debug("[Aggregator:{}s] Flushed {} bars", resolutionSeconds, flushed.size());
        }
        return flushed;
    }

    /**
     * Remove bars that have not been updated within the staleness TTL, regardless of bucket end.
     * Evicted bars are returned so the caller can persist them; nothing is dropped silently.
     */
    public List<Bar> evictStale(Instant now) {
        List<Bar> evicted = new ArrayList<>();
        for (BarKey key : openBars.keySet()) {
            openBars.computeIfPresent(key, (k, bar) -> {
                if (isStale(bar, now)) {
                    evicted.add(close(k, bar));
                    return null;
                }
                return bar;
            });
        }
        if (!evicted.isEmpty()) {
            log.info("[Aggregator:{}s] Evicted {} stale bars", resolutionSeconds, evicted.size());
        }
        return evicted;
    }

    public int activeCount() {
        return openBars.size();
    }

    public long lateTradeCount() {
        return lateTrades.get();
    }

    public int resolutionSeconds() {
        return resolutionSeconds;
    }

    /**
     * Snapshot of the open bar for a key (end is null), if any.
     */
    public Optional<Bar> openBar(String venue, String symbol, MarketType market) {
        Bar[] snapshot = new Bar[1];
        openBars.computeIfPresent(new BarKey(venue, symbol, market), (k, bar) -> {
            snapshot[0] = bar.snapshot();
            return bar;
        });
        return Optional.ofNullable(snapshot[0]);
    }

    /**
     * Bucket start for a timestamp at this aggregator's resolution.
     */
    public Instant bucketStart(Instant ts) {
        return floor(ts, resolutionSeconds);
    }

    public static Instant floor(Instant ts, long resolutionSeconds) {
        long epoch = ts.getEpochSecond();
        return Instant.ofEpochSecond(Math.floorDiv(epoch, resolutionSeconds) * resolutionSeconds);
    }

    private Bar close(BarKey key, OpenBar bar) {
        closedThrough.put(key, bar.end);
        return bar.close();
    }

    private void rejectLate(BarKey key, Instant ts, Instant boundary) {
        lateTrades.incrementAndGet();
        log.debug("[Aggregator:{}s] Late trade rejected for {} {} at {} (accepting from {})",
            resolutionSeconds, key.venue(), key.symbol(), ts, boundary);
    }

    private boolean isStale(OpenBar bar, Instant now) {
        return Duration.between(bar.lastUpdate, now).compareTo(stalenessTtl) > 0;
    }

    record BarKey(String venue, String symbol, MarketType market) {
        static BarKey of(Trade trade) {
            return new BarKey(trade.venue(), trade.symbol(), trade.market());
        }
    }

    /**
     * Mutable open bar. Only touched inside the owning map's compute section.
     */
    private static final class OpenBar {
        private final String venue;
        private final String symbol;
        private final MarketType market;
        private final int resolutionSeconds;
        private final Instant start;
        private final Instant end;
        private final double open;
        private double high;
        private double low;
        private double close;
        private double volume;
        private long tradeCount;
        private Instant lastUpdate;

        private OpenBar(Trade first, int resolutionSeconds) {
            this.venue = first.venue();
            this.symbol = first.symbol();
            this.market = first.market();
            this.resolutionSeconds = resolutionSeconds;
            this.start = floor(first.timestamp(), resolutionSeconds);
            this.end = start.plusSeconds(resolutionSeconds);
            this.open = first.price();
            this.high = first.price();
            this.low = first.price();
            this.close = first.price();
            this.volume = first.size();
            this.tradeCount = 1;
            this.lastUpdate = first.timestamp();
        }

        static OpenBar from(Trade trade, int resolutionSeconds) {
            return new OpenBar(trade, resolutionSeconds);
        }

        void merge(Trade trade) {
            high = Math.max(high, trade.price());
            low = Math.min(low, trade.price());
            close = trade.price();
            volume += trade.size();
            tradeCount++;
            lastUpdate = trade.timestamp();
        }

        Bar close() {
            return new Bar(venue, symbol, market, resolutionSeconds, start, end,
                open, high, low, close, volume, tradeCount, lastUpdate);
        }

        Bar snapshot() {
            return new Bar(venue, symbol, market, resolutionSeconds, start, null,
                open, high, low, close, volume, tradeCount, lastUpdate);
        }
    }
}
