package in.marketpulse.service.backfill;

import in.marketpulse.config.ConfigurationException;
import in.marketpulse.domain.backfill.BackfillCursor;
import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.domain.market.Trade;
import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.metrics.FeedMetrics;
import in.marketpulse.infrastructure.persistence.MarketDataSink;
import in.marketpulse.infrastructure.persistence.StorageWriteException;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.VenueRestClient;
import in.marketpulse.service.candle.CandleAggregator;
import in.marketpulse.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Backfill Engine - Walk backward through trade history for one (venue, symbol, market).
 *
 * Each iteration fetches the window {@code [max(current - step, target), current)}, stores the
 * raw trades, runs them through fresh aggregators (one per resolution), stores every bar they
 * close, then moves {@code current} to the window start and persists the cursor. The walk goes
 * backward in time, so aggregators never outlive their window.
 *
 * Windows are aligned to the step grid and the step is a multiple of every resolution, so a
 * bucket never spans two windows and flushing after each window only emits complete bars.
 *
 * Used when:
 * 1. First start for a symbol: walk from now back to the configured horizon
 * 2. Restart: resume from the persisted cursor
 *
 * A fetch failure ends the task; the cursor already points at the last completed window.
 */
public class BackfillEngine {
    private static final Logger log = LoggerFactory.getLogger(BackfillEngine.class);

    private final String venue;
    private final String symbol;
    private final MarketType market;
    private final Instant configuredTarget;
    private final Duration step;
    private final Duration delay;
    private final List<Integer> resolutions;

    private final VenueRestClient restClient;
    private final AdaptiveRateLimiter limiter;
    private final HealthRegistry health;
    private final MarketDataSink sink;
    private final BackfillCursorStore cursors;
    private final FeedMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final String restComponent;
    private final String storageComponent;
    private final String logPrefix;

    private volatile boolean running = false;
    private volatile BackfillStatus status = BackfillStatus.PENDING;
    private volatile BackfillCursor cursor;
    private volatile long tradesIngested = 0;
    private volatile long barsEmitted = 0;
    private volatile RuntimeException lastError;

    public BackfillEngine(String symbol, MarketType market, Instant target, Duration step, Duration delay,
                          List<Integer> resolutions, BackfillDependencies deps) {
        this.restClient = deps.restClient();
        this.venue = restClient.venue();
        this.symbol = symbol.toUpperCase();
        this.market = market;
        this.configuredTarget = target;
        this.step = step;
        this.delay = delay;
        this.limiter = deps.limiter();
        this.health = deps.health();
        this.sink = deps.sink();
        this.cursors = deps.cursors();
        this.metrics = deps.metrics();
        this.sleeper = deps.sleeper();
        this.clock = deps.clock();
        this.restComponent = venue + "_rest_api";
        this.storageComponent = venue + "_storage";
        this.logPrefix = "[Backfill:" + venue + ":" + this.symbol + ":" + market.code() + "]";

        validateStep(step, resolutions);
        this.resolutions = List.copyOf(resolutions);
    }

    /**
     * @throws ConfigurationException if the step is not a positive multiple of every resolution
     */
    public static void validateStep(Duration step, List<Integer> resolutions) {
        long stepSeconds = step.getSeconds();
        if (stepSeconds <= 0 || step.getNano() != 0) {
            throw new ConfigurationException("Backfill step must be a positive whole number of seconds: " + step);
        }
        for (int resolution : resolutions) {
            if (resolution <= 0 || stepSeconds % resolution != 0) {
                throw new ConfigurationException("Backfill step " + stepSeconds
                    + "s is not a multiple of resolution " + resolution + "s");
            }
        }
    }

    /**
     * Run until the horizon is reached, {@link #stop()} is called, the thread is interrupted,
     * or a fetch fails. Blocks the calling thread.
     */
    public void run() {
        running = true;
        status = BackfillStatus.RUNNING;
        cursor = loadOrInitCursor();
        log.info("{} Starting at {} towards {} ({}%)", logPrefix, cursor.current(), cursor.target(),
            String.format("%.1f", cursor.progressPercent()));

        try {
            while (running && cursor.current().isAfter(cursor.target())) {
                Instant windowEnd = cursor.current();
                Instant windowStart = windowEnd.minus(step);
                if (windowStart.isBefore(cursor.target())) {
                    windowStart = cursor.target();
                }

                limiter.acquire();
                if (!running) {
                    break;
                }

                List<Trade> trades;
                try {
                    trades = restClient.fetchTrades(symbol, market, windowStart, windowEnd);
                    limiter.reportSuccess();
                    health.recordSuccess(restComponent);
                } catch (RuntimeException e) {
                    limiter.reportError(e);
                    health.handleFailure(restComponent, e);
                    lastError = e;
                    status = BackfillStatus.FAILED;
                    log.error("{} Fetch of [{}, {}) failed, stopping task: {}",
                        logPrefix, windowStart, windowEnd, e.getMessage());
                    break;
                }

                if (!trades.isEmpty()) {
                    ingest(trades);
                    log.debug("{} Processed {} trades in [{}, {})", logPrefix, trades.size(), windowStart, windowEnd);
                }

                cursor = cursor.advanceTo(windowStart, clock.instant());
                persistCursor();
                metrics.updateBackfillProgress(venue, symbol, market.code(), cursor.progressPercent());

                if (running && cursor.current().isAfter(cursor.target())) {
                    sleeper.sleep(delay);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("{} Interrupted", logPrefix);
        } finally {
            persistCursor();
            if (status == BackfillStatus.RUNNING) {
                status = cursor.isComplete() ? BackfillStatus.COMPLETED : BackfillStatus.STOPPED;
            }
            running = false;
            log.info("{} {} at {} ({}%, {} trades, {} bars)", logPrefix, status, cursor.current(),
                String.format("%.1f", cursor.progressPercent()), tradesIngested, barsEmitted);
        }
    }

    /**
     * Ask the loop to exit at its next suspension point.
     */
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public BackfillStatus status() {
        return status;
    }

    /**
     * Current cursor, or the persisted one if the task has not started yet.
     */
    public Optional<BackfillCursor> cursor() {
        BackfillCursor c = cursor;
        if (c != null) {
            return Optional.of(c);
        }
        return cursors.load(venue, symbol, market);
    }

    public String symbol() {
        return symbol;
    }

    public MarketType market() {
        return market;
    }

    public long tradesIngested() {
        return tradesIngested;
    }

    public Optional<RuntimeException> lastError() {
        return Optional.ofNullable(lastError);
    }

    private void ingest(List<Trade> trades) {
        sink.appendTrades(trades);
        tradesIngested += trades.size();
        metrics.recordTrades(venue, "backfill", trades.size());

        for (int resolution : resolutions) {
            CandleAggregator aggregator = new CandleAggregator(resolution, CandleAggregator.DEFAULT_STALENESS_TTL, clock);
            List<Bar> bars = new ArrayList<>();
            for (Trade trade : trades) {
                aggregator.processTrade(trade).ifPresent(bars::add);
            }
            bars.addAll(aggregator.flushAll());
            if (!bars.isEmpty()) {
                sink.appendBars(bars);
                barsEmitted += bars.size();
                metrics.recordBars(venue, aggregator.resolutionSeconds(), bars.size());
            }
        }
    }

    private BackfillCursor loadOrInitCursor() {
        Optional<BackfillCursor> persisted = cursors.load(venue, symbol, market);
        if (persisted.isPresent()) {
            BackfillCursor c = persisted.get();
            log.info("{} Resuming from persisted cursor {}", logPrefix, c.current());
            return c;
        }
        Instant now = clock.instant();
        Instant aligned = CandleAggregator.floor(now, step.getSeconds());
        return new BackfillCursor(venue, symbol, market, aligned, configuredTarget,
            BackfillCursor.progress(now, aligned, configuredTarget));
    }

    private void persistCursor() {
        BackfillCursor c = cursor;
        if (c == null) {
            return;
        }
        try {
            cursors.save(c);
        } catch (StorageWriteException e) {
            log.error("{} Failed to persist cursor at {}: {}", logPrefix, c.current(), e.getMessage());
            health.handleFailure(storageComponent, e);
        } catch (RuntimeException e) {
            log.error("{} Failed to persist cursor at {}", logPrefix, c.current(), e);
            health.handleFailure(storageComponent, new StorageWriteException(c.key(), "cursor save failed", e));
        }
    }
}
