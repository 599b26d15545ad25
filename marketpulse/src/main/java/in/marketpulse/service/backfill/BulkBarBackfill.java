package in.marketpulse.service.backfill;

import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.metrics.FeedMetrics;
import in.marketpulse.infrastructure.persistence.MarketDataSink;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.VenueRestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Bulk candle backfill through the venue's kline/candle endpoint.
 *
 * Pages backward from {@code endTime}: after each page the next {@code endTime} is the oldest
 * returned bar start minus one millisecond. Bars are buffered and written once the buffer
 * reaches the batch size; each batch is written with one concurrent task per bar on the
 * supplied executor, and the call waits for the whole batch before fetching on.
 *
 * Stops at the requested count, an empty page, or the first fetch error.
 */
public class BulkBarBackfill {
    private static final Logger log = LoggerFactory.getLogger(BulkBarBackfill.class);

    public static final int DEFAULT_BATCH_SIZE = 500;
    private static final int PAGE_LIMIT = 1000;

    private final VenueRestClient restClient;
    private final AdaptiveRateLimiter limiter;
    private final HealthRegistry health;
    private final MarketDataSink sink;
    private final FeedMetrics metrics;
    private final ExecutorService writeExecutor;
    private final int batchSize;
    private final String restComponent;

    private volatile boolean running = true;
    private int batchesWritten = 0;

    public BulkBarBackfill(VenueRestClient restClient, AdaptiveRateLimiter limiter, HealthRegistry health,
                           MarketDataSink sink, FeedMetrics metrics, ExecutorService writeExecutor, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.restClient = restClient;
        this.limiter = limiter;
        this.health = health;
        this.sink = sink;
        this.metrics = metrics;
        this.writeExecutor = writeExecutor;
        this.batchSize = batchSize;
        this.restComponent = restClient.venue() + "_rest_api";
    }

    /**
     * Fetch up to {@code count} bars ending at {@code endTime} and write them to the sink.
     *
     * @return number of bars fetched
     */
    public int run(String symbol, MarketType market, int resolutionSeconds, Instant endTime, int count)
            throws InterruptedException {
        String prefix = "[BulkBackfill:" + restClient.venue() + ":" + symbol + ":" + market.code() + ":" + resolutionSeconds + "s]";
        log.info("{} Fetching up to {} bars ending {}", prefix, count, endTime);

        List<Bar> buffer = new ArrayList<>();
        int total = 0;
        Instant end = endTime;

        try {
            while (running && total < count) {
                limiter.acquire();
                List<Bar> page;
                try {
                    page = restClient.fetchBars(symbol, market, resolutionSeconds, end,
                        Math.min(PAGE_LIMIT, count - total));
                    limiter.reportSuccess();
                    health.recordSuccess(restComponent);
                } catch (RuntimeException e) {
                    limiter.reportError(e);
                    health.handleFailure(restComponent, e);
                    log.error("{} Fetch ending {} failed, stopping: {}", prefix, end, e.getMessage());
                    break;
                }
                if (page.isEmpty()) {
                    break;
                }

                int take = Math.min(page.size(), count - total);
                buffer.addAll(page.subList(0, take));
                total += take;

                Instant oldest = page.stream().map(Bar::start).min(Comparator.naturalOrder()).orElse(end);
                Instant next = oldest.minusMillis(1);
                if (!next.isBefore(end)) {
                    log.warn("{} Paging did not move backward from {}, stopping", prefix, end);
                    break;
                }
                end = next;

                if (buffer.size() >= batchSize) {
                    writeBatch(prefix, buffer);
                    buffer = new ArrayList<>();
                }
            }
        } finally {
            if (!buffer.isEmpty()) {
                writeBatch(prefix, buffer);
            }
        }

        log.info("{} Completed: {} bars in {} batches", prefix, total, batchesWritten);
        return total;
    }

    public void stop() {
        running = false;
    }

    public int batchesWritten() {
        return batchesWritten;
    }

    private void writeBatch(String prefix, List<Bar> batch) throws InterruptedException {
        List<CompletableFuture<Void>> writes = new ArrayList<>(batch.size());
        for (Bar bar : batch) {
            writes.add(CompletableFuture.runAsync(() -> sink.appendBar(bar), writeExecutor));
        }
        try {
            CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).get();
        } catch (ExecutionException e) {
            log.error("{} Batch write of {} bars failed: {}", prefix, batch.size(), e.getCause().getMessage());
        }
        batchesWritten++;
        if (!batch.isEmpty()) {
            metrics.recordBars(batch.get(0).venue(), batch.get(0).resolutionSeconds(), batch.size());
        }
        log.debug("{} Stored batch of {} bars", prefix, batch.size());
    }
}
