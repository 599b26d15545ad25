package in.marketpulse.service.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.marketpulse.config.BackfillConfig;
import in.marketpulse.config.CollectorConfig;
import in.marketpulse.config.VenueConfig;
import in.marketpulse.domain.backfill.BackfillCursor;
import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.metrics.FeedMetrics;
import in.marketpulse.infrastructure.persistence.HealthReportingSink;
import in.marketpulse.infrastructure.persistence.MarketDataSink;
import in.marketpulse.infrastructure.persistence.StateStore;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.ratelimit.RateLimiterRegistry;
import in.marketpulse.infrastructure.ratelimit.RateLimiterStats;
import in.marketpulse.infrastructure.venue.VenueAdapter;
import in.marketpulse.infrastructure.venue.VenueRestClient;
import in.marketpulse.infrastructure.venue.stream.ConnectionGroup;
import in.marketpulse.infrastructure.venue.stream.ConnectionStats;
import in.marketpulse.infrastructure.venue.stream.StreamClient;
import in.marketpulse.infrastructure.venue.stream.StreamConnector;
import in.marketpulse.infrastructure.venue.stream.StreamDependencies;
import in.marketpulse.service.backfill.BackfillCursorStore;
import in.marketpulse.service.backfill.BackfillDependencies;
import in.marketpulse.service.backfill.BackfillEngine;
import in.marketpulse.service.backfill.BulkBarBackfill;
import in.marketpulse.service.candle.CandleAggregator;
import in.marketpulse.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collector - Owns the ingestion pipeline of one venue.
 *
 * Owns:
 * - one {@link StreamClient} per connection group (symbols of a market split by group size)
 * - one live {@link CandleAggregator} per resolution, shared by all groups of the venue
 * - one {@link BackfillEngine} per (symbol, market) when backfill is enabled
 * - optional bulk candle passes ({@link BulkBarBackfill})
 * - a flush tick emitting completed and stale live bars
 *
 * Every task runs on an executor owned here; {@link #stop()} cancels and awaits them, flushes
 * the live aggregators one last time and writes a shutdown snapshot to the state store.
 */
public class Collector {
    private static final Logger log = LoggerFactory.getLogger(Collector.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final CollectorConfig config;
    private final VenueAdapter adapter;
    private final StreamConnector connector;
    private final HealthRegistry health;
    private final RateLimiterRegistry limiters;
    private final MarketDataSink sink;
    private final StateStore stateStore;
    private final BackfillCursorStore cursors;
    private final FeedMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final String venue;
    private final String logPrefix;

    private final List<CandleAggregator> aggregators;
    private final List<StreamClient> streamClients = new CopyOnWriteArrayList<>();
    private final List<BackfillEngine> backfillEngines = new CopyOnWriteArrayList<>();
    private final List<BulkBarBackfill> bulkPasses = new CopyOnWriteArrayList<>();
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();

    private ExecutorService taskExecutor;
    private ExecutorService writeExecutor;
    private ScheduledExecutorService flushScheduler;

    private volatile boolean running = false;
    private volatile Instant startedAt;
    private volatile CollectorSnapshot previousSnapshot;

    private Collector(Builder builder) {
        this.config = builder.config;
        this.adapter = builder.adapter;
        this.connector = builder.connector;
        this.health = builder.health;
        this.limiters = builder.limiters;
        this.metrics = builder.metrics;
        this.sleeper = builder.sleeper;
        this.clock = builder.clock;
        this.venue = adapter.venue();
        this.sink = new HealthReportingSink(venue, builder.sink, health, metrics);
        this.stateStore = builder.stateStore;
        this.cursors = new BackfillCursorStore(stateStore);
        this.logPrefix = "[Collector:" + venue + "]";

        List<CandleAggregator> live = new ArrayList<>();
        for (int resolution : config.resolutions()) {
            live.add(new CandleAggregator(resolution, config.stalenessTtl(), clock));
        }
        this.aggregators = List.copyOf(live);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ════════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Build every client and engine, then start them on owned threads. Returns immediately.
     * A stopped collector can be started again; it then runs only the new clients and engines.
     *
     * @throws in.marketpulse.config.ConfigurationException if the backfill step does not fit
     *         the resolutions; nothing is started in that case
     */
    public synchronized void start() {
        if (running) {
            log.warn("{} Already running", logPrefix);
            return;
        }
        VenueConfig venueConfig = config.venue();
        BackfillConfig backfill = config.backfill();

        health.register(venue + "_websocket");
        health.register(venue + "_rest_api");
        health.register(venue + "_storage");

        loadPreviousSnapshot();

        AdaptiveRateLimiter streamLimiter = limiters.get(venueConfig.streamLimiterScope(), venueConfig.streamLimit());
        AdaptiveRateLimiter restLimiter = limiters.get(venueConfig.restLimiterScope(), venueConfig.restLimit());

        StreamDependencies streamDeps = new StreamDependencies(
            streamLimiter, health, sink, aggregators, metrics, sleeper, clock);
        List<StreamClient> clients = new ArrayList<>();
        for (Map.Entry<MarketType, List<String>> entry : venueConfig.symbols().entrySet()) {
            for (ConnectionGroup group : ConnectionGroup.partition(venue, entry.getKey(), entry.getValue(),
                    config.groupSize(), adapter.tradeChannel(), venueConfig.streamLimiterScope())) {
                clients.add(adapter.createStreamClient(group, connector, streamDeps));
            }
        }

        List<BackfillEngine> engines = new ArrayList<>();
        VenueRestClient restClient = null;
        if (backfill.enabled() || backfill.bulkBars() > 0) {
            restClient = adapter.createRestClient(restLimiter);
        }
        if (backfill.enabled()) {
            BackfillDependencies backfillDeps = new BackfillDependencies(
                restClient, restLimiter, health, sink, cursors, metrics, sleeper, clock);
            for (Map.Entry<MarketType, List<String>> entry : venueConfig.symbols().entrySet()) {
                for (String symbol : entry.getValue()) {
                    engines.add(new BackfillEngine(symbol, entry.getKey(), backfill.targetFor(symbol),
                        backfill.step(), backfill.delay(), config.resolutions(), backfillDeps));
                }
            }
        }

        // Clients and engines of a previous run stay visible in the status until here
        streamClients.clear();
        backfillEngines.clear();
        bulkPasses.clear();
        tasks.clear();

        running = true;
        startedAt = clock.instant();
        streamClients.addAll(clients);
        backfillEngines.addAll(engines);
        taskExecutor = Executors.newCachedThreadPool(namedDaemon("collector-" + venue));
        writeExecutor = Executors.newFixedThreadPool(backfill.bulkWriteParallelism(), namedDaemon("bulk-write-" + venue));
        flushScheduler = Executors.newSingleThreadScheduledExecutor(namedDaemon("bar-flush-" + venue));

        for (StreamClient client : streamClients) {
            tasks.add(taskExecutor.submit(client::start));
        }
        for (BackfillEngine engine : backfillEngines) {
            tasks.add(taskExecutor.submit(engine::run));
        }
        if (backfill.bulkBars() > 0) {
            scheduleBulkPasses(restClient, restLimiter, backfill);
        }

        long intervalMs = config.flushInterval().toMillis();
        flushScheduler.scheduleAtFixedRate(this::flushTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        log.info("{} Started: {} stream connections, {} backfill engines, resolutions {}",
            logPrefix, streamClients.size(), backfillEngines.size(), config.resolutions());
    }

    /**
     * Stop everything, wait up to the shutdown timeout, flush once more and write the
     * shutdown snapshot. Tasks still running after the timeout are logged and abandoned.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("{} Stopping...", logPrefix);

        flushScheduler.shutdown();
        for (StreamClient client : streamClients) {
            client.stop();
        }
        for (BackfillEngine engine : backfillEngines) {
            engine.stop();
        }
        for (BulkBarBackfill pass : bulkPasses) {
            pass.stop();
        }
        for (Future<?> task : tasks) {
            task.cancel(true);
        }

        taskExecutor.shutdown();
        try {
            if (!taskExecutor.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                logUnfinished();
                taskExecutor.shutdownNow();
            }
            flushScheduler.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            taskExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        writeExecutor.shutdown();

        try {
            connector.close();
        } catch (Exception e) {
            log.warn("{} Error closing stream connector: {}", logPrefix, e.getMessage());
        }

        flushTick();
        int dropped = 0;
        for (CandleAggregator aggregator : aggregators) {
            dropped += aggregator.activeCount();
        }
        if (dropped > 0) {
            log.warn("{} {} bars still open at shutdown, not written", logPrefix, dropped);
        }

        writeSnapshot(dropped);
        tasks.clear();
        log.info("{} Stopped", logPrefix);
    }

    public boolean isRunning() {
        return running;
    }

    public String venue() {
        return venue;
    }

    // ════════════════════════════════════════════════════════════════════════
    // STATUS
    // ════════════════════════════════════════════════════════════════════════

    public CollectorStatus getStatus() {
        List<BackfillCursor> cursorList = new ArrayList<>();
        for (BackfillEngine engine : backfillEngines) {
            engine.cursor().ifPresent(cursorList::add);
        }
        Map<Integer, Integer> activeBars = new TreeMap<>();
        for (CandleAggregator aggregator : aggregators) {
            activeBars.put(aggregator.resolutionSeconds(), aggregator.activeCount());
        }
        return new CollectorStatus(venue, running, startedAt, getConnectionStats(), cursorList, activeBars);
    }

    public List<ConnectionStats> getConnectionStats() {
        List<ConnectionStats> stats = new ArrayList<>();
        for (StreamClient client : streamClients) {
            stats.add(client.stats());
        }
        return stats;
    }

    /**
     * Snapshot written by the previous shutdown, if one was found on start.
     */
    public Optional<CollectorSnapshot> previousSnapshot() {
        return Optional.ofNullable(previousSnapshot);
    }

    List<CandleAggregator> aggregators() {
        return aggregators;
    }

    // ════════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Emit completed and stale live bars. Runs on the flush scheduler and once more at stop.
     */
    void flushTick() {
        for (CandleAggregator aggregator : aggregators) {
            try {
                List<Bar> bars = new ArrayList<>(aggregator.flushAll());
                bars.addAll(aggregator.evictStale(clock.instant()));
                if (!bars.isEmpty()) {
                    sink.appendBars(bars);
                    metrics.recordBars(venue, aggregator.resolutionSeconds(), bars.size());
                    log.debug("{} Flushed {} bars at {}s", logPrefix, bars.size(), aggregator.resolutionSeconds());
                }
            } catch (RuntimeException e) {
                log.error("{} Flush of {}s bars failed", logPrefix, aggregator.resolutionSeconds(), e);
            }
        }
        for (Map.Entry<String, RateLimiterStats> entry : limiters.statsAll().entrySet()) {
            metrics.updateRateLimit(entry.getKey(), entry.getValue().currentRps(), entry.getValue().baseRps());
        }
    }

    private void scheduleBulkPasses(VenueRestClient restClient, AdaptiveRateLimiter restLimiter, BackfillConfig backfill) {
        Instant end = clock.instant();
        for (Map.Entry<MarketType, List<String>> entry : config.venue().symbols().entrySet()) {
            for (String symbol : entry.getValue()) {
                for (int resolution : config.resolutions()) {
                    if (resolution < 60) {
                        continue;
                    }
                    BulkBarBackfill pass = new BulkBarBackfill(restClient, restLimiter, health, sink, metrics,
                        writeExecutor, backfill.bulkBatchSize());
                    bulkPasses.add(pass);
                    MarketType market = entry.getKey();
                    tasks.add(taskExecutor.submit(() -> pass.run(symbol, market, resolution, end, backfill.bulkBars())));
                }
            }
        }
    }

    private void loadPreviousSnapshot() {
        String key = CollectorSnapshot.key(venue);
        try {
            Optional<String> json = stateStore.get(key);
            if (json.isEmpty()) {
                log.info("{} No previous shutdown snapshot", logPrefix);
                return;
            }
            previousSnapshot = MAPPER.readValue(json.get(), CollectorSnapshot.class);
            log.info("{} Previous shutdown at {} (reconnects {}, {} cursors, {} open bars dropped)",
                logPrefix, previousSnapshot.shutdownTime(), previousSnapshot.reconnectCounts(),
                previousSnapshot.cursors().size(), previousSnapshot.openBarsDropped());
        } catch (JsonProcessingException e) {
            log.warn("{} Unreadable snapshot at {}: {}", logPrefix, key, e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("{} Could not load snapshot {}: {}", logPrefix, key, e.getMessage());
        }
    }

    private void writeSnapshot(int openBarsDropped) {
        Map<String, Integer> reconnects = new LinkedHashMap<>();
        for (StreamClient client : streamClients) {
            ConnectionStats stats = client.stats();
            reconnects.put(stats.connection(), stats.reconnectCount());
        }
        List<BackfillCursor> cursorList = new ArrayList<>();
        for (BackfillEngine engine : backfillEngines) {
            engine.cursor().ifPresent(cursorList::add);
        }
        CollectorSnapshot snapshot = new CollectorSnapshot(
            venue, startedAt, clock.instant(), reconnects, cursorList, openBarsDropped);
        String key = CollectorSnapshot.key(venue);
        try {
            stateStore.set(key, MAPPER.writeValueAsString(snapshot));
            log.info("{} Shutdown snapshot written to {}", logPrefix, key);
        } catch (JsonProcessingException e) {
            log.error("{} Could not serialize shutdown snapshot", logPrefix, e);
        } catch (RuntimeException e) {
            log.error("{} Could not write shutdown snapshot: {}", logPrefix, e.getMessage());
            health.handleFailure(venue + "_storage", e);
        }
    }

    private void logUnfinished() {
        for (StreamClient client : streamClients) {
            if (client.isRunning()) {
                log.warn("{} Stream {} did not stop in time, abandoning", logPrefix, client.group().name());
            }
        }
        for (BackfillEngine engine : backfillEngines) {
            if (engine.isRunning()) {
                log.warn("{} Backfill {}:{} did not stop in time, abandoning",
                    logPrefix, engine.symbol(), engine.market().code());
            }
        }
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // ════════════════════════════════════════════════════════════════════════
    // BUILDER
    // ════════════════════════════════════════════════════════════════════════

    public static class Builder {
        private CollectorConfig config;
        private VenueAdapter adapter;
        private StreamConnector connector;
        private HealthRegistry health;
        private RateLimiterRegistry limiters;
        private MarketDataSink sink;
        private StateStore stateStore;
        private FeedMetrics metrics = FeedMetrics.NOOP;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Clock clock = Clock.systemUTC();

        public Builder config(CollectorConfig config) {
            this.config = config;
            return this;
        }

        public Builder adapter(VenueAdapter adapter) {
            this.adapter = adapter;
            return this;
        }

        public Builder connector(StreamConnector connector) {
            this.connector = connector;
            return this;
        }

        public Builder health(HealthRegistry health) {
            this.health = health;
            return this;
        }

        public Builder limiters(RateLimiterRegistry limiters) {
            this.limiters = limiters;
            return this;
        }

        /**
         * Raw sink; the collector wraps it so write failures only reach the health registry.
         */
        public Builder sink(MarketDataSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder stateStore(StateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        public Builder metrics(FeedMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Collector build() {
            if (config == null || adapter == null || connector == null || health == null
                    || limiters == null || sink == null || stateStore == null) {
                throw new IllegalStateException("Collector needs config, adapter, connector, health, limiters, sink and stateStore");
            }
            return new Collector(this);
        }
    }
}
