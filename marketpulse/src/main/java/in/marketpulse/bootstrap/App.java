package in.marketpulse.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.marketpulse.config.ConfigurationException;
import in.marketpulse.config.FeedConfig;
import in.marketpulse.config.VenueConfig;
import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.metrics.PrometheusFeedMetrics;
import in.marketpulse.infrastructure.metrics.PrometheusMetricsHandler;
import in.marketpulse.infrastructure.persistence.InMemoryMarketDataSink;
import in.marketpulse.infrastructure.persistence.InMemoryStateStore;
import in.marketpulse.infrastructure.persistence.MarketDataSink;
import in.marketpulse.infrastructure.persistence.PostgresMarketDataSink;
import in.marketpulse.infrastructure.persistence.PostgresStateStore;
import in.marketpulse.infrastructure.persistence.StateStore;
import in.marketpulse.infrastructure.ratelimit.RateLimiterRegistry;
import in.marketpulse.infrastructure.venue.VenueFactory;
import in.marketpulse.infrastructure.venue.stream.JdkWebSocketConnector;
import in.marketpulse.migration.FeedSchemaMigration;
import in.marketpulse.service.collector.Collector;
import in.marketpulse.transport.http.StatusHandlers;
import in.marketpulse.transport.http.StatusServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * MarketPulse entry point.
 *
 * Reads configuration, validates it, wires one collector per venue, serves the status endpoint
 * and blocks until the JVM shuts down. The shutdown hook stops collectors (final flush and
 * snapshot included) before closing storage.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        FeedConfig config;
        try {
            config = FeedConfig.fromEnv();
            StartupConfigValidator.validate(config);
        } catch (ConfigurationException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Metrics + health
        // ═══════════════════════════════════════════════════════════════
        PrometheusFeedMetrics metrics = new PrometheusFeedMetrics();
        log.info("✓ Prometheus metrics initialized");

        HealthRegistry health = new HealthRegistry(clock);
        health.setFailureThreshold(config.healthFailureThreshold());
        health.setFailureWindow(config.healthWindow());
        health.setCooldown(config.healthCooldown());
        health.setMetrics(metrics);
        health.onFailover(event -> log.error("[HEALTH] {} failed over: {}", event.component(), event.reason()));
        health.onRecovered(event -> log.info("[HEALTH] {} recovered", event.component()));
        health.start();

        RateLimiterRegistry limiters = new RateLimiterRegistry();

        // ═══════════════════════════════════════════════════════════════
        // Storage
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = null;
        MarketDataSink sink;
        StateStore stateStore;
        if (config.persistent()) {
            dataSource = createDataSource(config);
            new FeedSchemaMigration(dataSource).migrate();
            sink = new PostgresMarketDataSink(dataSource);
            stateStore = new PostgresStateStore(dataSource, clock);
            log.info("✓ PostgreSQL storage ready");
        } else {
            sink = new InMemoryMarketDataSink();
            stateStore = new InMemoryStateStore(clock);
            log.info("✓ In-memory storage ready");
        }

        // ═══════════════════════════════════════════════════════════════
        // Collectors (one per venue)
        // ═══════════════════════════════════════════════════════════════
        VenueFactory venueFactory = new VenueFactory();
        List<Collector> collectors = new ArrayList<>();
        for (VenueConfig venue : config.venues()) {
            collectors.add(Collector.builder()
                .config(config.collectorConfig(venue))
                .adapter(venueFactory.create(venue.name()))
                .connector(new JdkWebSocketConnector())
                .health(health)
                .limiters(limiters)
                .sink(sink)
                .stateStore(stateStore)
                .metrics(metrics)
                .clock(clock)
                .build());
        }

        // ═══════════════════════════════════════════════════════════════
        // Status endpoint
        // ═══════════════════════════════════════════════════════════════
        StatusServer statusServer = new StatusServer(
            config.statusPort(),
            new StatusHandlers(health, limiters, collectors, clock),
            new PrometheusMetricsHandler(metrics.getRegistry()));

        CountDownLatch stopped = new CountDownLatch(1);
        HikariDataSource pool = dataSource;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            for (Collector collector : collectors) {
                try {
                    collector.stop();
                } catch (RuntimeException e) {
                    log.error("Error stopping collector {}", collector.venue(), e);
                }
            }
            statusServer.stop();
            health.stop();
            if (pool != null) {
                pool.close();
            }
            stopped.countDown();
            log.info("MarketPulse stopped");
        }, "shutdown"));

        try {
            for (Collector collector : collectors) {
                collector.start();
            }
        } catch (ConfigurationException e) {
            log.error("❌ Collector configuration rejected", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }
        statusServer.start();
        log.info("MarketPulse started: {} venues, resolutions {}", collectors.size(), config.resolutions());

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static HikariDataSource createDataSource(FeedConfig feed) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(feed.dbUrl());
        config.setUsername(feed.dbUser());
        config.setPassword(feed.dbPass());
        config.setMaximumPoolSize(feed.dbPoolSize());
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("marketpulse-hikari");

        log.info("DB: url={}, user={}, pool={}", feed.dbUrl(), feed.dbUser(), feed.dbPoolSize());
        return new HikariDataSource(config);
    }

    private App() {}
}
