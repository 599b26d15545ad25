package in.marketpulse.infrastructure.metrics;

import in.marketpulse.domain.health.HealthState;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus implementation of FeedMetrics.
 *
 * Key Metrics:
 * - feed_trades_total{venue, source}
 * - feed_bars_total{venue, resolution}
 * - feed_reconnects_total{venue, connection}
 * - feed_malformed_messages_total{venue}
 * - feed_sink_failures_total{venue, operation}
 * - feed_rate_limit_current_rps{scope}, feed_rate_limit_base_rps{scope}
 * - feed_component_health{component} (2=healthy, 1=degraded, 0=failed over)
 * - feed_backfill_progress_percent{venue, symbol, market}
 *
 * Usage:
 * <pre>
 * PrometheusFeedMetrics metrics = new PrometheusFeedMetrics(new CollectorRegistry());
 * Handlers.path().addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusFeedMetrics implements FeedMetrics {

    private final CollectorRegistry registry;

    private final Counter tradesCounter;
    private final Counter barsCounter;
    private final Counter reconnectCounter;
    private final Counter malformedCounter;
    private final Counter sinkFailureCounter;
    private final Gauge currentRps;
    private final Gauge baseRps;
    private final Gauge componentHealth;
    private final Gauge backfillProgress;

    public PrometheusFeedMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusFeedMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.tradesCounter = Counter.build()
            .name("feed_trades_total")
            .help("Total number of trades ingested")
            .labelNames("venue", "source")
            .register(registry);

        this.barsCounter = Counter.build()
            .name("feed_bars_total")
            .help("Total number of closed bars emitted")
            .labelNames("venue", "resolution")
            .register(registry);

        this.reconnectCounter = Counter.build()
            .name("feed_reconnects_total")
            .help("Total number of stream reconnect attempts")
            .labelNames("venue", "connection")
            .register(registry);

        this.malformedCounter = Counter.build()
            .name("feed_malformed_messages_total")
            .help("Total number of stream messages skipped as malformed")
            .labelNames("venue")
            .register(registry);

        this.sinkFailureCounter = Counter.build()
            .name("feed_sink_failures_total")
            .help("Total number of failed sink writes")
            .labelNames("venue", "operation")
            .register(registry);

        this.currentRps = Gauge.build()
            .name("feed_rate_limit_current_rps")
            .help("Current adaptive request rate per second")
            .labelNames("scope")
            .register(registry);

        this.baseRps = Gauge.build()
            .name("feed_rate_limit_base_rps")
            .help("Configured base request rate per second")
            .labelNames("scope")
            .register(registry);

        this.componentHealth = Gauge.build()
            .name("feed_component_health")
            .help("Component health (2=healthy, 1=degraded, 0=failed over)")
            .labelNames("component")
            .register(registry);

        this.backfillProgress = Gauge.build()
            .name("feed_backfill_progress_percent")
            .help("Historical backfill progress in percent")
            .labelNames("venue", "symbol", "market")
            .register(registry);
    }

    @Override
    public void recordTrades(String venue, String source, int count) {
        if (count > 0) {
            tradesCounter.labels(venue, source).inc(count);
        }
    }

    @Override
    public void recordBars(String venue, int resolutionSeconds, int count) {
        if (count > 0) {
            barsCounter.labels(venue, String.valueOf(resolutionSeconds)).inc(count);
        }
    }

    @Override
    public void recordReconnect(String venue, String connection) {
        reconnectCounter.labels(venue, connection).inc();
    }

    @Override
    public void recordMalformedMessage(String venue) {
        malformedCounter.labels(venue).inc();
    }

    @Override
    public void recordSinkFailure(String venue, String operation) {
        sinkFailureCounter.labels(venue, operation).inc();
    }

    @Override
    public void updateRateLimit(String scope, double current, double base) {
        currentRps.labels(scope).set(current);
        baseRps.labels(scope).set(base);
    }

    @Override
    public void updateComponentHealth(String component, HealthState state) {
        double value = switch (state) {
            case HEALTHY -> 2;
            case DEGRADED -> 1;
            case FAILED_OVER -> 0;
        };
        componentHealth.labels(component).set(value);
    }

    @Override
    public void updateBackfillProgress(String venue, String symbol, String market, double percent) {
        backfillProgress.labels(venue, symbol, market).set(percent);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
