package in.marketpulse.infrastructure.metrics;

import in.marketpulse.domain.health.HealthState;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PrometheusFeedMetrics.
 *
 * Tests:
 * - Counters accumulate per label set
 * - Zero counts leave counters untouched
 * - Health states map to 2/1/0
 * - Rate limit and backfill gauges hold the latest value
 */
class PrometheusFeedMetricsTest {

    private CollectorRegistry registry;
    private PrometheusFeedMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusFeedMetrics(registry);
    }

    private Double sample(String name, String[] labels, String[] values) {
        return registry.getSampleValue(name, labels, values);
    }

    @Test
    void testCountersAccumulate() {
        metrics.recordTrades("binance", "stream", 3);
        metrics.recordTrades("binance", "stream", 2);
        metrics.recordTrades("binance", "backfill", 0);
        metrics.recordBars("bitget", 60, 4);
        metrics.recordReconnect("binance", "spot-0");

        assertEquals(5.0, sample("feed_trades_total", new String[]{"venue", "source"}, new String[]{"binance", "stream"}));
        assertNull(sample("feed_trades_total", new String[]{"venue", "source"}, new String[]{"binance", "backfill"}),
            "Zero count must not create a series");
        assertEquals(4.0, sample("feed_bars_total", new String[]{"venue", "resolution"}, new String[]{"bitget", "60"}));
        assertEquals(1.0, sample("feed_reconnects_total", new String[]{"venue", "connection"}, new String[]{"binance", "spot-0"}));
    }

    @Test
    void testComponentHealthGauge() {
        String[] labels = {"component"};
        metrics.updateComponentHealth("binance_websocket", HealthState.HEALTHY);
        assertEquals(2.0, sample("feed_component_health", labels, new String[]{"binance_websocket"}));

        metrics.updateComponentHealth("binance_websocket", HealthState.FAILED_OVER);
        assertEquals(0.0, sample("feed_component_health", labels, new String[]{"binance_websocket"}));

        metrics.updateComponentHealth("binance_websocket", HealthState.DEGRADED);
        assertEquals(1.0, sample("feed_component_health", labels, new String[]{"binance_websocket"}));
    }

    @Test
    void testGaugesHoldLatestValue() {
        metrics.updateRateLimit("binance_rest", 2.5, 5.0);
        metrics.updateRateLimit("binance_rest", 3.0, 5.0);
        metrics.updateBackfillProgress("binance", "BTCUSDT", "spot", 42.5);
        metrics.recordSinkFailure("binance", "appendBars");

        assertEquals(3.0, sample("feed_rate_limit_current_rps", new String[]{"scope"}, new String[]{"binance_rest"}));
        assertEquals(5.0, sample("feed_rate_limit_base_rps", new String[]{"scope"}, new String[]{"binance_rest"}));
        assertEquals(42.5, sample("feed_backfill_progress_percent",
            new String[]{"venue", "symbol", "market"}, new String[]{"binance", "BTCUSDT", "spot"}));
        assertEquals(1.0, sample("feed_sink_failures_total",
            new String[]{"venue", "operation"}, new String[]{"binance", "appendBars"}));
    }
}
