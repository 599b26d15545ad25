package in.marketpulse.config;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Configuration for historical backfill.
 */
public record BackfillConfig(
    boolean enabled,
    Instant defaultTarget,              // Horizon the walk stops at
    Map<String, Instant> targetOverrides, // Per-symbol horizon, keyed by upper-case symbol
    Duration step,                      // Window width, multiple of every resolution
    Duration delay,                     // Pause between windows
    int bulkBatchSize,                  // Bars buffered before a bulk flush
    int bulkWriteParallelism,           // Concurrent writes per bulk flush
    int bulkBars                        // Bars per (symbol, market, resolution) for the bulk candle pass, 0 = off
) {
    public BackfillConfig {
        targetOverrides = Map.copyOf(targetOverrides);
    }

    /**
     * Defaults: disabled, horizon 2020-01-01, 5-minute windows, 100 ms pause, batches of 500,
     * no bulk candle pass.
     */
    public static BackfillConfig defaults() {
        return new BackfillConfig(
            false,
            Instant.parse("2020-01-01T00:00:00Z"),
            Map.of(),
            Duration.ofMinutes(5),
            Duration.ofMillis(100),
            500,
            8,
            0
        );
    }

    public BackfillConfig withEnabled(boolean on) {
        return new BackfillConfig(on, defaultTarget, targetOverrides, step, delay, bulkBatchSize, bulkWriteParallelism, bulkBars);
    }

    public BackfillConfig withDefaultTarget(Instant target) {
        return new BackfillConfig(enabled, target, targetOverrides, step, delay, bulkBatchSize, bulkWriteParallelism, bulkBars);
    }

    public BackfillConfig withBulkBars(int bars) {
        return new BackfillConfig(enabled, defaultTarget, targetOverrides, step, delay, bulkBatchSize, bulkWriteParallelism, bars);
    }

    public Instant targetFor(String symbol) {
        return targetOverrides.getOrDefault(symbol.toUpperCase(), defaultTarget);
    }

    public boolean isValid() {
        return defaultTarget != null
            && step != null && !step.isNegative() && !step.isZero()
            && delay != null && !delay.isNegative()
            && bulkBatchSize > 0
            && bulkWriteParallelism > 0
            && bulkBars >= 0;
    }
}
