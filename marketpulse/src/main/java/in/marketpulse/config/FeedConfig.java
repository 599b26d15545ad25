package in.marketpulse.config;

import in.marketpulse.util.Env;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Process-wide configuration, read once at startup.
 *
 * Values come from environment variables (or {@code -D} system properties); see
 * {@link #fromEnv()} for the keys and defaults. A missing {@code DB_URL} selects the in-memory
 * stores.
 */
public record FeedConfig(
    List<VenueConfig> venues,
    List<Integer> resolutions,         // Bar resolutions in seconds
    Duration flushInterval,            // Live aggregator flush tick
    Duration stalenessTtl,             // Idle open bars older than this are flushed
    Duration shutdownTimeout,          // Grace period for owned tasks on stop
    int groupSize,                     // Symbols per stream connection
    BackfillConfig backfill,
    String dbUrl,
    String dbUser,
    String dbPass,
    int dbPoolSize,
    int statusPort,
    int healthFailureThreshold,
    Duration healthWindow,
    Duration healthCooldown
) {
    public static final List<Integer> DEFAULT_RESOLUTIONS = List.of(1, 60, 300, 900);

    public FeedConfig {
        venues = List.copyOf(venues);
        resolutions = List.copyOf(resolutions);
    }

    /**
     * Read the configuration from the environment.
     *
     * @throws ConfigurationException if a value is present but cannot be parsed
     */
    public static FeedConfig fromEnv() {
        List<VenueConfig> venues = new ArrayList<>();
        for (String venue : Env.getList("VENUES", List.of("binance", "bitget"))) {
            venues.add(VenueConfig.fromEnv(venue));
        }

        List<Integer> resolutions = new ArrayList<>();
        for (String value : Env.getList("RESOLUTIONS", List.of())) {
            try {
                resolutions.add(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("RESOLUTIONS entry is not an integer: " + value, e);
            }
        }
        if (resolutions.isEmpty()) {
            resolutions.addAll(DEFAULT_RESOLUTIONS);
        }

        BackfillConfig defaults = BackfillConfig.defaults();
        Instant defaultTarget = parseDate("BACKFILL_TARGET_DATE", Env.get("BACKFILL_TARGET_DATE", null),
            defaults.defaultTarget());
        Map<String, Instant> overrides = new HashMap<>();
        for (VenueConfig venue : venues) {
            for (String symbol : venue.allSymbols()) {
                String key = "BACKFILL_TARGET_" + symbol;
                String value = Env.get(key, null);
                if (value != null) {
                    overrides.put(symbol, parseDate(key, value, defaultTarget));
                }
            }
        }
        BackfillConfig backfill = new BackfillConfig(
            Env.getBool("BACKFILL_ENABLED", defaults.enabled()),
            defaultTarget,
            overrides,
            Duration.ofSeconds(Env.getLong("BACKFILL_STEP_SECONDS", defaults.step().getSeconds())),
            Duration.ofMillis(Env.getLong("BACKFILL_DELAY_MS", defaults.delay().toMillis())),
            Env.getInt("BACKFILL_BATCH_SIZE", defaults.bulkBatchSize()),
            Env.getInt("BACKFILL_WRITE_PARALLELISM", defaults.bulkWriteParallelism()),
            Env.getInt("BULK_BACKFILL_BARS", defaults.bulkBars())
        );

        return new FeedConfig(
            venues,
            resolutions,
            Duration.ofSeconds(Env.getLong("FLUSH_INTERVAL_SECONDS", 10)),
            Duration.ofMinutes(Env.getLong("STALENESS_TTL_MINUTES", 15)),
            Duration.ofSeconds(Env.getLong("SHUTDOWN_TIMEOUT_SECONDS", 30)),
            Env.getInt("GROUP_SIZE", 20),
            backfill,
            Env.get("DB_URL", null),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", ""),
            Env.getInt("DB_POOL_SIZE", 10),
            Env.getInt("STATUS_PORT", 9090),
            Env.getInt("HEALTH_FAILURE_THRESHOLD", 5),
            Duration.ofSeconds(Env.getLong("HEALTH_WINDOW_SECONDS", 60)),
            Duration.ofSeconds(Env.getLong("HEALTH_COOLDOWN_SECONDS", 60))
        );
    }

    public boolean persistent() {
        return dbUrl != null && !dbUrl.isBlank();
    }

    /**
     * Collector settings for one venue.
     */
    public CollectorConfig collectorConfig(VenueConfig venue) {
        return new CollectorConfig(venue, resolutions, flushInterval, stalenessTtl, shutdownTimeout, groupSize, backfill);
    }

    /**
     * Accepts {@code 2020-01-01} or a full ISO instant.
     */
    static Instant parseDate(String key, String value, Instant fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(trimmed.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(key + " is not a date: " + value, e);
        }
    }
}
