package in.marketpulse.config;

import in.marketpulse.domain.market.MarketType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FeedConfig, VenueConfig and BackfillConfig.
 *
 * Tests:
 * - Dates parse as plain days or full instants; garbage is a configuration error
 * - Venue settings are read from -D overrides
 * - Empty markets are dropped from a venue
 * - Per-symbol backfill horizons override the default
 */
class FeedConfigTest {

    private static final Instant FALLBACK = Instant.parse("2020-01-01T00:00:00Z");

    @AfterEach
    void clearProperties() {
        System.clearProperty("TESTVENUE_SPOT_SYMBOLS");
        System.clearProperty("TESTVENUE_HISTORICAL_RPS");
        System.clearProperty("TESTVENUE_MAX_REQUESTS_PER_MINUTE");
    }

    @Test
    void testParseDate() {
        assertEquals(Instant.parse("2023-06-01T00:00:00Z"), FeedConfig.parseDate("K", "2023-06-01", FALLBACK));
        assertEquals(Instant.parse("2023-06-01T12:30:00Z"), FeedConfig.parseDate("K", "2023-06-01t12:30:00z", FALLBACK));
        assertEquals(FALLBACK, FeedConfig.parseDate("K", null, FALLBACK));
        assertEquals(FALLBACK, FeedConfig.parseDate("K", "  ", FALLBACK));

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> FeedConfig.parseDate("BACKFILL_TARGET_DATE", "yesterday", FALLBACK));
        assertTrue(e.getMessage().contains("BACKFILL_TARGET_DATE"), "Error names the key");
    }

    @Test
    void testVenueFromProperties() {
        System.setProperty("TESTVENUE_SPOT_SYMBOLS", "btcusdt, ethusdt");
        System.setProperty("TESTVENUE_HISTORICAL_RPS", "2.5");
        System.setProperty("TESTVENUE_MAX_REQUESTS_PER_MINUTE", "600");

        VenueConfig venue = VenueConfig.fromEnv("TestVenue");

        assertEquals("testvenue", venue.name());
        assertEquals(List.of("BTCUSDT", "ETHUSDT"), venue.symbolsFor(MarketType.SPOT));
        assertEquals(2.5, venue.restLimit().baseRps(), 1e-9);
        assertEquals(600, venue.restLimit().maxRequestsPerWindow());
        assertEquals(0, venue.streamLimit().maxRequestsPerWindow());
        assertEquals("testvenue_stream", venue.streamLimiterScope());
        assertEquals("testvenue_rest", venue.restLimiterScope());
    }

    @Test
    void testEmptyMarketsDropped() {
        VenueConfig venue = new VenueConfig("binance",
            Map.of(MarketType.SPOT, List.of("BTCUSDT"), MarketType.COIN_FUTURES, List.of()),
            RateLimitConfig.defaults(10), RateLimitConfig.defaults(5));

        assertEquals(1, venue.symbols().size());
        assertTrue(venue.symbolsFor(MarketType.COIN_FUTURES).isEmpty());
    }

    @Test
    void testBackfillTargets() {
        BackfillConfig backfill = new BackfillConfig(true, FALLBACK,
            Map.of("ETHUSDT", Instant.parse("2022-01-01T00:00:00Z")),
            Duration.ofMinutes(5), Duration.ofMillis(100), 500, 8, 0);

        assertEquals(Instant.parse("2022-01-01T00:00:00Z"), backfill.targetFor("ethusdt"));
        assertEquals(FALLBACK, backfill.targetFor("BTCUSDT"));
        assertTrue(backfill.isValid());
        assertFalse(backfill.withBulkBars(-1).isValid());
    }

    @Test
    void testRateLimitDefaults() {
        RateLimitConfig config = RateLimitConfig.defaults(0.5);

        assertEquals(0.1, config.floorRps(), 1e-9, "Floor never drops below 0.1 rps");
        assertEquals(RateLimitConfig.MIN_RECOVERY_STEP, config.recoveryStep(), 1e-9);
        assertTrue(config.isValid());
        assertFalse(config.withFloorRps(1.0).isValid(), "Floor above base is rejected");
    }
}
