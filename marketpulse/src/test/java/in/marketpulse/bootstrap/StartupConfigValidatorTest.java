package in.marketpulse.bootstrap;

import in.marketpulse.config.BackfillConfig;
import in.marketpulse.config.ConfigurationException;
import in.marketpulse.config.FeedConfig;
import in.marketpulse.config.RateLimitConfig;
import in.marketpulse.config.VenueConfig;
import in.marketpulse.domain.market.MarketType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StartupConfigValidator.
 *
 * Tests:
 * - A sane in-memory configuration passes
 * - Unknown and duplicate venues are rejected
 * - A backfill step that does not fit the resolutions is rejected only when backfill is on
 * - Every problem is reported in one exception
 */
class StartupConfigValidatorTest {

    private static VenueConfig venue(String name) {
        return new VenueConfig(name, Map.of(MarketType.SPOT, List.of("BTCUSDT")),
            RateLimitConfig.defaults(10), RateLimitConfig.defaults(5));
    }

    private static FeedConfig config(List<VenueConfig> venues, List<Integer> resolutions, BackfillConfig backfill,
                                     int groupSize, int healthThreshold) {
        return new FeedConfig(venues, resolutions,
            Duration.ofSeconds(10), Duration.ofMinutes(15), Duration.ofSeconds(30), groupSize, backfill,
            null, "postgres", "", 10, 9090,
            healthThreshold, Duration.ofSeconds(60), Duration.ofSeconds(60));
    }

    private static FeedConfig valid() {
        return config(List.of(venue("binance"), venue("bitget")), FeedConfig.DEFAULT_RESOLUTIONS,
            BackfillConfig.defaults(), 20, 5);
    }

    @Test
    void testValidConfigPasses() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(valid()));
    }

    @Test
    void testUnknownAndDuplicateVenues() {
        FeedConfig config = config(List.of(venue("binance"), venue("binance"), venue("kraken")),
            List.of(60), BackfillConfig.defaults(), 20, 5);

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> StartupConfigValidator.validate(config));
        assertTrue(e.getMessage().contains("Unknown venue 'kraken'"), e.getMessage());
        assertTrue(e.getMessage().contains("Venue listed twice: binance"), e.getMessage());
    }

    @Test
    void testBackfillStepMustFitResolutions() {
        BackfillConfig odd = new BackfillConfig(false, BackfillConfig.defaults().defaultTarget(), Map.of(),
            Duration.ofSeconds(420), Duration.ofMillis(100), 500, 8, 0);

        assertDoesNotThrow(() -> StartupConfigValidator.validate(
            config(List.of(venue("binance")), List.of(60, 300), odd, 20, 5)), "Disabled backfill is not checked");

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> StartupConfigValidator.validate(
                config(List.of(venue("binance")), List.of(60, 300), odd.withEnabled(true), 20, 5)));
        assertTrue(e.getMessage().contains("not a multiple of resolution 300s"), e.getMessage());
    }

    @Test
    void testAllProblemsReported() {
        FeedConfig config = config(List.of(), List.of(60, 60, -1), BackfillConfig.defaults(), 0, 0);

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> StartupConfigValidator.validate(config));
        String message = e.getMessage();
        assertTrue(message.contains("VENUES is empty"), message);
        assertTrue(message.contains("Resolution listed twice: 60"), message);
        assertTrue(message.contains("Resolution must be positive: -1"), message);
        assertTrue(message.contains("GROUP_SIZE"), message);
        assertTrue(message.contains("HEALTH_FAILURE_THRESHOLD"), message);
    }
}
