package in.marketpulse.bootstrap;

import in.marketpulse.config.BackfillConfig;
import in.marketpulse.config.ConfigurationException;
import in.marketpulse.config.FeedConfig;
import in.marketpulse.config.VenueConfig;
import in.marketpulse.infrastructure.venue.VenueFactory;
import in.marketpulse.service.backfill.BackfillEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs every check and reports all problems at once. Any problem is fatal: App exits with
 * status 1 before anything connects.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws ConfigurationException listing every invalid setting
     */
    public static void validate(FeedConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> errors = new ArrayList<>();

        if (config.venues().isEmpty()) {
            errors.add("VENUES is empty");
        }
        Set<String> seen = new HashSet<>();
        for (VenueConfig venue : config.venues()) {
            if (!VenueFactory.isSupported(venue.name())) {
                errors.add("Unknown venue '" + venue.name() + "' (supported: " + String.join(", ", VenueFactory.SUPPORTED) + ")");
            }
            if (!seen.add(venue.name())) {
                errors.add("Venue listed twice: " + venue.name());
            }
            if (venue.symbols().isEmpty()) {
                errors.add("No symbols configured for " + venue.name());
            }
            if (!venue.streamLimit().isValid()) {
                errors.add(venue.name() + " stream rate limit is invalid: " + venue.streamLimit());
            }
            if (!venue.restLimit().isValid()) {
                errors.add(venue.name() + " REST rate limit is invalid: " + venue.restLimit());
            }
            log.info("✓ Venue {}: {}", venue.name(), venue.symbols());
        }

        Set<Integer> resolutions = new HashSet<>();
        for (int resolution : config.resolutions()) {
            if (resolution <= 0) {
                errors.add("Resolution must be positive: " + resolution);
            }
            if (!resolutions.add(resolution)) {
                errors.add("Resolution listed twice: " + resolution);
            }
        }

        if (config.flushInterval().isNegative() || config.flushInterval().isZero()) {
            errors.add("FLUSH_INTERVAL_SECONDS must be positive");
        }
        if (config.stalenessTtl().isNegative() || config.stalenessTtl().isZero()) {
            errors.add("STALENESS_TTL_MINUTES must be positive");
        }
        if (config.shutdownTimeout().isNegative()) {
            errors.add("SHUTDOWN_TIMEOUT_SECONDS must not be negative");
        }
        if (config.groupSize() < 1) {
            errors.add("GROUP_SIZE must be at least 1");
        }

        BackfillConfig backfill = config.backfill();
        if (!backfill.isValid()) {
            errors.add("Backfill settings are invalid: " + backfill);
        } else if (backfill.enabled()) {
            try {
                BackfillEngine.validateStep(backfill.step(), config.resolutions());
            } catch (ConfigurationException e) {
                errors.add(e.getMessage());
            }
        }

        if (config.healthFailureThreshold() < 1) {
            errors.add("HEALTH_FAILURE_THRESHOLD must be at least 1");
        }
        if (config.healthWindow().isNegative() || config.healthWindow().isZero()) {
            errors.add("HEALTH_WINDOW_SECONDS must be positive");
        }
        if (config.healthCooldown().isNegative()) {
            errors.add("HEALTH_COOLDOWN_SECONDS must not be negative");
        }
        if (config.statusPort() < 0 || config.statusPort() > 65535) {
            errors.add("STATUS_PORT out of range: " + config.statusPort());
        }
        if (config.persistent() && config.dbPoolSize() < 1) {
            errors.add("DB_POOL_SIZE must be at least 1");
        }
        if (!config.persistent()) {
            log.warn("⚠️  DB_URL not set - using in-memory stores, nothing survives a restart");
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("❌ INVALID CONFIG:\n  - " + String.join("\n  - ", errors));
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
