package in.marketpulse.infrastructure.venue.common;

import java.time.Duration;
import java.time.Instant;

/**
 * Reconnection policy with exponential backoff for venue connections.
 *
 * The delay after the n-th consecutive failure is
 * {@code min(initialDelay * multiplier^(n-1), maxDelay)}, so with the stream defaults the
 * sequence is 2s, 4s, 8s, ... capped at 60s. A successful connect resets the sequence.
 *
 * {@code maxAttempts == 0} means retry forever.
 *
 * Usage:
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.forStream();
 *
 * while (running &amp;&amp; policy.shouldRetry()) {
 *     try {
 *         connect();
 *         policy.recordSuccess();
 *         readUntilClosed();
 *     } catch (VenueConnectionException e) {
 *         Duration delay = policy.recordFailure();
 *         sleeper.sleep(delay);
 *     }
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    public static final int UNLIMITED = 0;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true unless a finite attempt limit has been used up
     */
    public synchronized boolean shouldRetry() {
        return maxAttempts == UNLIMITED || attemptCount < maxAttempts;
    }

    /**
     * Delay that applies to the most recent failure (the initial delay before any failure).
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt and return the delay to wait before the next one.
     */
    public synchronized Duration recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();

        double factor = Math.pow(multiplier, attemptCount - 1);
        double millis = initialDelay.toMillis() * factor;
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        currentDelay = Duration.ofMillis(capped);
        return currentDelay;
    }

    /**
     * Record a successful connection. Resets the backoff sequence.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Streaming connections: 2s base, doubling, capped at 60s, unlimited retries.
     */
    public static ReconnectionPolicy forStream() {
        return builder()
            .initialDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(60))
            .multiplier(2.0)
            .maxAttempts(UNLIMITED)
            .build();
    }

    /**
     * Builder for ReconnectionPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private int maxAttempts = UNLIMITED;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("Max attempts must not be negative");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
