package in.marketpulse.infrastructure.venue.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectionPolicy.
 *
 * Tests:
 * - Stream backoff sequence 2s, 4s, 8s ... capped at 60s
 * - Reset on success
 * - Finite attempt limits
 * - Builder validation
 */
class ReconnectionPolicyTest {

    @Test
    void testInitialState() {
        ReconnectionPolicy policy = ReconnectionPolicy.forStream();

        assertTrue(policy.shouldRetry(), "Should allow initial retry");
        assertEquals(0, policy.getAttemptCount(), "Initial attempt count should be 0");
        assertEquals(Duration.ofSeconds(2), policy.getNextDelay(), "Initial delay is the base delay");
        assertNull(policy.getLastAttemptTime(), "No attempts made yet");
    }

    @Test
    void testStreamBackoffSequence() {
        ReconnectionPolicy policy = ReconnectionPolicy.forStream();

        long[] expected = {2, 4, 8, 16, 32, 60, 60, 60};
        for (int i = 0; i < expected.length; i++) {
            Duration delay = policy.recordFailure();
            assertEquals(Duration.ofSeconds(expected[i]), delay, "Delay after failure " + (i + 1));
            assertEquals(delay, policy.getNextDelay());
        }
        assertEquals(expected.length, policy.getAttemptCount());
        assertTrue(policy.shouldRetry(), "Stream policy retries forever");
    }

    @Test
    void testSuccessResetsSequence() {
        ReconnectionPolicy policy = ReconnectionPolicy.forStream();
        policy.recordFailure();
        policy.recordFailure();
        policy.recordFailure();
        assertNotNull(policy.getLastAttemptTime());

        policy.recordSuccess();

        assertEquals(0, policy.getAttemptCount(), "Attempt count should reset");
        assertNull(policy.getLastAttemptTime(), "Last attempt time should be cleared");
        assertEquals(Duration.ofSeconds(2), policy.recordFailure(), "Sequence restarts at the base delay");
    }

    @Test
    void testMaxDelayRespected() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(3.0)
            .build();

        assertEquals(Duration.ofSeconds(10), policy.recordFailure());
        assertEquals(Duration.ofSeconds(30), policy.recordFailure());
        assertEquals(Duration.ofSeconds(30), policy.recordFailure());
    }

    @Test
    void testFiniteAttempts() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(5))
            .maxAttempts(2)
            .build();

        policy.recordFailure();
        assertTrue(policy.shouldRetry(), "Should still retry (1/2)");
        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "Should NOT retry after max attempts");

        policy.recordSuccess();
        assertTrue(policy.shouldRetry(), "Success re-arms the policy");
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxDelay(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().multiplier(1.0));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxAttempts(-1));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder()
                .initialDelay(Duration.ofSeconds(10))
                .maxDelay(Duration.ofSeconds(5))
                .build(),
            "Initial delay cannot exceed max delay");
    }
}
