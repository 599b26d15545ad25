package in.marketpulse.infrastructure.health;

import in.marketpulse.domain.health.ComponentHealth;
import in.marketpulse.domain.health.HealthState;
import in.marketpulse.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HealthRegistry.
 *
 * Tests:
 * - Threshold inside the window fails a component over
 * - Failures outside the window do not count
 * - Cooldown expiry moves to DEGRADED, a success to HEALTHY
 * - Unknown components are available and auto-registered on failure
 * - Listener notification and isolation
 */
class HealthRegistryTest {

    private static final String WS = "binance_websocket";

    private MutableClock clock;
    private HealthRegistry health;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        health = new HealthRegistry(clock);
        health.setFailureThreshold(3);
        health.setFailureWindow(Duration.ofSeconds(60));
        health.setCooldown(Duration.ofSeconds(120));
        health.register(WS);
    }

    @Test
    void testRegisteredComponentStartsHealthy() {
        ComponentHealth status = health.status(WS);

        assertNotNull(status);
        assertTrue(status.isHealthy());
        assertTrue(health.isAvailable(WS));
        assertNull(health.status("never_seen"), "Unknown component has no status");
        assertTrue(health.isAvailable("never_seen"), "Unknown components are available");
    }

    @Test
    void testThresholdFailsOver() {
        health.handleFailure(WS, new IOException("reset"));
        health.handleFailure(WS, new IOException("reset"));
        assertTrue(health.isAvailable(WS), "Below threshold stays available");
        assertEquals(2, health.status(WS).consecutiveFailures());

        health.handleFailure(WS, new IOException("reset"));

        ComponentHealth status = health.status(WS);
        assertTrue(status.isFailedOver());
        assertFalse(health.isAvailable(WS));
        assertEquals(clock.instant().plusSeconds(120), status.cooldownUntil());
        assertEquals("IOException: reset", status.lastFailureReason());
    }

    @Test
    void testFailuresOutsideWindowAreForgotten() {
        health.handleFailure(WS, new IOException("a"));
        health.handleFailure(WS, new IOException("b"));
        clock.advance(Duration.ofSeconds(61));
        health.handleFailure(WS, new IOException("c"));

        ComponentHealth status = health.status(WS);
        assertEquals(HealthState.HEALTHY, status.state(), "Old failures fell out of the window");
        assertEquals(1, status.failuresInWindow());
    }

    @Test
    void testCooldownThenRecovery() {
        failOver();

        clock.advance(Duration.ofSeconds(119));
        assertFalse(health.isAvailable(WS), "Still cooling down");

        clock.advance(Duration.ofSeconds(1));
        assertTrue(health.isAvailable(WS), "Available again once cooldown ends");
        assertEquals(HealthState.DEGRADED, health.status(WS).state());

        health.recordSuccess(WS);
        assertEquals(HealthState.HEALTHY, health.status(WS).state());
    }

    @Test
    void testSuccessDuringCooldownDoesNotRecover() {
        failOver();

        health.recordSuccess(WS);

        assertEquals(HealthState.FAILED_OVER, health.status(WS).state());
        assertEquals(0, health.status(WS).consecutiveFailures());
    }

    @Test
    void testSweepAppliesCooldownExpiry() {
        failOver();
        clock.advance(Duration.ofSeconds(121));

        health.sweep();

        assertEquals(HealthState.DEGRADED, health.statusAll().get(WS).state());
    }

    @Test
    void testFailureAutoRegistersComponent() {
        health.handleFailure("bitget_storage", new RuntimeException("disk full"));

        ComponentHealth status = health.status("bitget_storage");
        assertNotNull(status, "Failure registers unknown component");
        assertEquals(1, status.consecutiveFailures());
        assertTrue(health.statusAll().containsKey("bitget_storage"));
    }

    @Test
    void testListenersNotified() {
        List<HealthEvent> failovers = new ArrayList<>();
        List<HealthEvent> recoveries = new ArrayList<>();
        health.onFailover(event -> {
            throw new IllegalStateException("listener bug");
        });
        health.onFailover(failovers::add);
        health.onRecovered(recoveries::add);

        failOver();
        health.handleFailure(WS, new IOException("again"));
        assertEquals(1, failovers.size(), "Failover reported once, bad listener isolated");
        assertEquals(HealthState.HEALTHY, failovers.get(0).previousState());
        assertEquals(HealthState.FAILED_OVER, failovers.get(0).newState());

        clock.advance(Duration.ofSeconds(120));
        health.recordSuccess(WS);
        assertEquals(1, recoveries.size());
        assertEquals(HealthEvent.HealthEventType.RECOVERED, recoveries.get(0).eventType());
        assertEquals(WS, recoveries.get(0).component());
    }

    @Test
    void testStartStop() {
        health.setSweepInterval(Duration.ofMillis(10));
        health.start();
        health.start();
        assertDoesNotThrow(health::stop);
        assertDoesNotThrow(health::stop);
    }

    @Test
    void testInvalidThreshold() {
        assertThrows(IllegalArgumentException.class, () -> health.setFailureThreshold(0));
    }

    private void failOver() {
        for (int i = 0; i < 3; i++) {
            health.handleFailure(WS, new IOException("reset " + i));
        }
        assertTrue(health.status(WS).isFailedOver());
    }
}
