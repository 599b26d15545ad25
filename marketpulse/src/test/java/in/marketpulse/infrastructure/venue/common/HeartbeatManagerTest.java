package in.marketpulse.infrastructure.venue.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HeartbeatManager.
 *
 * Tests:
 * - Periodic ping sending
 * - Inbound traffic keeps the connection healthy
 * - Timeout fires once when nothing arrives
 * - Failing ping counts as a timeout
 * - Lifecycle management
 */
class HeartbeatManagerTest {

    private HeartbeatManager heartbeat;

    @AfterEach
    void tearDown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
    }

    @Test
    void testInitialState() {
        AtomicInteger pingCount = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("binance", "spot-0",
            Duration.ofSeconds(1), Duration.ofSeconds(2),
            pingCount::incrementAndGet, () -> {});

        assertEquals(0, pingCount.get(), "No pings sent before start");
        assertNull(heartbeat.getTimeSinceLastPong(), "No pongs received yet");
        assertFalse(heartbeat.isRunning());
        assertFalse(heartbeat.isHealthy(), "Not healthy before start");
    }

    @Test
    void testPeriodicPingSending() throws InterruptedException {
        CountDownLatch pingLatch = new CountDownLatch(3);

        heartbeat = new HeartbeatManager("binance", "spot-0",
            Duration.ofMillis(100), Duration.ofSeconds(5),
            pingLatch::countDown, () -> {});
        heartbeat.start();

        assertTrue(pingLatch.await(2, TimeUnit.SECONDS), "Should send 3 pings within 2 seconds");
        assertTrue(heartbeat.isRunning());
    }

    @Test
    void testTrafficKeepsConnectionHealthy() throws InterruptedException {
        AtomicInteger timeouts = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("binance", "spot-0",
            Duration.ofMillis(50), Duration.ofMillis(300),
            () -> {}, timeouts::incrementAndGet);
        heartbeat.start();

        ScheduledExecutorService traffic = Executors.newSingleThreadScheduledExecutor();
        try {
            traffic.scheduleAtFixedRate(heartbeat::recordPong, 0, 50, TimeUnit.MILLISECONDS);
            Thread.sleep(800);
        } finally {
            traffic.shutdownNow();
        }

        assertEquals(0, timeouts.get(), "Steady traffic never times out");
        assertTrue(heartbeat.isHealthy());
        assertTrue(heartbeat.getTimeSinceLastPong().toMillis() < 300);
    }

    @Test
    void testTimeoutFiresOnceWithoutTraffic() throws InterruptedException {
        CountDownLatch timeoutLatch = new CountDownLatch(1);
        AtomicInteger timeouts = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("bitget", "usdtm-1",
            Duration.ofMillis(100), Duration.ofMillis(300),
            () -> {},
            () -> {
                timeouts.incrementAndGet();
                timeoutLatch.countDown();
            });
        heartbeat.start();

        assertTrue(timeoutLatch.await(2, TimeUnit.SECONDS), "Should time out when nothing arrives");
        Thread.sleep(500);
        assertEquals(1, timeouts.get(), "Timeout callback runs once");
        assertFalse(heartbeat.isHealthy());
    }

    @Test
    void testFailingPingTriggersTimeout() throws InterruptedException {
        CountDownLatch timeoutLatch = new CountDownLatch(1);

        heartbeat = new HeartbeatManager("bitget", "spot-0",
            Duration.ofMillis(50), Duration.ofSeconds(10),
            () -> {
                throw new IllegalStateException("socket closed");
            },
            timeoutLatch::countDown);
        heartbeat.start();

        assertTrue(timeoutLatch.await(2, TimeUnit.SECONDS), "Ping failure is handled as a timeout");
    }

    @Test
    void testStopHaltsPings() throws InterruptedException {
        AtomicInteger pingCount = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("binance", "spot-0",
            Duration.ofMillis(50), Duration.ofSeconds(5),
            pingCount::incrementAndGet, () -> {});
        heartbeat.start();
        Thread.sleep(200);
        heartbeat.stop();

        int afterStop = pingCount.get();
        Thread.sleep(200);
        assertEquals(afterStop, pingCount.get(), "No pings after stop");
        assertFalse(heartbeat.isRunning());

        assertDoesNotThrow(heartbeat::stop, "Stop is idempotent");
    }
}
