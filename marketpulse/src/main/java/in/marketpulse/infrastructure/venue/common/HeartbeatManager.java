package in.marketpulse.infrastructure.venue.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keep-alive for one live stream connection.
 *
 * Sends the venue's ping every {@code pingInterval}. Any inbound traffic counts as a pong.
 * If nothing arrives within {@code timeout} after a ping, {@code onTimeout} runs once; the
 * stream client closes the connection there and its normal reconnect path takes over.
 *
 * One manager per connection: create on connect, {@link #stop()} on disconnect.
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String venue;
    private final String connection;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Runnable onTimeout;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pingTask;
    private volatile ScheduledFuture<?> timeoutTask;
    private volatile Instant lastPongTime;
    private volatile boolean running = false;
    private volatile boolean timedOut = false;

    public HeartbeatManager(String venue, String connection,
                            Duration pingInterval, Duration timeout,
                            Runnable pingFunction, Runnable onTimeout) {
        this.venue = venue;
        this.connection = connection;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.onTimeout = onTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Heartbeat-" + venue + "-" + connection);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[{}:{}] Heartbeat already running", venue, connection);
            return;
        }

        log.debug("[{}:{}] Starting heartbeat (ping {}s, timeout {}s)",
            venue, connection, pingInterval.getSeconds(), timeout.getSeconds());

        running = true;
        timedOut = false;
        lastPongTime = Instant.now();

        pingTask = scheduler.scheduleAtFixedRate(this::sendPing,
            pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;

            if (pingTask != null) {
                pingTask.cancel(false);
                pingTask = null;
            }
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
                timeoutTask = null;
            }
        }

        // Await outside the monitor: a ping in flight may need it to finish.
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Record inbound traffic (pong or data). Cancels the pending timeout check.
     */
    public synchronized void recordPong() {
        lastPongTime = Instant.now();
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }
    }

    public boolean isHealthy() {
        return running && !timedOut && isWithinTimeout();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return time since the last pong, or null if none was recorded
     */
    public Duration getTimeSinceLastPong() {
        Instant lastPong = lastPongTime;
        if (lastPong == null) {
            return null;
        }
        return Duration.between(lastPong, Instant.now());
    }

    private void sendPing() {
        if (!running) {
            return;
        }
        log.trace("[{}:{}] Sending ping", venue, connection);
        try {
            pingFunction.run();
        } catch (RuntimeException e) {
            log.warn("[{}:{}] Ping failed: {}", venue, connection, e.getMessage());
            fireTimeout();
            return;
        }
        scheduleTimeoutCheck();
    }

    private synchronized void scheduleTimeoutCheck() {
        if (!running) {
            return;
        }
        // Keep the earliest pending check; later pings must not push the deadline back.
        if (timeoutTask != null && !timeoutTask.isDone()) {
            return;
        }
        timeoutTask = scheduler.schedule(() -> {
            if (isWithinTimeout()) {
                return;
            }
            log.warn("[{}:{}] Heartbeat timeout - nothing received for {} seconds",
                venue, connection, timeout.getSeconds());
            fireTimeout();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean isWithinTimeout() {
        Instant lastPong = lastPongTime;
        if (lastPong == null) {
            return false;
        }
        return Duration.between(lastPong, Instant.now()).compareTo(timeout) < 0;
    }

    private void fireTimeout() {
        if (timedOut) {
            return;
        }
        timedOut = true;
        try {
            onTimeout.run();
        } catch (RuntimeException e) {
            log.error("[{}:{}] Timeout callback threw exception", venue, connection, e);
        }
    }

    /**
     * Default keep-alive for venue WebSockets: ping every 20 seconds, 30 seconds to answer.
     */
    public static HeartbeatManager forWebSocket(String venue, String connection,
                                                Runnable pingFunction, Runnable onTimeout) {
        return new HeartbeatManager(
            venue,
            connection,
            Duration.ofSeconds(20),
            Duration.ofSeconds(30),
            pingFunction,
            onTimeout
        );
    }
}
