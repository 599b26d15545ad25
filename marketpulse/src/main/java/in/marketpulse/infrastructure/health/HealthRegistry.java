package in.marketpulse.infrastructure.health;

import in.marketpulse.domain.health.ComponentHealth;
import in.marketpulse.domain.health.HealthState;
import in.marketpulse.infrastructure.metrics.FeedMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Process-wide health table for named pipeline components
 * (e.g. {@code binance_websocket}, {@code bitget_rest_api}, {@code binance_storage}).
 *
 * Features:
 * - Rolling failure window per component
 * - FAILED_OVER with a cooldown deadline once the threshold is reached inside the window
 * - DEGRADED after the cooldown, HEALTHY again on the next success
 * - Periodic sweep applying cooldown expiry even when nobody reads the component
 * - Event notifications for failover and recovery
 *
 * Dependents call {@link #isAvailable(String)} before opening new connections or issuing new
 * requests. Existing connections are never torn down by the registry.
 *
 * Usage:
 * <pre>
 * HealthRegistry health = new HealthRegistry();
 * health.onFailover(event -> log.error("Component down: {}", event.component()));
 * health.start();
 *
 * if (health.isAvailable("binance_websocket")) {
 *     connect();
 * }
 * </pre>
 */
public class HealthRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthRegistry.class);

    private final Clock clock;
    private FeedMetrics metrics = FeedMetrics.NOOP;

    // ════════════════════════════════════════════════════════════════════════
    // CONFIGURATION
    // ════════════════════════════════════════════════════════════════════════
    private int failureThreshold = 5;
    private Duration failureWindow = Duration.ofSeconds(60);
    private Duration cooldown = Duration.ofSeconds(60);
    private Duration sweepInterval = Duration.ofSeconds(30);

    // State (guarded by this)
    private final Map<String, Entry> components = new HashMap<>();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;
    private boolean running = false;

    private final List<Consumer<HealthEvent>> failoverListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<HealthEvent>> recoveredListeners = new CopyOnWriteArrayList<>();

    public HealthRegistry() {
        this(Clock.systemUTC());
    }

    public HealthRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Start the periodic cooldown sweep.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[HealthRegistry] Already running");
            return;
        }
        log.info("[HealthRegistry] Starting (threshold {} in {}s, cooldown {}s, sweep {}s)",
            failureThreshold, failureWindow.toSeconds(), cooldown.toSeconds(), sweepInterval.toSeconds());
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "HealthRegistrySweep");
            t.setDaemon(true);
            return t;
        });
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweep,
            sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("[HealthRegistry] Stopping");
        running = false;
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
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
     * Register a component as HEALTHY. Registering an existing name is a no-op.
     */
    public synchronized void register(String component) {
        if (components.containsKey(component)) {
            return;
        }
        components.put(component, new Entry(component, clock.instant()));
        metrics.updateComponentHealth(component, HealthState.HEALTHY);
        log.info("[HealthRegistry] Registered {}", component);
    }

    /**
     * Record a failure. Reaching the threshold inside the window fails the component over.
     */
    public void handleFailure(String component, Throwable error) {
        HealthEvent event = null;
        String reason = describe(error);
        synchronized (this) {
            Entry entry = components.get(component);
            if (entry == null) {
                log.warn("[HealthRegistry] Failure reported for unregistered component {}, registering", component);
                entry = new Entry(component, clock.instant());
                components.put(component, entry);
            }
            Instant now = clock.instant();
            applyCooldownExpiry(entry, now);

            entry.consecutiveFailures++;
            entry.failureTimes.addLast(now);
            entry.lastFailureTime = now;
            entry.lastFailureReason = reason;
            pruneWindow(entry, now);

            log.warn("[HealthRegistry] {} failure {}/{} in window: {}",
                component, entry.failureTimes.size(), failureThreshold, reason);

            if (entry.state != HealthState.FAILED_OVER && entry.failureTimes.size() >= failureThreshold) {
                HealthState previous = entry.state;
                entry.state = HealthState.FAILED_OVER;
                entry.cooldownUntil = now.plus(cooldown);
                entry.stateChangedAt = now;
                entry.failureTimes.clear();
                log.error("[HealthRegistry] {} FAILED OVER until {} after {} failures: {}",
                    component, entry.cooldownUntil, failureThreshold, reason);
                metrics.updateComponentHealth(component, HealthState.FAILED_OVER);
                event = new HealthEvent(component, HealthEvent.HealthEventType.FAILED_OVER,
                    previous, HealthState.FAILED_OVER, reason, now);
            }
        }
        if (event != null) {
            notify(failoverListeners, event);
        }
    }

    /**
     * Record a success. Clears DEGRADED to HEALTHY; while still cooling down only the
     * consecutive-failure counter is reset.
     */
    public void recordSuccess(String component) {
        HealthEvent event = null;
        synchronized (this) {
            Entry entry = components.get(component);
            if (entry == null) {
                return;
            }
            Instant now = clock.instant();
            applyCooldownExpiry(entry, now);
            entry.consecutiveFailures = 0;

            if (entry.state == HealthState.DEGRADED) {
                entry.state = HealthState.HEALTHY;
                entry.stateChangedAt = now;
                entry.cooldownUntil = null;
                entry.failureTimes.clear();
                log.info("[HealthRegistry] {} recovered", component);
                metrics.updateComponentHealth(component, HealthState.HEALTHY);
                event = new HealthEvent(component, HealthEvent.HealthEventType.RECOVERED,
                    HealthState.DEGRADED, HealthState.HEALTHY, "success after cooldown", now);
            }
        }
        if (event != null) {
            notify(recoveredListeners, event);
        }
    }

    /**
     * False while the component is failed over and inside its cooldown.
     * Unknown components are available.
     */
    public synchronized boolean isAvailable(String component) {
        Entry entry = components.get(component);
        if (entry == null) {
            return true;
        }
        applyCooldownExpiry(entry, clock.instant());
        return entry.state != HealthState.FAILED_OVER;
    }

    /**
     * Snapshot of a component, or null if it was never registered.
     */
    public synchronized ComponentHealth status(String component) {
        Entry entry = components.get(component);
        if (entry == null) {
            return null;
        }
        Instant now = clock.instant();
        applyCooldownExpiry(entry, now);
        pruneWindow(entry, now);
        return entry.snapshot();
    }

    public synchronized Map<String, ComponentHealth> statusAll() {
        Instant now = clock.instant();
        Map<String, ComponentHealth> result = new TreeMap<>();
        for (Entry entry : components.values()) {
            applyCooldownExpiry(entry, now);
            pruneWindow(entry, now);
            result.put(entry.component, entry.snapshot());
        }
        return result;
    }

    /**
     * Apply cooldown expiry to every component. Runs on the sweep scheduler.
     */
    public synchronized void sweep() {
        Instant now = clock.instant();
        for (Entry entry : components.values()) {
            applyCooldownExpiry(entry, now);
            pruneWindow(entry, now);
        }
    }

    private void applyCooldownExpiry(Entry entry, Instant now) {
        if (entry.state == HealthState.FAILED_OVER && entry.cooldownUntil != null
            && !now.isBefore(entry.cooldownUntil)) {
            entry.state = HealthState.DEGRADED;
            entry.stateChangedAt = now;
            log.info("[HealthRegistry] {} cooldown elapsed, now DEGRADED", entry.component);
            metrics.updateComponentHealth(entry.component, HealthState.DEGRADED);
        }
    }

    private void pruneWindow(Entry entry, Instant now) {
        Instant cutoff = now.minus(failureWindow);
        while (!entry.failureTimes.isEmpty() && !entry.failureTimes.peekFirst().isAfter(cutoff)) {
            entry.failureTimes.pollFirst();
        }
    }

    private void notify(List<Consumer<HealthEvent>> listeners, HealthEvent event) {
        for (Consumer<HealthEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("[HealthRegistry] Listener failed for {} {}: {}",
                    event.component(), event.eventType(), e.getMessage(), e);
            }
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }

    // ════════════════════════════════════════════════════════════════════════
    // CONFIGURATION
    // ════════════════════════════════════════════════════════════════════════

    public void setFailureThreshold(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1");
        }
        this.failureThreshold = threshold;
    }

    public void setFailureWindow(Duration window) {
        this.failureWindow = window;
    }

    public void setCooldown(Duration cooldown) {
        this.cooldown = cooldown;
    }

    public void setSweepInterval(Duration interval) {
        this.sweepInterval = interval;
    }

    public void setMetrics(FeedMetrics metrics) {
        this.metrics = metrics != null ? metrics : FeedMetrics.NOOP;
    }

    // ════════════════════════════════════════════════════════════════════════
    // EVENT LISTENERS
    // ════════════════════════════════════════════════════════════════════════

    public void onFailover(Consumer<HealthEvent> listener) {
        failoverListeners.add(listener);
    }

    public void onRecovered(Consumer<HealthEvent> listener) {
        recoveredListeners.add(listener);
    }

    /**
     * Mutable per-component tracking, guarded by the registry monitor.
     */
    private static final class Entry {
        final String component;
        final Deque<Instant> failureTimes = new ArrayDeque<>();
        HealthState state = HealthState.HEALTHY;
        int consecutiveFailures = 0;
        Instant lastFailureTime;
        String lastFailureReason;
        Instant cooldownUntil;
        Instant stateChangedAt;

        Entry(String component, Instant now) {
            this.component = component;
            this.stateChangedAt = now;
        }

        ComponentHealth snapshot() {
            return new ComponentHealth(component, state, consecutiveFailures, failureTimes.size(),
                lastFailureTime, lastFailureReason, cooldownUntil, stateChangedAt);
        }
    }
}
