package in.marketpulse.infrastructure.venue.stream;

import in.marketpulse.domain.feed.ErrorMessage;
import in.marketpulse.domain.feed.FeedMessage;
import in.marketpulse.domain.feed.OrderbookUpdate;
import in.marketpulse.domain.feed.TradeUpdate;
import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.Trade;
import in.marketpulse.infrastructure.health.HealthRegistry;
import in.marketpulse.infrastructure.metrics.FeedMetrics;
import in.marketpulse.infrastructure.persistence.MarketDataSink;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.common.HeartbeatManager;
import in.marketpulse.infrastructure.venue.common.ReconnectionPolicy;
import in.marketpulse.infrastructure.venue.data.ErrorKind;
import in.marketpulse.infrastructure.venue.data.MalformedMessageException;
import in.marketpulse.infrastructure.venue.data.RateLimitExceededException;
import in.marketpulse.infrastructure.venue.data.VenueAuthenticationException;
import in.marketpulse.infrastructure.venue.data.VenueConnectionException;
import in.marketpulse.infrastructure.venue.data.VenueSubscriptionException;
import in.marketpulse.service.candle.CandleAggregator;
import in.marketpulse.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streaming client for one connection group of one venue.
 *
 * State machine:
 * <pre>
 * DISCONNECTED → CONNECTING → SUBSCRIBED → STREAMING
 *      ↑                                       │ drop / error
 *      └──────────── RECONNECTING ←────────────┘
 * CLOSED after stop()
 * </pre>
 *
 * {@link #start()} runs the loop on the calling thread until {@link #stop()} is called, the
 * thread is interrupted, or the venue rejects access. Reconnects are unlimited and back off
 * through {@link ReconnectionPolicy}. Only a rejected access is reported to the
 * {@link HealthRegistry}; dropped connections and refused connects are retried locally. Every outbound control frame goes through the group's
 * rate limiter.
 *
 * Subclasses supply the venue specifics: endpoint, subscribe frame, message parser and
 * keep-alive.
 */
public abstract class StreamClient {
    private static final Logger log = LoggerFactory.getLogger(StreamClient.class);

    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(1);

    protected final ConnectionGroup group;
    private final StreamConnector connector;
    private final AdaptiveRateLimiter limiter;
    private final HealthRegistry health;
    private final MarketDataSink sink;
    private final List<CandleAggregator> aggregators;
    private final FeedMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ReconnectionPolicy reconnectionPolicy;
    private final String wsComponent;
    private final String logPrefix;

    private Duration pingInterval = Duration.ofSeconds(20);
    private Duration pongTimeout = Duration.ofSeconds(30);

    // State
    private volatile boolean running = false;
    private volatile boolean loopActive = false;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile StreamConnection current;
    private volatile boolean keepAliveExpired = false;
    private volatile Instant lastMessageTime;

    private final AtomicInteger reconnectCount = new AtomicInteger(0);
    private final AtomicLong messagesReceived = new AtomicLong(0);
    private final AtomicLong tradesReceived = new AtomicLong(0);
    private final AtomicLong malformedMessages = new AtomicLong(0);
    private final Map<String, Instant> lastDataBySymbol = new ConcurrentHashMap<>();

    protected StreamClient(ConnectionGroup group, StreamConnector connector, StreamDependencies deps,
                           ReconnectionPolicy reconnectionPolicy) {
        this.group = group;
        this.connector = connector;
        this.limiter = deps.limiter();
        this.health = deps.health();
        this.sink = deps.sink();
        this.aggregators = List.copyOf(deps.aggregators());
        this.metrics = deps.metrics();
        this.sleeper = deps.sleeper();
        this.clock = deps.clock();
        this.reconnectionPolicy = reconnectionPolicy;
        this.wsComponent = group.venue() + "_websocket";
        this.logPrefix = "[" + group.venue().toUpperCase() + ":" + group.name() + "]";
    }

    // ════════════════════════════════════════════════════════════════════════
    // VENUE SPECIFICS
    // ════════════════════════════════════════════════════════════════════════

    protected abstract URI endpoint();

    /**
     * One frame subscribing every symbol of the group.
     */
    protected abstract String subscribeFrame();

    /**
     * Parse one complete text message.
     *
     * @throws MalformedMessageException for anything that is not a known message
     */
    protected abstract FeedMessage parse(String text);

    /**
     * Send the venue's keep-alive on an open connection.
     */
    protected abstract void sendKeepAlive(StreamConnection connection);

    // ════════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Run the connect / subscribe / read loop on the calling thread. Returns after
     * {@link #stop()}, interruption, or an authentication failure.
     */
    public void start() {
        running = true;
        loopActive = true;
        log.info("{} Starting stream for {} symbols ({})", logPrefix, group.symbols().size(), group.channel());

        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                if (!health.isAvailable(wsComponent)) {
                    state = ConnectionState.RECONNECTING;
                    Duration wait = reconnectionPolicy.getMaxDelay();
                    log.warn("{} {} is failed over, not connecting for {}s", logPrefix, wsComponent, wait.toSeconds());
                    sleeper.sleep(wait);
                    continue;
                }

                try {
                    runConnection();
                    if (running) {
                        throw new VenueConnectionException(group.venue(), group.name(), "Connection closed");
                    }
                } catch (VenueAuthenticationException e) {
                    log.error("{} Access rejected, stopping this connection group: {}", logPrefix, e.getMessage());
                    limiter.reportError(e);
                    health.handleFailure(wsComponent, e);
                    running = false;
                    break;
                } catch (RuntimeException e) {
                    if (!running) {
                        break;
                    }
                    // Transient: retried here with backoff, never counted against the venue's health
                    limiter.reportError(e);
                    log.warn("{} Stream error ({}): {}", logPrefix, ErrorKind.classify(e), e.getMessage());
                }

                if (!running) {
                    break;
                }
                int attempt = reconnectCount.incrementAndGet();
                metrics.recordReconnect(group.venue(), group.name());
                Duration delay = reconnectionPolicy.recordFailure();
                state = ConnectionState.RECONNECTING;
                log.info("{} Reconnect #{} in {}ms", logPrefix, attempt, delay.toMillis());
                sleeper.sleep(delay);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("{} Interrupted", logPrefix);
        } finally {
            running = false;
            closeCurrent();
            state = ConnectionState.CLOSED;
            loopActive = false;
            log.info("{} Stream stopped (reconnects: {}, trades: {})",
                logPrefix, reconnectCount.get(), tradesReceived.get());
        }
    }

    /**
     * Ask the loop to exit. Closes the live connection so a blocked read returns promptly.
     */
    public void stop() {
        running = false;
        closeCurrent();
        if (!loopActive) {
            state = ConnectionState.CLOSED;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public ConnectionState getState() {
        return state;
    }

    public ConnectionStats stats() {
        return new ConnectionStats(
            group.venue(),
            group.name(),
            state,
            reconnectCount.get(),
            messagesReceived.get(),
            tradesReceived.get(),
            malformedMessages.get(),
            lastMessageTime,
            new TreeMap<>(lastDataBySymbol),
            reconnectionPolicy.getNextDelay()
        );
    }

    public ConnectionGroup group() {
        return group;
    }

    /**
     * Keep-alive settings; a null interval disables keep-alive.
     */
    public void setKeepAlive(Duration interval, Duration timeout) {
        this.pingInterval = interval;
        this.pongTimeout = timeout;
    }

    // ════════════════════════════════════════════════════════════════════════
    // CONNECTION
    // ════════════════════════════════════════════════════════════════════════

    private void runConnection() throws InterruptedException {
        state = ConnectionState.CONNECTING;
        keepAliveExpired = false;
        log.info("{} Connecting to {}", logPrefix, endpoint());

        StreamConnection connection = connector.connect(group.venue(), group.name(), endpoint());
        current = connection;
        if (!running) {
            closeCurrent();
            return;
        }
        reconnectionPolicy.recordSuccess();

        HeartbeatManager heartbeat = null;
        try {
            sendControl(connection, subscribeFrame());
            state = ConnectionState.SUBSCRIBED;
            log.info("{} Subscribe sent for {}", logPrefix, group.symbols());

            if (pingInterval != null) {
                heartbeat = new HeartbeatManager(group.venue(), group.name(), pingInterval, pongTimeout,
                    () -> sendKeepAlive(connection),
                    () -> {
                        keepAliveExpired = true;
                        connection.close();
                    });
                heartbeat.start();
            }

            readUntilClosed(connection, heartbeat);
        } finally {
            if (heartbeat != null) {
                heartbeat.stop();
            }
            closeCurrent();
        }
    }

    private void readUntilClosed(StreamConnection connection, HeartbeatManager heartbeat) throws InterruptedException {
        while (running) {
            StreamEvent event = connection.poll(POLL_TIMEOUT);
            if (event == null) {
                continue;
            }
            if (heartbeat != null) {
                heartbeat.recordPong();
            }

            switch (event.type()) {
                case TEXT -> handleText(event.text());
                case PONG -> log.trace("{} Pong", logPrefix);
                case CLOSED -> {
                    if (!running) {
                        return;
                    }
                    String reason = keepAliveExpired ? "keep-alive timeout" : "closed (" + event.statusCode() + " " + event.text() + ")";
                    throw new VenueConnectionException(group.venue(), group.name(), "Connection " + reason);
                }
                case ERROR -> throw new VenueConnectionException(group.venue(), group.name(),
                    "Transport error: " + event.error().getMessage(), event.error());
            }
        }
    }

    /**
     * Send a control frame through the rate limiter.
     */
    protected void sendControl(StreamConnection connection, String frame) throws InterruptedException {
        limiter.acquire();
        connection.sendText(frame);
    }

    private void closeCurrent() {
        StreamConnection connection = current;
        current = null;
        if (connection != null) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.debug("{} Error closing connection: {}", logPrefix, e.getMessage());
            }
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // MESSAGE HANDLING
    // ════════════════════════════════════════════════════════════════════════

    void handleText(String text) {
        messagesReceived.incrementAndGet();
        lastMessageTime = clock.instant();

        FeedMessage message;
        try {
            message = parse(text);
        } catch (MalformedMessageException e) {
            malformedMessages.incrementAndGet();
            metrics.recordMalformedMessage(group.venue());
            log.warn("{} Skipping malformed message: {}", logPrefix, e.getMessage());
            return;
        }

        switch (message.kind()) {
            case SUBSCRIBE_ACK -> {
                if (state == ConnectionState.SUBSCRIBED) {
                    state = ConnectionState.STREAMING;
                    log.info("{} Subscription confirmed, streaming", logPrefix);
                }
                limiter.reportSuccess();
                health.recordSuccess(wsComponent);
            }
            case ERROR -> handleVenueError((ErrorMessage) message);
            case TRADE_UPDATE -> handleTrades((TradeUpdate) message);
            case ORDERBOOK_UPDATE -> log.trace("{} Book update for {}", logPrefix, ((OrderbookUpdate) message).symbol());
            case PONG -> log.trace("{} Pong", logPrefix);
        }
    }

    private void handleVenueError(ErrorMessage error) {
        if (error.authentication()) {
            throw new VenueAuthenticationException(group.venue(), group.name(),
                "Venue error " + error.code() + ": " + error.message());
        }
        RuntimeException cause = error.throttled()
            ? new RateLimitExceededException(group.venue(), 429, error.message())
            : new VenueSubscriptionException(group.venue(), group.name(), "Venue error " + error.code() + ": " + error.message());
        log.warn("{} Venue error {}: {}", logPrefix, error.code(), error.message());
        limiter.reportError(cause);
    }

    private void handleTrades(TradeUpdate update) {
        if (state == ConnectionState.SUBSCRIBED) {
            state = ConnectionState.STREAMING;
        }
        for (Trade trade : update.trades()) {
            tradesReceived.incrementAndGet();
            lastDataBySymbol.put(trade.symbol(), clock.instant());
            sink.appendTrade(trade);

            for (CandleAggregator aggregator : aggregators) {
                Optional<Bar> closed = aggregator.processTrade(trade);
                if (closed.isPresent()) {
                    sink.appendBar(closed.get());
                    metrics.recordBars(group.venue(), aggregator.resolutionSeconds(), 1);
                }
            }
        }
        metrics.recordTrades(group.venue(), "stream", update.trades().size());
    }
}
