package in.marketpulse.infrastructure.venue.stream;

import in.marketpulse.infrastructure.venue.data.VenueAuthenticationException;
import in.marketpulse.infrastructure.venue.data.VenueConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stream connector on top of {@code java.net.http.WebSocket}.
 *
 * The listener joins fragmented text frames and queues complete messages; the owning
 * client drains the queue from its own thread. One frame is requested at a time.
 */
public class JdkWebSocketConnector implements StreamConnector {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;
    private final Duration connectTimeout;
    private final Set<JdkWebSocketConnection> open = ConcurrentHashMap.newKeySet();

    public JdkWebSocketConnector() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), Duration.ofSeconds(10));
    }

    public JdkWebSocketConnector(HttpClient httpClient, Duration connectTimeout) {
        this.httpClient = httpClient;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public StreamConnection connect(String venue, String connectionName, URI endpoint) throws InterruptedException {
        JdkWebSocketConnection connection = new JdkWebSocketConnection(venue, connectionName);
        CompletableFuture<WebSocket> future = httpClient.newWebSocketBuilder()
            .connectTimeout(connectTimeout)
            .buildAsync(endpoint, connection.listener());
        try {
            WebSocket webSocket = future.get(connectTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS);
            connection.attach(webSocket);
            open.add(connection);
            log.info("[{}:{}] WebSocket connected to {}", venue, connectionName, endpoint);
            return connection;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof WebSocketHandshakeException) {
                int status = ((WebSocketHandshakeException) cause).getResponse().statusCode();
                if (status == 401 || status == 403) {
                    throw new VenueAuthenticationException(venue, connectionName,
                        "Handshake rejected with HTTP " + status, cause);
                }
                throw new VenueConnectionException(venue, connectionName,
                    "Handshake failed with HTTP " + status, cause);
            }
            throw new VenueConnectionException(venue, connectionName,
                "Connect failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new VenueConnectionException(venue, connectionName,
                "Connect timed out after " + connectTimeout.toSeconds() + "s", e);
        }
    }

    @Override
    public void close() {
        for (JdkWebSocketConnection connection : open) {
            connection.close();
        }
        open.clear();
    }

    private final class JdkWebSocketConnection implements StreamConnection {
        private final String venue;
        private final String name;
        private final BlockingQueue<StreamEvent> inbox = new LinkedBlockingQueue<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private volatile WebSocket webSocket;

        JdkWebSocketConnection(String venue, String name) {
            this.venue = venue;
            this.name = name;
        }

        void attach(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        WebSocket.Listener listener() {
            return new WebSocket.Listener() {
                private final StringBuilder textBuffer = new StringBuilder();

                @Override
                public void onOpen(WebSocket ws) {
                    ws.request(1);
                }

                @Override
                public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
                    textBuffer.append(data);
                    if (last) {
                        inbox.offer(StreamEvent.text(textBuffer.toString()));
                        textBuffer.setLength(0);
                    }
                    ws.request(1);
                    return null;
                }

                @Override
                public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
                    log.debug("[{}:{}] Ignoring binary frame ({} bytes)", venue, name, data.remaining());
                    ws.request(1);
                    return null;
                }

                @Override
                public CompletionStage<?> onPong(WebSocket ws, ByteBuffer message) {
                    inbox.offer(StreamEvent.pong());
                    ws.request(1);
                    return null;
                }

                @Override
                public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
                    log.info("[{}:{}] WebSocket closed by venue: {} - {}", venue, name, statusCode, reason);
                    markClosed(StreamEvent.closed(statusCode, reason));
                    return null;
                }

                @Override
                public void onError(WebSocket ws, Throwable error) {
                    log.warn("[{}:{}] WebSocket error: {}", venue, name, error.getMessage());
                    markClosed(StreamEvent.error(error));
                }
            };
        }

        @Override
        public void sendText(String text) {
            WebSocket ws = webSocket;
            if (ws == null || closed.get()) {
                throw new VenueConnectionException(venue, name, "Send on closed connection");
            }
            try {
                ws.sendText(text, true).get(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new VenueConnectionException(venue, name, "Interrupted while sending", e);
            } catch (ExecutionException | TimeoutException e) {
                throw new VenueConnectionException(venue, name, "Send failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void sendPing() {
            WebSocket ws = webSocket;
            if (ws == null || closed.get()) {
                throw new VenueConnectionException(venue, name, "Ping on closed connection");
            }
            ws.sendPing(ByteBuffer.allocate(0));
        }

        @Override
        public StreamEvent poll(Duration timeout) throws InterruptedException {
            return inbox.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public boolean isOpen() {
            return !closed.get();
        }

        @Override
        public void close() {
            WebSocket ws = webSocket;
            if (markClosed(StreamEvent.closed(WebSocket.NORMAL_CLOSURE, "closed locally")) && ws != null) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "Disconnect")
                    .orTimeout(5, TimeUnit.SECONDS)
                    .whenComplete((r, error) -> ws.abort());
            }
        }

        private boolean markClosed(StreamEvent event) {
            if (closed.compareAndSet(false, true)) {
                inbox.offer(event);
                open.remove(this);
                return true;
            }
            return false;
        }
    }
}
