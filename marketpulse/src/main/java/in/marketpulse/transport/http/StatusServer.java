package in.marketpulse.transport.http;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undertow server exposing /health, /status and /metrics.
 */
public class StatusServer {
    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);

    private final Undertow server;
    private final int port;

    public StatusServer(int port, StatusHandlers handlers, HttpHandler metricsHandler) {
        this.port = port;
        RoutingHandler routes = Handlers.routing()
            .get("/health", handlers::health)
            .get("/status", handlers::status)
            .get("/metrics", metricsHandler)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send("MarketPulse\n\nGET /health, /status, /metrics\n");
            });

        this.server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
    }

    public void start() {
        server.start();
        log.info("[StatusServer] Listening on http://localhost:{}/", port);
    }

    public void stop() {
        server.stop();
        log.info("[StatusServer] Stopped");
    }
}
