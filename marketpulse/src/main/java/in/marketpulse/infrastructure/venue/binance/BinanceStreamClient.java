package in.marketpulse.infrastructure.venue.binance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.marketpulse.domain.feed.ErrorMessage;
import in.marketpulse.domain.feed.FeedMessage;
import in.marketpulse.domain.feed.OrderbookUpdate;
import in.marketpulse.domain.feed.SubscribeAck;
import in.marketpulse.domain.feed.TradeUpdate;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.domain.market.Trade;
import in.marketpulse.domain.market.TradeSide;
import in.marketpulse.infrastructure.venue.common.ReconnectionPolicy;
import in.marketpulse.infrastructure.venue.data.ErrorKind;
import in.marketpulse.infrastructure.venue.data.MalformedMessageException;
import in.marketpulse.infrastructure.venue.stream.ConnectionGroup;
import in.marketpulse.infrastructure.venue.stream.StreamClient;
import in.marketpulse.infrastructure.venue.stream.StreamConnection;
import in.marketpulse.infrastructure.venue.stream.StreamConnector;
import in.marketpulse.infrastructure.venue.stream.StreamDependencies;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Binance market stream client.
 *
 * Wire format:
 * - subscribe: {@code {"method":"SUBSCRIBE","params":["btcusdt@aggTrade",...],"id":1}}
 * - ack: {@code {"result":null,"id":1}}
 * - error: {@code {"error":{"code":2,"msg":"..."},"id":1}} or {@code {"code":-1121,"msg":"..."}}
 * - trade: {@code {"e":"aggTrade","s":"BTCUSDT","a":1,"p":"1.0","q":"2.0","T":ms,"m":true}}
 * - book: {@code {"e":"depthUpdate","s":"BTCUSDT",...}}
 *
 * Combined stream envelopes ({@code {"stream":..,"data":{..}}}) are unwrapped. Keep-alive uses
 * protocol ping frames.
 */
public class BinanceStreamClient extends StreamClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AtomicInteger REQUEST_IDS = new AtomicInteger(1);

    public BinanceStreamClient(ConnectionGroup group, StreamConnector connector, StreamDependencies deps) {
        this(group, connector, deps, ReconnectionPolicy.forStream());
    }

    public BinanceStreamClient(ConnectionGroup group, StreamConnector connector, StreamDependencies deps,
                               ReconnectionPolicy reconnectionPolicy) {
        super(group, connector, deps, reconnectionPolicy);
    }

    @Override
    protected URI endpoint() {
        return URI.create(endpointFor(group.market()));
    }

    static String endpointFor(MarketType market) {
        return switch (market) {
            case SPOT -> "wss://stream.binance.com:9443/ws";
            case USDT_FUTURES, USDC_FUTURES -> "wss://fstream.binance.com/ws";
            case COIN_FUTURES -> "wss://dstream.binance.com/ws";
        };
    }

    @Override
    protected String subscribeFrame() {
        return subscribeFrame(group, REQUEST_IDS.getAndIncrement());
    }

    static String subscribeFrame(ConnectionGroup group, int id) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("method", "SUBSCRIBE");
        ArrayNode params = frame.putArray("params");
        for (String symbol : group.symbols()) {
            params.add(symbol.toLowerCase(Locale.ROOT) + "@" + group.channel());
        }
        frame.put("id", id);
        return frame.toString();
    }

    @Override
    protected FeedMessage parse(String text) {
        return parseMessage(text, group.market());
    }

    static FeedMessage parseMessage(String text, MarketType market) {
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(BinanceRestClient.VENUE, "Invalid JSON: " + abbreviate(text), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException(BinanceRestClient.VENUE, "Not a JSON object: " + abbreviate(text));
        }

        if (root.has("stream") && root.has("data")) {
            root = root.get("data");
        }

        if (root.has("result") && root.has("id")) {
            return new SubscribeAck(root.get("id").asText());
        }
        if (root.has("error")) {
            JsonNode error = root.get("error");
            return errorMessage(error.path("code").asText(), error.path("msg").asText(error.asText()));
        }
        if (root.has("code") && root.has("msg") && !root.has("e")) {
            return errorMessage(root.get("code").asText(), root.get("msg").asText());
        }

        String eventType = root.path("e").asText("");
        switch (eventType) {
            case "aggTrade", "trade" -> {
                return new TradeUpdate(List.of(parseTrade(root, market, eventType)));
            }
            case "depthUpdate" -> {
                return new OrderbookUpdate(root.path("s").asText(), "depth");
            }
            default -> throw new MalformedMessageException(BinanceRestClient.VENUE,
                "Unknown message: " + abbreviate(text));
        }
    }

    private static Trade parseTrade(JsonNode node, MarketType market, String eventType) {
        String symbol = node.path("s").asText(null);
        if (symbol == null || !node.has("p") || !node.has("q") || !node.has("T")) {
            throw new MalformedMessageException(BinanceRestClient.VENUE, "Incomplete trade: " + node);
        }
        String idField = "aggTrade".equals(eventType) ? "a" : "t";
        try {
            return new Trade(
                BinanceRestClient.VENUE,
                symbol.toUpperCase(Locale.ROOT),
                market,
                Double.parseDouble(node.get("p").asText()),
                Double.parseDouble(node.get("q").asText()),
                node.path("m").asBoolean(false) ? TradeSide.SELL : TradeSide.BUY,
                Instant.ofEpochMilli(node.get("T").asLong()),
                node.path(idField).asText()
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(BinanceRestClient.VENUE, "Invalid trade: " + node, e);
        }
    }

    private static ErrorMessage errorMessage(String code, String msg) {
        String lower = msg.toLowerCase(Locale.ROOT);
        boolean throttled = "429".equals(code) || ErrorKind.isThrottleSignal(new RuntimeException(msg));
        boolean authentication = "401".equals(code) || "403".equals(code)
            || lower.contains("unauthorized") || lower.contains("forbidden");
        return new ErrorMessage(code, msg, throttled, authentication);
    }

    @Override
    protected void sendKeepAlive(StreamConnection connection) {
        connection.sendPing();
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
