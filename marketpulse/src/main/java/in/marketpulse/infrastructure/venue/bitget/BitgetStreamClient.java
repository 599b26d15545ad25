package in.marketpulse.infrastructure.venue.bitget;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.marketpulse.domain.feed.ErrorMessage;
import in.marketpulse.domain.feed.FeedMessage;
import in.marketpulse.domain.feed.OrderbookUpdate;
import in.marketpulse.domain.feed.Pong;
import in.marketpulse.domain.feed.SubscribeAck;
import in.marketpulse.domain.feed.TradeUpdate;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.domain.market.Trade;
import in.marketpulse.domain.market.TradeSide;
import in.marketpulse.infrastructure.venue.common.ReconnectionPolicy;
import in.marketpulse.infrastructure.venue.data.MalformedMessageException;
import in.marketpulse.infrastructure.venue.stream.ConnectionGroup;
import in.marketpulse.infrastructure.venue.stream.StreamClient;
import in.marketpulse.infrastructure.venue.stream.StreamConnection;
import in.marketpulse.infrastructure.venue.stream.StreamConnector;
import in.marketpulse.infrastructure.venue.stream.StreamDependencies;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Bitget v2 public stream client.
 *
 * Wire format:
 * - subscribe: {@code {"op":"subscribe","args":[{"instType":"SPOT","channel":"trade","instId":"BTCUSDT"}]}}
 * - ack: {@code {"event":"subscribe","arg":{...}}}
 * - error: {@code {"event":"error","code":30001,"msg":"..."}}
 * - trade: {@code {"action":"update","arg":{"channel":"trade","instId":".."},"data":[{"ts","price","size","side","tradeId"}]}}
 * - book: channels starting with {@code books}
 * - keep-alive: text {@code ping}, answered with text {@code pong}
 */
public class BitgetStreamClient extends StreamClient {

    static final String ENDPOINT = "wss://ws.bitget.com/v2/ws/public";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Set<String> THROTTLE_CODES = Set.of("30006", "30007");
    private static final Set<String> AUTH_CODES = Set.of("30004", "30011", "30012");

    public BitgetStreamClient(ConnectionGroup group, StreamConnector connector, StreamDependencies deps) {
        this(group, connector, deps, ReconnectionPolicy.forStream());
    }

    public BitgetStreamClient(ConnectionGroup group, StreamConnector connector, StreamDependencies deps,
                              ReconnectionPolicy reconnectionPolicy) {
        super(group, connector, deps, reconnectionPolicy);
    }

    @Override
    protected URI endpoint() {
        return URI.create(ENDPOINT);
    }

    @Override
    protected String subscribeFrame() {
        return subscribeFrame(group);
    }

    static String subscribeFrame(ConnectionGroup group) {
        ObjectNode frame = MAPPER.createObjectNode();
        frame.put("op", "subscribe");
        ArrayNode args = frame.putArray("args");
        String instType = BitgetRestClient.productType(group.market());
        for (String symbol : group.symbols()) {
            ObjectNode arg = args.addObject();
            arg.put("instType", instType);
            arg.put("channel", group.channel());
            arg.put("instId", symbol.toUpperCase(Locale.ROOT));
        }
        return frame.toString();
    }

    @Override
    protected FeedMessage parse(String text) {
        return parseMessage(text, group.market());
    }

    static FeedMessage parseMessage(String text, MarketType market) {
        if ("pong".equals(text.trim())) {
            return new Pong();
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException(BitgetRestClient.VENUE, "Invalid JSON: " + abbreviate(text), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException(BitgetRestClient.VENUE, "Not a JSON object: " + abbreviate(text));
        }

        String event = root.path("event").asText("");
        switch (event) {
            case "subscribe" -> {
                return new SubscribeAck(root.path("arg").path("instId").asText(""));
            }
            case "error" -> {
                String code = root.path("code").asText("");
                String msg = root.path("msg").asText("");
                return new ErrorMessage(code, msg, THROTTLE_CODES.contains(code), AUTH_CODES.contains(code));
            }
            default -> {
                // data frames carry no event
            }
        }

        if (!root.has("action") || !root.has("arg")) {
            throw new MalformedMessageException(BitgetRestClient.VENUE, "Unknown message: " + abbreviate(text));
        }
        JsonNode arg = root.get("arg");
        String channel = arg.path("channel").asText("");
        String instId = arg.path("instId").asText("");

        if ("trade".equals(channel)) {
            return new TradeUpdate(parseTrades(root.path("data"), instId, market));
        }
        if (channel.startsWith("books")) {
            return new OrderbookUpdate(instId, channel);
        }
        throw new MalformedMessageException(BitgetRestClient.VENUE, "Unknown channel: " + channel);
    }

    private static List<Trade> parseTrades(JsonNode data, String instId, MarketType market) {
        if (!data.isArray() || instId.isEmpty()) {
            throw new MalformedMessageException(BitgetRestClient.VENUE, "Trade frame without data or instId");
        }
        List<Trade> trades = new ArrayList<>(data.size());
        for (JsonNode row : data) {
            try {
                trades.add(new Trade(
                    BitgetRestClient.VENUE,
                    instId.toUpperCase(Locale.ROOT),
                    market,
                    Double.parseDouble(row.path("price").asText()),
                    Double.parseDouble(row.path("size").asText()),
                    TradeSide.fromWire(row.path("side").asText()),
                    Instant.ofEpochMilli(Long.parseLong(row.path("ts").asText())),
                    row.path("tradeId").asText()
                ));
            } catch (IllegalArgumentException e) {
                throw new MalformedMessageException(BitgetRestClient.VENUE, "Invalid trade row: " + row, e);
            }
        }
        return trades;
    }

    @Override
    protected void sendKeepAlive(StreamConnection connection) {
        connection.sendText("ping");
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
