package in.marketpulse.infrastructure.venue.bitget;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.marketpulse.domain.feed.ErrorMessage;
import in.marketpulse.domain.feed.FeedMessage;
import in.marketpulse.domain.feed.TradeUpdate;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.domain.market.Trade;
import in.marketpulse.domain.market.TradeSide;
import in.marketpulse.infrastructure.venue.data.MalformedMessageException;
import in.marketpulse.infrastructure.venue.stream.ConnectionGroup;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Bitget stream frames.
 */
class BitgetStreamClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void testSubscribeFrame() throws Exception {
        ConnectionGroup group = new ConnectionGroup("bitget", MarketType.USDT_FUTURES, 1,
            List.of("btcusdt", "SOLUSDT"), "trade", "bitget_stream");

        JsonNode frame = MAPPER.readTree(BitgetStreamClient.subscribeFrame(group));

        assertEquals("subscribe", frame.get("op").asText());
        JsonNode args = frame.get("args");
        assertEquals(2, args.size());
        assertEquals("USDT-FUTURES", args.get(0).get("instType").asText());
        assertEquals("trade", args.get(0).get("channel").asText());
        assertEquals("BTCUSDT", args.get(0).get("instId").asText());
        assertEquals("SOLUSDT", args.get(1).get("instId").asText());
    }

    @Test
    void testParseTradeFrameWithSeveralTrades() {
        String text = """
            {"action":"update","arg":{"instType":"SPOT","channel":"trade","instId":"BTCUSDT"},
             "data":[{"ts":"1704067200000","price":"42000.1","size":"0.01","side":"buy","tradeId":"11"},
                     {"ts":"1704067200500","price":"41999.9","size":"0.02","side":"sell","tradeId":"12"}],
             "ts":1704067200600}
            """;

        FeedMessage message = BitgetStreamClient.parseMessage(text, MarketType.SPOT);

        List<Trade> trades = ((TradeUpdate) message).trades();
        assertEquals(2, trades.size());
        assertEquals("bitget", trades.get(0).venue());
        assertEquals(TradeSide.BUY, trades.get(0).side());
        assertEquals(TradeSide.SELL, trades.get(1).side());
        assertEquals(Instant.ofEpochMilli(1704067200500L), trades.get(1).timestamp());
        assertEquals("12", trades.get(1).venueTradeId());
    }

    @Test
    void testParseControlFrames() {
        assertEquals(FeedMessage.Kind.PONG, BitgetStreamClient.parseMessage("pong", MarketType.SPOT).kind());
        assertEquals(FeedMessage.Kind.SUBSCRIBE_ACK, BitgetStreamClient.parseMessage(
            "{\"event\":\"subscribe\",\"arg\":{\"instType\":\"SPOT\",\"channel\":\"trade\",\"instId\":\"BTCUSDT\"}}",
            MarketType.SPOT).kind());
        assertEquals(FeedMessage.Kind.ORDERBOOK_UPDATE, BitgetStreamClient.parseMessage(
            "{\"action\":\"snapshot\",\"arg\":{\"channel\":\"books5\",\"instId\":\"BTCUSDT\"},\"data\":[]}",
            MarketType.SPOT).kind());
    }

    @Test
    void testParseErrors() {
        ErrorMessage throttled = (ErrorMessage) BitgetStreamClient.parseMessage(
            "{\"event\":\"error\",\"code\":30006,\"msg\":\"request too many\"}", MarketType.SPOT);
        assertTrue(throttled.throttled());
        assertFalse(throttled.authentication());

        ErrorMessage auth = (ErrorMessage) BitgetStreamClient.parseMessage(
            "{\"event\":\"error\",\"code\":30011,\"msg\":\"invalid ACCESS_KEY\"}", MarketType.SPOT);
        assertTrue(auth.authentication());

        ErrorMessage other = (ErrorMessage) BitgetStreamClient.parseMessage(
            "{\"event\":\"error\",\"code\":30001,\"msg\":\"instType:SPOT,channel:trade,instId:FOO doesn't exist\"}",
            MarketType.SPOT);
        assertFalse(other.throttled());
        assertFalse(other.authentication());
    }

    @Test
    void testMalformedFrames() {
        assertThrows(MalformedMessageException.class,
            () -> BitgetStreamClient.parseMessage("{oops", MarketType.SPOT));
        assertThrows(MalformedMessageException.class,
            () -> BitgetStreamClient.parseMessage("{\"foo\":1}", MarketType.SPOT));
        assertThrows(MalformedMessageException.class,
            () -> BitgetStreamClient.parseMessage(
                "{\"action\":\"update\",\"arg\":{\"channel\":\"ticker\",\"instId\":\"BTCUSDT\"},\"data\":[]}",
                MarketType.SPOT));
        assertThrows(MalformedMessageException.class,
            () -> BitgetStreamClient.parseMessage(
                "{\"action\":\"update\",\"arg\":{\"channel\":\"trade\",\"instId\":\"BTCUSDT\"},"
                    + "\"data\":[{\"ts\":\"1\",\"price\":\"1\",\"size\":\"1\",\"side\":\"hold\"}]}",
                MarketType.SPOT),
            "Unknown side");
    }
}
