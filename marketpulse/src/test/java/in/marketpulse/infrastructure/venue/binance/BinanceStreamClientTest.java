package in.marketpulse.infrastructure.venue.binance;

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
 * Unit tests for Binance stream frames.
 *
 * Tests:
 * - Subscribe frame lists every symbol of the group
 * - Trade, ack, error and book frames are recognised
 * - Combined stream envelopes are unwrapped
 * - Unknown and broken frames are malformed
 */
class BinanceStreamClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void testSubscribeFrame() throws Exception {
        ConnectionGroup group = new ConnectionGroup("binance", MarketType.SPOT, 0,
            List.of("BTCUSDT", "ETHUSDT"), "aggTrade", "binance_stream");

        JsonNode frame = MAPPER.readTree(BinanceStreamClient.subscribeFrame(group, 7));

        assertEquals("SUBSCRIBE", frame.get("method").asText());
        assertEquals(7, frame.get("id").asInt());
        assertEquals("btcusdt@aggTrade", frame.get("params").get(0).asText());
        assertEquals("ethusdt@aggTrade", frame.get("params").get(1).asText());
    }

    @Test
    void testParseAggTrade() {
        String text = """
            {"e":"aggTrade","E":1704067200100,"s":"BTCUSDT","a":26129,"p":"42000.50","q":"0.25","T":1704067200000,"m":true}
            """;

        FeedMessage message = BinanceStreamClient.parseMessage(text, MarketType.USDT_FUTURES);

        assertEquals(FeedMessage.Kind.TRADE_UPDATE, message.kind());
        Trade trade = ((TradeUpdate) message).trades().get(0);
        assertEquals("binance", trade.venue());
        assertEquals("BTCUSDT", trade.symbol());
        assertEquals(MarketType.USDT_FUTURES, trade.market());
        assertEquals(42000.50, trade.price(), 1e-9);
        assertEquals(0.25, trade.size(), 1e-9);
        assertEquals(TradeSide.SELL, trade.side(), "Buyer is maker means the seller hit the bid");
        assertEquals(Instant.ofEpochMilli(1704067200000L), trade.timestamp());
        assertEquals("26129", trade.venueTradeId());
    }

    @Test
    void testParseCombinedStreamEnvelope() {
        String text = """
            {"stream":"ethusdt@trade","data":{"e":"trade","s":"ETHUSDT","t":99,"p":"2300","q":"1","T":1704067200000,"m":false}}
            """;

        TradeUpdate update = (TradeUpdate) BinanceStreamClient.parseMessage(text, MarketType.SPOT);

        assertEquals("ETHUSDT", update.trades().get(0).symbol());
        assertEquals(TradeSide.BUY, update.trades().get(0).side());
        assertEquals("99", update.trades().get(0).venueTradeId());
    }

    @Test
    void testParseAckAndErrors() {
        assertEquals(FeedMessage.Kind.SUBSCRIBE_ACK,
            BinanceStreamClient.parseMessage("{\"result\":null,\"id\":1}", MarketType.SPOT).kind());

        ErrorMessage invalid = (ErrorMessage) BinanceStreamClient.parseMessage(
            "{\"error\":{\"code\":2,\"msg\":\"Invalid request\"},\"id\":1}", MarketType.SPOT);
        assertEquals("2", invalid.code());
        assertFalse(invalid.throttled());
        assertFalse(invalid.authentication());

        ErrorMessage throttled = (ErrorMessage) BinanceStreamClient.parseMessage(
            "{\"code\":429,\"msg\":\"Too many requests\"}", MarketType.SPOT);
        assertTrue(throttled.throttled());
    }

    @Test
    void testParseDepthUpdate() {
        FeedMessage message = BinanceStreamClient.parseMessage(
            "{\"e\":\"depthUpdate\",\"s\":\"BTCUSDT\",\"b\":[],\"a\":[]}", MarketType.SPOT);

        assertEquals(FeedMessage.Kind.ORDERBOOK_UPDATE, message.kind());
    }

    @Test
    void testMalformedFrames() {
        assertThrows(MalformedMessageException.class,
            () -> BinanceStreamClient.parseMessage("{not json", MarketType.SPOT));
        assertThrows(MalformedMessageException.class,
            () -> BinanceStreamClient.parseMessage("[1,2]", MarketType.SPOT));
        assertThrows(MalformedMessageException.class,
            () -> BinanceStreamClient.parseMessage("{\"e\":\"kline\"}", MarketType.SPOT));
        assertThrows(MalformedMessageException.class,
            () -> BinanceStreamClient.parseMessage("{\"e\":\"aggTrade\",\"s\":\"BTCUSDT\",\"p\":\"1\"}", MarketType.SPOT),
            "Trade without quantity or time");
        assertThrows(MalformedMessageException.class,
            () -> BinanceStreamClient.parseMessage(
                "{\"e\":\"aggTrade\",\"s\":\"BTCUSDT\",\"a\":1,\"p\":\"-5\",\"q\":\"1\",\"T\":1}", MarketType.SPOT),
            "Negative price");
    }

    @Test
    void testEndpoints() {
        assertEquals("wss://stream.binance.com:9443/ws", BinanceStreamClient.endpointFor(MarketType.SPOT));
        assertEquals("wss://fstream.binance.com/ws", BinanceStreamClient.endpointFor(MarketType.USDT_FUTURES));
        assertEquals("wss://dstream.binance.com/ws", BinanceStreamClient.endpointFor(MarketType.COIN_FUTURES));
    }
}
