package in.marketpulse.infrastructure.venue.bitget;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.domain.market.Trade;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.data.BackfillFetchException;
import in.marketpulse.infrastructure.venue.data.RateLimitExceededException;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for Bitget REST parsing.
 *
 * Tests:
 * - Envelope unwrapping and error codes
 * - Fills are returned oldest first and clipped to the window
 * - Candle rows, granularity names and product types
 */
class BitgetRestClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void testUnwrap() throws Exception {
        JsonNode ok = MAPPER.readTree("{\"code\":\"00000\",\"msg\":\"success\",\"data\":[1,2]}");
        assertEquals(2, BitgetRestClient.unwrap("BTCUSDT", ok).size());

        assertThrows(RateLimitExceededException.class, () -> BitgetRestClient.unwrap("BTCUSDT",
            MAPPER.readTree("{\"code\":\"429\",\"msg\":\"Too Many Requests\"}")));
        assertThrows(BackfillFetchException.class, () -> BitgetRestClient.unwrap("BTCUSDT",
            MAPPER.readTree("{\"code\":\"40034\",\"msg\":\"Parameter does not exist\"}")));
        assertThrows(BackfillFetchException.class, () -> BitgetRestClient.unwrap("BTCUSDT",
            MAPPER.readTree("{\"code\":\"00000\",\"data\":{}}")));
    }

    @Test
    void testFetchTradesSortedAndClipped() throws Exception {
        long t0 = 1704067200000L;
        String body = "{\"code\":\"00000\",\"msg\":\"success\",\"data\":["
            + fill("3", t0 + 3_000, "sell") + ","
            + fill("2", t0 + 2_000, "buy") + ","
            + fill("1", t0 - 1, "buy") + "]}";
        HttpClient httpClient = mock(HttpClient.class);
        doReturn(response(body)).when(httpClient).send(any(), any());
        AdaptiveRateLimiter limiter = mock(AdaptiveRateLimiter.class);
        BitgetRestClient client = new BitgetRestClient(httpClient, MAPPER, limiter);

        List<Trade> trades = client.fetchTrades("BTCUSDT", MarketType.SPOT,
            Instant.ofEpochMilli(t0), Instant.ofEpochMilli(t0 + 60_000));

        assertEquals(2, trades.size(), "Fill before the window start is dropped");
        assertEquals("2", trades.get(0).venueTradeId(), "Oldest first");
        assertEquals("3", trades.get(1).venueTradeId());
        verify(limiter, never()).acquire();
    }

    @Test
    void testParseCandle() throws Exception {
        JsonNode row = MAPPER.readTree("[\"1704067200000\",\"100\",\"110\",\"95\",\"105\",\"12.5\",\"1300\",\"1300\"]");

        Bar bar = BitgetRestClient.parseCandle(row, "ETHUSDT", MarketType.SPOT, 300);

        assertEquals(Instant.ofEpochMilli(1704067200000L), bar.start());
        assertEquals(bar.start().plusSeconds(300), bar.end());
        assertEquals(105, bar.close(), 1e-9);
        assertEquals(12.5, bar.volume(), 1e-9);
        assertEquals(0, bar.tradeCount(), "Bitget does not report trade counts");

        assertThrows(BackfillFetchException.class, () -> BitgetRestClient.parseCandle(
            MAPPER.readTree("[\"x\",\"1\",\"1\",\"1\",\"1\",\"1\"]"), "ETHUSDT", MarketType.SPOT, 60));
    }

    @Test
    void testGranularityAndProductType() {
        assertEquals("1min", BitgetRestClient.granularity(60, MarketType.SPOT));
        assertEquals("1m", BitgetRestClient.granularity(60, MarketType.USDT_FUTURES));
        assertEquals("1H", BitgetRestClient.granularity(3600, MarketType.COIN_FUTURES));
        assertThrows(IllegalArgumentException.class, () -> BitgetRestClient.granularity(1, MarketType.SPOT));

        assertEquals("SPOT", BitgetRestClient.productType(MarketType.SPOT));
        assertEquals("USDT-FUTURES", BitgetRestClient.productType(MarketType.USDT_FUTURES));
    }

    private static String fill(String id, long ts, String side) {
        return "{\"tradeId\":\"" + id + "\",\"price\":\"100\",\"size\":\"1\",\"side\":\"" + side
            + "\",\"ts\":\"" + ts + "\"}";
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn(body);
        return response;
    }
}
