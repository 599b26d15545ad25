package in.marketpulse.infrastructure.venue.bitget;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.domain.market.Trade;
import in.marketpulse.domain.market.TradeSide;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.HttpVenueRestClient;
import in.marketpulse.infrastructure.venue.data.BackfillFetchException;
import in.marketpulse.infrastructure.venue.data.RateLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bitget v2 historical REST client.
 *
 * Trades come from {@code fills-history} (newest first, paged backwards with
 * {@code idLessThan}); bars from {@code candles}. Every response is wrapped as
 * {@code {"code":"00000","msg":"success","data":[...]}}.
 */
public class BitgetRestClient extends HttpVenueRestClient {
    private static final Logger log = LoggerFactory.getLogger(BitgetRestClient.class);

    public static final String VENUE = "bitget";
    static final String BASE_URL = "https://api.bitget.com";
    static final int PAGE_LIMIT = 1000;
    private static final String OK = "00000";

    public BitgetRestClient(AdaptiveRateLimiter limiter) {
        this(HttpClient.newBuilder().connectTimeout(TIMEOUT).build(), new ObjectMapper(), limiter);
    }

    public BitgetRestClient(HttpClient httpClient, ObjectMapper mapper, AdaptiveRateLimiter limiter) {
        super(httpClient, mapper, limiter);
    }

    @Override
    public String venue() {
        return VENUE;
    }

    @Override
    public List<Trade> fetchTrades(String symbol, MarketType market, Instant start, Instant end)
            throws InterruptedException {
        String path = market == MarketType.SPOT
            ? "/api/v2/spot/market/fills-history"
            : "/api/v2/mix/market/fills-history";
        long startMs = start.toEpochMilli();
        long endMs = end.toEpochMilli();

        List<Trade> result = new ArrayList<>();
        String idLessThan = null;
        int pages = 0;
        while (true) {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("symbol", symbol.toUpperCase());
            if (market.isFutures()) {
                params.put("productType", productType(market));
            }
            params.put("startTime", String.valueOf(startMs));
            params.put("endTime", String.valueOf(endMs - 1));
            params.put("limit", String.valueOf(PAGE_LIMIT));
            if (idLessThan != null) {
                params.put("idLessThan", idLessThan);
            }

            if (pages > 0) {
                acquirePage();
            }
            JsonNode data = unwrap(symbol, getJson(symbol, BASE_URL, path, params));
            pages++;

            List<Trade> trades = parseFills(data, symbol.toUpperCase(), market);
            for (Trade trade : trades) {
                long ts = trade.timestamp().toEpochMilli();
                if (ts >= startMs && ts < endMs) {
                    result.add(trade);
                }
            }
            if (trades.size() < PAGE_LIMIT) {
                break;
            }
            String oldestId = trades.stream()
                .min(Comparator.comparing(Trade::timestamp))
                .map(Trade::venueTradeId)
                .orElse(null);
            if (oldestId == null || oldestId.equals(idLessThan)) {
                break;
            }
            idLessThan = oldestId;
        }

        result.sort(Comparator.comparing(Trade::timestamp));
        log.debug("[BITGET] {} {} trades in [{}, {}) over {} page(s)", symbol, result.size(), start, end, pages);
        return result;
    }

    @Override
    public List<Bar> fetchBars(String symbol, MarketType market, int resolutionSeconds, Instant endTime, int limit)
            throws InterruptedException {
        String path = market == MarketType.SPOT
            ? "/api/v2/spot/market/candles"
            : "/api/v2/mix/market/candles";

        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol.toUpperCase());
        if (market.isFutures()) {
            params.put("productType", productType(market));
        }
        params.put("granularity", granularity(resolutionSeconds, market));
        params.put("endTime", String.valueOf(endTime.toEpochMilli()));
        params.put("limit", String.valueOf(Math.min(limit, PAGE_LIMIT)));

        JsonNode data = unwrap(symbol, getJson(symbol, BASE_URL, path, params));
        List<Bar> bars = new ArrayList<>(data.size());
        for (JsonNode row : data) {
            bars.add(parseCandle(row, symbol.toUpperCase(), market, resolutionSeconds));
        }
        return bars;
    }

    // ════════════════════════════════════════════════════════════════════════
    // PARSING
    // ════════════════════════════════════════════════════════════════════════

    static JsonNode unwrap(String symbol, JsonNode body) {
        String code = body.path("code").asText("");
        if (!OK.equals(code)) {
            String msg = body.path("msg").asText("");
            if ("429".equals(code) || msg.toLowerCase().contains("too many")) {
                throw new RateLimitExceededException(VENUE, 429, code + " " + msg);
            }
            throw new BackfillFetchException(VENUE, symbol, "Bitget error " + code + ": " + msg);
        }
        JsonNode data = body.path("data");
        if (!data.isArray()) {
            throw new BackfillFetchException(VENUE, symbol, "Missing data array");
        }
        return data;
    }

    /**
     * Fill rows: {@code {"tradeId","price","size","side":"buy|sell","ts":"ms"}}.
     */
    static List<Trade> parseFills(JsonNode data, String symbol, MarketType market) {
        List<Trade> trades = new ArrayList<>(data.size());
        for (JsonNode row : data) {
            try {
                trades.add(new Trade(
                    VENUE,
                    symbol,
                    market,
                    number(row.get("price"), VENUE, symbol, "price"),
                    number(row.get("size"), VENUE, symbol, "size"),
                    TradeSide.fromWire(row.path("side").asText()),
                    Instant.ofEpochMilli(Long.parseLong(row.path("ts").asText())),
                    row.path("tradeId").asText()
                ));
            } catch (IllegalArgumentException e) {
                throw new BackfillFetchException(VENUE, symbol, "Invalid fill row: " + row, e);
            }
        }
        return trades;
    }

    /**
     * Candle row: {@code [ts, open, high, low, close, baseVolume, quoteVolume, ...]}, all strings.
     * The venue does not report a trade count.
     */
    static Bar parseCandle(JsonNode row, String symbol, MarketType market, int resolutionSeconds) {
        if (row == null || !row.isArray() || row.size() < 6) {
            throw new BackfillFetchException(VENUE, symbol, "Invalid candle row: " + row);
        }
        Instant start;
        try {
            start = Instant.ofEpochMilli(Long.parseLong(row.get(0).asText()));
        } catch (NumberFormatException e) {
            throw new BackfillFetchException(VENUE, symbol, "Invalid candle timestamp: " + row.get(0), e);
        }
        Instant end = start.plusSeconds(resolutionSeconds);
        return new Bar(
            VENUE,
            symbol,
            market,
            resolutionSeconds,
            start,
            end,
            number(row.get(1), VENUE, symbol, "open"),
            number(row.get(2), VENUE, symbol, "high"),
            number(row.get(3), VENUE, symbol, "low"),
            number(row.get(4), VENUE, symbol, "close"),
            number(row.get(5), VENUE, symbol, "baseVolume"),
            0,
            end
        );
    }

    /**
     * instType / productType used by both REST and WebSocket.
     */
    public static String productType(MarketType market) {
        return switch (market) {
            case SPOT -> "SPOT";
            case USDT_FUTURES -> "USDT-FUTURES";
            case COIN_FUTURES -> "COIN-FUTURES";
            case USDC_FUTURES -> "USDC-FUTURES";
        };
    }

    static String granularity(int resolutionSeconds, MarketType market) {
        boolean spot = market == MarketType.SPOT;
        return switch (resolutionSeconds) {
            case 60 -> spot ? "1min" : "1m";
            case 180 -> spot ? "3min" : "3m";
            case 300 -> spot ? "5min" : "5m";
            case 900 -> spot ? "15min" : "15m";
            case 1800 -> spot ? "30min" : "30m";
            case 3600 -> spot ? "1h" : "1H";
            case 14400 -> spot ? "4h" : "4H";
            case 21600 -> spot ? "6h" : "6H";
            case 43200 -> spot ? "12h" : "12H";
            case 86400 -> spot ? "1day" : "1D";
            default -> throw new IllegalArgumentException("Unsupported Bitget candle resolution: " + resolutionSeconds);
        };
    }
}
