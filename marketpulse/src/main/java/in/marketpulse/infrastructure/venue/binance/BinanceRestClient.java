package in.marketpulse.infrastructure.venue.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.domain.market.Trade;
import in.marketpulse.domain.market.TradeSide;
import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.HttpVenueRestClient;
import in.marketpulse.infrastructure.venue.data.BackfillFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binance historical REST client.
 *
 * Trades come from {@code aggTrades}: the first page is selected by time window, follow-up
 * pages continue with {@code fromId} until the window end is passed. Bars come from
 * {@code klines}.
 *
 * Hosts:
 * - spot: api.binance.com/api/v3
 * - USDT/USDC futures: fapi.binance.com/fapi/v1
 * - coin futures: dapi.binance.com/dapi/v1
 */
public class BinanceRestClient extends HttpVenueRestClient {
    private static final Logger log = LoggerFactory.getLogger(BinanceRestClient.class);

    public static final String VENUE = "binance";
    static final int PAGE_LIMIT = 1000;

    public BinanceRestClient(AdaptiveRateLimiter limiter) {
        this(HttpClient.newBuilder().connectTimeout(TIMEOUT).build(), new ObjectMapper(), limiter);
    }

    public BinanceRestClient(HttpClient httpClient, ObjectMapper mapper, AdaptiveRateLimiter limiter) {
        super(httpClient, mapper, limiter);
    }

    @Override
    public String venue() {
        return VENUE;
    }

    @Override
    public List<Trade> fetchTrades(String symbol, MarketType market, Instant start, Instant end)
            throws InterruptedException {
        String host = host(market);
        String path = apiPrefix(market) + "/aggTrades";
        long startMs = start.toEpochMilli();
        long endMs = end.toEpochMilli();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol.toUpperCase());
        params.put("startTime", String.valueOf(startMs));
        params.put("endTime", String.valueOf(endMs - 1));
        params.put("limit", String.valueOf(PAGE_LIMIT));

        List<Trade> result = new ArrayList<>();
        int pages = 0;
        while (true) {
            if (pages > 0) {
                acquirePage();
            }
            JsonNode page = getJson(symbol, host, path, params);
            pages++;
            List<Trade> trades = parseAggTrades(page, symbol.toUpperCase(), market);
            long lastId = -1;
            boolean passedEnd = false;
            for (int i = 0; i < page.size(); i++) {
                lastId = page.get(i).path("a").asLong(lastId);
            }
            for (Trade trade : trades) {
                long ts = trade.timestamp().toEpochMilli();
                if (ts >= endMs) {
                    passedEnd = true;
                } else if (ts >= startMs) {
                    result.add(trade);
                }
            }
            if (page.size() < PAGE_LIMIT || passedEnd || lastId < 0) {
                break;
            }
            params = new LinkedHashMap<>();
            params.put("symbol", symbol.toUpperCase());
            params.put("fromId", String.valueOf(lastId + 1));
            params.put("limit", String.valueOf(PAGE_LIMIT));
        }
        log.debug("[BINANCE] {} {} trades in [{}, {}) over {} page(s)", symbol, result.size(), start, end, pages);
        return result;
    }

    @Override
    public List<Bar> fetchBars(String symbol, MarketType market, int resolutionSeconds, Instant endTime, int limit)
            throws InterruptedException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol.toUpperCase());
        params.put("interval", interval(resolutionSeconds));
        params.put("endTime", String.valueOf(endTime.toEpochMilli()));
        params.put("limit", String.valueOf(Math.min(limit, PAGE_LIMIT)));

        JsonNode page = getJson(symbol, host(market), apiPrefix(market) + "/klines", params);
        if (!page.isArray()) {
            throw new BackfillFetchException(VENUE, symbol, "Unexpected klines payload");
        }
        List<Bar> bars = new ArrayList<>(page.size());
        for (JsonNode row : page) {
            bars.add(parseKline(row, symbol.toUpperCase(), market, resolutionSeconds));
        }
        return bars;
    }

    // ════════════════════════════════════════════════════════════════════════
    // PARSING
    // ════════════════════════════════════════════════════════════════════════

    /**
     * aggTrades rows: {@code {"a":id,"p":"price","q":"qty","T":ms,"m":buyerIsMaker}}.
     * Buyer is maker means the seller was the aggressor.
     */
    static List<Trade> parseAggTrades(JsonNode page, String symbol, MarketType market) {
        if (page == null || !page.isArray()) {
            throw new BackfillFetchException(VENUE, symbol, "Unexpected aggTrades payload");
        }
        List<Trade> trades = new ArrayList<>(page.size());
        for (JsonNode row : page) {
            try {
                trades.add(new Trade(
                    VENUE,
                    symbol,
                    market,
                    number(row.get("p"), VENUE, symbol, "p"),
                    number(row.get("q"), VENUE, symbol, "q"),
                    row.path("m").asBoolean(false) ? TradeSide.SELL : TradeSide.BUY,
                    Instant.ofEpochMilli(row.path("T").asLong()),
                    row.path("a").asText()
                ));
            } catch (IllegalArgumentException e) {
                throw new BackfillFetchException(VENUE, symbol, "Invalid aggTrade row: " + row, e);
            }
        }
        return trades;
    }

    /**
     * Kline row: {@code [openTime, open, high, low, close, volume, closeTime, quoteVolume, trades, ...]}.
     */
    static Bar parseKline(JsonNode row, String symbol, MarketType market, int resolutionSeconds) {
        if (row == null || !row.isArray() || row.size() < 9) {
            throw new BackfillFetchException(VENUE, symbol, "Invalid kline row: " + row);
        }
        Instant start = Instant.ofEpochMilli(row.get(0).asLong());
        return new Bar(
            VENUE,
            symbol,
            market,
            resolutionSeconds,
            start,
            start.plusSeconds(resolutionSeconds),
            number(row.get(1), VENUE, symbol, "open"),
            number(row.get(2), VENUE, symbol, "high"),
            number(row.get(3), VENUE, symbol, "low"),
            number(row.get(4), VENUE, symbol, "close"),
            number(row.get(5), VENUE, symbol, "volume"),
            row.get(8).asLong(),
            Instant.ofEpochMilli(row.get(6).asLong())
        );
    }

    static String interval(int resolutionSeconds) {
        return switch (resolutionSeconds) {
            case 1 -> "1s";
            case 60 -> "1m";
            case 180 -> "3m";
            case 300 -> "5m";
            case 900 -> "15m";
            case 1800 -> "30m";
            case 3600 -> "1h";
            case 7200 -> "2h";
            case 14400 -> "4h";
            case 21600 -> "6h";
            case 28800 -> "8h";
            case 43200 -> "12h";
            case 86400 -> "1d";
            default -> throw new IllegalArgumentException("Unsupported Binance kline resolution: " + resolutionSeconds);
        };
    }

    static String host(MarketType market) {
        return switch (market) {
            case SPOT -> "https://api.binance.com";
            case USDT_FUTURES, USDC_FUTURES -> "https://fapi.binance.com";
            case COIN_FUTURES -> "https://dapi.binance.com";
        };
    }

    static String apiPrefix(MarketType market) {
        return switch (market) {
            case SPOT -> "/api/v3";
            case USDT_FUTURES, USDC_FUTURES -> "/fapi/v1";
            case COIN_FUTURES -> "/dapi/v1";
        };
    }
}
