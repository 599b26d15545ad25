package in.marketpulse.config;

import in.marketpulse.domain.market.MarketType;
import in.marketpulse.util.Env;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-venue settings: symbols per market and the two limiter budgets.
 *
 * Environment (prefix is the upper-case venue name):
 * <pre>
 * BINANCE_SPOT_SYMBOLS=BTCUSDT,ETHUSDT
 * BINANCE_USDTM_SYMBOLS=BTCUSDT
 * BINANCE_COINM_SYMBOLS=
 * BINANCE_USDCM_SYMBOLS=
 * BINANCE_MAX_RPS=10                 stream control frames
 * BINANCE_HISTORICAL_RPS=5           REST history
 * BINANCE_MAX_REQUESTS_PER_MINUTE=1200
 * </pre>
 */
public record VenueConfig(
    String name,
    Map<MarketType, List<String>> symbols,
    RateLimitConfig streamLimit,
    RateLimitConfig restLimit
) {
    private static final List<String> DEFAULT_SPOT = List.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "XRPUSDT", "ADAUSDT");
    private static final List<String> DEFAULT_FUTURES = List.of("BTCUSDT", "ETHUSDT");

    public VenueConfig {
        name = name.toLowerCase(Locale.ROOT);
        Map<MarketType, List<String>> copy = new EnumMap<>(MarketType.class);
        for (Map.Entry<MarketType, List<String>> e : symbols.entrySet()) {
            if (!e.getValue().isEmpty()) {
                copy.put(e.getKey(), List.copyOf(e.getValue()));
            }
        }
        symbols = Collections.unmodifiableMap(copy);
    }

    public static VenueConfig fromEnv(String venue) {
        String prefix = venue.toUpperCase(Locale.ROOT);
        Map<MarketType, List<String>> symbols = new EnumMap<>(MarketType.class);
        for (MarketType market : MarketType.values()) {
            List<String> defaults = switch (market) {
                case SPOT -> DEFAULT_SPOT;
                case USDT_FUTURES -> DEFAULT_FUTURES;
                case COIN_FUTURES, USDC_FUTURES -> List.of();
            };
            List<String> raw = Env.getList(prefix + "_" + market.code().toUpperCase(Locale.ROOT) + "_SYMBOLS", defaults);
            List<String> upper = new ArrayList<>();
            for (String symbol : raw) {
                upper.add(symbol.toUpperCase(Locale.ROOT));
            }
            symbols.put(market, upper);
        }

        double streamRps = Env.getDouble(prefix + "_MAX_RPS", 10.0);
        double restRps = Env.getDouble(prefix + "_HISTORICAL_RPS", 5.0);
        int perMinute = Env.getInt(prefix + "_MAX_REQUESTS_PER_MINUTE", "BINANCE".equals(prefix) ? 1200 : 0);

        return new VenueConfig(
            venue,
            symbols,
            RateLimitConfig.defaults(streamRps),
            RateLimitConfig.defaults(restRps).withMaxRequestsPerWindow(perMinute)
        );
    }

    public List<String> symbolsFor(MarketType market) {
        return symbols.getOrDefault(market, List.of());
    }

    /**
     * Every configured symbol across markets, first occurrence order.
     */
    public Set<String> allSymbols() {
        Set<String> all = new LinkedHashSet<>();
        for (List<String> list : symbols.values()) {
            all.addAll(list);
        }
        return all;
    }

    public String streamLimiterScope() {
        return name + "_stream";
    }

    public String restLimiterScope() {
        return name + "_rest";
    }
}
