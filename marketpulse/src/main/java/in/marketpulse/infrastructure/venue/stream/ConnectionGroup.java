package in.marketpulse.infrastructure.venue.stream;

import in.marketpulse.domain.market.MarketType;

import java.util.ArrayList;
import java.util.List;

/**
 * Symbols of one market sharing a single stream connection.
 *
 * @param index position of the group within its market, used in the connection name
 * @param channel venue channel subscribed for every symbol (e.g. "aggTrade", "trade")
 * @param limiterScope rate limiter scope used for outbound control frames
 */
public record ConnectionGroup(
    String venue,
    MarketType market,
    int index,
    List<String> symbols,
    String channel,
    String limiterScope
) {
    public ConnectionGroup {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("Connection group needs at least one symbol");
        }
        symbols = List.copyOf(symbols);
    }

    /**
     * Connection name used in logs and metrics, e.g. {@code spot-0}.
     */
    public String name() {
        return market.code() + "-" + index;
    }

    /**
     * Split symbols into groups of at most {@code groupSize}.
     */
    public static List<ConnectionGroup> partition(String venue, MarketType market, List<String> symbols,
                                                  int groupSize, String channel, String limiterScope) {
        if (groupSize < 1) {
            throw new IllegalArgumentException("Group size must be positive: " + groupSize);
        }
        List<ConnectionGroup> groups = new ArrayList<>();
        for (int from = 0, index = 0; from < symbols.size(); from += groupSize, index++) {
            int to = Math.min(from + groupSize, symbols.size());
            groups.add(new ConnectionGroup(venue, market, index, symbols.subList(from, to), channel, limiterScope));
        }
        return groups;
    }
}
