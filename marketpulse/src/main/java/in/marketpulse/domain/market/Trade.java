package in.marketpulse.domain.market;

import java.time.Instant;
import java.util.Objects;

/**
 * A single executed trade as reported by a venue.
 *
 * Built by a stream or REST parser from raw wire data and never mutated afterwards.
 */
public record Trade(
    String venue,
    String symbol,
    MarketType market,
    double price,
    double size,
    TradeSide side,
    Instant timestamp,
    String venueTradeId
) {
    public Trade {
        Objects.requireNonNull(venue, "venue");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(market, "market");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(timestamp, "timestamp");
        if (!Double.isFinite(price) || price <= 0) {
            throw new IllegalArgumentException("Invalid trade price: " + price);
        }
        if (!Double.isFinite(size) || size < 0) {
            throw new IllegalArgumentException("Invalid trade size: " + size);
        }
    }
}
