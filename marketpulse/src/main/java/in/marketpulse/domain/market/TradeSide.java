package in.marketpulse.domain.market;

/**
 * Aggressor side of a trade.
 */
public enum TradeSide {
    BUY,
    SELL;

    public static TradeSide fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Trade side is null");
        }
        return switch (value.trim().toLowerCase()) {
            case "buy", "b" -> BUY;
            case "sell", "s" -> SELL;
            default -> throw new IllegalArgumentException("Unknown trade side: " + value);
        };
    }
}
