package in.marketpulse.domain.market;

/**
 * Market segment of an instrument.
 *
 * The code is the stable short form used in storage keys, configuration
 * variables and log prefixes.
 */
public enum MarketType {
    SPOT("spot"),
    USDT_FUTURES("usdtm"),
    COIN_FUTURES("coinm"),
    USDC_FUTURES("usdcm");

    private final String code;

    MarketType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isFutures() {
        return this != SPOT;
    }

    /**
     * Resolve from the short code or the enum name (case-insensitive).
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static MarketType fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Market type is null");
        }
        String normalized = value.trim();
        for (MarketType type : values()) {
            if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown market type: " + value);
    }
}
