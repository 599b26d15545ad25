package in.marketpulse.infrastructure.venue.data;

/**
 * A historical REST fetch failed. Terminates the backfill task that issued it.
 */
public class BackfillFetchException extends RuntimeException {

    private final String venue;
    private final String symbol;

    public BackfillFetchException(String venue, String symbol, String message) {
        super(String.format("[%s:%s] %s", venue, symbol, message));
        this.venue = venue;
        this.symbol = symbol;
    }

    public BackfillFetchException(String venue, String symbol, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", venue, symbol, message), cause);
        this.venue = venue;
        this.symbol = symbol;
    }

    public String getVenue() {
        return venue;
    }

    public String getSymbol() {
        return symbol;
    }
}
