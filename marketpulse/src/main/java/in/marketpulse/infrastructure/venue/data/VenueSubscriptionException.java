package in.marketpulse.infrastructure.venue.data;

/**
 * Exception thrown when a venue refuses or errors on a subscription request.
 */
public class VenueSubscriptionException extends RuntimeException {

    private final String venue;
    private final String connection;

    public VenueSubscriptionException(String venue, String connection, String message) {
        super(String.format("[%s:%s] %s", venue, connection, message));
        this.venue = venue;
        this.connection = connection;
    }

    public String getVenue() {
        return venue;
    }

    public String getConnection() {
        return connection;
    }
}
