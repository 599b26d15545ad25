package in.marketpulse.infrastructure.venue.data;

/**
 * Exception thrown when a venue rejects credentials or access.
 * Fatal for the connection group that raised it.
 */
public class VenueAuthenticationException extends RuntimeException {

    private final String venue;
    private final String connection;

    public VenueAuthenticationException(String venue, String connection, String message) {
        super(String.format("[%s:%s] %s", venue, connection, message));
        this.venue = venue;
        this.connection = connection;
    }

    public VenueAuthenticationException(String venue, String connection, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", venue, connection, message), cause);
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
