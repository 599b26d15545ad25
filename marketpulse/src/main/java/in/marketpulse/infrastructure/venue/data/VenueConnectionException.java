package in.marketpulse.infrastructure.venue.data;

/**
 * Exception thrown when a venue connection fails or drops.
 * Transient: the owner retries with backoff.
 */
public class VenueConnectionException extends RuntimeException {

    private final String venue;
    private final String connection;

    public VenueConnectionException(String venue, String connection, String message) {
        super(String.format("[%s:%s] %s", venue, connection, message));
        this.venue = venue;
        this.connection = connection;
    }

    public VenueConnectionException(String venue, String connection, String message, Throwable cause) {
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
