package in.marketpulse.infrastructure.venue.data;

/**
 * A frame or payload that cannot be parsed. The message is skipped.
 */
public class MalformedMessageException extends RuntimeException {

    private final String venue;

    public MalformedMessageException(String venue, String message) {
        super(String.format("[%s] %s", venue, message));
        this.venue = venue;
    }

    public MalformedMessageException(String venue, String message, Throwable cause) {
        super(String.format("[%s] %s", venue, message), cause);
        this.venue = venue;
    }

    public String getVenue() {
        return venue;
    }
}
