package in.marketpulse.infrastructure.venue.data;

/**
 * Venue signalled throttling (HTTP 429/418 or an equivalent stream error).
 */
public class RateLimitExceededException extends RuntimeException {

    private final String venue;
    private final int statusCode;

    public RateLimitExceededException(String venue, int statusCode, String message) {
        super(String.format("[%s] rate limit exceeded (%d): %s", venue, statusCode, message));
        this.venue = venue;
        this.statusCode = statusCode;
    }

    public String getVenue() {
        return venue;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
