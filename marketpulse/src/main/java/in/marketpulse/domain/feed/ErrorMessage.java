package in.marketpulse.domain.feed;

/**
 * Error frame sent by the venue.
 *
 * @param throttled the venue says we are sending too fast
 * @param authentication the venue rejected access (fatal for the connection group)
 */
public record ErrorMessage(
    String code,
    String message,
    boolean throttled,
    boolean authentication
) implements FeedMessage {
    @Override
    public Kind kind() {
        return Kind.ERROR;
    }
}
