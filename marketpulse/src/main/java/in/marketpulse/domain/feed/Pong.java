package in.marketpulse.domain.feed;

/**
 * Keep-alive answer.
 */
public record Pong() implements FeedMessage {
    @Override
    public Kind kind() {
        return Kind.PONG;
    }
}
