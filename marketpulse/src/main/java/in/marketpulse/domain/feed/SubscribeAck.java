package in.marketpulse.domain.feed;

/**
 * Venue confirmed a subscription request.
 *
 * @param reference request id or channel echoed by the venue
 */
public record SubscribeAck(String reference) implements FeedMessage {
    @Override
    public Kind kind() {
        return Kind.SUBSCRIBE_ACK;
    }
}
