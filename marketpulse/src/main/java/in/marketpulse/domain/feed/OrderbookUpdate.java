package in.marketpulse.domain.feed;

/**
 * Order book delta or snapshot. Only counted; book data is not persisted.
 */
public record OrderbookUpdate(String symbol, String channel) implements FeedMessage {
    @Override
    public Kind kind() {
        return Kind.ORDERBOOK_UPDATE;
    }
}
