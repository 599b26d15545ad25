package in.marketpulse.domain.feed;

/**
 * Parsed inbound stream message. Dispatch is a switch over {@link #kind()}.
 */
public interface FeedMessage {

    enum Kind {
        SUBSCRIBE_ACK,
        ERROR,
        TRADE_UPDATE,
        ORDERBOOK_UPDATE,
        PONG
    }

    Kind kind();
}
