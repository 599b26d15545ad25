package in.marketpulse.domain.feed;

import in.marketpulse.domain.market.Trade;

import java.util.List;

/**
 * One or more trades carried by a single frame.
 */
public record TradeUpdate(List<Trade> trades) implements FeedMessage {
    public TradeUpdate {
        trades = List.copyOf(trades);
    }

    @Override
    public Kind kind() {
        return Kind.TRADE_UPDATE;
    }
}
