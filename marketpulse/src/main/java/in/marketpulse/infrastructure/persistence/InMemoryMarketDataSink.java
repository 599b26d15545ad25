package in.marketpulse.infrastructure.persistence;

import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.Trade;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps everything in memory. Used when no database is configured, and in tests.
 */
public class InMemoryMarketDataSink implements MarketDataSink {

    private final List<Trade> trades = new CopyOnWriteArrayList<>();
    private final List<Bar> bars = new CopyOnWriteArrayList<>();

    @Override
    public void appendTrade(Trade trade) {
        trades.add(trade);
    }

    @Override
    public void appendBar(Bar bar) {
        bars.add(bar);
    }

    @Override
    public void appendTrades(List<Trade> batch) {
        trades.addAll(batch);
    }

    @Override
    public void appendBars(List<Bar> batch) {
        bars.addAll(batch);
    }

    public List<Trade> trades() {
        return new ArrayList<>(trades);
    }

    public List<Bar> bars() {
        return new ArrayList<>(bars);
    }
}
