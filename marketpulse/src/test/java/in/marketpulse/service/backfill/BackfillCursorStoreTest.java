package in.marketpulse.service.backfill;

import in.marketpulse.domain.backfill.BackfillCursor;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.infrastructure.persistence.InMemoryStateStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BackfillCursorStoreTest {

    private final InMemoryStateStore store = new InMemoryStateStore();
    private final BackfillCursorStore cursors = new BackfillCursorStore(store);

    @Test
    void testSaveAndLoad() {
        BackfillCursor cursor = new BackfillCursor("binance", "BTCUSDT", MarketType.USDT_FUTURES,
            Instant.parse("2024-03-01T12:00:00Z"), Instant.parse("2023-01-01T00:00:00Z"), 12.5);

        cursors.save(cursor);

        assertTrue(store.get("backfill:binance:BTCUSDT:usdtm").isPresent(), "Stored under the documented key");
        assertTrue(store.get("backfill:binance:BTCUSDT:usdtm").get().contains("2024-03-01T12:00:00Z"),
            "Instants are written as ISO strings");
        assertEquals(Optional.of(cursor), cursors.load("binance", "BTCUSDT", MarketType.USDT_FUTURES));
    }

    @Test
    void testMissingAndUnreadableCursor() {
        assertTrue(cursors.load("bitget", "ETHUSDT", MarketType.SPOT).isEmpty());

        store.set("backfill:bitget:ETHUSDT:spot", "not json");
        assertTrue(cursors.load("bitget", "ETHUSDT", MarketType.SPOT).isEmpty(), "Garbage is treated as absent");
    }

    @Test
    void testDelete() {
        cursors.save(new BackfillCursor("bitget", "ETHUSDT", MarketType.SPOT,
            Instant.parse("2024-01-02T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z"), 0.0));

        cursors.delete("bitget", "ETHUSDT", MarketType.SPOT);

        assertEquals(0, store.size());
    }

    @Test
    void testProgress() {
        Instant target = Instant.parse("2024-01-01T00:00:00Z");
        Instant origin = target.plusSeconds(1000);

        assertEquals(0.0, BackfillCursor.progress(origin, origin, target), 1e-9);
        assertEquals(25.0, BackfillCursor.progress(origin, target.plusSeconds(750), target), 1e-9);
        assertEquals(100.0, BackfillCursor.progress(origin, target, target), 1e-9);
        assertEquals(100.0, BackfillCursor.progress(target, target, target), 1e-9, "Empty range is complete");
    }
}
