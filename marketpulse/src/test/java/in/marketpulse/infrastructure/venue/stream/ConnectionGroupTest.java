package in.marketpulse.infrastructure.venue.stream;

import in.marketpulse.domain.market.MarketType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionGroup.
 */
class ConnectionGroupTest {

    @Test
    void testPartition() {
        List<ConnectionGroup> groups = ConnectionGroup.partition("binance", MarketType.USDT_FUTURES,
            List.of("A", "B", "C", "D", "E"), 2, "aggTrade", "binance_stream");

        assertEquals(3, groups.size());
        assertEquals(List.of("A", "B"), groups.get(0).symbols());
        assertEquals(List.of("E"), groups.get(2).symbols());
        assertEquals("usdtm-2", groups.get(2).name());
    }

    @Test
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionGroup.partition("binance", MarketType.SPOT,
            List.of("A"), 0, "aggTrade", "binance_stream"));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionGroup("binance", MarketType.SPOT, 0,
            List.of(), "aggTrade", "binance_stream"));
        assertTrue(ConnectionGroup.partition("binance", MarketType.SPOT, List.of(), 5, "aggTrade", "s").isEmpty());
    }
}
