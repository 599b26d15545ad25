package in.marketpulse.infrastructure.venue;

import in.marketpulse.config.ConfigurationException;
import in.marketpulse.infrastructure.venue.binance.BinanceVenue;
import in.marketpulse.infrastructure.venue.bitget.BitgetVenue;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for VenueFactory.
 */
class VenueFactoryTest {

    @Test
    void testCreate() {
        VenueFactory factory = new VenueFactory();

        assertTrue(factory.create("binance") instanceof BinanceVenue);
        assertTrue(factory.create("BITGET") instanceof BitgetVenue);
        assertSame(factory.create("binance"), factory.create("Binance"), "Adapters are cached per name");
        assertThrows(ConfigurationException.class, () -> factory.create("kraken"));
    }

    @Test
    void testIsSupported() {
        assertTrue(VenueFactory.isSupported("Binance"));
        assertFalse(VenueFactory.isSupported("kraken"));
        assertFalse(VenueFactory.isSupported(null));
    }
}
