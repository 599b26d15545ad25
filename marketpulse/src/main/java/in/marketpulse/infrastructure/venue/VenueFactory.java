package in.marketpulse.infrastructure.venue;

import in.marketpulse.config.ConfigurationException;
import in.marketpulse.infrastructure.venue.binance.BinanceVenue;
import in.marketpulse.infrastructure.venue.bitget.BitgetVenue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * VenueFactory - Resolves venue names from configuration to adapters.
 *
 * Supported venues: BINANCE, BITGET. Adapters are stateless and cached per name.
 */
public class VenueFactory {
    private static final Logger log = LoggerFactory.getLogger(VenueFactory.class);

    public static final List<String> SUPPORTED = List.of(BinanceVenue.NAME, BitgetVenue.NAME);

    private final Map<String, VenueAdapter> cache = new ConcurrentHashMap<>();

    /**
     * @throws ConfigurationException for an unknown venue name
     */
    public VenueAdapter create(String venue) {
        return cache.computeIfAbsent(venue.toLowerCase(), name -> {
            VenueAdapter adapter = switch (name) {
                case BinanceVenue.NAME -> new BinanceVenue();
                case BitgetVenue.NAME -> new BitgetVenue();
                default -> throw new ConfigurationException(
                    "Unknown venue: " + venue + " (supported: " + String.join(", ", SUPPORTED) + ")");
            };
            log.info("[VenueFactory] Created adapter for {}", name);
            return adapter;
        });
    }

    public static boolean isSupported(String venue) {
        return venue != null && SUPPORTED.contains(venue.toLowerCase());
    }
}
