package in.marketpulse.infrastructure.venue.bitget;

import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.VenueAdapter;
import in.marketpulse.infrastructure.venue.VenueRestClient;
import in.marketpulse.infrastructure.venue.stream.ConnectionGroup;
import in.marketpulse.infrastructure.venue.stream.StreamClient;
import in.marketpulse.infrastructure.venue.stream.StreamConnector;
import in.marketpulse.infrastructure.venue.stream.StreamDependencies;

public class BitgetVenue implements VenueAdapter {

    public static final String NAME = BitgetRestClient.VENUE;

    @Override
    public String venue() {
        return NAME;
    }

    @Override
    public String tradeChannel() {
        return "trade";
    }

    @Override
    public StreamClient createStreamClient(ConnectionGroup group, StreamConnector connector, StreamDependencies deps) {
        return new BitgetStreamClient(group, connector, deps);
    }

    @Override
    public VenueRestClient createRestClient(AdaptiveRateLimiter limiter) {
        return new BitgetRestClient(limiter);
    }
}
