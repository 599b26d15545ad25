package in.marketpulse.infrastructure.venue;

import in.marketpulse.infrastructure.ratelimit.AdaptiveRateLimiter;
import in.marketpulse.infrastructure.venue.stream.ConnectionGroup;
import in.marketpulse.infrastructure.venue.stream.StreamClient;
import in.marketpulse.infrastructure.venue.stream.StreamConnector;
import in.marketpulse.infrastructure.venue.stream.StreamDependencies;

/**
 * Everything venue specific a collector needs: the trade channel name, a stream client per
 * connection group and a REST client for history.
 */
public interface VenueAdapter {

    String venue();

    /**
     * Stream channel carrying public trades (e.g. "aggTrade", "trade").
     */
    String tradeChannel();

    StreamClient createStreamClient(ConnectionGroup group, StreamConnector connector, StreamDependencies deps);

    /**
     * @param limiter limiter for follow-up pages inside one fetch
     */
    VenueRestClient createRestClient(AdaptiveRateLimiter limiter);
}
