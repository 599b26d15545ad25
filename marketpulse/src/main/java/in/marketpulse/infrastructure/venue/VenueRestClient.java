package in.marketpulse.infrastructure.venue;

import in.marketpulse.domain.market.Bar;
import in.marketpulse.domain.market.MarketType;
import in.marketpulse.domain.market.Trade;

import java.time.Instant;
import java.util.List;

/**
 * Historical REST access of one venue.
 *
 * Implementations map HTTP 429/418 to
 * {@link in.marketpulse.infrastructure.venue.data.RateLimitExceededException}, 401/403 to
 * {@link in.marketpulse.infrastructure.venue.data.VenueAuthenticationException} and every other
 * failure to {@link in.marketpulse.infrastructure.venue.data.BackfillFetchException}.
 */
public interface VenueRestClient {

    String venue();

    /**
     * All trades with {@code start <= ts < end}, oldest first. Paginates inside the window.
     */
    List<Trade> fetchTrades(String symbol, MarketType market, Instant start, Instant end) throws InterruptedException;

    /**
     * One page of closed bars ending at or before {@code endTime}, at most {@code limit}
     * (capped by the venue's page limit). Order is venue-defined.
     */
    List<Bar> fetchBars(String symbol, MarketType market, int resolutionSeconds, Instant endTime, int limit)
        throws InterruptedException;
}
