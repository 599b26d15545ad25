package in.marketpulse.infrastructure.venue.stream;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of a stream client for status reporting.
 */
public record ConnectionStats(
    String venue,
    String connection,
    ConnectionState state,
    int reconnectCount,
    long messagesReceived,
    long tradesReceived,
    long malformedMessages,
    Instant lastMessageTime,
    Map<String, Instant> lastDataBySymbol,
    Duration currentBackoff
) {}
