package in.marketpulse.infrastructure.venue.stream;

/**
 * Lifecycle of a stream connection group.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED,
    STREAMING,
    RECONNECTING,
    CLOSED
}
