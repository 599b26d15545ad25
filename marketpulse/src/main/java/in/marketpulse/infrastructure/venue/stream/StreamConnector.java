package in.marketpulse.infrastructure.venue.stream;

import java.net.URI;

/**
 * Opens stream connections. Replaced by fakes in tests.
 */
public interface StreamConnector extends AutoCloseable {

    /**
     * Open a connection.
     *
     * @throws in.marketpulse.infrastructure.venue.data.VenueConnectionException on transient failure
     * @throws in.marketpulse.infrastructure.venue.data.VenueAuthenticationException if access is refused
     * @throws InterruptedException if interrupted while connecting
     */
    StreamConnection connect(String venue, String connectionName, URI endpoint) throws InterruptedException;

    /**
     * Close every connection this connector opened that is still open.
     */
    @Override
    default void close() {
    }
}
