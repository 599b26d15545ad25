package in.marketpulse.infrastructure.venue.stream;

import java.time.Duration;

/**
 * One open stream connection. Inbound traffic is consumed by polling from the owning
 * client's loop thread.
 */
public interface StreamConnection extends AutoCloseable {

    /**
     * @throws in.marketpulse.infrastructure.venue.data.VenueConnectionException if the send fails
     */
    void sendText(String text);

    /**
     * Protocol-level ping frame.
     */
    void sendPing();

    /**
     * Next inbound event, or null if nothing arrived within {@code timeout}.
     */
    StreamEvent poll(Duration timeout) throws InterruptedException;

    boolean isOpen();

    /**
     * Close the connection. A CLOSED event becomes visible to {@link #poll}. Idempotent.
     */
    @Override
    void close();
}
