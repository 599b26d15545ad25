package in.marketpulse.infrastructure.venue.stream;

/**
 * Inbound event delivered by a {@link StreamConnection}.
 */
public record StreamEvent(Type type, String text, int statusCode, Throwable error) {

    public enum Type {
        TEXT,    // complete text message (fragments already joined)
        PONG,    // protocol-level pong frame
        CLOSED,  // remote or local close
        ERROR    // transport failure; the connection is unusable
    }

    public static StreamEvent text(String text) {
        return new StreamEvent(Type.TEXT, text, 0, null);
    }

    public static StreamEvent pong() {
        return new StreamEvent(Type.PONG, null, 0, null);
    }

    public static StreamEvent closed(int statusCode, String reason) {
        return new StreamEvent(Type.CLOSED, reason, statusCode, null);
    }

    public static StreamEvent error(Throwable error) {
        return new StreamEvent(Type.ERROR, null, 0, error);
    }
}
