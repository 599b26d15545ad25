package in.marketpulse.infrastructure.persistence;

/**
 * A write to the trade/bar sink or the state store failed.
 */
public class StorageWriteException extends RuntimeException {

    private final String target;

    public StorageWriteException(String target, String message, Throwable cause) {
        super(String.format("[%s] %s", target, message), cause);
        this.target = target;
    }

    public StorageWriteException(String target, String message) {
        super(String.format("[%s] %s", target, message));
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
