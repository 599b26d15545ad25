package in.marketpulse.config;

/**
 * Invalid or missing configuration. Fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
