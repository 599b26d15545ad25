package in.marketpulse.infrastructure.venue.data;

import in.marketpulse.config.ConfigurationException;
import in.marketpulse.infrastructure.persistence.StorageWriteException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;

/**
 * How a failure is handled by the component that observes it.
 */
public enum ErrorKind {
    RETRYABLE,            // reconnect / retry with backoff
    THROTTLED,            // slow down through the rate limiter
    SKIP_MESSAGE,         // log, count, drop the message
    FATAL_FOR_COMPONENT,  // escalate to health registry, stop this group
    LOSSY,                // log + health; data may be lost
    TERMINATE_TASK,       // end the task, state already persisted
    FATAL_AT_STARTUP;     // process exits

    public static ErrorKind classify(Throwable error) {
        if (error instanceof RateLimitExceededException) return THROTTLED;
        if (error instanceof VenueAuthenticationException) return FATAL_FOR_COMPONENT;
        if (error instanceof MalformedMessageException) return SKIP_MESSAGE;
        if (error instanceof StorageWriteException) return LOSSY;
        if (error instanceof BackfillFetchException) {
            return isThrottleSignal(error) ? THROTTLED : TERMINATE_TASK;
        }
        if (error instanceof ConfigurationException) return FATAL_AT_STARTUP;
        if (error instanceof VenueConnectionException
            || error instanceof VenueSubscriptionException
            || error instanceof HttpTimeoutException
            || error instanceof IOException) {
            return RETRYABLE;
        }
        return isThrottleSignal(error) ? THROTTLED : RETRYABLE;
    }

    /**
     * True when the error (or any cause) looks like venue throttling.
     */
    public static boolean isThrottleSignal(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            if (current instanceof RateLimitExceededException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("rate limit")
                    || lower.contains("too many requests")
                    || lower.contains("429")
                    || lower.contains("throttle")) {
                    return true;
                }
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
