package io.forecast4j.core;

/**
 * The push service as a whole cannot be reached. Aborts the remaining deliveries of a batch.
 */
public class PushServiceUnavailableException extends ForecastException {

    public PushServiceUnavailableException(String message) {
        super(message);
    }

    public PushServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
