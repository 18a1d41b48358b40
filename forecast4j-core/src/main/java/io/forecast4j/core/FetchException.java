package io.forecast4j.core;

/**
 * Weather provider failure.
 *
 * <p>Transient failures (timeouts, 5xx, exhausted call budget) may be retried;
 * permanent ones (unknown city, rejected API key) must not be.
 */
public class FetchException extends ForecastException {

    private final boolean transientFailure;

    private FetchException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static FetchException transientFailure(String message) {
        return new FetchException(message, null, true);
    }

    public static FetchException transientFailure(String message, Throwable cause) {
        return new FetchException(message, cause, true);
    }

    public static FetchException permanentFailure(String message) {
        return new FetchException(message, null, false);
    }

    public static FetchException permanentFailure(String message, Throwable cause) {
        return new FetchException(message, cause, false);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
