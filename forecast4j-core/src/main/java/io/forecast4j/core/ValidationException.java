package io.forecast4j.core;

/**
 * Malformed job definition or configuration. Raised at admission, before a job can be scheduled.
 */
public class ValidationException extends ForecastException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
