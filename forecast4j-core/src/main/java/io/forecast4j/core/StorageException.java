package io.forecast4j.core;

public class StorageException extends ForecastException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
