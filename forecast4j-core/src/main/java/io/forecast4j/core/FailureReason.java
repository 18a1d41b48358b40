package io.forecast4j.core;

public enum FailureReason {
    UPSTREAM_FETCH_FAILED,
    FANOUT_FAILED,
    STORAGE_ERROR,
    UNEXPECTED_ERROR
}
