package io.forecast4j.core;

public enum ExecutionState {
    PENDING,
    FETCHING,
    RESOLVING,
    NOTIFYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
