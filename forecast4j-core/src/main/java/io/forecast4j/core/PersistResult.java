package io.forecast4j.core;

public record PersistResult(
        boolean created,
        boolean updated
) {
    public static PersistResult createdResult() {
        return new PersistResult(true, false);
    }

    public static PersistResult updatedResult() {
        return new PersistResult(false, true);
    }
}
