package io.forecast4j.internal;

public enum DeliveryStatus {
    DELIVERED,
    FAILED_TRANSIENT,
    FAILED_PERMANENT,
    TIMED_OUT,
    // not attempted because the push service was unavailable
    ABORTED;

    public boolean isDelivered() {
        return this == DELIVERED;
    }
}
