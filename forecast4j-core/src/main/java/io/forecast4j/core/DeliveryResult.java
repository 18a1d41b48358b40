package io.forecast4j.core;

/**
 * Outcome reported by the push delivery client for one device.
 */
public enum DeliveryResult {
    OK,
    /** Network errors, timeouts, rate limiting. Worth retrying. */
    TRANSIENT_FAILURE,
    /** Invalid or expired token. Never retried. */
    PERMANENT_FAILURE
}
