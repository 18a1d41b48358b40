package io.forecast4j.core;

/**
 * Last recorded outcome of a scheduler job.
 */
public enum JobStatus {
    NEVER_RUN,
    COMPLETED,
    FAILED
}
