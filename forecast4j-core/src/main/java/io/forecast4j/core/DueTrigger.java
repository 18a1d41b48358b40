package io.forecast4j.core;

import java.time.Instant;

/**
 * A job paired with the due instant it fires for.
 */
public record DueTrigger(SchedulerJob job, Instant dueAt) {
}
