package io.forecast4j.core;

/**
 * What to fire when more than one due instant elapsed since a job was last evaluated
 * (for example after downtime).
 */
public enum CatchUpPolicy {
    /** Fire once, for the most recent elapsed instant. */
    LATEST_ONLY,
    /** Fire every elapsed instant, capped by the configured maximum of missed runs. */
    ALL_MISSED
}
