package io.forecast4j.internal;

/**
 * Totals of one history backfill run.
 */
public record BackfillReport(int cities, int daysFetched, int recordsStored, int failures, boolean budgetExhausted) {
}
