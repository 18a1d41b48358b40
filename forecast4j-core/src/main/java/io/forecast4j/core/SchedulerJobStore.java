package io.forecast4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for scheduler jobs.
 *
 * <p>The engine reads enabled jobs and writes back last-run metadata. {@link #save(SchedulerJob)}
 * is the admission path used by the admin API and must reject invalid schedules.
 */
public interface SchedulerJobStore {

    List<SchedulerJob> findEnabled();

    Optional<SchedulerJob> findById(String id);

    /**
     * Validate and upsert a job definition. Derived last-run fields are left untouched.
     *
     * @throws ValidationException when cron, timezone or city are invalid
     */
    PersistResult save(SchedulerJob job);

    /**
     * Write last-run metadata. An outcome older than the stored {@code lastRunAt} is ignored.
     */
    void recordOutcome(String jobId, Instant lastRunAt, JobStatus status, int notified, int failed);
}
