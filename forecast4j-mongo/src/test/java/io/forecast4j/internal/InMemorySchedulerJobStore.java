package io.forecast4j.internal;

import io.forecast4j.core.JobStatus;
import io.forecast4j.core.PersistResult;
import io.forecast4j.core.SchedulerJob;
import io.forecast4j.core.SchedulerJobStore;
import io.forecast4j.utils.CronSchedules;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

final class InMemorySchedulerJobStore implements SchedulerJobStore {

    record RecordedOutcome(String jobId, Instant lastRunAt, JobStatus status, int notified, int failed) {
    }

    final Map<String, SchedulerJob> jobs = new ConcurrentHashMap<>();
    final List<RecordedOutcome> outcomes = new CopyOnWriteArrayList<>();
    final AtomicInteger findEnabledCalls = new AtomicInteger();
    volatile RuntimeException failFindEnabled;
    volatile Consumer<Instant> beforeRecord = lastRunAt -> { };

    /**
     * Store a job without admission checks, e.g. one whose cron became invalid.
     */
    void put(SchedulerJob job) {
        jobs.put(job.id(), job);
    }

    @Override
    public List<SchedulerJob> findEnabled() {
        findEnabledCalls.incrementAndGet();
        RuntimeException failure = failFindEnabled;
        if (failure != null) {
            throw failure;
        }
        List<SchedulerJob> enabled = new ArrayList<>();
        for (SchedulerJob job : jobs.values()) {
            if (job.enabled()) {
                enabled.add(job);
            }
        }
        return enabled;
    }

    @Override
    public Optional<SchedulerJob> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public PersistResult save(SchedulerJob job) {
        CronSchedules.validate(job.cron(), job.timezone());
        return jobs.put(job.id(), job) == null ? PersistResult.createdResult() : PersistResult.updatedResult();
    }

    @Override
    public void recordOutcome(String jobId, Instant lastRunAt, JobStatus status, int notified, int failed) {
        beforeRecord.accept(lastRunAt);
        outcomes.add(new RecordedOutcome(jobId, lastRunAt, status, notified, failed));
        jobs.computeIfPresent(jobId, (id, job) -> job.lastRunAt() != null && job.lastRunAt().isAfter(lastRunAt)
                ? job
                : new SchedulerJob(job.id(), job.name(), job.city(), job.units(),
                job.cron(), job.timezone(), job.includeDaily(), job.includeHourly(), job.enabled(), job.notifyConfig(),
                lastRunAt, status, notified, failed));
    }
}
