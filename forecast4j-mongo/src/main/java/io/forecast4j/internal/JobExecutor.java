package io.forecast4j.internal;

import io.forecast4j.core.Device;
import io.forecast4j.core.DeviceRegistry;
import io.forecast4j.core.DueTrigger;
import io.forecast4j.core.ExecutionOutcome;
import io.forecast4j.core.ExecutionState;
import io.forecast4j.core.FailureReason;
import io.forecast4j.core.FetchException;
import io.forecast4j.core.NotificationPayload;
import io.forecast4j.core.SchedulerJob;
import io.forecast4j.core.SchedulerJobStore;
import io.forecast4j.core.StorageException;
import io.forecast4j.core.WeatherHistoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one due job: fetch weather, resolve target devices, fan out the notification, record the outcome.
 *
 * <p>Executions of the same job are serialized through {@link JobExecutionLocks}, outcome recording included.
 * {@link #execute(DueTrigger)} never throws: every failure ends in a {@link ExecutionState#FAILED} outcome.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final WeatherCache cache;
    private final DeviceRegistry deviceRegistry;
    private final NotificationFanout fanout;
    private final SchedulerJobStore jobStore;
    private final JobExecutionLocks locks;
    private final RetryPolicy fetchRetry;
    private final Clock clock;

    private final ConcurrentHashMap<String, ExecutionOutcome> lastOutcomes = new ConcurrentHashMap<>();

    public JobExecutor(WeatherCache cache,
                       DeviceRegistry deviceRegistry,
                       NotificationFanout fanout,
                       SchedulerJobStore jobStore,
                       JobExecutionLocks locks,
                       RetryPolicy fetchRetry,
                       Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.deviceRegistry = Objects.requireNonNull(deviceRegistry, "deviceRegistry must not be null");
        this.fanout = Objects.requireNonNull(fanout, "fanout must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.fetchRetry = Objects.requireNonNull(fetchRetry, "fetchRetry must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ExecutionOutcome execute(DueTrigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        SchedulerJob job = trigger.job();
        ExecutionAttempt attempt = new ExecutionAttempt(job.id(), trigger.dueAt());

        ReentrantLock lock = locks.lockFor(job.id());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attempt.fail(FailureReason.UNEXPECTED_ERROR, "Interrupted while waiting for the job lock");
            ExecutionOutcome outcome = attempt.toOutcome(clock.instant());
            log.warn("forecast job abandoned before start id={} dueAt={}", job.id(), trigger.dueAt());
            return outcome;
        }

        ExecutionOutcome outcome;
        try {
            try {
                attempt.start(clock.instant());
                run(job, attempt);
            } catch (FetchException e) {
                log.error("forecast job fetch failed id={} city={} transient={} attempts={} msg={}",
                        job.id(), job.city(), e.isTransient(), attempt.fetchAttempts(), e.getMessage());
                attempt.fail(FailureReason.UPSTREAM_FETCH_FAILED, e.getMessage());
            } catch (StorageException e) {
                log.error("forecast job storage error id={} state={} msg={}", job.id(), attempt.state(), e.getMessage(), e);
                attempt.fail(FailureReason.STORAGE_ERROR, e.getMessage());
            } catch (RuntimeException e) {
                log.error("forecast job crashed id={} state={} msg={}", job.id(), attempt.state(), e.getMessage(), e);
                attempt.fail(FailureReason.UNEXPECTED_ERROR, e.getMessage());
            }
            // recorded under the job lock so a later run of the same job is always written last
            outcome = attempt.toOutcome(clock.instant());
            record(outcome);
        } finally {
            lock.unlock();
        }
        return outcome;
    }

    public Optional<ExecutionOutcome> lastOutcome(String jobId) {
        return Optional.ofNullable(lastOutcomes.get(jobId));
    }

    private void run(SchedulerJob job, ExecutionAttempt attempt) {
        WeatherHistoryRecord record = fetchWithRetry(job, attempt);

        attempt.moveTo(ExecutionState.RESOLVING);
        List<Device> targets = resolveTargets(job);
        if (targets.isEmpty()) {
            log.debug("forecast job has no subscribed devices id={} city={}", job.id(), job.city());
            attempt.complete();
            return;
        }
        if (!ForecastMessages.shouldNotify(record, job.notifyConfig())) {
            log.debug("forecast job notification suppressed id={} city={}", job.id(), job.city());
            attempt.suppress();
            return;
        }

        attempt.moveTo(ExecutionState.NOTIFYING);
        NotificationPayload payload = ForecastMessages.build(job, record);
        FanoutResult result = fanout.dispatch(targets, payload);
        attempt.recordDeliveries(result);

        if (result.aborted()) {
            attempt.fail(FailureReason.FANOUT_FAILED, "Push service unavailable: " + result.abortReason());
            return;
        }
        attempt.complete();
    }

    private WeatherHistoryRecord fetchWithRetry(SchedulerJob job, ExecutionAttempt attempt) {
        int failed = 0;
        while (true) {
            attempt.countFetchAttempt();
            try {
                return cache.getOrFetch(job.city(), job.units(), clock.instant());
            } catch (FetchException e) {
                failed++;
                if (!e.isTransient() || !fetchRetry.canRetry(failed)) {
                    throw e;
                }
                log.warn("forecast job fetch retry id={} city={} attempt={} backoff={} msg={}",
                        job.id(), job.city(), failed, fetchRetry.backoff(failed), e.getMessage());
                if (!fetchRetry.pause(failed)) {
                    throw FetchException.transientFailure("Interrupted while backing off: " + e.getMessage(), e);
                }
            }
        }
    }

    private List<Device> resolveTargets(SchedulerJob job) {
        List<Device> candidates = deviceRegistry.findEnabledByCity(job.city());
        List<Device> targets = new ArrayList<>(candidates.size());
        for (Device d : candidates) {
            if (d != null && d.isTargetFor(job.city())) {
                targets.add(d);
            }
        }
        return targets;
    }

    private void record(ExecutionOutcome outcome) {
        lastOutcomes.merge(outcome.jobId(), outcome,
                (previous, latest) -> latest.dueAt().isBefore(previous.dueAt()) ? previous : latest);
        try {
            jobStore.recordOutcome(outcome.jobId(), outcome.dueAt(), outcome.toJobStatus(),
                    outcome.notified(), outcome.failed());
        } catch (RuntimeException e) {
            log.error("forecast job outcome not persisted id={} state={} msg={}",
                    outcome.jobId(), outcome.state(), e.getMessage(), e);
        }

        if (outcome.isCompleted()) {
            log.info("forecast job completed id={} dueAt={} notified={} failed={} suppressed={}",
                    outcome.jobId(), outcome.dueAt(), outcome.notified(), outcome.failed(), outcome.suppressed());
        } else {
            log.warn("forecast job failed id={} dueAt={} reason={} notified={} failed={}",
                    outcome.jobId(), outcome.dueAt(), outcome.failureReason(), outcome.notified(), outcome.failed());
        }
    }
}
