package io.forecast4j.internal;

import io.forecast4j.core.CatchUpPolicy;
import io.forecast4j.core.DueTrigger;
import io.forecast4j.core.SchedulerJob;
import io.forecast4j.core.SchedulerJobStore;
import io.forecast4j.core.ValidationException;
import io.forecast4j.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides which jobs are due on each tick.
 *
 * <p>Works on an immutable snapshot of the enabled jobs, reloaded from the {@link SchedulerJobStore} at most once
 * per refresh interval. For every job it keeps the last evaluated fire time; a tick fires the job when its next
 * fire time (in the job's own time zone) is at or before {@code now}, and advances the last evaluated instant
 * before handing the trigger out, so a following tick never fires the same instant again.
 */
public class CronScheduler {
    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    private final SchedulerJobStore jobStore;
    private final Duration tickInterval;
    private final Duration refreshInterval;
    private final CatchUpPolicy catchUpPolicy;
    private final int maxMissedRuns;

    private volatile List<SchedulerJob> snapshot = List.of();
    private volatile Instant lastRefreshAt;
    private volatile Instant lastTickAt;

    private final ConcurrentHashMap<String, JobScheduleState> states = new ConcurrentHashMap<>();
    private final Set<String> invalidJobIds = ConcurrentHashMap.newKeySet();

    private static final class JobScheduleState {
        private final String cron;
        private final String timezone;
        private final AtomicReference<Instant> lastEvaluated;

        private JobScheduleState(SchedulerJob job, Instant anchor) {
            this.cron = job.cron();
            this.timezone = job.timezone();
            this.lastEvaluated = new AtomicReference<>(anchor);
        }

        private boolean sameSchedule(SchedulerJob job) {
            return Objects.equals(cron, job.cron()) && Objects.equals(timezone, job.timezone());
        }
    }

    public CronScheduler(SchedulerJobStore jobStore,
                         Duration tickInterval,
                         Duration refreshInterval,
                         CatchUpPolicy catchUpPolicy,
                         int maxMissedRuns) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval must not be null");
        this.refreshInterval = Objects.requireNonNull(refreshInterval, "refreshInterval must not be null");
        this.catchUpPolicy = Objects.requireNonNull(catchUpPolicy, "catchUpPolicy must not be null");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be a positive duration");
        }
        if (refreshInterval.isNegative()) {
            throw new IllegalArgumentException("refreshInterval must not be negative");
        }
        if (maxMissedRuns <= 0) {
            throw new IllegalArgumentException("maxMissedRuns must be a positive number");
        }
        this.maxMissedRuns = maxMissedRuns;
    }

    /**
     * Return the triggers due at {@code now}, oldest first per job.
     *
     * <p>Never throws for a single bad job: jobs whose schedule cannot be evaluated are skipped and reported by
     * {@link #invalidJobIds()}.
     */
    public List<DueTrigger> tick(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        refreshIfStale(now);

        List<SchedulerJob> jobs = snapshot;
        Instant previousTick = lastTickAt;
        List<DueTrigger> due = new ArrayList<>();

        for (SchedulerJob job : jobs) {
            if (!job.enabled()) {
                continue;
            }
            try {
                due.addAll(evaluate(job, now, previousTick));
            } catch (ValidationException e) {
                if (invalidJobIds.add(job.id())) {
                    log.warn("forecast job skipped, schedule is invalid id={} cron={} timezone={} msg={}",
                            job.id(), job.cron(), job.timezone(), e.getMessage());
                }
            } catch (RuntimeException e) {
                log.error("forecast job evaluation failed id={} msg={}", job.id(), e.getMessage(), e);
            }
        }

        lastTickAt = now;
        if (!due.isEmpty()) {
            log.debug("forecast tick now={} due={}", now, due.size());
        }
        return due;
    }

    /**
     * Reload the job snapshot now. On failure the previous snapshot stays in use.
     */
    public void refresh(Instant now) {
        List<SchedulerJob> loaded;
        try {
            loaded = jobStore.findEnabled();
        } catch (RuntimeException e) {
            log.error("forecast job refresh failed, keeping previous snapshot size={} msg={}", snapshot.size(), e.getMessage(), e);
            return;
        }

        List<SchedulerJob> enabled = new ArrayList<>(loaded.size());
        Set<String> ids = new HashSet<>();
        for (SchedulerJob job : loaded) {
            if (job != null && job.enabled() && ids.add(job.id())) {
                enabled.add(job);
            }
        }

        snapshot = List.copyOf(enabled);
        states.keySet().retainAll(ids);
        invalidJobIds.retainAll(ids);
        lastRefreshAt = now;
        log.debug("forecast job snapshot refreshed size={}", enabled.size());
    }

    public List<SchedulerJob> snapshot() {
        return snapshot;
    }

    /**
     * Ids of jobs in the current snapshot whose cron or timezone could not be evaluated.
     */
    public Set<String> invalidJobIds() {
        return Set.copyOf(invalidJobIds);
    }

    /**
     * Last fire time handed out for a job, or the anchor it was first seen with.
     */
    public Instant lastEvaluated(String jobId) {
        JobScheduleState state = states.get(jobId);
        return state == null ? null : state.lastEvaluated.get();
    }

    private void refreshIfStale(Instant now) {
        Instant last = lastRefreshAt;
        if (last == null || !now.isBefore(last.plus(refreshInterval))) {
            refresh(now);
        }
    }

    private List<DueTrigger> evaluate(SchedulerJob job, Instant now, Instant previousTick) {
        JobScheduleState state = states.compute(job.id(), (id, existing) -> {
            if (existing != null && existing.sameSchedule(job)) {
                return existing;
            }
            return new JobScheduleState(job, initialAnchor(job, now, previousTick));
        });

        Instant anchor = state.lastEvaluated.get();
        int limit = catchUpPolicy == CatchUpPolicy.LATEST_ONLY ? 1 : maxMissedRuns;
        List<Instant> fires = CronSchedules.firesBetween(job.cron(), job.timezone(), anchor, now, limit);
        invalidJobIds.remove(job.id());
        if (fires.isEmpty()) {
            return List.of();
        }

        Instant latest = fires.get(fires.size() - 1);
        if (!state.lastEvaluated.compareAndSet(anchor, latest)) {
            // another tick already claimed these instants
            return List.of();
        }

        if (fires.size() > 1) {
            log.info("forecast job catching up id={} missedRuns={} policy={}", job.id(), fires.size(), catchUpPolicy);
        }

        List<DueTrigger> triggers = new ArrayList<>(fires.size());
        for (Instant fireAt : fires) {
            triggers.add(new DueTrigger(job, fireAt));
        }
        return triggers;
    }

    /*
     * First anchor for a job the scheduler has not seen yet (or whose schedule changed):
     * - while running: the previous tick, so only instants after it fire
     * - right after startup: the persisted last run, so missed runs follow the catch-up policy
     * - otherwise: one tick interval back
     */
    private Instant initialAnchor(SchedulerJob job, Instant now, Instant previousTick) {
        if (previousTick != null) {
            return laterOf(previousTick, job.lastRunAt());
        }
        if (job.lastRunAt() != null && job.lastRunAt().isBefore(now)) {
            return job.lastRunAt();
        }
        return now.minus(tickInterval);
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
