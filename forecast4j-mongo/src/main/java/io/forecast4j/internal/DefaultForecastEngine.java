package io.forecast4j.internal;

import io.forecast4j.ForecastEngine;
import io.forecast4j.config.ForecastProperties;
import io.forecast4j.core.CatchUpPolicy;
import io.forecast4j.core.DueTrigger;
import io.forecast4j.core.ExecutionOutcome;
import io.forecast4j.core.SchedulerJob;
import io.forecast4j.core.SchedulerJobStore;
import io.forecast4j.core.WeatherHistoryStore;
import io.forecast4j.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ForecastEngine} driven by a single ticking thread.
 *
 * <p>Each tick asks the {@link CronScheduler} for due triggers and hands them to a fixed worker pool, one
 * execution per job at a time. The driver loop survives any failure, backing off exponentially while failures
 * repeat. When a {@link HistoryBackfill} is configured it runs on its own thread whenever the backfill cron
 * fires.
 */
public class DefaultForecastEngine implements ForecastEngine {
    private static final Logger log = LoggerFactory.getLogger(DefaultForecastEngine.class);

    private final ForecastProperties props;
    private final CronScheduler scheduler;
    private final JobExecutor executor;
    private final SchedulerJobStore jobStore;
    private final WeatherHistoryStore historyStore;
    private final Clock clock;
    private final HistoryBackfill backfill;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile ExecutorService workerPool;
    private volatile Thread driverThread;
    private int systemErrorCount = 0;
    private volatile Instant lastPurgeAt;

    private volatile ExecutorService backfillPool;
    private final AtomicBoolean backfillRunning = new AtomicBoolean(false);
    private volatile Instant nextBackfillAt;

    // job id -> triggers waiting for that job's running execution; a key is present while the job is in flight
    private final ConcurrentHashMap<String, Deque<DueTrigger>> inFlight = new ConcurrentHashMap<>();

    public DefaultForecastEngine(ForecastProperties props,
                                 CronScheduler scheduler,
                                 JobExecutor executor,
                                 SchedulerJobStore jobStore,
                                 WeatherHistoryStore historyStore,
                                 Clock clock) {
        this(props, scheduler, executor, jobStore, historyStore, null, clock);
    }

    /**
     * @param backfill history backfill run on {@code forecast.backfillCron}, or null to never backfill
     */
    public DefaultForecastEngine(ForecastProperties props,
                                 CronScheduler scheduler,
                                 JobExecutor executor,
                                 SchedulerJobStore jobStore,
                                 WeatherHistoryStore historyStore,
                                 HistoryBackfill backfill,
                                 Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.backfill = backfill;
    }

    /**
     * Start ticking. Idempotent.
     */
    @Override
    public synchronized void start() {
        if (started.get()) {
            return;
        }

        requirePositive(props.getTickInterval(), "forecast.tickInterval");
        requirePositive(props.getShutdownGracePeriod(), "forecast.shutdownGracePeriod");
        if (props.getMaxConcurrentExecutions() <= 0) {
            throw new IllegalArgumentException("forecast.maxConcurrentExecutions must be a positive number");
        }
        if (backfill != null) {
            CronSchedules.validate(props.getBackfillCron(), "UTC");
        }

        log.info("Forecast engine starting with tickInterval={}, jobRefreshInterval={}, maxConcurrentExecutions={}, catchUpPolicy={}",
                props.getTickInterval(),
                props.getJobRefreshInterval(),
                props.getMaxConcurrentExecutions(),
                props.getCatchUpPolicy());

        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrentExecutions(), r -> {
            Thread t = new Thread(r);
            t.setName("forecast.worker");
            t.setDaemon(true);
            return t;
        });

        if (backfill != null) {
            backfillPool = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r);
                t.setName("forecast.backfill");
                t.setDaemon(true);
                return t;
            });
            nextBackfillAt = CronSchedules.nextFireTime(props.getBackfillCron(), "UTC", clock.instant());
            log.info("history backfill scheduled cron={} next={}", props.getBackfillCron(), nextBackfillAt);
        }

        started.set(true);
        systemErrorCount = 0;

        Thread driver = new Thread(this::driverLoop);
        driver.setName("forecast.driver");
        driver.setDaemon(true);
        driverThread = driver;
        driver.start();
        log.info("Forecast engine started successfully.");
    }

    /**
     * Stop ticking and drain in-flight executions for up to the grace period. Idempotent.
     */
    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Forecast engine stopping...");

        Thread driver = driverThread;
        if (driver != null) {
            driver.interrupt();
            driverThread = null;
        }

        ExecutorService pool = workerPool;
        if (pool != null) {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(props.getShutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                    List<Runnable> pending = pool.shutdownNow();
                    log.warn("Forecast engine abandoned executions after gracePeriod={} queued={}",
                            props.getShutdownGracePeriod(), pending.size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }
        inFlight.clear();

        ExecutorService backfills = backfillPool;
        if (backfills != null) {
            // a backfill only fills gaps, so it is interrupted rather than drained
            backfills.shutdownNow();
            backfillPool = null;
        }
        log.info("Forecast engine stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public ExecutionOutcome triggerNow(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        SchedulerJob job = jobStore.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown forecast job: " + jobId));
        if (!job.enabled()) {
            throw new IllegalStateException("Forecast job is disabled: " + jobId);
        }
        log.info("forecast job triggered manually id={}", jobId);
        return executor.execute(new DueTrigger(job, clock.instant()));
    }

    @Override
    public Optional<ExecutionOutcome> lastOutcome(String jobId) {
        return executor.lastOutcome(jobId);
    }

    /**
     * One driver pass: dispatch due triggers and purge expired history.
     *
     * <p>A job occupies at most one worker. Triggers of a job that is still running wait for it to finish
     * instead of queueing on the pool.
     *
     * @return number of triggers handed to the worker pool
     */
    int tickOnce() {
        Instant now = clock.instant();
        List<DueTrigger> due = scheduler.tick(now);

        int submitted = 0;
        ExecutorService pool = workerPool;
        for (DueTrigger trigger : due) {
            if (pool == null) {
                break;
            }
            if (claim(trigger) && dispatch(pool, trigger)) {
                submitted++;
            }
        }

        purgeHistoryIfDue(now);
        startBackfillIfDue(now);
        return submitted;
    }

    /**
     * Mark the trigger's job as in flight, or park the trigger behind the running execution.
     *
     * @return true if the caller must dispatch the trigger
     */
    private boolean claim(DueTrigger trigger) {
        boolean[] claimed = {false};
        inFlight.compute(trigger.job().id(), (id, waiting) -> {
            if (waiting == null) {
                claimed[0] = true;
                return new ArrayDeque<>();
            }
            waiting.addLast(trigger);
            while (waiting.size() > waitingLimit()) {
                waiting.removeFirst();
            }
            return waiting;
        });
        if (!claimed[0]) {
            log.debug("forecast job still running, trigger deferred id={} dueAt={}", trigger.job().id(), trigger.dueAt());
        }
        return claimed[0];
    }

    private boolean dispatch(ExecutorService pool, DueTrigger trigger) {
        try {
            pool.execute(() -> runAndRelease(trigger));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(trigger.job().id());
            log.warn("forecast job not dispatched, engine stopping id={} dueAt={}", trigger.job().id(), trigger.dueAt());
            return false;
        }
    }

    private void runAndRelease(DueTrigger trigger) {
        String jobId = trigger.job().id();
        try {
            runSafely(trigger);
        } finally {
            DueTrigger next = nextWaiting(jobId);
            if (next != null) {
                ExecutorService pool = workerPool;
                if (pool == null) {
                    inFlight.remove(jobId);
                } else {
                    dispatch(pool, next);
                }
            }
        }
    }

    // pops the next parked trigger, or clears the in-flight mark when none is left
    private DueTrigger nextWaiting(String jobId) {
        DueTrigger[] next = {null};
        inFlight.computeIfPresent(jobId, (id, waiting) -> {
            next[0] = waiting.pollFirst();
            return next[0] == null ? null : waiting;
        });
        return next[0];
    }

    private int waitingLimit() {
        return props.getCatchUpPolicy() == CatchUpPolicy.LATEST_ONLY ? 1 : Math.max(1, props.getMaxMissedRuns());
    }

    private void driverLoop() {
        while (started.get()) {
            try {
                tickOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("forecast tick failed errors={} msg={}", systemErrorCount, e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(props.getTickInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void runSafely(DueTrigger trigger) {
        try {
            executor.execute(trigger);
        } catch (Exception e) {
            log.error("forecast execution escaped id={} msg={}", trigger.job().id(), e.getMessage(), e);
        }
    }

    private void purgeHistoryIfDue(Instant now) {
        Duration retention = props.getHistoryRetention();
        if (retention == null || retention.isZero() || retention.isNegative()) {
            return;
        }
        Instant last = lastPurgeAt;
        if (last != null && now.isBefore(last.plus(Duration.ofDays(1)))) {
            return;
        }
        lastPurgeAt = now;
        Instant cutoff = now.minus(retention);
        try {
            long deleted = historyStore.deleteOlderThan(cutoff);
            log.info("weather history purged cutoff={} deleted={}", cutoff, deleted);
        } catch (RuntimeException e) {
            log.error("weather history purge failed cutoff={} msg={}", cutoff, e.getMessage(), e);
        }
    }

    /**
     * Hand a backfill run to its own thread when the backfill cron has fired. A run still in progress
     * absorbs the fire.
     */
    private void startBackfillIfDue(Instant now) {
        ExecutorService pool = backfillPool;
        Instant next = nextBackfillAt;
        if (pool == null || next == null || now.isBefore(next)) {
            return;
        }
        nextBackfillAt = CronSchedules.nextFireTime(props.getBackfillCron(), "UTC", now);
        if (!backfillRunning.compareAndSet(false, true)) {
            log.info("history backfill still running, fire skipped dueAt={}", next);
            return;
        }
        try {
            pool.execute(this::runBackfill);
        } catch (RejectedExecutionException e) {
            backfillRunning.set(false);
            log.warn("history backfill not started, engine stopping dueAt={}", next);
        }
    }

    private void runBackfill() {
        try {
            backfill.run();
        } catch (RuntimeException e) {
            log.error("history backfill failed msg={}", e.getMessage(), e);
        } finally {
            backfillRunning.set(false);
        }
    }

    // Exponential backoff for repeated tick failures.
    private static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
