package io.forecast4j;

import io.forecast4j.core.ExecutionOutcome;

import java.util.Optional;

/**
 * Main engine API.
 *
 * <p>Once started, the engine ticks on a fixed interval, fires the enabled jobs whose cron schedule is due,
 * fetches weather for each job's city (through the cache) and pushes a notification to every enabled device
 * subscribed to that city.
 *
 * <p>Typical usage:
 * <pre>{@code
 * engine.start();
 * jobStore.save(SchedulerJob.of("paris-hourly", "Paris hourly", "Paris", "0 * * * *", "Europe/Paris"));
 * ExecutionOutcome outcome = engine.triggerNow("paris-hourly");
 * engine.stop();
 * }</pre>
 */
public interface ForecastEngine {
    void start();

    /**
     * Stop ticking and drain in-flight executions up to the configured grace period.
     */
    void stop();

    boolean isRunning();

    /**
     * Run a stored job immediately, outside its cron schedule. Blocks until the execution finishes.
     *
     * @throws IllegalArgumentException if no job with this id exists
     */
    ExecutionOutcome triggerNow(String jobId);

    /**
     * Latest outcome observed by this process for a job.
     */
    Optional<ExecutionOutcome> lastOutcome(String jobId);
}
