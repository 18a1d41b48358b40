package io.forecast4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A recurring forecast job.
 *
 * <p>The scheduling fields (cron, timezone, city, units, flags, notify config) are owned by the admin API.
 * {@code lastRunAt}, {@code lastStatus}, {@code lastNotified} and {@code lastFailed} are derived state
 * written by the engine after each execution.
 */
public record SchedulerJob(

        // identity
        String id,
        String name,

        // what to fetch
        String city,
        Units units,

        // scheduling
        String cron,
        String timezone,

        // payload shape, passed to devices in the payload data; the fetch is always current conditions
        boolean includeDaily,
        boolean includeHourly,

        boolean enabled,
        NotifyConfig notifyConfig,

        // derived
        Instant lastRunAt,
        JobStatus lastStatus,
        int lastNotified,
        int lastFailed
) {
    public static final String DEFAULT_TIMEZONE = "UTC";

    public SchedulerJob {
        Objects.requireNonNull(id, "id must not be null");
        units = units == null ? Units.METRIC : units;
        timezone = (timezone == null || timezone.isBlank()) ? DEFAULT_TIMEZONE : timezone;
        notifyConfig = notifyConfig == null ? NotifyConfig.defaults() : notifyConfig;
        lastStatus = lastStatus == null ? JobStatus.NEVER_RUN : lastStatus;
    }

    /**
     * Convenience factory for a new, enabled job with default flags.
     */
    public static SchedulerJob of(String id, String name, String city, String cron, String timezone) {
        return new SchedulerJob(id, name, city, Units.METRIC, cron, timezone,
                true, false, true, NotifyConfig.defaults(),
                null, JobStatus.NEVER_RUN, 0, 0);
    }

    public SchedulerJob withEnabled(boolean enabled) {
        return new SchedulerJob(id, name, city, units, cron, timezone, includeDaily, includeHourly,
                enabled, notifyConfig, lastRunAt, lastStatus, lastNotified, lastFailed);
    }

    public SchedulerJob withUnits(Units units) {
        return new SchedulerJob(id, name, city, units, cron, timezone, includeDaily, includeHourly,
                enabled, notifyConfig, lastRunAt, lastStatus, lastNotified, lastFailed);
    }

    public SchedulerJob withNotify(NotifyConfig notifyConfig) {
        return new SchedulerJob(id, name, city, units, cron, timezone, includeDaily, includeHourly,
                enabled, notifyConfig, lastRunAt, lastStatus, lastNotified, lastFailed);
    }

    public SchedulerJob withLastRunAt(Instant lastRunAt) {
        return new SchedulerJob(id, name, city, units, cron, timezone, includeDaily, includeHourly,
                enabled, notifyConfig, lastRunAt, lastStatus, lastNotified, lastFailed);
    }

    public SchedulerJob withSchedule(String cron, String timezone) {
        return new SchedulerJob(id, name, city, units, cron, timezone, includeDaily, includeHourly,
                enabled, notifyConfig, lastRunAt, lastStatus, lastNotified, lastFailed);
    }
}
