package io.forecast4j.internal.mongo;

import io.forecast4j.core.JobStatus;
import io.forecast4j.core.Units;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for forecast jobs. {@code notify} is kept as a plain map.
 */
@Document(collection = "scheduler_jobs")
public class SchedulerJobDocument {

    @Id
    private String id;

    private String name;
    private String city;
    private Units units;
    private String cron;
    private String timezone;
    private boolean includeDaily;
    private boolean includeHourly;
    private boolean enabled;
    private Map<String, Object> notify;
    private Instant lastRunAt;
    private JobStatus lastStatus;
    private int lastNotified;
    private int lastFailed;
    private Instant createdAt;
    private Instant updatedAt;

    public SchedulerJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCity() {
        return city;
    }

    public void setCity(String city) {
        this.city = city;
    }

    public Units getUnits() {
        return units;
    }

    public void setUnits(Units units) {
        this.units = units;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isIncludeDaily() {
        return includeDaily;
    }

    public void setIncludeDaily(boolean includeDaily) {
        this.includeDaily = includeDaily;
    }

    public boolean isIncludeHourly() {
        return includeHourly;
    }

    public void setIncludeHourly(boolean includeHourly) {
        this.includeHourly = includeHourly;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, Object> getNotify() {
        return notify;
    }

    public void setNotify(Map<String, Object> notify) {
        this.notify = notify;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public JobStatus getLastStatus() {
        return lastStatus;
    }

    public void setLastStatus(JobStatus lastStatus) {
        this.lastStatus = lastStatus;
    }

    public int getLastNotified() {
        return lastNotified;
    }

    public void setLastNotified(int lastNotified) {
        this.lastNotified = lastNotified;
    }

    public int getLastFailed() {
        return lastFailed;
    }

    public void setLastFailed(int lastFailed) {
        this.lastFailed = lastFailed;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
