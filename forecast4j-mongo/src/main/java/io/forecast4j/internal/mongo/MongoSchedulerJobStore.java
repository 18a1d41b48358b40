package io.forecast4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.forecast4j.core.JobStatus;
import io.forecast4j.core.NotifyConfig;
import io.forecast4j.core.PersistResult;
import io.forecast4j.core.SchedulerJob;
import io.forecast4j.core.SchedulerJobStore;
import io.forecast4j.core.StorageException;
import io.forecast4j.core.ValidationException;
import io.forecast4j.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for forecast jobs ({@code scheduler_jobs} collection).
 *
 * <p>{@link #save(SchedulerJob)} upserts the definition by id and leaves the derived last-run fields alone;
 * those are only written by {@link #recordOutcome}.
 */
public class MongoSchedulerJobStore implements SchedulerJobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoSchedulerJobStore.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoSchedulerJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public List<SchedulerJob> findEnabled() {
        Query q = new Query(Criteria.where("enabled").is(true));
        List<SchedulerJobDocument> docs;
        try {
            docs = mongoTemplate.find(q, SchedulerJobDocument.class);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load enabled jobs: " + e.getMessage(), e);
        }
        List<SchedulerJob> jobs = new ArrayList<>(docs.size());
        for (SchedulerJobDocument doc : docs) {
            jobs.add(toJob(doc));
        }
        return jobs;
    }

    @Override
    public Optional<SchedulerJob> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        try {
            return Optional.ofNullable(mongoTemplate.findById(id, SchedulerJobDocument.class)).map(this::toJob);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load job " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * Validate and persist a job definition.
     *
     * <p>Returns CREATED when no job with this id existed, UPDATED otherwise.
     */
    @Override
    public PersistResult save(SchedulerJob job) {
        Objects.requireNonNull(job, "job must not be null");
        validate(job);

        Instant now = Instant.now();
        Query q = new Query(Criteria.where("_id").is(job.id()));
        Update u = new Update()
                .set("name", job.name().trim())
                .set("city", job.city().trim())
                .set("units", job.units())
                .set("cron", job.cron().trim())
                .set("timezone", job.timezone())
                .set("includeDaily", job.includeDaily())
                .set("includeHourly", job.includeHourly())
                .set("enabled", job.enabled())
                .set("notify", toMap(job.notifyConfig()))
                .set("updatedAt", now)
                .setOnInsert("createdAt", now)
                .setOnInsert("lastStatus", JobStatus.NEVER_RUN)
                .setOnInsert("lastNotified", 0)
                .setOnInsert("lastFailed", 0);

        UpdateResult result;
        try {
            result = mongoTemplate.upsert(q, u, SchedulerJobDocument.class);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to save job " + job.id() + ": " + e.getMessage(), e);
        }
        boolean created = result.getUpsertedId() != null;
        log.info("forecast job saved id={} city={} cron={} timezone={} created={}",
                job.id(), job.city(), job.cron(), job.timezone(), created);
        return created ? PersistResult.createdResult() : PersistResult.updatedResult();
    }

    @Override
    public void recordOutcome(String jobId, Instant lastRunAt, JobStatus status, int notified, int failed) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(lastRunAt, "lastRunAt must not be null");
        // never move lastRunAt backwards
        Query q = new Query(new Criteria().andOperator(
                Criteria.where("_id").is(jobId),
                new Criteria().orOperator(
                        Criteria.where("lastRunAt").is(null),
                        Criteria.where("lastRunAt").lte(lastRunAt))));
        Update u = new Update()
                .set("lastRunAt", lastRunAt)
                .set("lastStatus", status)
                .set("lastNotified", notified)
                .set("lastFailed", failed);
        try {
            UpdateResult r = mongoTemplate.updateFirst(q, u, SchedulerJobDocument.class);
            if (r.getMatchedCount() == 0) {
                log.warn("forecast job outcome not applied, unknown job or newer run recorded id={} lastRunAt={}",
                        jobId, lastRunAt);
            }
        } catch (DataAccessException e) {
            throw new StorageException("Failed to record outcome of job " + jobId + ": " + e.getMessage(), e);
        }
    }

    /**
     * Hard delete a job by id.
     *
     * @return deleted count (0 or 1)
     */
    public long deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        try {
            return mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), SchedulerJobDocument.class)
                    .getDeletedCount();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete job " + id + ": " + e.getMessage(), e);
        }
    }

    SchedulerJob toJob(SchedulerJobDocument doc) {
        NotifyConfig notify = doc.getNotify() == null
                ? NotifyConfig.defaults()
                : objectMapper.convertValue(doc.getNotify(), NotifyConfig.class);
        return new SchedulerJob(
                doc.getId(),
                doc.getName(),
                doc.getCity(),
                doc.getUnits(),
                doc.getCron(),
                doc.getTimezone(),
                doc.isIncludeDaily(),
                doc.isIncludeHourly(),
                doc.isEnabled(),
                notify,
                doc.getLastRunAt(),
                doc.getLastStatus(),
                doc.getLastNotified(),
                doc.getLastFailed()
        );
    }

    private Map<String, Object> toMap(NotifyConfig notify) {
        return objectMapper.convertValue(notify, new TypeReference<>() {
        });
    }

    private static void validate(SchedulerJob job) {
        if (isBlank(job.id())) {
            throw new ValidationException("id", "id must not be blank");
        }
        if (isBlank(job.name())) {
            throw new ValidationException("name", "name must not be blank");
        }
        if (isBlank(job.city())) {
            throw new ValidationException("city", "city must not be blank");
        }
        CronSchedules.validate(job.cron(), job.timezone());
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
