package io.forecast4j.internal.mongo;

import io.forecast4j.core.PersistResult;
import io.forecast4j.core.StorageException;
import io.forecast4j.core.Units;
import io.forecast4j.core.WeatherHistoryRecord;
import io.forecast4j.core.WeatherHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Weather snapshots in the {@code weather_history} collection.
 *
 * <p>Writes are upserts on (city, timestamp, units), so storing the same observation twice leaves one document
 * with the later fetch time.
 */
public class MongoWeatherHistoryStore implements WeatherHistoryStore {
    private static final Logger log = LoggerFactory.getLogger(MongoWeatherHistoryStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoWeatherHistoryStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public PersistResult upsert(WeatherHistoryRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Query q = keyQuery(record.city(), record.timestamp(), record.units());
        Update u = toUpdate(record);
        try {
            return doUpsert(q, u);
        } catch (DuplicateKeyException e) {
            // two concurrent upserts raced on the unique index; the loser becomes an update
            log.debug("weather history upsert raced, retrying city={} timestamp={}", record.city(), record.timestamp());
            try {
                return doUpsert(q, u);
            } catch (DataAccessException retryError) {
                throw new StorageException("Failed to store weather record: " + retryError.getMessage(), retryError);
            }
        } catch (DataAccessException e) {
            throw new StorageException("Failed to store weather record: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<WeatherHistoryRecord> findFreshest(String city, Units units, Instant from, Instant to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Query q = new Query(Criteria.where("city").is(city)
                .and("units").is(units)
                .and("timestamp").gte(from).lte(to));
        return findFirstByTimestampDesc(q);
    }

    @Override
    public Optional<WeatherHistoryRecord> findLatest(String city, Units units) {
        Query q = new Query(Criteria.where("city").is(city).and("units").is(units));
        return findFirstByTimestampDesc(q);
    }

    @Override
    public long deleteOlderThan(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        try {
            return mongoTemplate.remove(new Query(Criteria.where("timestamp").lt(cutoff)), WeatherHistoryDocument.class)
                    .getDeletedCount();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to purge weather history: " + e.getMessage(), e);
        }
    }

    private PersistResult doUpsert(Query q, Update u) {
        return mongoTemplate.upsert(q, u, WeatherHistoryDocument.class).getUpsertedId() != null
                ? PersistResult.createdResult()
                : PersistResult.updatedResult();
    }

    private Optional<WeatherHistoryRecord> findFirstByTimestampDesc(Query q) {
        q.with(Sort.by(Sort.Order.desc("timestamp"))).limit(1);
        try {
            return Optional.ofNullable(mongoTemplate.findOne(q, WeatherHistoryDocument.class))
                    .map(MongoWeatherHistoryStore::toRecord);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read weather history: " + e.getMessage(), e);
        }
    }

    // Mongo dates keep milliseconds only
    private static Query keyQuery(String city, Instant timestamp, Units units) {
        return new Query(Criteria.where("city").is(city)
                .and("timestamp").is(timestamp.truncatedTo(ChronoUnit.MILLIS))
                .and("units").is(units));
    }

    private static Update toUpdate(WeatherHistoryRecord r) {
        return new Update()
                .set("lat", r.lat())
                .set("lon", r.lon())
                .set("temperature", r.temperature())
                .set("feelsLike", r.feelsLike())
                .set("humidity", r.humidity())
                .set("pressure", r.pressure())
                .set("windSpeed", r.windSpeed())
                .set("windDirection", r.windDirection())
                .set("clouds", r.clouds())
                .set("visibility", r.visibility())
                .set("description", r.description())
                .set("icon", r.icon())
                .set("rain1h", r.rain1h())
                .set("snow1h", r.snow1h())
                .set("fetchedAt", r.fetchedAt());
    }

    private static WeatherHistoryRecord toRecord(WeatherHistoryDocument d) {
        return new WeatherHistoryRecord(
                d.getCity(),
                d.getLat(),
                d.getLon(),
                d.getTimestamp(),
                d.getTemperature(),
                d.getFeelsLike(),
                d.getHumidity(),
                d.getPressure(),
                d.getWindSpeed(),
                d.getWindDirection(),
                d.getClouds(),
                d.getVisibility(),
                d.getDescription(),
                d.getIcon(),
                d.getRain1h(),
                d.getSnow1h(),
                d.getUnits(),
                d.getFetchedAt()
        );
    }
}
