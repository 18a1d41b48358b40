package io.forecast4j.config;

import io.forecast4j.internal.mongo.DeviceDocument;
import io.forecast4j.internal.mongo.SchedulerJobDocument;
import io.forecast4j.internal.mongo.WeatherHistoryDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the forecast collections.
 *
 * <p>Indexes are not created at startup unless {@code forecast.ensure-indexes-on-startup=true};
 * production setups usually manage them with migrations.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>ux_devices_token</b> (unique): {@code devices { token: 1 }}</li>
 *   <li><b>idx_devices_enabled_cities</b>: {@code devices { enabled: 1, cities: 1 }}</li>
 *   <li><b>idx_jobs_enabled</b>: {@code scheduler_jobs { enabled: 1 }}</li>
 *   <li><b>ux_history_city_ts_units</b> (unique): {@code weather_history { city: 1, timestamp: 1, units: 1 }}
 *       <br/>Backs the idempotent upsert of weather snapshots.</li>
 *   <li><b>idx_history_city_units_ts</b>: {@code weather_history { city: 1, units: 1, timestamp: -1 }}
 *       <br/>Used by the cache lookup of the freshest record.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.devices.createIndex({ token: 1 }, { name: "ux_devices_token", unique: true });
 * db.devices.createIndex({ enabled: 1, cities: 1 }, { name: "idx_devices_enabled_cities" });
 * db.scheduler_jobs.createIndex({ enabled: 1 }, { name: "idx_jobs_enabled" });
 * db.weather_history.createIndex({ city: 1, timestamp: 1, units: 1 }, { name: "ux_history_city_ts_units", unique: true });
 * db.weather_history.createIndex({ city: 1, units: 1, timestamp: -1 }, { name: "idx_history_city_units_ts" });
 * </pre>
 */
public class ForecastMongoIndexConfig {

    public static final String UX_DEVICES_TOKEN = "ux_devices_token";
    public static final String IDX_DEVICES_ENABLED_CITIES = "idx_devices_enabled_cities";
    public static final String IDX_JOBS_ENABLED = "idx_jobs_enabled";
    public static final String UX_HISTORY_CITY_TS_UNITS = "ux_history_city_ts_units";
    public static final String IDX_HISTORY_CITY_UNITS_TS = "idx_history_city_units_ts";

    private final MongoTemplate mongoTemplate;

    public ForecastMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(DeviceDocument.class).ensureIndex(deviceTokenUniqueIndex());
        mongoTemplate.indexOps(DeviceDocument.class).ensureIndex(deviceEnabledCitiesIndex());
        mongoTemplate.indexOps(SchedulerJobDocument.class).ensureIndex(jobEnabledIndex());
        mongoTemplate.indexOps(WeatherHistoryDocument.class).ensureIndex(historyKeyUniqueIndex());
        mongoTemplate.indexOps(WeatherHistoryDocument.class).ensureIndex(historyLookupIndex());
    }

    public static Index deviceTokenUniqueIndex() {
        return new Index()
                .on("token", Sort.Direction.ASC)
                .unique()
                .named(UX_DEVICES_TOKEN);
    }

    public static Index deviceEnabledCitiesIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("cities", Sort.Direction.ASC)
                .named(IDX_DEVICES_ENABLED_CITIES);
    }

    public static Index jobEnabledIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .named(IDX_JOBS_ENABLED);
    }

    public static Index historyKeyUniqueIndex() {
        return new Index()
                .on("city", Sort.Direction.ASC)
                .on("timestamp", Sort.Direction.ASC)
                .on("units", Sort.Direction.ASC)
                .unique()
                .named(UX_HISTORY_CITY_TS_UNITS);
    }

    public static Index historyLookupIndex() {
        return new Index()
                .on("city", Sort.Direction.ASC)
                .on("units", Sort.Direction.ASC)
                .on("timestamp", Sort.Direction.DESC)
                .named(IDX_HISTORY_CITY_UNITS_TS);
    }
}
