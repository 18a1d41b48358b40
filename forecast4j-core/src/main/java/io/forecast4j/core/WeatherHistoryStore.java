package io.forecast4j.core;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for fetched weather snapshots, unique by (city, timestamp, units).
 */
public interface WeatherHistoryStore {

    /**
     * Insert or overwrite the record stored under the same (city, timestamp, units) key.
     */
    PersistResult upsert(WeatherHistoryRecord record);

    /**
     * Record with the greatest timestamp in {@code [from, to]}.
     */
    Optional<WeatherHistoryRecord> findFreshest(String city, Units units, Instant from, Instant to);

    Optional<WeatherHistoryRecord> findLatest(String city, Units units);

    long deleteOlderThan(Instant cutoff);
}
