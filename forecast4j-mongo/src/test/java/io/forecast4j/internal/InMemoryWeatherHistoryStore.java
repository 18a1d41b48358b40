package io.forecast4j.internal;

import io.forecast4j.core.PersistResult;
import io.forecast4j.core.Units;
import io.forecast4j.core.WeatherHistoryRecord;
import io.forecast4j.core.WeatherHistoryStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

final class InMemoryWeatherHistoryStore implements WeatherHistoryStore {

    record Key(String city, Instant timestamp, Units units) {
    }

    final Map<Key, WeatherHistoryRecord> records = new ConcurrentHashMap<>();

    @Override
    public PersistResult upsert(WeatherHistoryRecord record) {
        WeatherHistoryRecord previous = records.put(new Key(record.city(), record.timestamp(), record.units()), record);
        return previous == null ? PersistResult.createdResult() : PersistResult.updatedResult();
    }

    @Override
    public Optional<WeatherHistoryRecord> findFreshest(String city, Units units, Instant from, Instant to) {
        return records.values().stream()
                .filter(r -> r.city().equals(city) && r.units() == units)
                .filter(r -> !r.timestamp().isBefore(from) && !r.timestamp().isAfter(to))
                .max(Comparator.comparing(WeatherHistoryRecord::timestamp));
    }

    @Override
    public Optional<WeatherHistoryRecord> findLatest(String city, Units units) {
        return records.values().stream()
                .filter(r -> r.city().equals(city) && r.units() == units)
                .max(Comparator.comparing(WeatherHistoryRecord::timestamp));
    }

    @Override
    public long deleteOlderThan(Instant cutoff) {
        List<Key> old = records.keySet().stream().filter(k -> k.timestamp().isBefore(cutoff)).toList();
        old.forEach(records::remove);
        return old.size();
    }
}
