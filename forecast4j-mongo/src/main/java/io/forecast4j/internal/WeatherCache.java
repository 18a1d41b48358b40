package io.forecast4j.internal;

import io.forecast4j.WeatherProviderClient;
import io.forecast4j.core.FetchException;
import io.forecast4j.core.Units;
import io.forecast4j.core.WeatherHistoryRecord;
import io.forecast4j.core.WeatherHistoryStore;
import io.forecast4j.core.WeatherObservation;
import io.forecast4j.utils.Cities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-through cache of weather snapshots backed by {@link WeatherHistoryStore}.
 *
 * <p>Concurrent misses for the same (city, units) key are single-flighted: the first caller fetches from the
 * provider, later callers attach to its in-flight handle and get the same record or the same failure.
 * The handle is dropped once the fetch settles, so the next miss after the staleness window fetches again.
 */
public class WeatherCache {
    private static final Logger log = LoggerFactory.getLogger(WeatherCache.class);

    private final WeatherHistoryStore store;
    private final WeatherProviderClient provider;
    private final UpstreamCallBudget budget;
    private final Duration stalenessWindow;
    private final boolean serveStaleOnError;
    private final Clock clock;

    private final ConcurrentHashMap<CacheKey, CompletableFuture<WeatherHistoryRecord>> inFlight = new ConcurrentHashMap<>();

    record CacheKey(String city, Units units) {
    }

    public WeatherCache(WeatherHistoryStore store,
                        WeatherProviderClient provider,
                        UpstreamCallBudget budget,
                        Duration stalenessWindow,
                        boolean serveStaleOnError,
                        Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.stalenessWindow = Objects.requireNonNull(stalenessWindow, "stalenessWindow must not be null");
        this.serveStaleOnError = serveStaleOnError;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (stalenessWindow.isNegative()) {
            throw new IllegalArgumentException("stalenessWindow must not be negative");
        }
    }

    /**
     * Return a record for (city, units) no further than the staleness window from {@code asOf},
     * fetching from the provider on a miss.
     *
     * @throws FetchException                          if the provider fails (and no stale record may be served)
     * @throws io.forecast4j.core.StorageException     if the history store fails
     */
    public WeatherHistoryRecord getOrFetch(String city, Units units, Instant asOf) {
        Objects.requireNonNull(units, "units must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        CacheKey key = new CacheKey(Cities.normalize(city), units);

        Optional<WeatherHistoryRecord> cached = lookup(key, asOf);
        if (cached.isPresent()) {
            log.debug("weather cache hit city={} units={} timestamp={}", key.city(), key.units(), cached.get().timestamp());
            return cached.get();
        }

        CompletableFuture<WeatherHistoryRecord> mine = new CompletableFuture<>();
        CompletableFuture<WeatherHistoryRecord> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("weather fetch already in flight, joining city={} units={}", key.city(), key.units());
            return await(existing);
        }

        try {
            // a fetch that settled between the lookup above and putIfAbsent has already been stored
            WeatherHistoryRecord record = lookup(key, asOf).orElse(null);
            if (record == null) {
                record = fetchOrServeStale(key);
            }
            mine.complete(record);
            return record;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Number of keys with a fetch currently in flight.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private Optional<WeatherHistoryRecord> lookup(CacheKey key, Instant asOf) {
        return store.findFreshest(key.city(), key.units(), asOf.minus(stalenessWindow), asOf.plus(stalenessWindow));
    }

    private WeatherHistoryRecord fetchOrServeStale(CacheKey key) {
        try {
            return fetchAndStore(key);
        } catch (FetchException e) {
            if (!serveStaleOnError) {
                throw e;
            }
            Optional<WeatherHistoryRecord> stale = store.findLatest(key.city(), key.units());
            if (stale.isEmpty()) {
                throw e;
            }
            log.warn("weather fetch failed, serving stale record city={} units={} timestamp={} msg={}",
                    key.city(), key.units(), stale.get().timestamp(), e.getMessage());
            return stale.get();
        }
    }

    private WeatherHistoryRecord fetchAndStore(CacheKey key) {
        if (!budget.tryAcquire()) {
            throw FetchException.transientFailure("Daily upstream call budget exhausted (limit=" + budget.dailyLimit() + ")");
        }

        WeatherObservation observation;
        try {
            observation = provider.fetch(key.city(), key.units());
        } catch (FetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw FetchException.transientFailure("Weather provider failed: " + e.getMessage(), e);
        }
        if (observation == null) {
            throw FetchException.transientFailure("Weather provider returned no data for " + key.city());
        }

        WeatherHistoryRecord record = WeatherHistoryRecord.from(key.city(), key.units(), observation, clock.instant());
        store.upsert(record);
        log.debug("weather fetched city={} units={} timestamp={} temperature={}",
                key.city(), key.units(), record.timestamp(), record.temperature());
        return record;
    }

    private static WeatherHistoryRecord await(CompletableFuture<WeatherHistoryRecord> handle) {
        try {
            return handle.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
}
