package io.forecast4j.internal;

import io.forecast4j.WeatherProviderClient;
import io.forecast4j.core.FetchException;
import io.forecast4j.core.Units;
import io.forecast4j.core.WeatherHistoryRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeatherCacheTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryWeatherHistoryStore store = new InMemoryWeatherHistoryStore();

    @Test
    void concurrentMissesShouldCallProviderOnce() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        WeatherProviderClient provider = (city, units) -> {
            calls.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TestRecords.observation(city, NOW.minusSeconds(60), 18.0, "clear sky");
        };
        WeatherCache cache = newCache(provider, Duration.ofMinutes(30), false);

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch ready = new CountDownLatch(callers);
        List<Future<WeatherHistoryRecord>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(pool.submit(() -> {
                ready.countDown();
                return cache.getOrFetch("Paris", Units.METRIC, NOW);
            }));
        }
        ready.await(5, TimeUnit.SECONDS);
        while (calls.get() == 0) {
            Thread.onSpinWait();
        }
        release.countDown();

        WeatherHistoryRecord first = results.get(0).get(5, TimeUnit.SECONDS);
        for (Future<WeatherHistoryRecord> f : results) {
            assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo(first);
        }
        pool.shutdown();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(store.records).hasSize(1);
        assertThat(cache.inFlightCount()).isZero();
    }

    @Test
    void recordWithinStalenessWindowShouldBeReused() {
        store.upsert(TestRecords.record("paris", Units.METRIC, NOW.minus(Duration.ofMinutes(10)), 15.0));
        AtomicInteger calls = new AtomicInteger();
        WeatherCache cache = newCache(countingProvider(calls), Duration.ofMinutes(30), false);

        WeatherHistoryRecord record = cache.getOrFetch("  PARIS ", Units.METRIC, NOW);

        assertThat(record.temperature()).isEqualTo(15.0);
        assertThat(calls.get()).isZero();
    }

    @Test
    void staleRecordShouldTriggerFetch() {
        store.upsert(TestRecords.record("paris", Units.METRIC, NOW.minus(Duration.ofHours(2)), 15.0));
        AtomicInteger calls = new AtomicInteger();
        WeatherCache cache = newCache(countingProvider(calls), Duration.ofMinutes(30), false);

        WeatherHistoryRecord record = cache.getOrFetch("Paris", Units.METRIC, NOW);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(record.temperature()).isEqualTo(21.0);
        assertThat(record.city()).isEqualTo("paris");
        assertThat(record.fetchedAt()).isEqualTo(NOW);
        assertThat(store.records).hasSize(2);
    }

    @Test
    void unitsShouldBePartOfTheKey() {
        store.upsert(TestRecords.record("paris", Units.METRIC, NOW.minusSeconds(30), 15.0));
        AtomicInteger calls = new AtomicInteger();
        WeatherCache cache = newCache(countingProvider(calls), Duration.ofMinutes(30), false);

        cache.getOrFetch("Paris", Units.IMPERIAL, NOW);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void failureShouldPropagateWithoutServeStale() {
        store.upsert(TestRecords.record("paris", Units.METRIC, NOW.minus(Duration.ofHours(3)), 11.0));
        WeatherCache cache = newCache((city, units) -> {
            throw FetchException.transientFailure("upstream 503");
        }, Duration.ofMinutes(30), false);

        assertThatThrownBy(() -> cache.getOrFetch("Paris", Units.METRIC, NOW))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("503");
        assertThat(cache.inFlightCount()).isZero();
    }

    @Test
    void serveStaleShouldReturnLatestRecordOnFailure() {
        store.upsert(TestRecords.record("paris", Units.METRIC, NOW.minus(Duration.ofHours(3)), 11.0));
        WeatherCache cache = newCache((city, units) -> {
            throw FetchException.transientFailure("upstream 503");
        }, Duration.ofMinutes(30), true);

        WeatherHistoryRecord record = cache.getOrFetch("Paris", Units.METRIC, NOW);

        assertThat(record.temperature()).isEqualTo(11.0);
    }

    @Test
    void unexpectedProviderErrorShouldBecomeTransientFetchFailure() {
        WeatherCache cache = newCache((city, units) -> {
            throw new IllegalStateException("socket closed");
        }, Duration.ofMinutes(30), false);

        assertThatThrownBy(() -> cache.getOrFetch("Paris", Units.METRIC, NOW))
                .isInstanceOfSatisfying(FetchException.class, e -> assertThat(e.isTransient()).isTrue());
    }

    @Test
    void exhaustedBudgetShouldFailWithoutCallingProvider() {
        AtomicInteger calls = new AtomicInteger();
        UpstreamCallBudget budget = new UpstreamCallBudget(1, clock);
        WeatherCache cache = new WeatherCache(store, countingProvider(calls), budget, Duration.ofMinutes(30), false, clock);

        cache.getOrFetch("Paris", Units.METRIC, NOW);
        assertThatThrownBy(() -> cache.getOrFetch("Lyon", Units.METRIC, NOW))
                .isInstanceOfSatisfying(FetchException.class, e -> assertThat(e.isTransient()).isTrue());

        assertThat(calls.get()).isEqualTo(1);
    }

    private WeatherCache newCache(WeatherProviderClient provider, Duration window, boolean serveStale) {
        return new WeatherCache(store, provider, UpstreamCallBudget.unlimited(clock), window, serveStale, clock);
    }

    private static WeatherProviderClient countingProvider(AtomicInteger calls) {
        return (city, units) -> {
            calls.incrementAndGet();
            return TestRecords.observation(city, NOW.minusSeconds(120), 21.0, "few clouds");
        };
    }
}
