package io.forecast4j.internal;

import io.forecast4j.HistoricalWeatherClient;
import io.forecast4j.core.Device;
import io.forecast4j.core.DeviceRegistry;
import io.forecast4j.core.FetchException;
import io.forecast4j.core.SchedulerJob;
import io.forecast4j.core.SchedulerJobStore;
import io.forecast4j.core.StorageException;
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
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fills missing days of weather history from a {@link HistoricalWeatherClient}, spending only what is left of
 * the daily upstream call budget.
 *
 * <p>Cities are visited in priority order: the first city of every enabled device, then the remaining device
 * cities, then the cities of enabled jobs, then the configured fallback cities. Days are filled newest first,
 * one upstream call per day, in metric units. A run stops as soon as the budget is spent.
 */
public class HistoryBackfill {
    private static final Logger log = LoggerFactory.getLogger(HistoryBackfill.class);

    private final HistoricalWeatherClient client;
    private final WeatherHistoryStore historyStore;
    private final DeviceRegistry deviceRegistry;
    private final SchedulerJobStore jobStore;
    private final UpstreamCallBudget budget;
    private final List<String> fallbackCities;
    private final int maxDays;
    private final Duration callDelay;
    private final Clock clock;

    public HistoryBackfill(HistoricalWeatherClient client,
                           WeatherHistoryStore historyStore,
                           DeviceRegistry deviceRegistry,
                           SchedulerJobStore jobStore,
                           UpstreamCallBudget budget,
                           List<String> fallbackCities,
                           int maxDays,
                           Duration callDelay,
                           Clock clock) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.historyStore = Objects.requireNonNull(historyStore, "historyStore must not be null");
        this.deviceRegistry = Objects.requireNonNull(deviceRegistry, "deviceRegistry must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.fallbackCities = fallbackCities == null ? List.of() : List.copyOf(fallbackCities);
        this.callDelay = callDelay == null ? Duration.ZERO : callDelay;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxDays <= 0) {
            throw new IllegalArgumentException("maxDays must be a positive number");
        }
        this.maxDays = maxDays;
    }

    /**
     * Run one backfill pass.
     *
     * @throws StorageException if devices or jobs cannot be loaded
     */
    public BackfillReport run() {
        if (budget.remaining() == 0) {
            log.info("history backfill skipped, upstream call budget spent used={}", budget.usedToday());
            return new BackfillReport(0, 0, 0, 0, true);
        }

        List<String> cities = cityList(deviceRegistry.findEnabled(), jobStore.findEnabled(), fallbackCities);
        log.info("history backfill starting cities={} maxDays={} budgetRemaining={}", cities.size(), maxDays,
                budget.remaining());

        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        int daysFetched = 0;
        int recordsStored = 0;
        int failures = 0;
        boolean exhausted = false;

        cityLoop:
        for (String city : cities) {
            for (int back = 1; back <= maxDays; back++) {
                LocalDate day = today.minusDays(back);
                if (hasRecords(city, day)) {
                    continue;
                }
                if (!budget.tryAcquire()) {
                    exhausted = true;
                    break cityLoop;
                }

                try {
                    recordsStored += store(city, day, client.fetchDay(city, Units.METRIC, day));
                    daysFetched++;
                } catch (FetchException e) {
                    failures++;
                    log.warn("history backfill fetch failed city={} day={} transient={} msg={}",
                            city, day, e.isTransient(), e.getMessage());
                    if (!e.isTransient()) {
                        continue cityLoop;
                    }
                } catch (StorageException e) {
                    failures++;
                    log.warn("history backfill store failed city={} day={} msg={}", city, day, e.getMessage());
                }

                if (!pause()) {
                    break cityLoop;
                }
            }
        }

        BackfillReport report = new BackfillReport(cities.size(), daysFetched, recordsStored, failures, exhausted);
        log.info("history backfill finished cities={} daysFetched={} recordsStored={} failures={} budgetExhausted={}",
                report.cities(), report.daysFetched(), report.recordsStored(), report.failures(), report.budgetExhausted());
        return report;
    }

    /**
     * Distinct normalized cities in backfill priority order.
     */
    static List<String> cityList(List<Device> devices, List<SchedulerJob> jobs, List<String> fallback) {
        Map<String, Boolean> ordered = new LinkedHashMap<>();
        for (Device device : devices) {
            if (!device.cities().isEmpty()) {
                add(ordered, device.cities().get(0));
            }
        }
        for (Device device : devices) {
            device.cities().forEach(city -> add(ordered, city));
        }
        for (SchedulerJob job : jobs) {
            add(ordered, job.city());
        }
        fallback.forEach(city -> add(ordered, city));
        return new ArrayList<>(ordered.keySet());
    }

    private static void add(Map<String, Boolean> ordered, String city) {
        if (city != null && !city.isBlank()) {
            ordered.putIfAbsent(Cities.normalize(city), Boolean.TRUE);
        }
    }

    private boolean hasRecords(String city, LocalDate day) {
        Instant from = day.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1);
        return historyStore.findFreshest(city, Units.METRIC, from, to).isPresent();
    }

    private int store(String city, LocalDate day, List<WeatherObservation> observations) {
        Instant fetchedAt = clock.instant();
        int stored = 0;
        for (WeatherObservation observation : observations) {
            // the day's key is its timestamp; an observation without one cannot be placed
            if (observation.timestamp() == null) {
                continue;
            }
            historyStore.upsert(WeatherHistoryRecord.from(city, Units.METRIC, observation, fetchedAt));
            stored++;
        }
        log.debug("history backfill day stored city={} day={} records={}", city, day, stored);
        return stored;
    }

    private boolean pause() {
        if (callDelay.isZero() || callDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(callDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("history backfill interrupted");
            return false;
        }
    }
}
