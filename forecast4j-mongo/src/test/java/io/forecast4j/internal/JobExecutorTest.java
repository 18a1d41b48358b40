package io.forecast4j.internal;

import io.forecast4j.PushDeliveryClient;
import io.forecast4j.WeatherProviderClient;
import io.forecast4j.core.DeliveryResult;
import io.forecast4j.core.Device;
import io.forecast4j.core.DeviceRegistry;
import io.forecast4j.core.DueTrigger;
import io.forecast4j.core.ExecutionOutcome;
import io.forecast4j.core.ExecutionState;
import io.forecast4j.core.FailureReason;
import io.forecast4j.core.FetchException;
import io.forecast4j.core.JobStatus;
import io.forecast4j.core.NotifyConfig;
import io.forecast4j.core.PushServiceUnavailableException;
import io.forecast4j.core.SchedulerJob;
import io.forecast4j.core.SchedulerJobStore;
import io.forecast4j.core.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.forecast4j.internal.InMemoryDeviceRegistry.device;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class JobExecutorTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryWeatherHistoryStore historyStore = new InMemoryWeatherHistoryStore();
    private final InMemorySchedulerJobStore jobStore = new InMemorySchedulerJobStore();
    private final InMemoryDeviceRegistry registry = new InMemoryDeviceRegistry();
    private final JobExecutionLocks locks = new JobExecutionLocks();

    private final AtomicInteger providerCalls = new AtomicInteger();
    private final List<String> sentTokens = new CopyOnWriteArrayList<>();
    private NotificationFanout fanout;

    private final SchedulerJob job = SchedulerJob.of("paris", "Paris hourly", "Paris", "0 * * * *", "Europe/Paris");

    @AfterEach
    void tearDown() {
        if (fanout != null) {
            fanout.close();
        }
    }

    @Test
    void partialDeliveryFailureShouldStillComplete() {
        registry.add(device("ok-1", true, "Paris"))
                .add(device("bad-1", true, "Paris"))
                .add(device("ok-2", true, "paris"))
                .add(device("bad-2", true, "Paris"))
                .add(device("bad-3", true, "PARIS"));
        JobExecutor executor = newExecutor(healthyProvider(), (token, platform, payload) -> {
            sentTokens.add(token);
            return token.startsWith("ok") ? DeliveryResult.OK : DeliveryResult.PERMANENT_FAILURE;
        });

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(outcome.state()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(outcome.notified()).isEqualTo(2);
        assertThat(outcome.failed()).isEqualTo(3);
        assertThat(outcome.permanentlyFailedTokens()).hasSize(3);
        assertThat(jobStore.outcomes).containsExactly(
                new InMemorySchedulerJobStore.RecordedOutcome("paris", NOW, JobStatus.COMPLETED, 2, 3));
        assertThat(executor.lastOutcome("paris")).contains(outcome);
    }

    @Test
    void permanentFetchFailureShouldFailWithoutRetry() {
        registry.add(device("ok-1", true, "Paris"));
        JobExecutor executor = newExecutor((city, units) -> {
            providerCalls.incrementAndGet();
            throw FetchException.permanentFailure("city not found");
        }, recordingClient());

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(outcome.state()).isEqualTo(ExecutionState.FAILED);
        assertThat(outcome.failureReason()).isEqualTo(FailureReason.UPSTREAM_FETCH_FAILED);
        assertThat(outcome.fetchAttempts()).isEqualTo(1);
        assertThat(providerCalls.get()).isEqualTo(1);
        assertThat(sentTokens).isEmpty();
        assertThat(jobStore.outcomes).extracting(InMemorySchedulerJobStore.RecordedOutcome::status)
                .containsExactly(JobStatus.FAILED);
    }

    @Test
    void transientFetchFailureShouldBeRetried() {
        registry.add(device("ok-1", true, "Paris"));
        JobExecutor executor = newExecutor((city, units) -> {
            if (providerCalls.incrementAndGet() < 3) {
                throw FetchException.transientFailure("timeout");
            }
            return TestRecords.observation(city, NOW, 17.0, "clear sky");
        }, recordingClient());

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.fetchAttempts()).isEqualTo(3);
        assertThat(sentTokens).containsExactly("ok-1");
    }

    @Test
    void exhaustedFetchRetriesShouldFail() {
        JobExecutor executor = newExecutor((city, units) -> {
            providerCalls.incrementAndGet();
            throw FetchException.transientFailure("timeout");
        }, recordingClient());

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(outcome.failureReason()).isEqualTo(FailureReason.UPSTREAM_FETCH_FAILED);
        assertThat(providerCalls.get()).isEqualTo(3);
    }

    @Test
    void onlyEnabledSubscribersShouldBeNotified() {
        registry.add(device("paris-on", true, "Lyon", " paris "))
                .add(device("paris-off", false, "Paris"))
                .add(device("lyon-on", true, "Lyon"))
                .add(device("partial-match", true, "Paris, TX"));
        JobExecutor executor = newExecutor(healthyProvider(), recordingClient());

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(sentTokens).containsExactly("paris-on");
        assertThat(outcome.notified()).isEqualTo(1);
        assertThat(outcome.failed()).isZero();
    }

    @Test
    void emptyTargetSetShouldCompleteWithZeroNotifications() {
        registry.add(device("lyon-on", true, "Lyon"));
        JobExecutor executor = newExecutor(healthyProvider(), recordingClient());

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(outcome.state()).isEqualTo(ExecutionState.COMPLETED);
        assertThat(outcome.notified()).isZero();
        assertThat(outcome.failed()).isZero();
        assertThat(providerCalls.get()).isEqualTo(1);
        assertThat(sentTokens).isEmpty();
    }

    @Test
    void unremarkableWeatherShouldBeSuppressedWhenOnRunIsOff() {
        registry.add(device("ok-1", true, "Paris"));
        SchedulerJob quiet = job.withNotify(new NotifyConfig(false, true, true, -5.0, 35.0));
        JobExecutor executor = newExecutor(healthyProvider(), recordingClient());

        ExecutionOutcome outcome = executor.execute(new DueTrigger(quiet, NOW));

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.suppressed()).isTrue();
        assertThat(sentTokens).isEmpty();
    }

    @Test
    void unavailablePushServiceShouldFailExecution() {
        registry.add(device("a", true, "Paris")).add(device("b", true, "Paris"));
        JobExecutor executor = newExecutor(healthyProvider(), (token, platform, payload) -> {
            throw new PushServiceUnavailableException("gateway down");
        });

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(outcome.state()).isEqualTo(ExecutionState.FAILED);
        assertThat(outcome.failureReason()).isEqualTo(FailureReason.FANOUT_FAILED);
        assertThat(outcome.failed()).isEqualTo(2);
    }

    @Test
    void storageErrorShouldFailExecution() {
        DeviceRegistry broken = failingRegistry(new StorageException("devices unavailable", new RuntimeException("socket")));
        fanout = new NotificationFanout(recordingClient(), 2, Duration.ofSeconds(5), RetryPolicy.fixed(1, Duration.ZERO));
        JobExecutor executor = new JobExecutor(newCache(healthyProvider()), broken, fanout, jobStore, locks,
                RetryPolicy.fixed(3, Duration.ofMillis(1)), clock);

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(outcome.failureReason()).isEqualTo(FailureReason.STORAGE_ERROR);
    }

    @Test
    void unexpectedErrorShouldNotEscape() {
        DeviceRegistry broken = failingRegistry(new IllegalStateException("boom"));
        fanout = new NotificationFanout(recordingClient(), 2, Duration.ofSeconds(5), RetryPolicy.fixed(1, Duration.ZERO));
        JobExecutor executor = new JobExecutor(newCache(healthyProvider()), broken, fanout, jobStore, locks,
                RetryPolicy.fixed(3, Duration.ofMillis(1)), clock);

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(outcome.failureReason()).isEqualTo(FailureReason.UNEXPECTED_ERROR);
        assertThat(outcome.message()).isEqualTo("boom");
        assertThat(locks.isLocked("paris")).isFalse();
    }

    @Test
    void executionsOfSameJobShouldNotOverlap() throws Exception {
        registry.add(device("ok-1", true, "Paris"));
        CountDownLatch firstSending = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        JobExecutor executor = newExecutor(healthyProvider(), (token, platform, payload) -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            sentTokens.add(token);
            firstSending.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            return DeliveryResult.OK;
        });

        ExecutorService callers = Executors.newFixedThreadPool(2);
        CompletableFuture<ExecutionOutcome> first = CompletableFuture.supplyAsync(
                () -> executor.execute(new DueTrigger(job, NOW)), callers);
        assertThat(firstSending.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<ExecutionOutcome> second = CompletableFuture.supplyAsync(
                () -> executor.execute(new DueTrigger(job, NOW.plusSeconds(3600))), callers);
        while (!locks.lockFor("paris").hasQueuedThreads()) {
            Thread.onSpinWait();
        }
        assertThat(sentTokens).hasSize(1);

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).isCompleted()).isTrue();
        assertThat(second.get(5, TimeUnit.SECONDS).isCompleted()).isTrue();
        assertThat(maxActive.get()).isEqualTo(1);
        assertThat(sentTokens).hasSize(2);
        callers.shutdown();
    }

    @Test
    void laterRunShouldBeRecordedAfterEarlierRun() throws Exception {
        Instant nextHour = NOW.plusSeconds(3600);
        jobStore.put(job);
        registry.add(device("ok-1", true, "Paris"));
        CountDownLatch firstRecording = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        jobStore.beforeRecord = lastRunAt -> {
            if (lastRunAt.equals(NOW)) {
                firstRecording.countDown();
                try {
                    releaseFirst.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        JobExecutor executor = newExecutor(healthyProvider(), recordingClient());

        ExecutorService callers = Executors.newFixedThreadPool(2);
        CompletableFuture<ExecutionOutcome> first = CompletableFuture.supplyAsync(
                () -> executor.execute(new DueTrigger(job, NOW)), callers);
        assertThat(firstRecording.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<ExecutionOutcome> second = CompletableFuture.supplyAsync(
                () -> executor.execute(new DueTrigger(job, nextHour)), callers);
        while (!locks.lockFor("paris").hasQueuedThreads()) {
            Thread.onSpinWait();
        }

        releaseFirst.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        callers.shutdown();

        assertThat(jobStore.outcomes).extracting(InMemorySchedulerJobStore.RecordedOutcome::lastRunAt)
                .containsExactly(NOW, nextHour);
        assertThat(jobStore.jobs.get("paris").lastRunAt()).isEqualTo(nextHour);
        assertThat(executor.lastOutcome("paris").orElseThrow().dueAt()).isEqualTo(nextHour);
    }

    @Test
    void outcomePersistenceFailureShouldNotEscape() {
        SchedulerJobStore failingStore = mock(SchedulerJobStore.class);
        doThrow(new StorageException("write concern timeout", new RuntimeException("wtimeout")))
                .when(failingStore).recordOutcome(any(), any(), any(), anyInt(), anyInt());
        registry.add(device("ok-1", true, "Paris"));
        fanout = new NotificationFanout(recordingClient(), 2, Duration.ofSeconds(5), RetryPolicy.fixed(1, Duration.ZERO));
        JobExecutor executor = new JobExecutor(newCache(healthyProvider()), registry, fanout, failingStore, locks,
                RetryPolicy.fixed(3, Duration.ofMillis(1)), clock);

        ExecutionOutcome outcome = executor.execute(new DueTrigger(job, NOW));

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(executor.lastOutcome("paris")).contains(outcome);
        verify(failingStore).recordOutcome("paris", NOW, JobStatus.COMPLETED, 1, 0);
    }

    private JobExecutor newExecutor(WeatherProviderClient provider, PushDeliveryClient client) {
        fanout = new NotificationFanout(client, 4, Duration.ofSeconds(5), RetryPolicy.fixed(1, Duration.ZERO));
        return new JobExecutor(newCache(provider), registry, fanout, jobStore, locks,
                RetryPolicy.fixed(3, Duration.ofMillis(1)), clock);
    }

    private WeatherCache newCache(WeatherProviderClient provider) {
        return new WeatherCache(historyStore, provider, UpstreamCallBudget.unlimited(clock),
                Duration.ofMinutes(30), false, clock);
    }

    private WeatherProviderClient healthyProvider() {
        return (city, units) -> {
            providerCalls.incrementAndGet();
            return TestRecords.observation(city, NOW.minusSeconds(60), 18.0, "scattered clouds");
        };
    }

    private PushDeliveryClient recordingClient() {
        return (token, platform, payload) -> {
            sentTokens.add(token);
            return DeliveryResult.OK;
        };
    }

    private static DeviceRegistry failingRegistry(RuntimeException failure) {
        return new DeviceRegistry() {
            @Override
            public List<Device> findEnabledByCity(String city) {
                throw failure;
            }

            @Override
            public List<Device> findEnabled() {
                throw failure;
            }
        };
    }
}
