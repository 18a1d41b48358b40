package io.forecast4j.internal;

import io.forecast4j.PushDeliveryClient;
import io.forecast4j.core.DeliveryResult;
import io.forecast4j.core.Device;
import io.forecast4j.core.NotificationPayload;
import io.forecast4j.core.PushServiceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pushes one payload to a batch of devices with bounded parallelism.
 *
 * <p>Each device is delivered independently: its failure, retries or timeout never block or cancel the others.
 * Transient results are retried up to the delivery policy; permanent rejections are not. When the push service
 * reports itself unavailable, devices not yet dispatched are skipped and the batch is flagged as aborted.
 */
public class NotificationFanout implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationFanout.class);

    private final PushDeliveryClient client;
    private final int parallelism;
    private final Duration timeout;
    private final RetryPolicy retry;
    private final ExecutorService pool;

    public NotificationFanout(PushDeliveryClient client, int parallelism, Duration timeout, RetryPolicy retry) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be a positive number");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        this.parallelism = parallelism;
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("forecast.delivery");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Deliver {@code payload} to every device and wait for all of them to settle.
     *
     * <p>Returns once each device is delivered, failed, timed out or aborted. Results keep the order of
     * {@code devices}.
     */
    public FanoutResult dispatch(List<Device> devices, NotificationPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        if (devices == null || devices.isEmpty()) {
            return FanoutResult.empty();
        }

        Semaphore permits = new Semaphore(parallelism);
        AtomicReference<String> abortReason = new AtomicReference<>();
        List<CompletableFuture<DeviceDelivery>> futures = new ArrayList<>(devices.size());

        for (Device device : devices) {
            if (abortReason.get() != null) {
                futures.add(CompletableFuture.completedFuture(aborted(device, 0)));
                continue;
            }
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abortReason.compareAndSet(null, "Fan-out interrupted");
                futures.add(CompletableFuture.completedFuture(aborted(device, 0)));
                continue;
            }
            if (abortReason.get() != null) {
                permits.release();
                futures.add(CompletableFuture.completedFuture(aborted(device, 0)));
                continue;
            }
            futures.add(submit(device, payload, permits, abortReason));
        }

        List<DeviceDelivery> deliveries = new ArrayList<>(futures.size());
        for (CompletableFuture<DeviceDelivery> f : futures) {
            deliveries.add(f.join());
        }

        String reason = abortReason.get();
        FanoutResult result = new FanoutResult(devices.size(), deliveries, reason != null, reason);
        log.debug("fan-out finished targeted={} notified={} failed={} aborted={}",
                result.targeted(), result.notified(), result.failed(), result.aborted());
        return result;
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("fan-out pool did not terminate within timeout={}", timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private CompletableFuture<DeviceDelivery> submit(Device device,
                                                     NotificationPayload payload,
                                                     Semaphore permits,
                                                     AtomicReference<String> abortReason) {
        AtomicInteger attempts = new AtomicInteger();
        AtomicBoolean released = new AtomicBoolean();
        Runnable release = () -> {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        };
        long deadline = System.nanoTime() + timeout.toNanos();

        CompletableFuture<DeviceDelivery> outcome = new CompletableFuture<>();
        Future<?> task;
        try {
            task = pool.submit(() -> {
                try {
                    outcome.complete(deliver(device, payload, attempts, deadline, abortReason));
                } catch (RuntimeException e) {
                    outcome.completeExceptionally(e);
                } finally {
                    release.run();
                }
            });
        } catch (RejectedExecutionException e) {
            release.run();
            log.warn("fan-out pool rejected delivery deviceId={} msg={}", device.id(), e.getMessage());
            return CompletableFuture.completedFuture(
                    new DeviceDelivery(device.id(), device.token(), DeliveryStatus.FAILED_TRANSIENT, 0));
        }

        return outcome
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((delivery, error) -> {
                    if (error == null) {
                        return delivery;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    if (cause instanceof TimeoutException) {
                        // free the slot for the next device and interrupt the stuck send
                        release.run();
                        task.cancel(true);
                        log.warn("push delivery timed out deviceId={} timeout={}", device.id(), timeout);
                        return new DeviceDelivery(device.id(), device.token(), DeliveryStatus.TIMED_OUT, attempts.get());
                    }
                    log.error("push delivery crashed deviceId={} msg={}", device.id(), cause.getMessage(), cause);
                    return new DeviceDelivery(device.id(), device.token(), DeliveryStatus.FAILED_TRANSIENT, attempts.get());
                });
    }

    private DeviceDelivery deliver(Device device,
                                   NotificationPayload payload,
                                   AtomicInteger attempts,
                                   long deadline,
                                   AtomicReference<String> abortReason) {
        while (true) {
            if (abortReason.get() != null) {
                return aborted(device, attempts.get());
            }
            if (Thread.currentThread().isInterrupted()) {
                return new DeviceDelivery(device.id(), device.token(), DeliveryStatus.TIMED_OUT, attempts.get());
            }

            int attempt = attempts.incrementAndGet();
            DeliveryResult result;
            try {
                result = client.send(device.token(), device.platform(), payload);
            } catch (PushServiceUnavailableException e) {
                if (abortReason.compareAndSet(null, e.getMessage())) {
                    log.error("push service unavailable, aborting fan-out msg={}", e.getMessage());
                }
                return aborted(device, attempt);
            } catch (RuntimeException e) {
                log.warn("push delivery error deviceId={} attempt={} msg={}", device.id(), attempt, e.getMessage());
                result = DeliveryResult.TRANSIENT_FAILURE;
            }
            if (result == null) {
                result = DeliveryResult.TRANSIENT_FAILURE;
            }

            switch (result) {
                case OK:
                    return new DeviceDelivery(device.id(), device.token(), DeliveryStatus.DELIVERED, attempt);
                case PERMANENT_FAILURE:
                    log.info("push token rejected deviceId={} platform={}", device.id(), device.platform());
                    return new DeviceDelivery(device.id(), device.token(), DeliveryStatus.FAILED_PERMANENT, attempt);
                default:
                    break;
            }

            if (!retry.canRetry(attempt)) {
                log.warn("push delivery failed, retries exhausted deviceId={} attempts={}", device.id(), attempt);
                return new DeviceDelivery(device.id(), device.token(), DeliveryStatus.FAILED_TRANSIENT, attempt);
            }
            long pauseNanos = retry.backoff(attempt).toNanos();
            if (System.nanoTime() + pauseNanos >= deadline || !retry.pause(attempt)) {
                return new DeviceDelivery(device.id(), device.token(), DeliveryStatus.FAILED_TRANSIENT, attempt);
            }
        }
    }

    private static DeviceDelivery aborted(Device device, int attempts) {
        return new DeviceDelivery(device.id(), device.token(), DeliveryStatus.ABORTED, attempts);
    }
}
