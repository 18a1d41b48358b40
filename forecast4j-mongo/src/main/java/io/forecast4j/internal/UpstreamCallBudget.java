package io.forecast4j.internal;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Daily cap on weather provider calls, reset at UTC day boundaries.
 * A limit of zero or less means unlimited.
 */
public class UpstreamCallBudget {
    private static final long SECONDS_PER_DAY = 86_400L;

    private final int dailyLimit;
    private final Clock clock;
    private final AtomicInteger callsToday = new AtomicInteger();
    private final AtomicLong currentDay;

    public UpstreamCallBudget(int dailyLimit, Clock clock) {
        this.dailyLimit = dailyLimit;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.currentDay = new AtomicLong(utcDay());
    }

    public static UpstreamCallBudget unlimited(Clock clock) {
        return new UpstreamCallBudget(0, clock);
    }

    /**
     * Record a call. Returns true if it was within budget.
     */
    public boolean tryAcquire() {
        maybeReset();
        int previous = callsToday.getAndIncrement();
        return dailyLimit <= 0 || previous < dailyLimit;
    }

    public int remaining() {
        if (dailyLimit <= 0) {
            return Integer.MAX_VALUE;
        }
        maybeReset();
        return Math.max(0, dailyLimit - callsToday.get());
    }

    public int usedToday() {
        maybeReset();
        return callsToday.get();
    }

    public int dailyLimit() {
        return dailyLimit;
    }

    // only the thread that moves the day forward resets the counter
    private void maybeReset() {
        long today = utcDay();
        long stored = currentDay.get();
        if (today != stored && currentDay.compareAndSet(stored, today)) {
            callsToday.set(0);
        }
    }

    private long utcDay() {
        return clock.instant().getEpochSecond() / SECONDS_PER_DAY;
    }
}
