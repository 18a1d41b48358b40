package io.forecast4j.internal;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per job id, so two executions of the same job never overlap in this process.
 *
 * <p>Locks are never removed; the map is bounded by the number of job ids ever seen.
 */
public class JobExecutionLocks {
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String jobId) {
        return locks.computeIfAbsent(jobId, id -> new ReentrantLock(true));
    }

    public boolean isLocked(String jobId) {
        ReentrantLock lock = locks.get(jobId);
        return lock != null && lock.isLocked();
    }
}
