package io.forecast4j.internal;

import io.forecast4j.core.ExecutionOutcome;
import io.forecast4j.core.ExecutionState;
import io.forecast4j.core.FailureReason;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable progress of one execution, confined to the thread running it.
 *
 * <p>Allowed transitions: PENDING to FETCHING to RESOLVING to NOTIFYING, then COMPLETED; RESOLVING may complete
 * directly, and any non-terminal state may fail.
 */
final class ExecutionAttempt {

    private static final Map<ExecutionState, Set<ExecutionState>> TRANSITIONS = Map.of(
            ExecutionState.PENDING, EnumSet.of(ExecutionState.FETCHING, ExecutionState.FAILED),
            ExecutionState.FETCHING, EnumSet.of(ExecutionState.RESOLVING, ExecutionState.FAILED),
            ExecutionState.RESOLVING, EnumSet.of(ExecutionState.NOTIFYING, ExecutionState.COMPLETED, ExecutionState.FAILED),
            ExecutionState.NOTIFYING, EnumSet.of(ExecutionState.COMPLETED, ExecutionState.FAILED),
            ExecutionState.COMPLETED, EnumSet.noneOf(ExecutionState.class),
            ExecutionState.FAILED, EnumSet.noneOf(ExecutionState.class)
    );

    private final String jobId;
    private final Instant dueAt;

    private ExecutionState state = ExecutionState.PENDING;
    private Instant startedAt;
    private FailureReason failureReason;
    private String message;
    private int fetchAttempts;
    private FanoutResult fanout = FanoutResult.empty();
    private boolean suppressed;

    ExecutionAttempt(String jobId, Instant dueAt) {
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.dueAt = Objects.requireNonNull(dueAt, "dueAt must not be null");
    }

    ExecutionState state() {
        return state;
    }

    void start(Instant startedAt) {
        this.startedAt = startedAt;
        moveTo(ExecutionState.FETCHING);
    }

    void moveTo(ExecutionState next) {
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException("Invalid execution transition " + state + " -> " + next + " for job " + jobId);
        }
        state = next;
    }

    void countFetchAttempt() {
        fetchAttempts++;
    }

    int fetchAttempts() {
        return fetchAttempts;
    }

    void recordDeliveries(FanoutResult result) {
        this.fanout = Objects.requireNonNull(result, "result must not be null");
    }

    void suppress() {
        suppressed = true;
        moveTo(ExecutionState.COMPLETED);
    }

    void complete() {
        moveTo(ExecutionState.COMPLETED);
    }

    void fail(FailureReason reason, String message) {
        if (state.isTerminal()) {
            return;
        }
        this.failureReason = reason;
        this.message = message;
        moveTo(ExecutionState.FAILED);
    }

    ExecutionOutcome toOutcome(Instant finishedAt) {
        if (!state.isTerminal()) {
            throw new IllegalStateException("Execution of job " + jobId + " has not finished, state=" + state);
        }
        List<String> rejected = fanout.permanentlyFailedTokens();
        return new ExecutionOutcome(
                jobId,
                dueAt,
                startedAt,
                finishedAt,
                state,
                failureReason,
                message,
                fetchAttempts,
                fanout.notified(),
                fanout.failed(),
                rejected,
                suppressed);
    }
}
