package io.forecast4j.core;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one job execution.
 *
 * @param jobId                   executed job
 * @param dueAt                   due instant that triggered the run
 * @param startedAt               when the per-job lock was acquired
 * @param finishedAt              when a terminal state was reached
 * @param state                   {@link ExecutionState#COMPLETED} or {@link ExecutionState#FAILED}
 * @param failureReason           null unless failed
 * @param message                 failure detail, null unless failed
 * @param fetchAttempts           provider calls made by this execution (cache hits count as one)
 * @param notified                devices that accepted the notification
 * @param failed                  devices whose delivery failed or timed out
 * @param permanentlyFailedTokens tokens the push service rejected; candidates for deactivation
 * @param suppressed              true when notify rules decided nothing was worth sending
 */
public record ExecutionOutcome(
        String jobId,
        Instant dueAt,
        Instant startedAt,
        Instant finishedAt,
        ExecutionState state,
        FailureReason failureReason,
        String message,
        int fetchAttempts,
        int notified,
        int failed,
        List<String> permanentlyFailedTokens,
        boolean suppressed
) {
    public ExecutionOutcome {
        permanentlyFailedTokens = permanentlyFailedTokens == null ? List.of() : List.copyOf(permanentlyFailedTokens);
    }

    public boolean isCompleted() {
        return state == ExecutionState.COMPLETED;
    }

    public JobStatus toJobStatus() {
        return isCompleted() ? JobStatus.COMPLETED : JobStatus.FAILED;
    }
}
