package io.taskhost.supervisor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * One dispatched task waiting for its reply. Lives in the supervisor's correlation table
 * until the reply arrives, the timer fires, or the supervisor is disposed.
 */
record PendingRequest(
        String taskId,
        String taskName,
        CompletableFuture<TaskResult> result,
        ScheduledFuture<?> timeout,
        long createdAtMs
) {
    /**
     * @return false when the request had already been resolved
     */
    boolean resolve(TaskResult outcome) {
        timeout.cancel(false);
        return result.complete(outcome);
    }
}
