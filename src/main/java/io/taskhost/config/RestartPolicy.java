package io.taskhost.config;

/**
 * Linear backoff with a cap: attempt {@code n} waits {@code min(n * step, max)}.
 * Attempts above {@code maxAttempts} are not scheduled; the supervisor cools down instead.
 */
public record RestartPolicy(int maxAttempts, long delayStepMs, long maxDelayMs) {
    public RestartPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
        }
        if (delayStepMs < 0L || maxDelayMs < 0L) {
            throw new IllegalArgumentException("restart delays must be >= 0");
        }
    }

    public static RestartPolicy defaults() {
        return new RestartPolicy(
                TaskHostConfig.DEFAULT_MAX_RESTART_ATTEMPTS,
                TaskHostConfig.DEFAULT_RESTART_DELAY_STEP_MS,
                TaskHostConfig.DEFAULT_MAX_RESTART_DELAY_MS
        );
    }

    public boolean exhausted(int attempt) {
        return attempt > maxAttempts;
    }

    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return 0L;
        }
        if (delayStepMs > 0L && attempt > maxDelayMs / delayStepMs) {
            return maxDelayMs;
        }
        return Math.min((long) attempt * delayStepMs, maxDelayMs);
    }
}
