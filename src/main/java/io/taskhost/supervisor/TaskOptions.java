package io.taskhost.supervisor;

/**
 * Per-call overrides. A {@code null} timeout means the supervisor default.
 */
public record TaskOptions(Long timeoutMs) {
    public static TaskOptions defaults() {
        return new TaskOptions(null);
    }

    public static TaskOptions timeout(long timeoutMs) {
        return new TaskOptions(timeoutMs);
    }
}
