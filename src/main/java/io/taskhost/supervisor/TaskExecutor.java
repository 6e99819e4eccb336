package io.taskhost.supervisor;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * What callers of the supervisor get to see.
 */
public interface TaskExecutor {
    CompletableFuture<TaskResult> execute(String taskName, Object... args);

    CompletableFuture<TaskResult> executeWithOptions(String taskName, TaskOptions options, Object... args);

    boolean isAvailable();

    List<String> getRecentLogs(int lines);

    Path getLogFilePath();

    void dispose();
}
