package io.taskhost.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TaskHostConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "taskhost-settings.json";
    public static final String LOG_FILE_PREFIX = "worker-";
    public static final String LOG_FILE_SUFFIX = ".log";
    public static final long DEFAULT_TASK_TIMEOUT_MS = 30_000L;
    public static final long LONG_RUNNING_TASK_TIMEOUT_MS = 300_000L;
    public static final int DEFAULT_MAX_RESTART_ATTEMPTS = 5;
    public static final long DEFAULT_RESTART_DELAY_STEP_MS = 1_000L;
    public static final long DEFAULT_MAX_RESTART_DELAY_MS = 10_000L;
    public static final long DEFAULT_COMMAND_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_COMMAND_MAX_OUTPUT_BYTES = 10L * 1024L * 1024L;
    public static final long DEFAULT_WORKER_SHUTDOWN_GRACE_MS = 2_000L;

    private final Path rootDir;

    public TaskHostConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TaskHostConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new TaskHostConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path logsDir() {
        return rootDir.resolve("logs");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
