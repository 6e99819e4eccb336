package io.taskhost.config;

import io.taskhost.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Effective supervisor knobs. Values come from {@code taskhost-settings.json} when present,
 * each field falling back to its {@link TaskHostConfig} default when missing or out of range.
 *
 * <p>The task timeout here bounds how long the supervisor waits for a reply; the command
 * timeout applied inside the worker is a separate knob and the two are not reconciled.
 */
public record SupervisorSettings(
        long defaultTaskTimeoutMs,
        int maxRestartAttempts,
        long restartDelayStepMs,
        long maxRestartDelayMs,
        List<String> workerCommand
) {
    public SupervisorSettings {
        workerCommand = workerCommand == null ? List.of() : List.copyOf(workerCommand);
    }

    public static SupervisorSettings defaults() {
        return new SupervisorSettings(
                TaskHostConfig.DEFAULT_TASK_TIMEOUT_MS,
                TaskHostConfig.DEFAULT_MAX_RESTART_ATTEMPTS,
                TaskHostConfig.DEFAULT_RESTART_DELAY_STEP_MS,
                TaskHostConfig.DEFAULT_MAX_RESTART_DELAY_MS,
                List.of()
        );
    }

    public static LoadOutcome load(Path file) {
        SupervisorSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return new LoadOutcome(defaults, "defaults", List.of());
        }
        SettingsFile raw;
        try {
            raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            return new LoadOutcome(defaults, "defaults", List.of("unreadable settings file: " + e.getMessage()));
        }
        if (raw == null) {
            return new LoadOutcome(defaults, "defaults", List.of());
        }
        List<String> rejected = new ArrayList<>();
        long timeout = positiveOr(raw.defaultTaskTimeoutMs(), defaults.defaultTaskTimeoutMs(), "defaultTaskTimeoutMs", rejected);
        int attempts = raw.maxRestartAttempts() == null
                ? defaults.maxRestartAttempts()
                : (int) positiveOr(raw.maxRestartAttempts().longValue(), defaults.maxRestartAttempts(), "maxRestartAttempts", rejected);
        long step = positiveOr(raw.restartDelayStepMs(), defaults.restartDelayStepMs(), "restartDelayStepMs", rejected);
        long maxDelay = positiveOr(raw.maxRestartDelayMs(), defaults.maxRestartDelayMs(), "maxRestartDelayMs", rejected);
        if (maxDelay < step) {
            rejected.add("maxRestartDelayMs");
            maxDelay = Math.max(step, defaults.maxRestartDelayMs());
        }
        List<String> command = new ArrayList<>();
        if (raw.workerCommand() != null) {
            for (String part : raw.workerCommand()) {
                if (part != null && !part.isBlank()) {
                    command.add(part);
                }
            }
        }
        SupervisorSettings resolved = new SupervisorSettings(timeout, attempts, step, maxDelay, command);
        return new LoadOutcome(resolved, file.toString(), List.copyOf(rejected));
    }

    public RestartPolicy restartPolicy() {
        return new RestartPolicy(maxRestartAttempts, restartDelayStepMs, maxRestartDelayMs);
    }

    public SupervisorSettings withRestartPolicy(RestartPolicy policy) {
        return new SupervisorSettings(
                defaultTaskTimeoutMs,
                policy.maxAttempts(),
                policy.delayStepMs(),
                policy.maxDelayMs(),
                workerCommand
        );
    }

    public SupervisorSettings withDefaultTaskTimeoutMs(long timeoutMs) {
        return new SupervisorSettings(timeoutMs, maxRestartAttempts, restartDelayStepMs, maxRestartDelayMs, workerCommand);
    }

    private static long positiveOr(Long value, long fallback, String field, List<String> rejected) {
        if (value == null) {
            return fallback;
        }
        if (value <= 0L) {
            rejected.add(field);
            return fallback;
        }
        return value;
    }

    public record LoadOutcome(SupervisorSettings settings, String source, List<String> rejectedFields) {
    }

    private record SettingsFile(
            Long defaultTaskTimeoutMs,
            Integer maxRestartAttempts,
            Long restartDelayStepMs,
            Long maxRestartDelayMs,
            List<String> workerCommand
    ) {
    }
}
