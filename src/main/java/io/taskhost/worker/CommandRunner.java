package io.taskhost.worker;

import io.taskhost.config.TaskHostConfig;

/**
 * Runs one shell command line and returns its trimmed standard output.
 * Implementations never retry; failures surface as {@link CommandFailedException}.
 */
public interface CommandRunner {
    String run(String commandLine, CommandOptions options) throws CommandFailedException;

    default String run(String commandLine) throws CommandFailedException {
        return run(commandLine, CommandOptions.defaults());
    }

    record CommandOptions(long timeoutMs, long maxOutputBytes) {
        public CommandOptions {
            if (timeoutMs <= 0L) {
                throw new IllegalArgumentException("command timeout must be > 0: " + timeoutMs);
            }
            if (maxOutputBytes <= 0L) {
                throw new IllegalArgumentException("command output limit must be > 0: " + maxOutputBytes);
            }
        }

        public static CommandOptions defaults() {
            return new CommandOptions(TaskHostConfig.DEFAULT_COMMAND_TIMEOUT_MS, TaskHostConfig.DEFAULT_COMMAND_MAX_OUTPUT_BYTES);
        }

        public static CommandOptions withTimeout(long timeoutMs) {
            return new CommandOptions(timeoutMs, TaskHostConfig.DEFAULT_COMMAND_MAX_OUTPUT_BYTES);
        }
    }
}
