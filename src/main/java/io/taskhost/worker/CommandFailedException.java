package io.taskhost.worker;

public final class CommandFailedException extends TaskFailureException {
    public CommandFailedException(String detail, int exitCode) {
        super("Command failed: " + detail, exitCode, null);
    }

    public CommandFailedException(String detail, Throwable cause) {
        super("Command failed: " + detail, DEFAULT_CODE, cause);
    }
}
