package io.taskhost.worker;

import io.taskhost.observability.LogLevel;
import io.taskhost.observability.LogLines;

import java.io.PrintStream;
import java.time.Instant;

/**
 * Worker diagnostics. Written to stderr in session-log layout so the supervisor can copy
 * the lines into its log file unchanged.
 */
public final class WorkerLog {
    private final PrintStream out;
    private final long pid;

    public WorkerLog(PrintStream out) {
        this.out = out;
        this.pid = ProcessHandle.current().pid();
    }

    public void info(String message) {
        write(LogLevel.INFO, message);
    }

    public void debug(String message) {
        write(LogLevel.DEBUG, message);
    }

    public void error(String message, Throwable cause) {
        String detail = cause == null ? "" : ": " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        write(LogLevel.ERROR, message + detail);
    }

    public void write(LogLevel level, String message) {
        String line = LogLines.format(Instant.now(), LogLines.ROLE_WORKER, pid, level, message);
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }
}
