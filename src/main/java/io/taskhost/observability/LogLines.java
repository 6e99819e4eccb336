package io.taskhost.observability;

import java.time.Instant;

/**
 * Line layout shared by the supervisor log file and worker stderr:
 * {@code [ISO-timestamp] [ROLE PID:n] [LEVEL] message}.
 */
public final class LogLines {
    public static final String ROLE_MAIN = "MAIN";
    public static final String ROLE_WORKER = "WORKER";

    private LogLines() {
    }

    public static String format(Instant at, String role, long pid, LogLevel level, String message) {
        String body = message == null ? "" : message.replace("\r", " ").replace("\n", " | ");
        return "[" + at + "] [" + role + " PID:" + pid + "] " + level.token() + " " + body;
    }

    public static boolean isFormatted(String line) {
        if (line == null || !line.startsWith("[")) {
            return false;
        }
        int close = line.indexOf("] [");
        return close > 0 && line.indexOf(" PID:", close) > 0 && LogLevel.fromLine(line) != null;
    }
}
