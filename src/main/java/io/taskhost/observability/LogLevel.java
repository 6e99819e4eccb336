package io.taskhost.observability;

import java.util.Locale;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public String token() {
        return "[" + name() + "]";
    }

    public static LogLevel fromLine(String line) {
        if (line == null) {
            return null;
        }
        for (LogLevel level : values()) {
            if (line.contains(level.token())) {
                return level;
            }
        }
        return null;
    }

    public static LogLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        return LogLevel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
