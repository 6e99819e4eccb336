package io.taskhost.observability;

import io.taskhost.config.TaskHostConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only text log for one supervisor session. The file is never rotated or truncated;
 * readers take the trailing lines.
 */
public final class SessionLog {
    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final Path logFile;
    private final long pid;

    public SessionLog(Path logFile) {
        this.logFile = logFile;
        this.pid = ProcessHandle.current().pid();
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try {
                Files.createFile(logFile);
            } catch (FileAlreadyExistsException ignored) {
                // Reopening an existing session file keeps appending to it.
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize session log file: " + logFile, e);
        }
    }

    public static SessionLog create(TaskHostConfig config) {
        String name = TaskHostConfig.LOG_FILE_PREFIX + FILE_STAMP.format(Instant.now()) + TaskHostConfig.LOG_FILE_SUFFIX;
        Path candidate = config.logsDir().resolve(name);
        int suffix = 1;
        while (Files.exists(candidate)) {
            candidate = config.logsDir().resolve(TaskHostConfig.LOG_FILE_PREFIX + FILE_STAMP.format(Instant.now())
                    + "-" + suffix++ + TaskHostConfig.LOG_FILE_SUFFIX);
        }
        return new SessionLog(candidate);
    }

    public Path path() {
        return logFile;
    }

    public void debug(String message) {
        main(LogLevel.DEBUG, message);
    }

    public void info(String message) {
        main(LogLevel.INFO, message);
    }

    public void warn(String message) {
        main(LogLevel.WARN, message);
    }

    public void error(String message, Throwable cause) {
        String detail = cause == null ? "" : ": " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        main(LogLevel.ERROR, message + detail);
    }

    public void main(LogLevel level, String message) {
        appendLine(LogLines.format(Instant.now(), LogLines.ROLE_MAIN, pid, level, message));
    }

    /**
     * Records one line the worker printed. Lines already in log layout are kept as-is,
     * anything else is tagged with the worker pid and the stream it came from.
     */
    public void workerOutput(long workerPid, String stream, String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        if (LogLines.isFormatted(line)) {
            appendLine(line);
            return;
        }
        LogLevel level = "stderr".equals(stream) ? LogLevel.WARN : LogLevel.DEBUG;
        appendLine(LogLines.format(Instant.now(), LogLines.ROLE_WORKER, workerPid, level, stream + ": " + line));
    }

    /**
     * Appends one line. A failed write never reaches the caller: the line goes to stderr
     * instead, so logging cannot break the supervisor's event loop.
     */
    public synchronized void appendLine(String line) {
        try {
            Files.writeString(logFile, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            System.err.println("WARN session log write failed (" + logFile + "): " + e.getMessage());
            System.err.println(line);
        }
    }

    public synchronized List<String> recentLines(int lines) {
        return tail(logFile, lines);
    }

    public static List<String> tail(Path file, int lines) {
        if (lines <= 0 || !Files.exists(file)) {
            return List.of();
        }
        List<String> nonEmpty = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    nonEmpty.add(line);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read session log: " + file, e);
        }
        int from = Math.max(0, nonEmpty.size() - lines);
        return List.copyOf(nonEmpty.subList(from, nonEmpty.size()));
    }
}
