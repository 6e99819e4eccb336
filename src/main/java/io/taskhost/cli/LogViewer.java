package io.taskhost.cli;

import io.taskhost.config.TaskHostConfig;
import io.taskhost.observability.LogLevel;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

final class LogViewer {
    static final String RED = "\u001B[31m";
    static final String GREEN = "\u001B[32m";
    static final String CYAN = "\u001B[36m";
    static final String RESET = "\u001B[0m";

    private LogViewer() {
    }

    static Optional<Path> findLatestLogFile(Path logsDir) throws IOException {
        if (logsDir == null || !Files.isDirectory(logsDir)) {
            return Optional.empty();
        }
        Path latest = null;
        FileTime latestTime = null;
        String glob = TaskHostConfig.LOG_FILE_PREFIX + "*" + TaskHostConfig.LOG_FILE_SUFFIX;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logsDir, glob)) {
            for (Path file : stream) {
                FileTime mtime = Files.getLastModifiedTime(file);
                if (latest == null
                        || mtime.compareTo(latestTime) > 0
                        || (mtime.compareTo(latestTime) == 0 && file.getFileName().toString()
                        .compareTo(latest.getFileName().toString()) > 0)) {
                    latest = file;
                    latestTime = mtime;
                }
            }
        }
        return Optional.ofNullable(latest);
    }

    static String colorize(String line) {
        LogLevel level = LogLevel.fromLine(line);
        if (level == null) {
            return line;
        }
        return switch (level) {
            case ERROR -> RED + line + RESET;
            case INFO -> GREEN + line + RESET;
            case DEBUG -> CYAN + line + RESET;
            case WARN -> line;
        };
    }

    /**
     * Reads complete lines appended after {@code offset}. A trailing partial line is left for
     * the next call.
     */
    static Chunk readFrom(Path file, long offset) throws IOException {
        long size = Files.size(file);
        if (size <= offset) {
            return new Chunk(List.of(), size < offset ? 0L : offset);
        }
        byte[] all = Files.readAllBytes(file);
        int start = (int) Math.min(offset, all.length);
        int lastNewline = -1;
        for (int i = all.length - 1; i >= start; i--) {
            if (all[i] == '\n') {
                lastNewline = i;
                break;
            }
        }
        if (lastNewline < 0) {
            return new Chunk(List.of(), offset);
        }
        String text = new String(all, start, lastNewline + 1 - start, StandardCharsets.UTF_8);
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return new Chunk(lines, lastNewline + 1L);
    }

    record Chunk(List<String> lines, long nextOffset) {
    }
}
