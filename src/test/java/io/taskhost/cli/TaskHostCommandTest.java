package io.taskhost.cli;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class TaskHostCommandTest {

    @Test
    void logsLineCountAcceptsNumbersAndAll() {
        Assertions.assertEquals(50, TaskHostCommand.LogsCommand.parseCount(null));
        Assertions.assertEquals(20, TaskHostCommand.LogsCommand.parseCount("20"));
        Assertions.assertEquals(Integer.MAX_VALUE, TaskHostCommand.LogsCommand.parseCount("ALL"));
        Assertions.assertEquals(50, TaskHostCommand.LogsCommand.parseCount("-3"));
        Assertions.assertEquals(50, TaskHostCommand.LogsCommand.parseCount("lots"));
    }

    @Test
    void logsCommandPrintsTheTailOfTheNewestSession() throws Exception {
        Path root = Files.createTempDirectory("taskhost-cli-logs-");
        try {
            Path logs = Files.createDirectories(root.resolve("logs"));
            Files.writeString(logs.resolve("worker-20260101-000000-000.log"), String.join("\n",
                    "[2026-01-01T00:00:00Z] [MAIN PID:1] [INFO] first",
                    "[2026-01-01T00:00:01Z] [MAIN PID:1] [INFO] second",
                    "[2026-01-01T00:00:02Z] [MAIN PID:1] [WARN] third") + "\n");

            String out = runCli("--root", root.toString(), "logs", "2");

            Assertions.assertTrue(out.contains("Worker process logs (last 2 lines)"), out);
            Assertions.assertFalse(out.contains("first"), out);
            Assertions.assertTrue(out.contains("second"), out);
            Assertions.assertTrue(out.contains("third"), out);
            Assertions.assertTrue(out.contains("Total lines in file: 3"), out);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void logsCommandExplainsWhenThereIsNothingToShow() throws Exception {
        Path root = Files.createTempDirectory("taskhost-cli-nologs-");
        try {
            String out = runCli("--root", root.toString(), "logs");

            Assertions.assertTrue(out.startsWith("No session logs found"), out);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tasksCommandListsTheCatalog() {
        String out = runCli("tasks");

        Assertions.assertTrue(out.contains("manage-service"), out);
        Assertions.assertTrue(out.contains("get-system-info"), out);
    }

    private static String runCli(String... args) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream previous = System.out;
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            int code = new CommandLine(new TaskHostCommand()).execute(args);
            Assertions.assertEquals(0, code);
        } finally {
            System.setOut(previous);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
