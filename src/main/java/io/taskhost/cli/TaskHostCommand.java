package io.taskhost.cli;

import io.taskhost.config.TaskHostConfig;
import io.taskhost.observability.SessionLog;
import io.taskhost.supervisor.TaskOptions;
import io.taskhost.supervisor.TaskResult;
import io.taskhost.supervisor.TaskSupervisor;
import io.taskhost.util.Jsons;
import io.taskhost.worker.SystemTask;
import io.taskhost.worker.WorkerProcess;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

@Command(
        name = "taskhost",
        mixinStandardHelpOptions = true,
        description = "Runs privileged system tasks in a supervised worker process",
        subcommands = {
                TaskHostCommand.RunCommand.class,
                TaskHostCommand.WorkerCommand.class,
                TaskHostCommand.TasksCommand.class,
                TaskHostCommand.LogsCommand.class
        }
)
public final class TaskHostCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory (logs, settings)", defaultValue = TaskHostConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | worker | tasks | logs");
    }

    TaskHostConfig config() {
        return TaskHostConfig.fromRoot(root);
    }

    @Command(name = "run", description = "Execute one task in a supervised worker and print the result")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TaskHostCommand parent;

        @Parameters(index = "0", description = "Task name, see 'tasks'")
        String taskName;

        @Parameters(index = "1..*", arity = "0..*", description = "Positional task arguments")
        List<String> args = new ArrayList<>();

        @Option(names = {"--timeout-ms"}, description = "Reply timeout; defaults to the supervisor setting")
        Long timeoutMs;

        @Option(names = {"--startup-timeout-ms"}, defaultValue = "15000", description = "How long to wait for the worker to come up")
        long startupTimeoutMs;

        @Override
        public Integer call() {
            TaskSupervisor supervisor = new TaskSupervisor(parent.config());
            try {
                supervisor.start();
                if (!supervisor.awaitAvailable(Duration.ofMillis(startupTimeoutMs))) {
                    System.out.println(Jsons.toJson(TaskResult.fail(TaskSupervisor.ERROR_UNAVAILABLE)));
                    System.err.println("Worker did not start, see " + supervisor.getLogFilePath());
                    return 1;
                }
                TaskResult result = supervisor.executeWithOptions(
                        taskName,
                        new TaskOptions(timeoutMs),
                        args.toArray()
                ).join();
                System.out.println(Jsons.toJson(result));
                return result.success() ? 0 : 1;
            } finally {
                supervisor.dispose();
            }
        }
    }

    @Command(name = "worker", hidden = true, description = "Worker process entry; speaks JSON lines on stdin/stdout")
    static final class WorkerCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            return WorkerProcess.runMain();
        }
    }

    @Command(name = "tasks", description = "List the tasks the worker can run")
    static final class TasksCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            for (SystemTask task : SystemTask.values()) {
                System.out.println(task.taskName());
            }
            return 0;
        }
    }

    @Command(name = "logs", description = "Show the newest worker session log")
    static final class LogsCommand implements Callable<Integer> {
        @ParentCommand
        TaskHostCommand parent;

        @Parameters(index = "0", arity = "0..1", defaultValue = "50", description = "Number of trailing lines, or 'all'")
        String lines;

        @Option(names = {"--watch", "-f"}, defaultValue = "false", description = "Follow the log as it grows")
        boolean watch;

        @Option(names = {"--interval-ms"}, defaultValue = "1000", description = "Poll interval for --watch")
        long intervalMs;

        @Override
        public Integer call() throws Exception {
            Path logsDir = parent.config().logsDir();
            Optional<Path> latest = LogViewer.findLatestLogFile(logsDir);
            if (latest.isEmpty()) {
                System.out.println("No session logs found under " + logsDir + ". Run a task to generate logs.");
                return 0;
            }
            Path file = latest.get();
            if (watch) {
                return follow(file);
            }
            int count = parseCount(lines);
            List<String> recent = SessionLog.tail(file, count);
            System.out.println("Worker process logs (last " + recent.size() + " lines)");
            System.out.println("File: " + file);
            System.out.println("-".repeat(80));
            for (String line : recent) {
                System.out.println(LogViewer.colorize(line));
            }
            System.out.println("-".repeat(80));
            System.out.println("Total lines in file: " + SessionLog.tail(file, Integer.MAX_VALUE).size());
            return 0;
        }

        private int follow(Path file) throws Exception {
            System.out.println("Watching " + file + " (Ctrl+C to stop)");
            AtomicBoolean running = new AtomicBoolean(true);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> running.set(false), "taskhost-logs-shutdown-hook"));
            long offset = 0L;
            while (running.get()) {
                LogViewer.Chunk chunk = LogViewer.readFrom(file, offset);
                for (String line : chunk.lines()) {
                    System.out.println(LogViewer.colorize(line));
                }
                offset = chunk.nextOffset();
                Thread.sleep(Math.max(100L, intervalMs));
            }
            return 0;
        }

        static int parseCount(String raw) {
            if (raw == null || raw.isBlank()) {
                return 50;
            }
            if ("all".equalsIgnoreCase(raw.trim())) {
                return Integer.MAX_VALUE;
            }
            try {
                int parsed = Integer.parseInt(raw.trim());
                return parsed > 0 ? parsed : 50;
            } catch (NumberFormatException e) {
                return 50;
            }
        }
    }
}
