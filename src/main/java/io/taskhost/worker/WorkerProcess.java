package io.taskhost.worker;

import io.taskhost.config.TaskHostConfig;
import io.taskhost.ipc.MessageCodec;
import io.taskhost.ipc.WorkerMessage;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Worker side of the pipe: announces readiness, then reads one dispatch per line until the
 * supervisor closes stdin.
 */
public final class WorkerProcess {
    private final TaskRegistry registry;
    private final WorkerLog log;
    private final Consumer<Throwable> fatalHandler;

    public WorkerProcess(TaskRegistry registry, WorkerLog log, Consumer<Throwable> fatalHandler) {
        this.registry = registry;
        this.log = log;
        this.fatalHandler = fatalHandler;
    }

    /**
     * Serves until {@code in} reaches end of stream, then waits for running tasks so their
     * replies are flushed.
     */
    public void serve(InputStream in, OutputStream out) throws IOException, InterruptedException {
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        WorkerDispatcher.ReplySink sink = reply -> {
            synchronized (writer) {
                writer.write(MessageCodec.encode(reply));
                writer.newLine();
                writer.flush();
            }
        };
        try (WorkerDispatcher dispatcher = new WorkerDispatcher(registry, sink, log, fatalHandler)) {
            sink.send(WorkerMessage.workerReady(ProcessHandle.current().pid()));
            log.info("Worker ready with tasks " + registry.taskNames());
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    WorkerMessage message;
                    try {
                        message = MessageCodec.decode(line);
                    } catch (MessageCodec.MalformedMessageException e) {
                        log.error("Discarding malformed message", e);
                        continue;
                    }
                    log.debug("Received " + message.type().wireName() + " " + message.taskName() + " (taskId=" + message.taskId() + ")");
                    dispatcher.dispatch(message);
                }
            }
            log.info("Supervisor closed the channel, draining running tasks");
            if (!dispatcher.awaitIdle(TaskHostConfig.LONG_RUNNING_TASK_TIMEOUT_MS)) {
                log.error("Running tasks did not finish before shutdown", null);
            }
        }
    }

    /**
     * Process entry used by the {@code worker} subcommand. Any failure outside a task handler
     * ends the process with exit code 1 and the supervisor restarts it.
     */
    public static int runMain() {
        WorkerLog log = new WorkerLog(System.err);
        Consumer<Throwable> fatal = error -> {
            log.error("Uncaught exception in worker", error);
            Runtime.getRuntime().halt(1);
        };
        Thread.setDefaultUncaughtExceptionHandler((thread, error) -> fatal.accept(error));
        TaskRegistry registry = TaskRegistry.systemTasks(new ShellCommandRunner(), log);
        WorkerProcess worker = new WorkerProcess(registry, log, fatal);
        try {
            worker.serve(System.in, System.out);
            return 0;
        } catch (IOException e) {
            fatal.accept(new UncheckedIOException(e));
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Worker interrupted", e);
            return 1;
        }
    }
}
